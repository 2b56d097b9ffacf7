/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.viewbench.driver;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Injector;
import io.airlift.airline.HelpOption;
import io.airlift.airline.Option;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.airlift.log.Logger;

import javax.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Throwables.throwIfUnchecked;
import static io.airlift.configuration.ConfigurationLoader.loadPropertiesFrom;
import static io.viewbench.driver.ViewBenchCli.initializeLogging;

/**
 * Loads configuration, bootstraps the injector and hands it to the concrete command.
 */
public abstract class AbstractViewBenchCommand
        implements Runnable
{
    private static final Logger log = Logger.get(AbstractViewBenchCommand.class);

    @Inject
    public HelpOption helpOption;

    @Option(name = "--config", title = "file", description = "Configuration properties file")
    public String configFile;

    @Option(name = "--debug", description = "Enable debug logging")
    public boolean debug;

    private int exitCode;

    @Override
    public void run()
    {
        if (helpOption != null && helpOption.showHelpIfRequested()) {
            return;
        }

        initializeLogging(debug);

        Bootstrap app = new Bootstrap(new ViewBenchModule(debug));
        Injector injector;
        try {
            injector = app
                    .setRequiredConfigurationProperties(loadConfigurationProperties())
                    .doNotInitializeLogging()
                    .quiet()
                    .initialize();
        }
        catch (Exception e) {
            throwIfUnchecked(e);
            throw new RuntimeException(e);
        }

        try {
            exitCode = execute(injector);
        }
        finally {
            try {
                injector.getInstance(LifeCycleManager.class).stop();
            }
            catch (Exception e) {
                log.error(e);
            }
        }
    }

    public int getExitCode()
    {
        return exitCode;
    }

    @VisibleForTesting
    Map<String, String> loadConfigurationProperties()
    {
        Map<String, String> properties = new HashMap<>();
        if (configFile != null) {
            try {
                properties.putAll(loadPropertiesFrom(configFile));
            }
            catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        properties.putAll(getConfigurationOverrides());
        return properties;
    }

    /**
     * Properties given on the command line, replacing the same properties from the configuration file.
     */
    protected Map<String, String> getConfigurationOverrides()
    {
        return new HashMap<>();
    }

    /**
     * @return the process exit code
     */
    protected abstract int execute(Injector injector);
}
