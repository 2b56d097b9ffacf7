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

import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;

import javax.inject.Inject;

import java.util.List;

import static io.viewbench.ViewBenchErrorCode.CONTAINER_COMMAND_FAILED;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Issues container start and stop commands. It does not wait for the database to accept connections.
 */
public class ContainerManager
{
    private static final Logger log = Logger.get(ContainerManager.class);

    private final DockerCommands commands;
    private final CommandExecutor executor;
    private final boolean removeOnStop;

    @Inject
    public ContainerManager(DockerCommands commands, CommandExecutor executor, ContainerConfig config)
    {
        this.commands = requireNonNull(commands, "commands is null");
        this.executor = requireNonNull(executor, "executor is null");
        this.removeOnStop = requireNonNull(config, "config is null").isRemoveOnStop();
    }

    public void start()
    {
        execute(commands.startCommand());
    }

    public void stop()
    {
        execute(commands.stopCommand());
        if (removeOnStop) {
            execute(commands.removeCommand());
        }
    }

    private void execute(List<String> command)
    {
        String description = commands.describe(command);
        log.info("Running %s", description);
        CommandResult result = executor.execute(command);
        if (!result.isSuccess()) {
            throw new ViewBenchException(CONTAINER_COMMAND_FAILED, format("%s exited with code %s: %s", description, result.getExitCode(), result.getOutput().trim()));
        }
        log.debug("%s", result.getOutput().trim());
    }
}
