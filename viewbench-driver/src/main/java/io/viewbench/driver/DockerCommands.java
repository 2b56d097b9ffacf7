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

import com.google.common.collect.ImmutableList;

import javax.inject.Inject;

import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Command lines that start and stop the PostgreSQL container a benchmark runs against.
 */
public class DockerCommands
{
    static final int POSTGRES_PORT = 5432;

    private final ContainerConfig config;

    @Inject
    public DockerCommands(ContainerConfig config)
    {
        this.config = requireNonNull(config, "config is null");
    }

    public List<String> startCommand()
    {
        return ImmutableList.of(
                config.getDockerCommand(),
                "run",
                "-d",
                "--name", config.getName(),
                "-e", "POSTGRES_PASSWORD=" + config.getPassword(),
                "-p", format("%s:%s", config.getHostPort(), POSTGRES_PORT),
                config.getImage());
    }

    public List<String> stopCommand()
    {
        return ImmutableList.of(config.getDockerCommand(), "stop", config.getName());
    }

    public List<String> removeCommand()
    {
        return ImmutableList.of(config.getDockerCommand(), "rm", config.getName());
    }

    /**
     * Command line with the container password masked, for logging.
     */
    public String describe(List<String> command)
    {
        String secret = "POSTGRES_PASSWORD=" + config.getPassword();
        return String.join(" ", command).replace(secret, "POSTGRES_PASSWORD=***");
    }
}
