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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigSecuritySensitive;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

public class ContainerConfig
{
    private String dockerCommand = "docker";
    private String name = "viewbench-postgres";
    private String image = "postgres:15";
    private int hostPort = 5432;
    private String password = "postgres";
    private boolean removeOnStop = true;

    @NotNull
    public String getDockerCommand()
    {
        return dockerCommand;
    }

    @Config("container.docker-command")
    public ContainerConfig setDockerCommand(String dockerCommand)
    {
        this.dockerCommand = dockerCommand;
        return this;
    }

    @NotNull
    public String getName()
    {
        return name;
    }

    @Config("container.name")
    public ContainerConfig setName(String name)
    {
        this.name = name;
        return this;
    }

    @NotNull
    public String getImage()
    {
        return image;
    }

    @Config("container.image")
    public ContainerConfig setImage(String image)
    {
        this.image = image;
        return this;
    }

    @Min(1)
    @Max(65535)
    public int getHostPort()
    {
        return hostPort;
    }

    @Config("container.host-port")
    public ContainerConfig setHostPort(int hostPort)
    {
        this.hostPort = hostPort;
        return this;
    }

    @NotNull
    public String getPassword()
    {
        return password;
    }

    @Config("container.password")
    @ConfigSecuritySensitive
    public ContainerConfig setPassword(String password)
    {
        this.password = password;
        return this;
    }

    public boolean isRemoveOnStop()
    {
        return removeOnStop;
    }

    @Config("container.remove-on-stop")
    public ContainerConfig setRemoveOnStop(boolean removeOnStop)
    {
        this.removeOnStop = removeOnStop;
        return this;
    }
}
