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
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TestDockerCommands
{
    private final DockerCommands commands = new DockerCommands(new ContainerConfig()
            .setName("bench")
            .setImage("postgres:16")
            .setHostPort(15432)
            .setPassword("secret"));

    @Test
    public void testStartCommand()
    {
        assertEquals(commands.startCommand(), ImmutableList.of(
                "docker", "run", "-d",
                "--name", "bench",
                "-e", "POSTGRES_PASSWORD=secret",
                "-p", "15432:5432",
                "postgres:16"));
    }

    @Test
    public void testStopAndRemoveCommands()
    {
        assertEquals(commands.stopCommand(), ImmutableList.of("docker", "stop", "bench"));
        assertEquals(commands.removeCommand(), ImmutableList.of("docker", "rm", "bench"));
    }

    @Test
    public void testDockerCommand()
    {
        DockerCommands podman = new DockerCommands(new ContainerConfig().setDockerCommand("podman"));
        assertEquals(podman.stopCommand(), ImmutableList.of("podman", "stop", "viewbench-postgres"));
    }

    @Test
    public void testDescribeMasksPassword()
    {
        assertEquals(
                commands.describe(commands.startCommand()),
                "docker run -d --name bench -e POSTGRES_PASSWORD=*** -p 15432:5432 postgres:16");
        assertEquals(commands.describe(commands.stopCommand()), "docker stop bench");
    }
}
