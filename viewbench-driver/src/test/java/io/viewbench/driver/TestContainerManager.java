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
import io.viewbench.ViewBenchException;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static io.viewbench.ViewBenchErrorCode.CONTAINER_COMMAND_FAILED;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestContainerManager
{
    @Test
    public void testStart()
    {
        RecordingCommandExecutor executor = new RecordingCommandExecutor(0);
        ContainerConfig config = new ContainerConfig();
        new ContainerManager(new DockerCommands(config), executor, config).start();

        assertEquals(executor.getCommands().size(), 1);
        assertEquals(executor.getCommands().get(0).subList(0, 3), ImmutableList.of("docker", "run", "-d"));
    }

    @Test
    public void testStopRemovesContainer()
    {
        RecordingCommandExecutor executor = new RecordingCommandExecutor(0);
        ContainerConfig config = new ContainerConfig();
        new ContainerManager(new DockerCommands(config), executor, config).stop();

        assertEquals(executor.getCommands(), ImmutableList.of(
                ImmutableList.of("docker", "stop", "viewbench-postgres"),
                ImmutableList.of("docker", "rm", "viewbench-postgres")));
    }

    @Test
    public void testStopKeepsContainer()
    {
        RecordingCommandExecutor executor = new RecordingCommandExecutor(0);
        ContainerConfig config = new ContainerConfig().setRemoveOnStop(false);
        new ContainerManager(new DockerCommands(config), executor, config).stop();

        assertEquals(executor.getCommands(), ImmutableList.of(ImmutableList.of("docker", "stop", "viewbench-postgres")));
    }

    @Test
    public void testCommandFailure()
    {
        RecordingCommandExecutor executor = new RecordingCommandExecutor(125);
        ContainerConfig config = new ContainerConfig().setPassword("secret");
        try {
            new ContainerManager(new DockerCommands(config), executor, config).start();
            fail("expected non-zero exit code to fail");
        }
        catch (ViewBenchException e) {
            assertEquals(e.getErrorCode(), CONTAINER_COMMAND_FAILED);
            assertTrue(e.getMessage().contains("exited with code 125: name already in use"), e.getMessage());
            assertFalse(e.getMessage().contains("secret"), e.getMessage());
        }
    }

    @Test
    public void testStopFailureSkipsRemove()
    {
        RecordingCommandExecutor executor = new RecordingCommandExecutor(1);
        ContainerConfig config = new ContainerConfig();
        try {
            new ContainerManager(new DockerCommands(config), executor, config).stop();
            fail("expected non-zero exit code to fail");
        }
        catch (ViewBenchException e) {
            assertEquals(executor.getCommands().size(), 1);
        }
    }

    private static class RecordingCommandExecutor
            implements CommandExecutor
    {
        private final int exitCode;
        private final List<List<String>> commands = new ArrayList<>();

        RecordingCommandExecutor(int exitCode)
        {
            this.exitCode = exitCode;
        }

        @Override
        public CommandResult execute(List<String> command)
        {
            commands.add(ImmutableList.copyOf(command));
            return new CommandResult(exitCode, exitCode == 0 ? "ok\n" : "name already in use\n");
        }

        public List<List<String>> getCommands()
        {
            return commands;
        }
    }
}
