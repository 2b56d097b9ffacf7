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

import com.google.common.io.CharStreams;
import io.viewbench.ViewBenchException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.List;

import static io.viewbench.ViewBenchErrorCode.CONTAINER_COMMAND_FAILED;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs a command to completion. Standard error is merged into the captured output.
 */
public class ProcessCommandExecutor
        implements CommandExecutor
{
    @Override
    public CommandResult execute(List<String> command)
    {
        ProcessBuilder processBuilder = new ProcessBuilder(command)
                .redirectErrorStream(true);
        Process process;
        try {
            process = processBuilder.start();
        }
        catch (IOException e) {
            throw new ViewBenchException(CONTAINER_COMMAND_FAILED, format("Cannot start %s", command.get(0)), e);
        }

        try (Reader reader = new InputStreamReader(process.getInputStream(), UTF_8)) {
            String output = CharStreams.toString(reader);
            return new CommandResult(process.waitFor(), output);
        }
        catch (IOException e) {
            throw new ViewBenchException(CONTAINER_COMMAND_FAILED, format("Failed to read output of %s", command.get(0)), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new ViewBenchException(CONTAINER_COMMAND_FAILED, format("Interrupted while waiting for %s", command.get(0)), e);
        }
    }
}
