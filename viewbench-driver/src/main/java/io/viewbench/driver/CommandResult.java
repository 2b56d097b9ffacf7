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

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class CommandResult
{
    private final int exitCode;
    private final String output;

    public CommandResult(int exitCode, String output)
    {
        this.exitCode = exitCode;
        this.output = requireNonNull(output, "output is null");
    }

    public int getExitCode()
    {
        return exitCode;
    }

    /**
     * Standard output and standard error, interleaved.
     */
    public String getOutput()
    {
        return output;
    }

    public boolean isSuccess()
    {
        return exitCode == 0;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("exitCode", exitCode)
                .add("output", output)
                .toString();
    }
}
