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

import io.airlift.airline.Cli;
import io.airlift.airline.Help;
import io.airlift.log.Level;
import io.airlift.log.Logging;
import io.airlift.log.LoggingConfiguration;
import io.viewbench.ViewBenchException;

import java.io.PrintStream;

import static com.google.common.base.Throwables.throwIfUnchecked;
import static com.google.common.io.ByteStreams.nullOutputStream;

public final class ViewBenchCli
{
    private ViewBenchCli() {}

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void main(String[] args)
    {
        Cli<Runnable> cli = Cli.<Runnable>builder("viewbench")
                .withDescription("Compares a raw join against a view and a materialized view over the same join")
                .withDefaultCommand(Help.class)
                .withCommand(RunCommand.class)
                .withCommand(ProvisionCommand.class)
                .withCommand(ContainerStartCommand.class)
                .withCommand(ContainerStopCommand.class)
                .withCommand(Help.class)
                .build();

        Runnable command = cli.parse(args);
        try {
            command.run();
        }
        catch (ViewBenchException e) {
            System.err.println(e.getErrorCode() + ": " + e.getMessage());
            System.exit(1);
        }

        if (command instanceof AbstractViewBenchCommand) {
            System.exit(((AbstractViewBenchCommand) command).getExitCode());
        }
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void initializeLogging(boolean debug)
    {
        // unhook out and err while initializing logging or logger will print to them
        PrintStream out = System.out;
        PrintStream err = System.err;
        try {
            if (debug) {
                Logging logging = Logging.initialize();
                logging.configure(new LoggingConfiguration());
                logging.setLevel("io.viewbench", Level.DEBUG);
            }
            else {
                System.setOut(new PrintStream(nullOutputStream()));
                System.setErr(new PrintStream(nullOutputStream()));

                Logging logging = Logging.initialize();
                logging.configure(new LoggingConfiguration());
                logging.disableConsole();
            }
        }
        catch (Exception e) {
            throwIfUnchecked(e);
            throw new RuntimeException(e);
        }
        finally {
            System.setOut(out);
            System.setErr(err);
        }
    }
}
