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

import com.google.inject.Injector;
import io.airlift.airline.Command;
import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;
import io.viewbench.ViewBenchmark;
import io.viewbench.report.BenchmarkReport;
import io.viewbench.report.ReportEmitter;

import javax.inject.Inject;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static io.viewbench.ViewBenchErrorCode.REPORT_FAILED;
import static java.nio.charset.StandardCharsets.UTF_8;

@Command(name = "run", description = "Provision, generate data, benchmark every variant and print the report")
public class RunCommand
        extends AbstractViewBenchCommand
{
    private static final Logger log = Logger.get(RunCommand.class);

    @Inject
    public BenchmarkOptions benchmarkOptions = new BenchmarkOptions();

    @Override
    protected Map<String, String> getConfigurationOverrides()
    {
        return new HashMap<>(benchmarkOptions.toConfigurationProperties());
    }

    @Override
    protected int execute(Injector injector)
    {
        BenchmarkReport report;
        try (ViewBenchmark benchmark = injector.getInstance(ViewBenchmark.class)) {
            report = benchmark.run();
        }

        ReportConfig reportConfig = injector.getInstance(ReportConfig.class);
        writeReport(report, injector.getInstance(ReportEmitter.class), reportConfig.getOutputFile());

        if (!report.isSuccessful()) {
            log.warn("Benchmark finished with failed variants or mismatched results");
            return 1;
        }
        return 0;
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static void writeReport(BenchmarkReport report, ReportEmitter emitter, String outputFile)
    {
        try {
            if (outputFile == null) {
                // System.out stays open
                emitter.emit(report, new OutputStreamWriter(System.out, UTF_8));
                return;
            }
            try (Writer writer = Files.newBufferedWriter(Paths.get(outputFile), UTF_8)) {
                emitter.emit(report, writer);
            }
            log.info("Report written to %s", outputFile);
        }
        catch (IOException e) {
            throw new ViewBenchException(REPORT_FAILED, "Failed to write report", e);
        }
    }
}
