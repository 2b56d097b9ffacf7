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
package io.viewbench.report;

import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;

import static io.viewbench.report.TestingBenchmarkReports.createReport;
import static org.testng.Assert.assertTrue;

public class TestMarkdownReportEmitter
{
    @Test
    public void testEmit()
            throws IOException
    {
        StringWriter writer = new StringWriter();
        new MarkdownReportEmitter().emit(createReport(), writer);
        String output = writer.toString();

        assertTrue(output.startsWith("" +
                "### latency\n" +
                "\n" +
                "| variant | status | rows | median_ms | mean_ms | stddev_ms | min_ms | max_ms | speedup |\n" +
                "| --- | --- | ---: | ---: | ---: | ---: | ---: | ---: | --- |\n" +
                "| raw_join | pass | 1000 | 4.000 | 4.000 | "), output);
        assertTrue(output.contains("| view | pass | 1000 | 2.000 | 2.000 | 0.000 | 2.000 | 2.000 | 2.00 |\n"), output);
        assertTrue(output.contains("| materialized_view | fail | 0 | 0.000 | 0.000 | 0.000 | 0.000 | 0.000 | n/a |\n"), output);
        assertTrue(output.contains("\n\n### verification\n\n| control | test | status | control_rows | test_rows |\n"), output);
        assertTrue(output.contains("| raw_join | view | match | 1000 | 1000 |\n"), output);
        assertTrue(output.contains("\n\n### space\n\n| object | kind | persistence | size |\n| --- | --- | --- | --- |\n"), output);
        assertTrue(output.contains("| enrollment | table | permanent | 64KB |\n"), output);
        assertTrue(output.endsWith("\n\n### failures\n\n| variant | error |\n| --- | --- |\n| materialized_view | Query materialized_view failed: boom |\n"), output);
    }
}
