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

import com.google.common.base.Splitter;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static io.viewbench.report.TestingBenchmarkReports.createReport;
import static org.testng.Assert.assertEquals;

public class TestCsvReportEmitter
{
    @Test
    public void testEmit()
            throws IOException
    {
        StringWriter writer = new StringWriter();
        new CsvReportEmitter().emit(createReport(), writer);
        List<String> lines = Splitter.on('\n').splitToList(writer.toString());

        assertEquals(lines.get(0), "\"variant\",\"status\",\"rows\",\"median_ms\",\"mean_ms\",\"stddev_ms\",\"min_ms\",\"max_ms\",\"speedup\"");
        assertEquals(lines.get(2), "\"view\",\"pass\",\"1000\",\"2.000\",\"2.000\",\"0.000\",\"2.000\",\"2.000\",\"2.00\"");
        assertEquals(lines.get(3), "\"materialized_view\",\"fail\",\"0\",\"0.000\",\"0.000\",\"0.000\",\"0.000\",\"0.000\",\"n/a\"");
        assertEquals(lines.get(4), "");
        assertEquals(lines.get(5), "\"control\",\"test\",\"status\",\"control_rows\",\"test_rows\"");
        assertEquals(lines.get(6), "\"raw_join\",\"view\",\"match\",\"1000\",\"1000\"");
        assertEquals(lines.get(7), "");
        assertEquals(lines.get(8), "\"object\",\"kind\",\"persistence\",\"size\"");
        assertEquals(lines.get(11), "\"enrollment_details_mv (unpopulated)\",\"materialized_view\",\"unlogged\",\"1.5MB\"");
        assertEquals(lines.get(12), "");
        assertEquals(lines.get(13), "\"variant\",\"error\"");
        assertEquals(lines.get(14), "\"materialized_view\",\"Query materialized_view failed: boom\"");
        assertEquals(lines.get(15), "");
        assertEquals(lines.size(), 16);
    }
}
