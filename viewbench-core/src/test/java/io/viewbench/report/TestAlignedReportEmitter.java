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

import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static io.viewbench.report.TestingBenchmarkReports.createReport;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestAlignedReportEmitter
{
    @Test
    public void testPrintTable()
            throws IOException
    {
        List<List<Object>> rows = ImmutableList.of(
                Arrays.<Object>asList("hello", "world", 123),
                Arrays.<Object>asList("a", null, 4.5),
                Arrays.<Object>asList("some long text", "b", 3));
        StringWriter writer = new StringWriter();
        AlignedReportEmitter.printTable(new ReportTable("demo", ImmutableList.of("first", "last", "quantity"), rows), writer);

        String expected = "" +
                "demo\n" +
                "     first      | last  | quantity \n" +
                "----------------+-------+----------\n" +
                " hello          | world |      123 \n" +
                " a              | NULL  |      4.5 \n" +
                " some long text | b     |        3 \n" +
                "(3 rows)\n";
        assertEquals(writer.toString(), expected);
    }

    @Test
    public void testPrintEmptyTable()
            throws IOException
    {
        StringWriter writer = new StringWriter();
        AlignedReportEmitter.printTable(new ReportTable("empty", ImmutableList.of("a", "bb"), ImmutableList.of()), writer);

        String expected = "" +
                "empty\n" +
                " a | bb \n" +
                "---+----\n" +
                "(0 rows)\n";
        assertEquals(writer.toString(), expected);
    }

    @Test
    public void testSingleRowFooter()
            throws IOException
    {
        StringWriter writer = new StringWriter();
        AlignedReportEmitter.printTable(new ReportTable("one", ImmutableList.of("x"), ImmutableList.of(ImmutableList.of(1L))), writer);
        assertTrue(writer.toString().endsWith("(1 row)\n"), writer.toString());
    }

    @Test
    public void testEmitReport()
            throws IOException
    {
        StringWriter writer = new StringWriter();
        new AlignedReportEmitter().emit(createReport(), writer);
        String output = writer.toString();

        assertTrue(output.startsWith("latency\n"), output);
        assertTrue(output.contains("\n\nverification\n"), output);
        assertTrue(output.contains("\n\nspace\n"), output);
        assertTrue(output.contains(" enrollment_details_mv (unpopulated) "), output);
        assertTrue(output.contains(" fail "), output);
        assertTrue(output.contains("\n\nfailures\n"), output);
        assertTrue(output.contains(" materialized_view | Query materialized_view failed: boom "), output);
    }
}
