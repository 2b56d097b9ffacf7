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

import au.com.bytecode.opencsv.CSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * One CSV block per report section, each starting with its header record.
 * Blocks are separated by an empty line.
 */
public class CsvReportEmitter
        implements ReportEmitter
{
    @Override
    public void emit(BenchmarkReport report, Writer writer)
            throws IOException
    {
        CSVWriter csvWriter = new CSVWriter(writer);
        boolean first = true;
        for (ReportTable table : ReportTables.tables(report)) {
            if (!first) {
                csvWriter.flush();
                writer.append('\n');
            }
            first = false;

            csvWriter.writeNext(toStrings(table.getColumns()));
            for (List<Object> row : table.getRows()) {
                csvWriter.writeNext(toStrings(row));
                checkError(csvWriter);
            }
        }
        csvWriter.flush();
        checkError(csvWriter);
    }

    private static void checkError(CSVWriter writer)
            throws IOException
    {
        if (writer.checkError()) {
            throw new IOException("error writing to output");
        }
    }

    private static String[] toStrings(List<?> values)
    {
        String[] array = new String[values.size()];
        for (int i = 0; i < values.size(); i++) {
            array[i] = formatValue(values.get(i));
        }
        return array;
    }

    static String formatValue(Object o)
    {
        if (o == null) {
            return "";
        }
        return o.toString();
    }
}
