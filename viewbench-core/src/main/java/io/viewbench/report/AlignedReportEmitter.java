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

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Strings.repeat;
import static java.lang.Math.max;
import static java.lang.String.format;

/**
 * Prints each report table the way psql prints query results: a centered header,
 * a dashed separator, numbers aligned right and a row count footer.
 */
public class AlignedReportEmitter
        implements ReportEmitter
{
    @Override
    public void emit(BenchmarkReport report, Writer writer)
            throws IOException
    {
        boolean first = true;
        for (ReportTable table : ReportTables.tables(report)) {
            if (!first) {
                writer.append('\n');
            }
            first = false;
            printTable(table, writer);
        }
        writer.flush();
    }

    static void printTable(ReportTable table, Writer writer)
            throws IOException
    {
        List<String> fieldNames = table.getColumns();
        List<List<Object>> rows = table.getRows();
        int columns = fieldNames.size();

        int[] maxWidth = new int[columns];
        for (int i = 0; i < columns; i++) {
            maxWidth[i] = max(1, fieldNames.get(i).length());
        }
        for (List<Object> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                maxWidth[i] = max(maxWidth[i], formatValue(row.get(i)).length());
            }
        }

        writer.append(table.getTitle()).append('\n');
        for (int i = 0; i < columns; i++) {
            if (i > 0) {
                writer.append('|');
            }
            writer.append(center(fieldNames.get(i), maxWidth[i], 1));
        }
        writer.append('\n');

        for (int i = 0; i < columns; i++) {
            if (i > 0) {
                writer.append('+');
            }
            writer.append(repeat("-", maxWidth[i] + 2));
        }
        writer.append('\n');

        for (List<Object> row : rows) {
            for (int column = 0; column < columns; column++) {
                if (column > 0) {
                    writer.append('|');
                }
                boolean numeric = row.get(column) instanceof Number;
                writer.append(align(formatValue(row.get(column)), maxWidth[column], 1, numeric));
            }
            writer.append('\n');
        }
        writer.append(format("(%s row%s)\n", rows.size(), (rows.size() != 1) ? "s" : ""));
    }

    static String formatValue(Object o)
    {
        if (o == null) {
            return "NULL";
        }
        return o.toString();
    }

    private static String center(String s, int maxWidth, int padding)
    {
        int width = s.length();
        checkState(width <= maxWidth, "string width is greater than max width");
        int left = (maxWidth - width) / 2;
        int right = maxWidth - (left + width);
        return repeat(" ", left + padding) + s + repeat(" ", right + padding);
    }

    private static String align(String s, int maxWidth, int padding, boolean right)
    {
        int width = s.length();
        checkState(width <= maxWidth, "string width is greater than max width");
        String large = repeat(" ", (maxWidth - width) + padding);
        String small = repeat(" ", padding);
        return right ? (large + s + small) : (small + s + large);
    }
}
