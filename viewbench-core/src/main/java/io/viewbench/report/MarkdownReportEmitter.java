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

import com.google.common.base.Joiner;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub flavored markdown tables, one per report section.
 */
public class MarkdownReportEmitter
        implements ReportEmitter
{
    private static final Joiner CELL_JOINER = Joiner.on(" | ");

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

            writer.append("### ").append(table.getTitle()).append("\n\n");
            writer.append(row(table.getColumns()));

            List<String> separators = new ArrayList<>();
            for (int column = 0; column < table.getColumns().size(); column++) {
                separators.add(isNumeric(table, column) ? "---:" : "---");
            }
            writer.append(row(separators));

            for (List<Object> values : table.getRows()) {
                List<String> cells = new ArrayList<>();
                for (Object value : values) {
                    cells.add(escape(AlignedReportEmitter.formatValue(value)));
                }
                writer.append(row(cells));
            }
        }
        writer.flush();
    }

    private static String row(List<String> cells)
    {
        return "| " + CELL_JOINER.join(cells) + " |\n";
    }

    private static boolean isNumeric(ReportTable table, int column)
    {
        return !table.getRows().isEmpty() &&
                table.getRows().stream().allMatch(row -> row.get(column) instanceof Number);
    }

    private static String escape(String value)
    {
        return value.replace("|", "\\|");
    }
}
