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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A titled table of report values. Numeric cells stay numbers so emitters can align them.
 */
public class ReportTable
{
    private final String title;
    private final List<String> columns;
    private final List<List<Object>> rows;

    public ReportTable(String title, List<String> columns, List<List<Object>> rows)
    {
        this.title = requireNonNull(title, "title is null");
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        this.rows = ImmutableList.copyOf(requireNonNull(rows, "rows is null"));
        for (List<Object> row : rows) {
            checkArgument(row.size() == columns.size(), "row %s does not have %s columns", row, columns.size());
        }
    }

    public String getTitle()
    {
        return title;
    }

    public List<String> getColumns()
    {
        return columns;
    }

    public List<List<Object>> getRows()
    {
        return rows;
    }
}
