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
package io.viewbench.dialect;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;

/**
 * H2 has no materialized views. They are emulated by a snapshot table that is
 * created from the query and rebuilt on refresh.
 */
public final class H2Dialect
        implements SqlDialect
{
    public static final H2Dialect INSTANCE = new H2Dialect();

    private H2Dialect() {}

    @Override
    public String getName()
    {
        return "h2";
    }

    @Override
    public boolean hasNativeMaterializedViews()
    {
        return false;
    }

    @Override
    public String createMaterializedViewSql(String viewName, String query, boolean populate)
    {
        if (populate) {
            return format("CREATE TABLE %s AS %s", viewName, query);
        }
        return format("CREATE TABLE %s AS SELECT * FROM (%s) q WHERE 1 = 0", viewName, query);
    }

    @Override
    public List<String> refreshMaterializedViewSql(String viewName, String query)
    {
        return ImmutableList.of(
                format("TRUNCATE TABLE %s", viewName),
                format("INSERT INTO %s %s", viewName, query));
    }

    @Override
    public String dropMaterializedViewSql(String viewName)
    {
        return dropTableSql(viewName);
    }

    @Override
    public String analyzeTableSql(String tableName)
    {
        return format("ANALYZE TABLE %s", tableName);
    }

    @Override
    public String objectStorageSql()
    {
        // every H2 object outlives the session
        return "SELECT 'p' AS persistence, DISK_SPACE_USED(CAST(:name AS VARCHAR)) AS size_bytes";
    }

    @Override
    public String catalogName(String name)
    {
        return name.toUpperCase(ENGLISH);
    }

    @Override
    public String materializedViewPopulatedSql(String viewName)
    {
        return format("SELECT EXISTS (SELECT 1 FROM %s)", viewName);
    }

    @Override
    public String rowSequence(long count)
    {
        checkArgument(count >= 1, "count must be at least 1");
        return format("SYSTEM_RANGE(1, %s)", count);
    }

    @Override
    public String rowSequenceColumn()
    {
        return "X";
    }

    @Override
    public String randomIntegerSql(long low, long high)
    {
        checkArgument(low <= high, "low is greater than high");
        return format("(%s + CAST(FLOOR(RAND() * %s) AS BIGINT))", low, high - low + 1);
    }
}
