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

public final class PostgreSqlDialect
        implements SqlDialect
{
    public static final PostgreSqlDialect INSTANCE = new PostgreSqlDialect();

    private PostgreSqlDialect() {}

    @Override
    public String getName()
    {
        return "postgresql";
    }

    @Override
    public boolean hasNativeMaterializedViews()
    {
        return true;
    }

    @Override
    public String createMaterializedViewSql(String viewName, String query, boolean populate)
    {
        return format("CREATE MATERIALIZED VIEW %s AS %s WITH %s", viewName, query, populate ? "DATA" : "NO DATA");
    }

    @Override
    public List<String> refreshMaterializedViewSql(String viewName, String query)
    {
        return ImmutableList.of(format("REFRESH MATERIALIZED VIEW %s", viewName));
    }

    @Override
    public String dropMaterializedViewSql(String viewName)
    {
        return format("DROP MATERIALIZED VIEW IF EXISTS %s", viewName);
    }

    @Override
    public String analyzeTableSql(String tableName)
    {
        return format("ANALYZE %s", tableName);
    }

    @Override
    public String objectStorageSql()
    {
        // relpersistence: p = permanent, u = unlogged, t = temporary
        return "" +
                "SELECT c.relpersistence AS persistence\n" +
                ", pg_total_relation_size(c.oid) AS size_bytes\n" +
                "FROM pg_class c\n" +
                "JOIN pg_namespace n ON n.oid = c.relnamespace\n" +
                "WHERE n.nspname = current_schema()\n" +
                "AND c.relname = :name";
    }

    @Override
    public String materializedViewPopulatedSql(String viewName)
    {
        return format("" +
                "SELECT ispopulated\n" +
                "FROM pg_matviews\n" +
                "WHERE schemaname = current_schema()\n" +
                "AND matviewname = '%s'", viewName);
    }

    @Override
    public String rowSequence(long count)
    {
        checkArgument(count >= 1, "count must be at least 1");
        return format("generate_series(1, %s) AS g(i)", count);
    }

    @Override
    public String rowSequenceColumn()
    {
        return "i";
    }

    @Override
    public String randomIntegerSql(long low, long high)
    {
        checkArgument(low <= high, "low is greater than high");
        return format("(%s + floor(random() * %s)::bigint)", low, high - low + 1);
    }
}
