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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;

/**
 * SQL differences between the databases a benchmark can run against.
 * <p>
 * Object names are passed unquoted and are expected to be plain lowercase identifiers.
 */
public interface SqlDialect
{
    String getName();

    /**
     * Whether {@link #createMaterializedViewSql} produces a real materialized view,
     * as opposed to a snapshot table maintained by {@link #refreshMaterializedViewSql}.
     */
    boolean hasNativeMaterializedViews();

    default String createViewSql(String viewName, String query)
    {
        return format("CREATE VIEW %s AS %s", viewName, query);
    }

    default String dropViewSql(String viewName)
    {
        return format("DROP VIEW IF EXISTS %s", viewName);
    }

    default String dropTableSql(String tableName)
    {
        return format("DROP TABLE IF EXISTS %s", tableName);
    }

    /**
     * @param populate when false the materialized view is created empty and stays unpopulated until refreshed
     */
    String createMaterializedViewSql(String viewName, String query, boolean populate);

    /**
     * Statements that bring the materialized view up to date with its base tables, in execution order.
     */
    List<String> refreshMaterializedViewSql(String viewName, String query);

    String dropMaterializedViewSql(String viewName);

    String analyzeTableSql(String tableName);

    /**
     * Query returning a single row with columns {@code persistence} and {@code size_bytes}
     * for the object bound to the {@code name} parameter.
     */
    String objectStorageSql();

    /**
     * Name of the object as the catalog stores it.
     */
    default String catalogName(String name)
    {
        return name;
    }

    /**
     * Query returning at most one boolean telling whether the materialized view holds data.
     * No row means the materialized view does not exist.
     */
    String materializedViewPopulatedSql(String viewName);

    /**
     * FROM clause item producing {@code count} rows numbered 1 to {@code count}
     * in the column named by {@link #rowSequenceColumn()}.
     */
    String rowSequence(long count);

    String rowSequenceColumn();

    /**
     * Expression producing a random integer in {@code [low, high]}.
     */
    String randomIntegerSql(long low, long high);

    /**
     * Expression producing one of the string literals, each with equal probability.
     */
    default String randomChoiceSql(List<String> values)
    {
        checkArgument(!values.isEmpty(), "values is empty");
        StringBuilder sql = new StringBuilder("CASE ").append(randomIntegerSql(0, values.size() - 1));
        for (int i = 0; i < values.size(); i++) {
            sql.append(format(" WHEN %s THEN '%s'", i, values.get(i).replace("'", "''")));
        }
        return sql.append(" END").toString();
    }
}
