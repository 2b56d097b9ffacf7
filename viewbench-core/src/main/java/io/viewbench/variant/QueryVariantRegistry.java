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
package io.viewbench.variant;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;
import io.viewbench.dialect.SqlDialect;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static io.airlift.units.Duration.nanosSince;
import static io.viewbench.ViewBenchErrorCode.DERIVED_OBJECT_FAILED;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * The three equivalent ways of reading enrollment details: the join itself,
 * a view over the join and a materialized view over the join.
 */
public class QueryVariantRegistry
{
    private static final Logger log = Logger.get(QueryVariantRegistry.class);

    public static final String VIEW_NAME = "enrollment_details";
    public static final String MATERIALIZED_VIEW_NAME = "enrollment_details_mv";

    private static final String JOIN_RESOURCE = "enrollment_details.sql";

    private final Jdbi jdbi;
    private final SqlDialect dialect;
    private final String joinSql;
    private final List<QueryVariant> variants;

    public QueryVariantRegistry(Jdbi jdbi, SqlDialect dialect)
    {
        this(jdbi, dialect, loadJoinSql());
    }

    @VisibleForTesting
    QueryVariantRegistry(Jdbi jdbi, SqlDialect dialect, String joinSql)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.joinSql = requireNonNull(joinSql, "joinSql is null");
        this.variants = ImmutableList.of(
                new QueryVariant("raw_join", VariantType.RAW_JOIN, joinSql),
                new QueryVariant("view", VariantType.VIEW, "SELECT * FROM " + VIEW_NAME),
                new QueryVariant("materialized_view", VariantType.MATERIALIZED_VIEW, "SELECT * FROM " + MATERIALIZED_VIEW_NAME));
    }

    /**
     * Variants in benchmark order, raw join first.
     */
    public List<QueryVariant> getVariants()
    {
        return variants;
    }

    public QueryVariant getVariant(VariantType type)
    {
        requireNonNull(type, "type is null");
        return variants.stream()
                .filter(variant -> variant.getType() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown variant type: " + type));
    }

    public String getJoinSql()
    {
        return joinSql;
    }

    public void createDerivedObjects(MaterializedViewPopulation population)
    {
        requireNonNull(population, "population is null");
        long start = System.nanoTime();
        execute(format("create view %s", VIEW_NAME), ImmutableList.of(dialect.createViewSql(VIEW_NAME, joinSql)));
        execute(
                format("create materialized view %s", MATERIALIZED_VIEW_NAME),
                ImmutableList.of(dialect.createMaterializedViewSql(MATERIALIZED_VIEW_NAME, joinSql, population == MaterializedViewPopulation.IMMEDIATE)));
        log.info("Created %s and %s (%s) in %s", VIEW_NAME, MATERIALIZED_VIEW_NAME, population, nanosSince(start).convertToMostSuccinctTimeUnit());
    }

    public void refreshMaterializedView()
    {
        long start = System.nanoTime();
        execute(format("refresh materialized view %s", MATERIALIZED_VIEW_NAME), dialect.refreshMaterializedViewSql(MATERIALIZED_VIEW_NAME, joinSql));
        log.info("Refreshed %s in %s", MATERIALIZED_VIEW_NAME, nanosSince(start).convertToMostSuccinctTimeUnit());
    }

    /**
     * Refreshes the optimizer statistics of the materialized view.
     */
    public void analyzeMaterializedView()
    {
        execute(format("analyze materialized view %s", MATERIALIZED_VIEW_NAME), ImmutableList.of(dialect.analyzeTableSql(MATERIALIZED_VIEW_NAME)));
    }

    public void dropDerivedObjects()
    {
        execute(format("drop materialized view %s", MATERIALIZED_VIEW_NAME), ImmutableList.of(dialect.dropMaterializedViewSql(MATERIALIZED_VIEW_NAME)));
        execute(format("drop view %s", VIEW_NAME), ImmutableList.of(dialect.dropViewSql(VIEW_NAME)));
    }

    private void execute(String action, List<String> statements)
    {
        try {
            jdbi.useTransaction(handle -> {
                for (String statement : statements) {
                    log.debug("Executing: %s", statement);
                    handle.execute(statement);
                }
            });
        }
        catch (JdbiException e) {
            throw new ViewBenchException(DERIVED_OBJECT_FAILED, format("Failed to %s", action), e);
        }
    }

    private static String loadJoinSql()
    {
        try {
            String sql = Resources.toString(Resources.getResource(QueryVariantRegistry.class, JOIN_RESOURCE), UTF_8).trim();
            if (sql.endsWith(";")) {
                sql = sql.substring(0, sql.length() - 1).trim();
            }
            return sql;
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
