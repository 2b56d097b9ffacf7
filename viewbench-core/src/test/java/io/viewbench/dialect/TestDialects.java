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
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestDialects
{
    @Test
    public void testDialectFromJdbcUrl()
    {
        assertSame(DialectType.fromJdbcUrl("jdbc:postgresql://localhost:5432/postgres").getDialect(), PostgreSqlDialect.INSTANCE);
        assertSame(DialectType.fromJdbcUrl("jdbc:h2:mem:test").getDialect(), H2Dialect.INSTANCE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnsupportedJdbcUrl()
    {
        DialectType.fromJdbcUrl("jdbc:mysql://localhost/test");
    }

    @Test
    public void testPostgreSqlMaterializedView()
    {
        SqlDialect dialect = PostgreSqlDialect.INSTANCE;
        assertTrue(dialect.hasNativeMaterializedViews());
        assertEquals(dialect.createMaterializedViewSql("mv", "SELECT 1", true), "CREATE MATERIALIZED VIEW mv AS SELECT 1 WITH DATA");
        assertEquals(dialect.createMaterializedViewSql("mv", "SELECT 1", false), "CREATE MATERIALIZED VIEW mv AS SELECT 1 WITH NO DATA");
        assertEquals(dialect.refreshMaterializedViewSql("mv", "SELECT 1").size(), 1);
        assertTrue(dialect.refreshMaterializedViewSql("mv", "SELECT 1").get(0).startsWith("REFRESH MATERIALIZED VIEW mv"));
        assertEquals(dialect.dropMaterializedViewSql("mv"), "DROP MATERIALIZED VIEW IF EXISTS mv");
        assertEquals(dialect.analyzeTableSql("course"), "ANALYZE course");
        assertTrue(dialect.objectStorageSql().contains("pg_total_relation_size"));
        assertTrue(dialect.materializedViewPopulatedSql("mv").contains("matviewname = 'mv'"));
        assertEquals(dialect.catalogName("course"), "course");
    }

    @Test
    public void testPostgreSqlRowGeneration()
    {
        SqlDialect dialect = PostgreSqlDialect.INSTANCE;
        assertTrue(dialect.rowSequence(10).contains("generate_series(1, 10)"));
        assertEquals(dialect.rowSequenceColumn(), "i");
        assertTrue(dialect.randomIntegerSql(1, 5).contains("random()"));
    }

    @Test
    public void testH2MaterializedViewEmulation()
    {
        SqlDialect dialect = H2Dialect.INSTANCE;
        assertFalse(dialect.hasNativeMaterializedViews());
        assertEquals(dialect.createMaterializedViewSql("mv", "SELECT 1 AS x", true), "CREATE TABLE mv AS SELECT 1 AS x");
        assertTrue(dialect.createMaterializedViewSql("mv", "SELECT 1 AS x", false).endsWith("WHERE 1 = 0"));
        assertEquals(dialect.refreshMaterializedViewSql("mv", "SELECT 1 AS x").size(), 2);
        assertEquals(dialect.refreshMaterializedViewSql("mv", "SELECT 1 AS x").get(0), "TRUNCATE TABLE mv");
        assertEquals(dialect.dropMaterializedViewSql("mv"), "DROP TABLE IF EXISTS mv");
        assertEquals(dialect.catalogName("enrollment_details_mv"), "ENROLLMENT_DETAILS_MV");
    }

    @Test
    public void testCommonStatements()
    {
        for (DialectType type : DialectType.values()) {
            SqlDialect dialect = type.getDialect();
            assertEquals(dialect.createViewSql("v", "SELECT 1"), "CREATE VIEW v AS SELECT 1");
            assertEquals(dialect.dropViewSql("v"), "DROP VIEW IF EXISTS v");
            assertEquals(dialect.dropTableSql("t"), "DROP TABLE IF EXISTS t");
            String choice = dialect.randomChoiceSql(ImmutableList.of("M", "F", "O'Hara"));
            assertTrue(choice.startsWith("CASE " + dialect.randomIntegerSql(0, 2)), choice);
            assertTrue(choice.endsWith(" WHEN 0 THEN 'M' WHEN 1 THEN 'F' WHEN 2 THEN 'O''Hara' END"), choice);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "values is empty")
    public void testEmptyRandomChoice()
    {
        PostgreSqlDialect.INSTANCE.randomChoiceSql(ImmutableList.of());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidRandomRange()
    {
        H2Dialect.INSTANCE.randomIntegerSql(5, 1);
    }
}
