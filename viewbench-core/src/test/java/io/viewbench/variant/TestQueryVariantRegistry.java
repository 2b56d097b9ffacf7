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

import io.viewbench.ViewBenchException;
import io.viewbench.dialect.H2Dialect;
import io.viewbench.generator.DataGenerator;
import io.viewbench.generator.GenerationMode;
import io.viewbench.generator.ScaleParameters;
import io.viewbench.schema.SchemaProvisioner;
import io.viewbench.testing.TestingH2Database;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static io.viewbench.ViewBenchErrorCode.DERIVED_OBJECT_FAILED;
import static io.viewbench.variant.MaterializedViewPopulation.DEFERRED;
import static io.viewbench.variant.MaterializedViewPopulation.IMMEDIATE;
import static io.viewbench.variant.QueryVariantRegistry.MATERIALIZED_VIEW_NAME;
import static io.viewbench.variant.QueryVariantRegistry.VIEW_NAME;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestQueryVariantRegistry
{
    private static final long ENROLLMENTS = 120;

    private TestingH2Database database;
    private QueryVariantRegistry registry;

    @BeforeMethod
    public void setUp()
    {
        database = new TestingH2Database();
        new SchemaProvisioner(database.getJdbi(), H2Dialect.INSTANCE).create();
        new DataGenerator(database.getJdbi(), H2Dialect.INSTANCE, GenerationMode.CLIENT, 42, 50)
                .generate(new ScaleParameters(5, 30, 10, ENROLLMENTS));
        registry = new QueryVariantRegistry(database.getJdbi(), H2Dialect.INSTANCE);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown()
    {
        database.close();
    }

    @Test
    public void testVariants()
    {
        assertEquals(registry.getVariants().size(), 3);
        assertEquals(registry.getVariants().get(0).getType(), VariantType.RAW_JOIN);
        assertEquals(registry.getVariants().get(1).getType(), VariantType.VIEW);
        assertEquals(registry.getVariants().get(2).getType(), VariantType.MATERIALIZED_VIEW);

        assertEquals(registry.getVariant(VariantType.RAW_JOIN).getSql(), registry.getJoinSql());
        assertEquals(registry.getVariant(VariantType.VIEW).getSql(), "SELECT * FROM enrollment_details");
        assertEquals(registry.getVariant(VariantType.MATERIALIZED_VIEW).getSql(), "SELECT * FROM enrollment_details_mv");
    }

    @Test
    public void testJoinSqlResource()
    {
        String sql = registry.getJoinSql();
        assertTrue(sql.startsWith("SELECT"), sql);
        assertFalse(sql.endsWith(";"), sql);
        for (String table : new String[] {"enrollment", "student", "class", "course"}) {
            assertTrue(sql.contains(table), table);
        }
    }

    @Test
    public void testImmediatePopulation()
    {
        registry.createDerivedObjects(IMMEDIATE);
        assertEquals(database.count("SELECT count(*) FROM (" + registry.getJoinSql() + ") t"), ENROLLMENTS);
        assertEquals(database.count("SELECT count(*) FROM " + VIEW_NAME), ENROLLMENTS);
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), ENROLLMENTS);
    }

    @Test
    public void testDeferredPopulation()
    {
        registry.createDerivedObjects(DEFERRED);
        assertEquals(database.count("SELECT count(*) FROM " + VIEW_NAME), ENROLLMENTS);
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), 0);

        registry.refreshMaterializedView();
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), ENROLLMENTS);

        // refreshing again must not duplicate rows
        registry.refreshMaterializedView();
        registry.analyzeMaterializedView();
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), ENROLLMENTS);
    }

    @Test
    public void testMaterializedViewIsSnapshot()
    {
        registry.createDerivedObjects(IMMEDIATE);
        database.getJdbi().useHandle(handle -> handle.execute("DELETE FROM enrollment WHERE id = 1"));
        assertEquals(database.count("SELECT count(*) FROM " + VIEW_NAME), ENROLLMENTS - 1);
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), ENROLLMENTS);

        registry.refreshMaterializedView();
        assertEquals(database.count("SELECT count(*) FROM " + MATERIALIZED_VIEW_NAME), ENROLLMENTS - 1);
    }

    @Test
    public void testDrop()
    {
        registry.createDerivedObjects(IMMEDIATE);
        registry.dropDerivedObjects();
        assertFalse(database.tableExists(MATERIALIZED_VIEW_NAME));
        assertFalse(database.tableExists(VIEW_NAME));

        // dropping objects that do not exist is a no-op
        registry.dropDerivedObjects();
    }

    @Test
    public void testCreateTwiceFails()
    {
        registry.createDerivedObjects(IMMEDIATE);
        try {
            registry.createDerivedObjects(IMMEDIATE);
            fail("expected existing view to fail creation");
        }
        catch (ViewBenchException e) {
            assertEquals(e.getErrorCode(), DERIVED_OBJECT_FAILED);
        }
    }
}
