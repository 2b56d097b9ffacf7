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
package io.viewbench.schema;

import com.google.common.collect.ImmutableList;
import io.viewbench.dialect.H2Dialect;
import io.viewbench.testing.TestingH2Database;
import org.jdbi.v3.core.JdbiException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static java.util.Locale.ENGLISH;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

@Test(singleThreaded = true)
public class TestSchemaProvisioner
{
    private TestingH2Database database;
    private SchemaProvisioner provisioner;

    @BeforeMethod
    public void setUp()
    {
        database = new TestingH2Database();
        provisioner = new SchemaProvisioner(database.getJdbi(), H2Dialect.INSTANCE);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown()
    {
        database.close();
    }

    @Test
    public void testTableOrder()
    {
        assertEquals(BenchmarkTable.creationOrder(), ImmutableList.of(BenchmarkTable.COURSE, BenchmarkTable.STUDENT, BenchmarkTable.CLASS, BenchmarkTable.ENROLLMENT));
        assertEquals(BenchmarkTable.dropOrder(), ImmutableList.of(BenchmarkTable.ENROLLMENT, BenchmarkTable.CLASS, BenchmarkTable.STUDENT, BenchmarkTable.COURSE));
        for (BenchmarkTable table : BenchmarkTable.creationOrder()) {
            for (String parent : table.getParentTables()) {
                int parentIndex = BenchmarkTable.creationOrder().indexOf(BenchmarkTable.valueOf(parent.toUpperCase(ENGLISH)));
                assertTrue(parentIndex < BenchmarkTable.creationOrder().indexOf(table), parent + " must be created before " + table);
            }
        }
    }

    @Test
    public void testCreate()
    {
        provisioner.create();
        for (BenchmarkTable table : BenchmarkTable.values()) {
            assertTrue(database.tableExists(table.getTableName()), table.getTableName());
            assertEquals(database.count("SELECT count(*) FROM " + table.getTableName()), 0);
        }
    }

    @Test
    public void testCreateReplacesExistingTables()
    {
        provisioner.create();
        database.getJdbi().useHandle(handle -> handle.execute("INSERT INTO course VALUES (1, 'Course 1', 3)"));

        provisioner.create();
        assertEquals(database.count("SELECT count(*) FROM course"), 0);
    }

    @Test
    public void testDropIsIdempotent()
    {
        provisioner.drop();
        provisioner.create();
        provisioner.drop();
        provisioner.drop();
        for (BenchmarkTable table : BenchmarkTable.values()) {
            assertFalse(database.tableExists(table.getTableName()), table.getTableName());
        }
    }

    @Test
    public void testAnalyze()
    {
        provisioner.create();
        provisioner.analyze();
    }

    @Test(expectedExceptions = JdbiException.class)
    public void testCreditsConstraint()
    {
        provisioner.create();
        database.getJdbi().useHandle(handle -> handle.execute("INSERT INTO course VALUES (1, 'Course 1', 6)"));
    }

    @Test(expectedExceptions = JdbiException.class)
    public void testGenderConstraint()
    {
        provisioner.create();
        database.getJdbi().useHandle(handle -> handle.execute("INSERT INTO student VALUES (1, 'Ann', 'Lee', 'X')"));
    }

    @Test(expectedExceptions = JdbiException.class)
    public void testForeignKey()
    {
        provisioner.create();
        database.getJdbi().useHandle(handle -> handle.execute("INSERT INTO class VALUES (1, 42)"));
    }
}
