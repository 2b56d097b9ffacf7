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
package io.viewbench.generator;

import io.viewbench.schema.BenchmarkTable;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TestScaleParameters
{
    @Test
    public void testScaleFactor()
    {
        assertEquals(ScaleParameters.withScaleFactor(1), new ScaleParameters(100, 1_000, 500, 10_000));
        assertEquals(ScaleParameters.withScaleFactor(2.5), new ScaleParameters(250, 2_500, 1_250, 25_000));
        assertEquals(ScaleParameters.withScaleFactor(0.01), new ScaleParameters(1, 10, 5, 100));
    }

    @Test
    public void testTinyScaleFactorKeepsOneRowPerTable()
    {
        ScaleParameters scale = ScaleParameters.withScaleFactor(0.0001);
        for (BenchmarkTable table : BenchmarkTable.values()) {
            assertEquals(scale.getRowCount(table), 1, table.getTableName());
        }
    }

    @Test
    public void testOverrides()
    {
        ScaleParameters scale = ScaleParameters.withScaleFactor(1)
                .withCourses(7)
                .withStudents(8)
                .withClasses(9)
                .withEnrollments(10);
        assertEquals(scale.getRowCount(BenchmarkTable.COURSE), 7);
        assertEquals(scale.getRowCount(BenchmarkTable.STUDENT), 8);
        assertEquals(scale.getRowCount(BenchmarkTable.CLASS), 9);
        assertEquals(scale.getRowCount(BenchmarkTable.ENROLLMENT), 10);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroRowsRejected()
    {
        new ScaleParameters(1, 1, 0, 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveScaleFactorRejected()
    {
        ScaleParameters.withScaleFactor(0);
    }
}
