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

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestRowGenerator
{
    @Test
    public void testValueRanges()
    {
        RowGenerator rows = new RowGenerator(1);
        for (int i = 0; i < 10_000; i++) {
            int credits = rows.nextCredits();
            assertTrue(credits >= RowGenerator.MIN_CREDITS && credits <= RowGenerator.MAX_CREDITS, "credits " + credits);

            String gender = rows.nextGender();
            assertTrue(gender.equals("M") || gender.equals("F"), "gender " + gender);

            long id = rows.nextId(17);
            assertTrue(id >= 1 && id <= 17, "id " + id);

            String name = rows.nextName();
            assertTrue(name.length() >= 4 && name.length() <= 64, name);
            assertTrue(Character.isUpperCase(name.charAt(0)), name);
        }
        assertEquals(rows.nextId(1), 1);
    }

    @Test
    public void testCourseName()
    {
        assertTrue(new RowGenerator(1).nextCourseName(12).startsWith("Course 12 "));
    }

    @Test
    public void testSameSeedSameValues()
    {
        RowGenerator first = new RowGenerator(42);
        RowGenerator second = new RowGenerator(42);
        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextName(), second.nextName());
            assertEquals(first.nextId(1_000), second.nextId(1_000));
        }
    }
}
