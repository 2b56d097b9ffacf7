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
package io.viewbench.runner;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TestStat
{
    private static final double EPSILON = 1e-9;

    @Test
    public void testOddCount()
    {
        Stat stat = new Stat(new double[] {5, 1, 3});
        assertEquals(stat.getCount(), 3);
        assertEquals(stat.getMin(), 1.0, EPSILON);
        assertEquals(stat.getMax(), 5.0, EPSILON);
        assertEquals(stat.getMean(), 3.0, EPSILON);
        assertEquals(stat.getMedian(), 3.0, EPSILON);
        assertEquals(stat.getStandardDeviation(), Math.sqrt(8.0 / 3), EPSILON);
    }

    @Test
    public void testEvenCount()
    {
        Stat stat = new Stat(new double[] {2, 4, 4, 4, 5, 5, 7, 9});
        assertEquals(stat.getMedian(), 4.5, EPSILON);
        assertEquals(stat.getMean(), 5.0, EPSILON);
        assertEquals(stat.getStandardDeviation(), 2.0, EPSILON);
    }

    @Test
    public void testSingleSample()
    {
        Stat stat = new Stat(new double[] {42});
        assertEquals(stat.getMedian(), 42.0, EPSILON);
        assertEquals(stat.getStandardDeviation(), 0.0, EPSILON);
    }

    @Test
    public void testEmpty()
    {
        Stat stat = new Stat(new double[0]);
        assertEquals(stat.getCount(), 0);
        assertEquals(stat.getMin(), 0.0, EPSILON);
        assertEquals(stat.getMax(), 0.0, EPSILON);
        assertEquals(stat.getMean(), 0.0, EPSILON);
        assertEquals(stat.getMedian(), 0.0, EPSILON);
        assertEquals(stat.getStandardDeviation(), 0.0, EPSILON);
    }

    @Test
    public void testSamplesAreNotModified()
    {
        double[] samples = {3, 1, 2};
        new Stat(samples);
        assertEquals(samples, new double[] {3, 1, 2});
    }
}
