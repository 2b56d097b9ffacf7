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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Produces column values for client side generation. Two generators created
 * with the same seed produce the same sequence of values.
 */
public class RowGenerator
{
    public static final int MIN_CREDITS = 1;
    public static final int MAX_CREDITS = 5;

    static final List<String> SYLLABLES = ImmutableList.of(
            "an", "ber", "cal", "da", "el", "fin", "gor", "ha", "is", "jo",
            "ka", "lin", "mar", "no", "or", "pe", "qui", "ro", "sa", "tor",
            "ul", "va", "wen", "xi", "ya", "zel");

    static final List<String> SUBJECTS = ImmutableList.of(
            "Algebra", "Biology", "Chemistry", "Databases", "Economics", "French",
            "Geometry", "History", "Literature", "Music", "Philosophy", "Physics",
            "Statistics", "Networks", "Compilers", "Painting");

    private final Random random;

    public RowGenerator(long seed)
    {
        this.random = new Random(seed);
    }

    public String nextName()
    {
        int syllables = 2 + random.nextInt(2);
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < syllables; i++) {
            name.append(SYLLABLES.get(random.nextInt(SYLLABLES.size())));
        }
        name.setCharAt(0, Character.toUpperCase(name.charAt(0)));
        return name.toString();
    }

    public String nextGender()
    {
        return random.nextBoolean() ? "M" : "F";
    }

    public String nextCourseName(long courseId)
    {
        return "Course " + courseId + " " + SUBJECTS.get(random.nextInt(SUBJECTS.size()));
    }

    public int nextCredits()
    {
        return MIN_CREDITS + random.nextInt(MAX_CREDITS - MIN_CREDITS + 1);
    }

    /**
     * Returns an id in {@code [1, count]}, the id range of a table holding {@code count} rows.
     */
    public long nextId(long count)
    {
        checkArgument(count >= 1, "count must be at least 1");
        if (count <= Integer.MAX_VALUE) {
            return 1 + random.nextInt((int) count);
        }
        return 1 + Math.floorMod(random.nextLong(), count);
    }
}
