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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.viewbench.schema.BenchmarkTable;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.round;

public class ScaleParameters
{
    public static final long COURSES_PER_SCALE = 100;
    public static final long STUDENTS_PER_SCALE = 1_000;
    public static final long CLASSES_PER_SCALE = 500;
    public static final long ENROLLMENTS_PER_SCALE = 10_000;

    private final long courses;
    private final long students;
    private final long classes;
    private final long enrollments;

    @JsonCreator
    public ScaleParameters(
            @JsonProperty("courses") long courses,
            @JsonProperty("students") long students,
            @JsonProperty("classes") long classes,
            @JsonProperty("enrollments") long enrollments)
    {
        checkArgument(courses >= 1, "courses must be at least 1");
        checkArgument(students >= 1, "students must be at least 1");
        checkArgument(classes >= 1, "classes must be at least 1");
        checkArgument(enrollments >= 1, "enrollments must be at least 1");
        this.courses = courses;
        this.students = students;
        this.classes = classes;
        this.enrollments = enrollments;
    }

    public static ScaleParameters withScaleFactor(double scaleFactor)
    {
        checkArgument(scaleFactor > 0, "scaleFactor must be positive");
        return new ScaleParameters(
                scaled(COURSES_PER_SCALE, scaleFactor),
                scaled(STUDENTS_PER_SCALE, scaleFactor),
                scaled(CLASSES_PER_SCALE, scaleFactor),
                scaled(ENROLLMENTS_PER_SCALE, scaleFactor));
    }

    private static long scaled(long base, double scaleFactor)
    {
        return max(1, round(base * scaleFactor));
    }

    @JsonProperty
    public long getCourses()
    {
        return courses;
    }

    @JsonProperty
    public long getStudents()
    {
        return students;
    }

    @JsonProperty
    public long getClasses()
    {
        return classes;
    }

    @JsonProperty
    public long getEnrollments()
    {
        return enrollments;
    }

    public long getRowCount(BenchmarkTable table)
    {
        switch (table) {
            case COURSE:
                return courses;
            case STUDENT:
                return students;
            case CLASS:
                return classes;
            case ENROLLMENT:
                return enrollments;
        }
        throw new IllegalArgumentException("Unknown table: " + table);
    }

    public ScaleParameters withCourses(long courses)
    {
        return new ScaleParameters(courses, students, classes, enrollments);
    }

    public ScaleParameters withStudents(long students)
    {
        return new ScaleParameters(courses, students, classes, enrollments);
    }

    public ScaleParameters withClasses(long classes)
    {
        return new ScaleParameters(courses, students, classes, enrollments);
    }

    public ScaleParameters withEnrollments(long enrollments)
    {
        return new ScaleParameters(courses, students, classes, enrollments);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScaleParameters that = (ScaleParameters) o;
        return courses == that.courses &&
                students == that.students &&
                classes == that.classes &&
                enrollments == that.enrollments;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(courses, students, classes, enrollments);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("courses", courses)
                .add("students", students)
                .add("classes", classes)
                .add("enrollments", enrollments)
                .toString();
    }
}
