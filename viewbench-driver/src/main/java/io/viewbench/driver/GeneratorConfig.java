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
package io.viewbench.driver;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.viewbench.generator.GenerationMode;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

public class GeneratorConfig
{
    private double scaleFactor = 1.0;
    private GenerationMode mode = GenerationMode.CLIENT;
    private long seed = 42;
    private int batchSize = 1000;
    private Long courses;
    private Long students;
    private Long classes;
    private Long enrollments;

    @DecimalMin(value = "0", inclusive = false)
    public double getScaleFactor()
    {
        return scaleFactor;
    }

    @Config("generator.scale-factor")
    @ConfigDescription("Multiplier applied to the base row count of every table")
    public GeneratorConfig setScaleFactor(double scaleFactor)
    {
        this.scaleFactor = scaleFactor;
        return this;
    }

    @NotNull
    public GenerationMode getMode()
    {
        return mode;
    }

    @Config("generator.mode")
    @ConfigDescription("CLIENT inserts seeded rows in batches, SERVER generates rows with INSERT ... SELECT")
    public GeneratorConfig setMode(GenerationMode mode)
    {
        this.mode = mode;
        return this;
    }

    public long getSeed()
    {
        return seed;
    }

    @Config("generator.seed")
    public GeneratorConfig setSeed(long seed)
    {
        this.seed = seed;
        return this;
    }

    @Min(1)
    public int getBatchSize()
    {
        return batchSize;
    }

    @Config("generator.batch-size")
    public GeneratorConfig setBatchSize(int batchSize)
    {
        this.batchSize = batchSize;
        return this;
    }

    @Min(1)
    public Long getCourses()
    {
        return courses;
    }

    @Config("generator.courses")
    @ConfigDescription("Row count of the course table, overriding the scale factor")
    public GeneratorConfig setCourses(Long courses)
    {
        this.courses = courses;
        return this;
    }

    @Min(1)
    public Long getStudents()
    {
        return students;
    }

    @Config("generator.students")
    @ConfigDescription("Row count of the student table, overriding the scale factor")
    public GeneratorConfig setStudents(Long students)
    {
        this.students = students;
        return this;
    }

    @Min(1)
    public Long getClasses()
    {
        return classes;
    }

    @Config("generator.classes")
    @ConfigDescription("Row count of the class table, overriding the scale factor")
    public GeneratorConfig setClasses(Long classes)
    {
        this.classes = classes;
        return this;
    }

    @Min(1)
    public Long getEnrollments()
    {
        return enrollments;
    }

    @Config("generator.enrollments")
    @ConfigDescription("Row count of the enrollment table, overriding the scale factor")
    public GeneratorConfig setEnrollments(Long enrollments)
    {
        this.enrollments = enrollments;
        return this;
    }
}
