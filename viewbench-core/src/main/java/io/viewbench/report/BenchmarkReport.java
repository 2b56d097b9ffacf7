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
package io.viewbench.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import io.viewbench.generator.GenerationResult;
import io.viewbench.generator.ScaleParameters;
import io.viewbench.runner.VariantResult;
import io.viewbench.space.ObjectSize;
import io.viewbench.variant.MaterializedViewPopulation;
import io.viewbench.verifier.Verification;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Everything measured by one benchmark run.
 */
public class BenchmarkReport
{
    private final String dialect;
    private final ScaleParameters scale;
    private final GenerationResult generation;
    private final MaterializedViewPopulation population;
    private final List<VariantResult> variantResults;
    private final List<Verification> verifications;
    private final List<ObjectSize> objectSizes;

    public BenchmarkReport(
            String dialect,
            ScaleParameters scale,
            GenerationResult generation,
            MaterializedViewPopulation population,
            List<VariantResult> variantResults,
            List<Verification> verifications,
            List<ObjectSize> objectSizes)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.scale = requireNonNull(scale, "scale is null");
        this.generation = requireNonNull(generation, "generation is null");
        this.population = requireNonNull(population, "population is null");
        this.variantResults = ImmutableList.copyOf(requireNonNull(variantResults, "variantResults is null"));
        this.verifications = ImmutableList.copyOf(requireNonNull(verifications, "verifications is null"));
        this.objectSizes = ImmutableList.copyOf(requireNonNull(objectSizes, "objectSizes is null"));
    }

    @JsonProperty
    public String getDialect()
    {
        return dialect;
    }

    @JsonProperty
    public ScaleParameters getScale()
    {
        return scale;
    }

    @JsonProperty
    public GenerationResult getGeneration()
    {
        return generation;
    }

    @JsonProperty
    public MaterializedViewPopulation getPopulation()
    {
        return population;
    }

    @JsonProperty
    public List<VariantResult> getVariantResults()
    {
        return variantResults;
    }

    @JsonProperty
    public List<Verification> getVerifications()
    {
        return verifications;
    }

    @JsonProperty
    public List<ObjectSize> getObjectSizes()
    {
        return objectSizes;
    }

    /**
     * True when every variant passed and every verification matched.
     */
    @JsonProperty
    public boolean isSuccessful()
    {
        return variantResults.stream().allMatch(VariantResult::isPassed) &&
                verifications.stream().allMatch(Verification::isMatch);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dialect", dialect)
                .add("scale", scale)
                .add("population", population)
                .add("variantResults", variantResults)
                .add("verifications", verifications)
                .add("objectSizes", objectSizes)
                .toString();
    }
}
