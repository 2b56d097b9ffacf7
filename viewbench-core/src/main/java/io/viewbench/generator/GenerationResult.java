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
import com.google.common.collect.ImmutableMap;
import io.airlift.units.Duration;

import java.util.Map;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class GenerationResult
{
    private final GenerationMode mode;
    private final Map<String, Long> rowCounts;
    private final Duration elapsed;

    @JsonCreator
    public GenerationResult(
            @JsonProperty("mode") GenerationMode mode,
            @JsonProperty("rowCounts") Map<String, Long> rowCounts,
            @JsonProperty("elapsed") Duration elapsed)
    {
        this.mode = requireNonNull(mode, "mode is null");
        this.rowCounts = ImmutableMap.copyOf(requireNonNull(rowCounts, "rowCounts is null"));
        this.elapsed = requireNonNull(elapsed, "elapsed is null");
    }

    @JsonProperty
    public GenerationMode getMode()
    {
        return mode;
    }

    /**
     * Rows present in each table after generation, keyed by table name in creation order.
     */
    @JsonProperty
    public Map<String, Long> getRowCounts()
    {
        return rowCounts;
    }

    @JsonProperty
    public Duration getElapsed()
    {
        return elapsed;
    }

    public long getTotalRows()
    {
        return rowCounts.values().stream()
                .mapToLong(Long::longValue)
                .sum();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("mode", mode)
                .add("rowCounts", rowCounts)
                .add("elapsed", elapsed)
                .toString();
    }
}
