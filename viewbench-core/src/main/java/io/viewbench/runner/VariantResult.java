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

import com.fasterxml.jackson.annotation.JsonProperty;
import io.airlift.units.Duration;
import io.viewbench.variant.QueryVariant;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

public class VariantResult
{
    public enum Status
    {
        PASS, FAIL
    }

    private static final Stat FAIL_STAT = new Stat(new double[0]);

    public static VariantResult passResult(QueryVariant variant, Stat wallTimeNanos, long rowCount)
    {
        return new VariantResult(variant, Status.PASS, Optional.empty(), wallTimeNanos, rowCount);
    }

    public static VariantResult failResult(QueryVariant variant, String errorMessage)
    {
        return new VariantResult(variant, Status.FAIL, Optional.of(errorMessage), FAIL_STAT, 0);
    }

    private final QueryVariant variant;
    private final Status status;
    private final Optional<String> errorMessage;
    private final Stat wallTimeNanos;
    private final long rowCount;

    private VariantResult(
            QueryVariant variant,
            Status status,
            Optional<String> errorMessage,
            Stat wallTimeNanos,
            long rowCount)
    {
        this.variant = requireNonNull(variant, "variant is null");
        this.status = requireNonNull(status, "status is null");
        this.errorMessage = requireNonNull(errorMessage, "errorMessage is null");
        this.wallTimeNanos = requireNonNull(wallTimeNanos, "wallTimeNanos is null");
        this.rowCount = rowCount;
    }

    @JsonProperty
    public QueryVariant getVariant()
    {
        return variant;
    }

    @JsonProperty
    public Status getStatus()
    {
        return status;
    }

    @JsonProperty
    public Optional<String> getErrorMessage()
    {
        return errorMessage;
    }

    @JsonProperty
    public Stat getWallTimeNanos()
    {
        return wallTimeNanos;
    }

    /**
     * Rows returned by the last measured run.
     */
    @JsonProperty
    public long getRowCount()
    {
        return rowCount;
    }

    public boolean isPassed()
    {
        return status == Status.PASS;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("variant", variant.getName())
                .add("status", status)
                .add("rowCount", rowCount)
                .add("wallTimeMedian", new Duration(wallTimeNanos.getMedian(), NANOSECONDS).convertToMostSuccinctTimeUnit())
                .add("wallTimeMean", new Duration(wallTimeNanos.getMean(), NANOSECONDS).convertToMostSuccinctTimeUnit())
                .add("wallTimeStd", new Duration(wallTimeNanos.getStandardDeviation(), NANOSECONDS).convertToMostSuccinctTimeUnit())
                .add("error", errorMessage)
                .toString();
    }
}
