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

import java.util.Arrays;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Summary of a series of samples. An empty series summarizes to zeros.
 */
public class Stat
{
    private final int count;
    private final double min;
    private final double max;
    private final double mean;
    private final double median;
    private final double standardDeviation;

    public Stat(double[] samples)
    {
        requireNonNull(samples, "samples is null");
        double[] sorted = samples.clone();
        Arrays.sort(sorted);

        this.count = sorted.length;
        if (sorted.length == 0) {
            this.min = 0;
            this.max = 0;
            this.mean = 0;
            this.median = 0;
            this.standardDeviation = 0;
            return;
        }

        this.min = sorted[0];
        this.max = sorted[sorted.length - 1];

        double sum = 0;
        for (double sample : sorted) {
            sum += sample;
        }
        this.mean = sum / sorted.length;

        int middle = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            this.median = (sorted[middle - 1] + sorted[middle]) / 2;
        }
        else {
            this.median = sorted[middle];
        }

        // population standard deviation
        double squares = 0;
        for (double sample : sorted) {
            squares += (sample - mean) * (sample - mean);
        }
        this.standardDeviation = Math.sqrt(squares / sorted.length);
    }

    @JsonProperty
    public int getCount()
    {
        return count;
    }

    @JsonProperty
    public double getMin()
    {
        return min;
    }

    @JsonProperty
    public double getMax()
    {
        return max;
    }

    @JsonProperty
    public double getMean()
    {
        return mean;
    }

    @JsonProperty
    public double getMedian()
    {
        return median;
    }

    @JsonProperty
    public double getStandardDeviation()
    {
        return standardDeviation;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("count", count)
                .add("min", min)
                .add("max", max)
                .add("mean", mean)
                .add("median", median)
                .add("standardDeviation", standardDeviation)
                .toString();
    }
}
