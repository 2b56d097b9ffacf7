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
import io.airlift.units.Duration;
import io.airlift.units.MinDuration;
import io.viewbench.variant.MaterializedViewPopulation;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import java.util.concurrent.TimeUnit;

public class BenchmarkConfig
{
    private int warm = 1;
    private int runs = 5;
    private int maxFailures = 3;
    private Duration queryTimeout = new Duration(10, TimeUnit.MINUTES);
    private Duration failureBackoff = new Duration(5, TimeUnit.SECONDS);
    private MaterializedViewPopulation materializedViewPopulation = MaterializedViewPopulation.IMMEDIATE;
    private int verifyMaxRows = 1_000_000;
    private int verifyPrecision = 4;
    private boolean cleanup;

    @Min(0)
    public int getWarm()
    {
        return warm;
    }

    @Config("benchmark.warm")
    @ConfigDescription("Executions per variant whose timing is discarded")
    public BenchmarkConfig setWarm(int warm)
    {
        this.warm = warm;
        return this;
    }

    @Min(1)
    public int getRuns()
    {
        return runs;
    }

    @Config("benchmark.runs")
    @ConfigDescription("Timed executions per variant")
    public BenchmarkConfig setRuns(int runs)
    {
        this.runs = runs;
        return this;
    }

    @Min(0)
    public int getMaxFailures()
    {
        return maxFailures;
    }

    @Config("benchmark.max-failures")
    @ConfigDescription("Consecutive transient failures tolerated before a variant fails")
    public BenchmarkConfig setMaxFailures(int maxFailures)
    {
        this.maxFailures = maxFailures;
        return this;
    }

    @MinDuration("1ms")
    @NotNull
    public Duration getQueryTimeout()
    {
        return queryTimeout;
    }

    @Config("benchmark.query-timeout")
    public BenchmarkConfig setQueryTimeout(Duration queryTimeout)
    {
        this.queryTimeout = queryTimeout;
        return this;
    }

    @NotNull
    public Duration getFailureBackoff()
    {
        return failureBackoff;
    }

    @Config("benchmark.failure-backoff")
    @ConfigDescription("Pause before retrying a failed execution")
    public BenchmarkConfig setFailureBackoff(Duration failureBackoff)
    {
        this.failureBackoff = failureBackoff;
        return this;
    }

    @NotNull
    public MaterializedViewPopulation getMaterializedViewPopulation()
    {
        return materializedViewPopulation;
    }

    @Config("benchmark.materialized-view-population")
    @ConfigDescription("IMMEDIATE populates the materialized view on creation, DEFERRED populates it with a refresh")
    public BenchmarkConfig setMaterializedViewPopulation(MaterializedViewPopulation materializedViewPopulation)
    {
        this.materializedViewPopulation = materializedViewPopulation;
        return this;
    }

    @Min(1)
    public int getVerifyMaxRows()
    {
        return verifyMaxRows;
    }

    @Config("benchmark.verify-max-rows")
    @ConfigDescription("Maximum rows held in memory per variant when comparing results")
    public BenchmarkConfig setVerifyMaxRows(int verifyMaxRows)
    {
        this.verifyMaxRows = verifyMaxRows;
        return this;
    }

    @Min(1)
    public int getVerifyPrecision()
    {
        return verifyPrecision;
    }

    @Config("benchmark.verify-precision")
    @ConfigDescription("Significant digits compared for floating point values")
    public BenchmarkConfig setVerifyPrecision(int verifyPrecision)
    {
        this.verifyPrecision = verifyPrecision;
        return this;
    }

    public boolean isCleanup()
    {
        return cleanup;
    }

    @Config("benchmark.cleanup")
    @ConfigDescription("Drop all benchmark objects after the run")
    public BenchmarkConfig setCleanup(boolean cleanup)
    {
        this.cleanup = cleanup;
        return this;
    }
}
