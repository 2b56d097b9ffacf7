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

import com.google.common.collect.ImmutableMap;
import com.google.inject.Injector;
import io.airlift.airline.Command;
import io.airlift.airline.Option;
import io.viewbench.ViewBenchmark;
import io.viewbench.generator.GenerationResult;

import java.util.HashMap;
import java.util.Map;

@Command(name = "provision", description = "Create the schema and generate data without benchmarking")
public class ProvisionCommand
        extends AbstractViewBenchCommand
{
    @Option(name = "--scale-factor", title = "factor", description = "Multiplier applied to the base row count of every table")
    public Double scaleFactor;

    @Override
    protected Map<String, String> getConfigurationOverrides()
    {
        if (scaleFactor == null) {
            return new HashMap<>();
        }
        return new HashMap<>(ImmutableMap.of("generator.scale-factor", scaleFactor.toString()));
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    @Override
    protected int execute(Injector injector)
    {
        GenerationResult result;
        try (ViewBenchmark benchmark = injector.getInstance(ViewBenchmark.class)) {
            result = benchmark.provision();
        }
        for (Map.Entry<String, Long> entry : result.getRowCounts().entrySet()) {
            System.out.printf("%-12s %,d rows%n", entry.getKey(), entry.getValue());
        }
        System.out.printf("Generated %,d rows in %s (%s)%n", result.getTotalRows(), result.getElapsed(), result.getMode());
        return 0;
    }
}
