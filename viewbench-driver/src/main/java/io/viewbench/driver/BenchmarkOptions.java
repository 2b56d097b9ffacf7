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
import io.airlift.airline.Option;

import java.util.Map;

import static java.util.Locale.ENGLISH;

public class BenchmarkOptions
{
    @Option(name = "--scale-factor", title = "factor", description = "Multiplier applied to the base row count of every table")
    public Double scaleFactor;

    @Option(name = "--runs", title = "count", description = "Timed executions per variant")
    public Integer runs;

    @Option(name = "--warm", title = "count", description = "Discarded executions per variant")
    public Integer warm;

    @Option(name = "--format", title = "format", description = "Report format: aligned, markdown, csv or json")
    public String format;

    public Map<String, String> toConfigurationProperties()
    {
        ImmutableMap.Builder<String, String> properties = ImmutableMap.builder();
        if (scaleFactor != null) {
            properties.put("generator.scale-factor", scaleFactor.toString());
        }
        if (runs != null) {
            properties.put("benchmark.runs", runs.toString());
        }
        if (warm != null) {
            properties.put("benchmark.warm", warm.toString());
        }
        if (format != null) {
            properties.put("report.format", format.toUpperCase(ENGLISH));
        }
        return properties.build();
    }
}
