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
import io.viewbench.report.ReportFormat;

import javax.validation.constraints.NotNull;

public class ReportConfig
{
    private ReportFormat format = ReportFormat.ALIGNED;
    private String outputFile;

    @NotNull
    public ReportFormat getFormat()
    {
        return format;
    }

    @Config("report.format")
    public ReportConfig setFormat(ReportFormat format)
    {
        this.format = format;
        return this;
    }

    public String getOutputFile()
    {
        return outputFile;
    }

    @Config("report.output-file")
    @ConfigDescription("File the report is written to, standard output when unset")
    public ReportConfig setOutputFile(String outputFile)
    {
        this.outputFile = outputFile;
        return this;
    }
}
