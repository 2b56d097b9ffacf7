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

import io.airlift.json.JsonCodec;

import java.io.IOException;
import java.io.Writer;

import static io.airlift.json.JsonCodec.jsonCodec;

public class JsonReportEmitter
        implements ReportEmitter
{
    private static final JsonCodec<BenchmarkReport> REPORT_CODEC = jsonCodec(BenchmarkReport.class);

    @Override
    public void emit(BenchmarkReport report, Writer writer)
            throws IOException
    {
        writer.write(REPORT_CODEC.toJson(report));
        writer.write('\n');
        writer.flush();
    }
}
