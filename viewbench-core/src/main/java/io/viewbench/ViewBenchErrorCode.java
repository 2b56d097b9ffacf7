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
package io.viewbench;

public enum ViewBenchErrorCode
{
    SCHEMA_PROVISIONING_FAILED(1),
    DATA_GENERATION_FAILED(2),
    DERIVED_OBJECT_FAILED(3),
    CATALOG_INSPECTION_FAILED(4),
    RESULT_FETCH_FAILED(5),
    REPORT_FAILED(6),
    CONTAINER_COMMAND_FAILED(7);

    private final int code;

    ViewBenchErrorCode(int code)
    {
        this.code = code + 0x0100_0000;
    }

    public int getCode()
    {
        return code;
    }

    @Override
    public String toString()
    {
        return name() + ":" + code;
    }
}
