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

public enum GenerationMode
{
    /**
     * Rows are produced by a seeded generator in the benchmark process and inserted in batches.
     */
    CLIENT,
    /**
     * Rows are produced by the database with one INSERT ... SELECT per table.
     */
    SERVER
}
