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
package io.viewbench.verifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of comparing the rows of a test query against the rows of a control query.
 */
public class Verification
{
    public enum Status
    {
        MATCH,
        MISMATCH,
        /**
         * One of the queries returned more rows than the verifier holds in memory.
         */
        TOO_MANY_ROWS
    }

    private final String controlName;
    private final String testName;
    private final Status status;
    private final long controlRowCount;
    private final long testRowCount;
    private final List<String> differences;

    public Verification(String controlName, String testName, Status status, long controlRowCount, long testRowCount, List<String> differences)
    {
        this.controlName = requireNonNull(controlName, "controlName is null");
        this.testName = requireNonNull(testName, "testName is null");
        this.status = requireNonNull(status, "status is null");
        this.controlRowCount = controlRowCount;
        this.testRowCount = testRowCount;
        this.differences = ImmutableList.copyOf(requireNonNull(differences, "differences is null"));
    }

    @JsonProperty
    public String getControlName()
    {
        return controlName;
    }

    @JsonProperty
    public String getTestName()
    {
        return testName;
    }

    @JsonProperty
    public Status getStatus()
    {
        return status;
    }

    @JsonProperty
    public long getControlRowCount()
    {
        return controlRowCount;
    }

    @JsonProperty
    public long getTestRowCount()
    {
        return testRowCount;
    }

    /**
     * Rows only the control returned, prefixed with {@code -}, and rows only the test
     * returned, prefixed with {@code +}. Empty when the results match.
     */
    @JsonProperty
    public List<String> getDifferences()
    {
        return differences;
    }

    public boolean isMatch()
    {
        return status == Status.MATCH;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("controlName", controlName)
                .add("testName", testName)
                .add("status", status)
                .add("controlRowCount", controlRowCount)
                .add("testRowCount", testRowCount)
                .add("differences", differences.size())
                .toString();
    }
}
