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

import com.google.common.collect.ImmutableList;
import io.viewbench.runner.Stat;
import io.viewbench.runner.VariantResult;
import io.viewbench.space.ObjectKind;
import io.viewbench.space.ObjectSize;
import io.viewbench.variant.VariantType;
import io.viewbench.verifier.Verification;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static io.viewbench.report.FormatUtils.formatDataSize;
import static io.viewbench.report.FormatUtils.toMillis;
import static java.util.Locale.ENGLISH;

/**
 * Lays out a {@link BenchmarkReport} as the tables every tabular emitter prints.
 */
public final class ReportTables
{
    public static final List<String> LATENCY_COLUMNS = ImmutableList.of(
            "variant", "status", "rows", "median_ms", "mean_ms", "stddev_ms", "min_ms", "max_ms", "speedup");
    public static final List<String> VERIFICATION_COLUMNS = ImmutableList.of(
            "control", "test", "status", "control_rows", "test_rows");
    public static final List<String> SPACE_COLUMNS = ImmutableList.of(
            "object", "kind", "persistence", "size");
    public static final List<String> FAILURE_COLUMNS = ImmutableList.of(
            "variant", "error");

    static final String NOT_AVAILABLE = "n/a";

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\R\\s*");

    private ReportTables() {}

    /**
     * The latency, verification and space tables, followed by the failures table when a variant failed.
     */
    public static List<ReportTable> tables(BenchmarkReport report)
    {
        ImmutableList.Builder<ReportTable> tables = ImmutableList.<ReportTable>builder()
                .add(latency(report))
                .add(verification(report))
                .add(space(report));
        ReportTable failures = failures(report);
        if (!failures.getRows().isEmpty()) {
            tables.add(failures);
        }
        return tables.build();
    }

    public static ReportTable latency(BenchmarkReport report)
    {
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        for (VariantResult result : report.getVariantResults()) {
            Stat stat = result.getWallTimeNanos();
            Object speedup = speedup(report, result)
                    .<Object>map(FormatUtils::toRatio)
                    .orElse(NOT_AVAILABLE);
            rows.add(ImmutableList.of(
                    result.getVariant().getName(),
                    lower(result.getStatus()),
                    result.getRowCount(),
                    toMillis(stat.getMedian()),
                    toMillis(stat.getMean()),
                    toMillis(stat.getStandardDeviation()),
                    toMillis(stat.getMin()),
                    toMillis(stat.getMax()),
                    speedup));
        }
        return new ReportTable("latency", LATENCY_COLUMNS, rows.build());
    }

    public static ReportTable verification(BenchmarkReport report)
    {
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        for (Verification verification : report.getVerifications()) {
            rows.add(ImmutableList.of(
                    verification.getControlName(),
                    verification.getTestName(),
                    lower(verification.getStatus()),
                    verification.getControlRowCount(),
                    verification.getTestRowCount()));
        }
        return new ReportTable("verification", VERIFICATION_COLUMNS, rows.build());
    }

    public static ReportTable space(BenchmarkReport report)
    {
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        for (ObjectSize size : report.getObjectSizes()) {
            String name = size.getName();
            if (size.getKind() == ObjectKind.MATERIALIZED_VIEW && !size.isPopulated()) {
                name += " (unpopulated)";
            }
            rows.add(ImmutableList.of(
                    name,
                    lower(size.getKind()),
                    size.getPersistence().getDisplayName(),
                    formatDataSize(size.getSize(), true)));
        }
        return new ReportTable("space", SPACE_COLUMNS, rows.build());
    }

    public static ReportTable failures(BenchmarkReport report)
    {
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        for (VariantResult result : report.getVariantResults()) {
            if (!result.isPassed()) {
                // cells stay on one line
                String error = result.getErrorMessage()
                        .map(message -> LINE_BREAK.matcher(message).replaceAll(" "))
                        .orElse(NOT_AVAILABLE);
                rows.add(ImmutableList.of(result.getVariant().getName(), error));
            }
        }
        return new ReportTable("failures", FAILURE_COLUMNS, rows.build());
    }

    /**
     * Median wall time of the raw join divided by the median wall time of the variant.
     * Empty when either variant failed or has no measurable time.
     */
    public static Optional<Double> speedup(BenchmarkReport report, VariantResult result)
    {
        if (!result.isPassed() || result.getWallTimeNanos().getMedian() <= 0) {
            return Optional.empty();
        }
        return report.getVariantResults().stream()
                .filter(candidate -> candidate.getVariant().getType() == VariantType.RAW_JOIN)
                .filter(VariantResult::isPassed)
                .map(rawJoin -> rawJoin.getWallTimeNanos().getMedian())
                .filter(median -> median > 0)
                .map(median -> median / result.getWallTimeNanos().getMedian())
                .findFirst();
    }

    private static String lower(Enum<?> value)
    {
        return value.name().toLowerCase(ENGLISH);
    }
}
