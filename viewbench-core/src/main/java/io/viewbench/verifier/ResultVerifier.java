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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.collect.Iterables;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import com.google.common.collect.Ordering;
import com.google.common.collect.SortedMultiset;
import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;
import io.viewbench.variant.QueryVariant;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.viewbench.ViewBenchErrorCode.RESULT_FETCH_FAILED;
import static java.lang.Double.isFinite;
import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Checks that two queries return the same rows regardless of order. Rows are held in
 * memory, so each query may return at most {@code maxRowCount} rows.
 */
public class ResultVerifier
{
    private static final Logger log = Logger.get(ResultVerifier.class);

    @VisibleForTesting
    static final int MAX_DIFFERENCES = 100;

    private final Jdbi jdbi;
    private final int maxRowCount;
    private final int precision;

    public ResultVerifier(Jdbi jdbi, int maxRowCount, int precision)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        checkArgument(maxRowCount >= 1, "maxRowCount must be at least 1");
        checkArgument(precision >= 1, "precision must be at least 1");
        this.maxRowCount = maxRowCount;
        this.precision = precision;
    }

    public Verification verify(QueryVariant control, QueryVariant test)
    {
        requireNonNull(control, "control is null");
        requireNonNull(test, "test is null");

        List<List<Object>> controlRows;
        List<List<Object>> testRows;
        try {
            controlRows = fetch(control);
            testRows = fetch(test);
        }
        catch (TooManyRowsException e) {
            log.warn("%s", e.getMessage());
            return new Verification(control.getName(), test.getName(), Verification.Status.TOO_MANY_ROWS, 0, 0, ImmutableList.of(e.getMessage()));
        }

        Verification verification = compare(control.getName(), test.getName(), controlRows, testRows, precision);
        if (verification.isMatch()) {
            log.info("%s matches %s (%s rows)", test.getName(), control.getName(), controlRows.size());
        }
        else {
            log.warn("%s does not match %s: control %s rows, test %s rows", test.getName(), control.getName(), controlRows.size(), testRows.size());
        }
        return verification;
    }

    @VisibleForTesting
    static Verification compare(String controlName, String testName, List<List<Object>> controlRows, List<List<Object>> testRows, int precision)
    {
        try {
            SortedMultiset<List<Object>> control = ImmutableSortedMultiset.copyOf(rowComparator(precision), controlRows);
            SortedMultiset<List<Object>> test = ImmutableSortedMultiset.copyOf(rowComparator(precision), testRows);
            if (control.equals(test)) {
                return new Verification(controlName, testName, Verification.Status.MATCH, controlRows.size(), testRows.size(), ImmutableList.of());
            }
            return new Verification(controlName, testName, Verification.Status.MISMATCH, controlRows.size(), testRows.size(), differences(control, test, precision));
        }
        catch (TypesDoNotMatchException e) {
            return new Verification(controlName, testName, Verification.Status.MISMATCH, controlRows.size(), testRows.size(), ImmutableList.of(e.getMessage()));
        }
    }

    private static List<String> differences(Multiset<List<Object>> control, Multiset<List<Object>> test, int precision)
    {
        Iterable<ChangedRow> diff = ImmutableSortedMultiset.<ChangedRow>naturalOrder()
                .addAll(Iterables.transform(Multisets.difference(control, test), row -> new ChangedRow(ChangedRow.Changed.REMOVED, row, precision)))
                .addAll(Iterables.transform(Multisets.difference(test, control), row -> new ChangedRow(ChangedRow.Changed.ADDED, row, precision)))
                .build();

        ImmutableList.Builder<String> lines = ImmutableList.builder();
        for (ChangedRow row : Iterables.limit(diff, MAX_DIFFERENCES)) {
            lines.add(row.toString());
        }
        return lines.build();
    }

    private List<List<Object>> fetch(QueryVariant variant)
            throws TooManyRowsException
    {
        try (Handle handle = jdbi.open();
                Statement statement = handle.getConnection().createStatement();
                ResultSet resultSet = statement.executeQuery(variant.getSql())) {
            return convertJdbcResultSet(variant, resultSet);
        }
        catch (SQLException | JdbiException e) {
            throw new ViewBenchException(RESULT_FETCH_FAILED, format("Failed to fetch rows of %s", variant.getName()), e);
        }
    }

    private List<List<Object>> convertJdbcResultSet(QueryVariant variant, ResultSet resultSet)
            throws SQLException, TooManyRowsException
    {
        int rowCount = 0;
        int columnCount = resultSet.getMetaData().getColumnCount();

        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>();
            for (int i = 1; i <= columnCount; i++) {
                Object object = resultSet.getObject(i);
                if (object instanceof BigDecimal) {
                    if (((BigDecimal) object).scale() <= 0) {
                        object = ((BigDecimal) object).longValueExact();
                    }
                    else {
                        object = ((BigDecimal) object).doubleValue();
                    }
                }
                row.add(object);
            }
            rows.add(unmodifiableList(row));
            rowCount++;
            if (rowCount > maxRowCount) {
                throw new TooManyRowsException(format("%s returned more than %s rows", variant.getName(), maxRowCount));
            }
        }
        return rows.build();
    }

    private static Comparator<List<Object>> rowComparator(int precision)
    {
        Comparator<Object> comparator = Ordering.from(columnComparator(precision)).nullsFirst();
        return (a, b) -> {
            if (a.size() != b.size()) {
                return Integer.compare(a.size(), b.size());
            }
            for (int i = 0; i < a.size(); i++) {
                int r = comparator.compare(a.get(i), b.get(i));
                if (r != 0) {
                    return r;
                }
            }
            return 0;
        };
    }

    @SuppressWarnings("unchecked")
    private static Comparator<Object> columnComparator(int precision)
    {
        return (a, b) -> {
            if (a instanceof Number && b instanceof Number) {
                Number x = (Number) a;
                Number y = (Number) b;
                boolean bothReal = isReal(x) && isReal(y);
                boolean bothIntegral = isIntegral(x) && isIntegral(y);
                if (!(bothReal || bothIntegral)) {
                    throw new TypesDoNotMatchException(format("item types do not match: %s vs %s", a.getClass().getName(), b.getClass().getName()));
                }
                if (isIntegral(x)) {
                    return Long.compare(x.longValue(), y.longValue());
                }
                return precisionCompare(x.doubleValue(), y.doubleValue(), precision);
            }
            if (a.getClass() != b.getClass()) {
                throw new TypesDoNotMatchException(format("item types do not match: %s vs %s", a.getClass().getName(), b.getClass().getName()));
            }
            checkArgument(a instanceof Comparable, "item is not Comparable: %s", a.getClass().getName());
            return ((Comparable<Object>) a).compareTo(b);
        };
    }

    private static boolean isReal(Number x)
    {
        return x instanceof Float || x instanceof Double;
    }

    private static boolean isIntegral(Number x)
    {
        return x instanceof Byte || x instanceof Short || x instanceof Integer || x instanceof Long;
    }

    private static boolean isClose(double a, double b, double epsilon)
    {
        double absA = Math.abs(a);
        double absB = Math.abs(b);
        double diff = Math.abs(a - b);

        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a, b) == 0;
        }

        // relative error is meaningless next to zero
        if (a == 0 || b == 0 || diff < Float.MIN_NORMAL) {
            return diff < (epsilon * Float.MIN_NORMAL);
        }
        return diff / Math.min((absA + absB), Float.MAX_VALUE) < epsilon;
    }

    /**
     * Returns 0 when the values agree to {@code precision} significant digits.
     */
    @VisibleForTesting
    static int precisionCompare(double a, double b, int precision)
    {
        return isClose(a, b, Math.pow(10, -1 * (precision - 1))) ? 0 : Double.compare(a, b);
    }

    private static class ChangedRow
            implements Comparable<ChangedRow>
    {
        enum Changed
        {
            ADDED, REMOVED
        }

        private final Changed changed;
        private final List<Object> row;
        private final int precision;

        ChangedRow(Changed changed, List<Object> row, int precision)
        {
            this.changed = changed;
            this.row = row;
            this.precision = precision;
        }

        @Override
        public String toString()
        {
            if (changed == Changed.ADDED) {
                return "+ " + row;
            }
            return "- " + row;
        }

        @Override
        public int compareTo(ChangedRow that)
        {
            return ComparisonChain.start()
                    .compare(this.row, that.row, rowComparator(precision))
                    .compareFalseFirst(this.changed == Changed.ADDED, that.changed == Changed.ADDED)
                    .result();
        }
    }

    private static class TooManyRowsException
            extends Exception
    {
        TooManyRowsException(String message)
        {
            super(message);
        }
    }
}
