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
package io.viewbench.runner;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import io.airlift.log.Logger;
import io.airlift.units.Duration;
import io.viewbench.variant.QueryVariant;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.io.Closeable;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;
import static io.viewbench.runner.VariantResult.failResult;
import static io.viewbench.runner.VariantResult.passResult;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newSingleThreadExecutor;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Times repeated executions of a query variant. Every execution drains the complete
 * result set, so the measured wall time covers producing all rows. A transient failure,
 * including a failure to connect, discards the connection and is retried on a new one.
 */
public class BenchmarkRunner
        implements Closeable
{
    private static final Logger log = Logger.get(BenchmarkRunner.class);

    private final Jdbi jdbi;
    private final int warm;
    private final int runs;
    private final int maxFailures;
    private final Duration queryTimeout;
    private final Duration failureBackoff;
    private final boolean debug;

    private final ExecutorService executor = newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "benchmark-query");
        thread.setDaemon(true);
        return thread;
    });
    private final TimeLimiter limiter = SimpleTimeLimiter.create(executor);

    private int failures;

    public BenchmarkRunner(Jdbi jdbi, int warm, int runs, int maxFailures, Duration queryTimeout, Duration failureBackoff, boolean debug)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");

        checkArgument(warm >= 0, "warm is negative");
        this.warm = warm;

        checkArgument(runs >= 1, "runs must be at least 1");
        this.runs = runs;

        checkArgument(maxFailures >= 0, "maxFailures must be at least 0");
        this.maxFailures = maxFailures;

        this.queryTimeout = requireNonNull(queryTimeout, "queryTimeout is null");
        this.failureBackoff = requireNonNull(failureBackoff, "failureBackoff is null");
        this.debug = debug;
    }

    @SuppressWarnings("AssignmentToForLoopParameter")
    public VariantResult execute(QueryVariant variant)
    {
        requireNonNull(variant, "variant is null");
        failures = 0;
        Handle handle = null;
        try {
            for (int i = 0; i < warm; ) {
                try {
                    if (handle == null) {
                        handle = open(variant);
                    }
                    execute(handle, variant);
                    i++;
                    failures = 0;
                }
                catch (BenchmarkExecutionException e) {
                    return failResult(variant, e.getMessage());
                }
                catch (TransientFailureException e) {
                    handle = discard(handle, variant);
                    if (!handleFailure(variant, e)) {
                        return failResult(variant, tooManyFailures(e));
                    }
                }
            }

            double[] wallTimeNanos = new double[runs];
            long rowCount = 0;
            for (int i = 0; i < runs; ) {
                try {
                    if (handle == null) {
                        handle = open(variant);
                    }
                    long startWallTime = System.nanoTime();
                    rowCount = execute(handle, variant);
                    long endWallTime = System.nanoTime();

                    wallTimeNanos[i] = endWallTime - startWallTime;
                    i++;
                    failures = 0;
                }
                catch (BenchmarkExecutionException e) {
                    return failResult(variant, e.getMessage());
                }
                catch (TransientFailureException e) {
                    handle = discard(handle, variant);
                    if (!handleFailure(variant, e)) {
                        return failResult(variant, tooManyFailures(e));
                    }
                }
            }

            VariantResult result = passResult(variant, new Stat(wallTimeNanos), rowCount);
            log.info("%s", result);
            return result;
        }
        finally {
            discard(handle, variant);
        }
    }

    private Handle open(QueryVariant variant)
    {
        try {
            return jdbi.open();
        }
        catch (JdbiException e) {
            throw new TransientFailureException(format("Query %s could not connect: %s", variant.getName(), e.getMessage()), e);
        }
    }

    /**
     * Closes the handle so the next execution opens a fresh connection.
     */
    private static Handle discard(Handle handle, QueryVariant variant)
    {
        if (handle != null) {
            try {
                handle.close();
            }
            catch (JdbiException e) {
                log.debug(e, "Failed to close connection of query %s", variant.getName());
            }
        }
        return null;
    }

    private long execute(Handle handle, QueryVariant variant)
    {
        Statement statement = createStatement(handle, variant);
        try {
            return limiter.callWithTimeout(() -> drain(statement, variant.getSql()), queryTimeout.toMillis(), MILLISECONDS);
        }
        catch (TimeoutException e) {
            cancel(statement);
            throw new TransientFailureException(format("Query %s exceeded timeout of %s", variant.getName(), queryTimeout), e);
        }
        catch (ExecutionException e) {
            if (e.getCause() instanceof SQLException) {
                throw classify(variant, (SQLException) e.getCause());
            }
            throw new BenchmarkExecutionException(format("Query %s failed: %s", variant.getName(), e.getCause()), e.getCause());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
        finally {
            try {
                statement.close();
            }
            catch (SQLException e) {
                log.debug(e, "Failed to close statement of query %s", variant.getName());
            }
        }
    }

    private static Statement createStatement(Handle handle, QueryVariant variant)
    {
        try {
            return handle.getConnection().createStatement();
        }
        catch (SQLException e) {
            throw classify(variant, e);
        }
    }

    private static long drain(Statement statement, String sql)
            throws SQLException
    {
        long rows = 0;
        try (ResultSet resultSet = statement.executeQuery(sql)) {
            int columnCount = resultSet.getMetaData().getColumnCount();
            while (resultSet.next()) {
                for (int column = 1; column <= columnCount; column++) {
                    resultSet.getObject(column);
                }
                rows++;
            }
        }
        return rows;
    }

    private static RuntimeException classify(QueryVariant variant, SQLException e)
    {
        String message = format("Query %s failed: %s", variant.getName(), e.getMessage());
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return new TransientFailureException(message, e);
        }
        return new BenchmarkExecutionException(message, e);
    }

    private static void cancel(Statement statement)
    {
        try {
            statement.cancel();
        }
        catch (SQLException e) {
            log.warn(e, "Failed to cancel timed out query");
        }
    }

    /**
     * @return false when the variant has failed too many times in a row
     */
    private boolean handleFailure(QueryVariant variant, TransientFailureException e)
    {
        if (debug) {
            log.error(e, "Query %s failed", variant.getName());
        }
        else {
            log.warn("%s", e.getMessage());
        }

        failures++;
        if (failures > maxFailures) {
            return false;
        }

        try {
            MILLISECONDS.sleep(failureBackoff.toMillis());
        }
        catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(interruptedException);
        }
        return true;
    }

    private String tooManyFailures(TransientFailureException e)
    {
        return format("Too many consecutive failures (%s): %s", failures, e.getMessage());
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }

    private static class TransientFailureException
            extends RuntimeException
    {
        TransientFailureException(String message, Throwable cause)
        {
            super(message, cause);
        }
    }
}
