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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;
import io.viewbench.dialect.SqlDialect;
import io.viewbench.schema.BenchmarkTable;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.PreparedBatch;

import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.airlift.units.Duration.nanosSince;
import static io.viewbench.ViewBenchErrorCode.DATA_GENERATION_FAILED;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fills the base tables with synthetic rows. Ids of every table run from 1 to the
 * table's row count, so foreign keys are drawn from the id range of the parent table.
 */
public class DataGenerator
{
    private static final Logger log = Logger.get(DataGenerator.class);
    private static final Joiner COMMA_JOINER = Joiner.on(", ");

    private final Jdbi jdbi;
    private final SqlDialect dialect;
    private final GenerationMode mode;
    private final long seed;
    private final int batchSize;

    public DataGenerator(Jdbi jdbi, SqlDialect dialect, GenerationMode mode, long seed, int batchSize)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.mode = requireNonNull(mode, "mode is null");
        checkArgument(batchSize >= 1, "batchSize must be at least 1");
        this.seed = seed;
        this.batchSize = batchSize;
    }

    public GenerationResult generate(ScaleParameters scale)
    {
        requireNonNull(scale, "scale is null");
        long start = System.nanoTime();
        RowGenerator rows = new RowGenerator(seed);

        ImmutableMap.Builder<String, Long> rowCounts = ImmutableMap.builder();
        for (BenchmarkTable table : BenchmarkTable.creationOrder()) {
            long requested = scale.getRowCount(table);
            long tableStart = System.nanoTime();
            try {
                jdbi.useTransaction(handle -> {
                    if (mode == GenerationMode.CLIENT) {
                        insertClientRows(handle, table, requested, rows, scale);
                    }
                    else {
                        handle.execute(serverInsertSql(dialect, table, scale));
                    }
                });
            }
            catch (JdbiException e) {
                throw new ViewBenchException(DATA_GENERATION_FAILED, format("Failed to generate rows for table %s", table.getTableName()), e);
            }

            long actual = countRows(table);
            if (actual != requested) {
                throw new ViewBenchException(DATA_GENERATION_FAILED, format("Table %s has %s rows, expected %s", table.getTableName(), actual, requested));
            }
            log.info("Generated %s rows for table %s in %s", actual, table.getTableName(), nanosSince(tableStart).convertToMostSuccinctTimeUnit());
            rowCounts.put(table.getTableName(), actual);
        }
        return new GenerationResult(mode, rowCounts.build(), nanosSince(start).convertToMostSuccinctTimeUnit());
    }

    private void insertClientRows(Handle handle, BenchmarkTable table, long count, RowGenerator rows, ScaleParameters scale)
    {
        String sql = insertSql(table);
        PreparedBatch batch = handle.prepareBatch(sql);
        for (long id = 1; id <= count; id++) {
            batch.add(rowValues(table, id, rows, scale));
            if (batch.size() >= batchSize) {
                batch.execute();
                batch = handle.prepareBatch(sql);
            }
        }
        if (batch.size() > 0) {
            batch.execute();
        }
    }

    private static Object[] rowValues(BenchmarkTable table, long id, RowGenerator rows, ScaleParameters scale)
    {
        switch (table) {
            case COURSE:
                return new Object[] {id, rows.nextCourseName(id), rows.nextCredits()};
            case STUDENT:
                return new Object[] {id, rows.nextName(), rows.nextName(), rows.nextGender()};
            case CLASS:
                return new Object[] {id, rows.nextId(scale.getCourses())};
            case ENROLLMENT:
                return new Object[] {id, rows.nextId(scale.getClasses()), rows.nextId(scale.getStudents())};
        }
        throw new IllegalArgumentException("Unknown table: " + table);
    }

    private long countRows(BenchmarkTable table)
    {
        try {
            return jdbi.withHandle(handle -> handle.createQuery("SELECT count(*) FROM " + table.getTableName())
                    .mapTo(Long.class)
                    .one());
        }
        catch (JdbiException e) {
            throw new ViewBenchException(DATA_GENERATION_FAILED, format("Failed to count rows of table %s", table.getTableName()), e);
        }
    }

    @VisibleForTesting
    static String insertSql(BenchmarkTable table)
    {
        return format("INSERT INTO %s (%s) VALUES (%s)",
                table.getTableName(),
                COMMA_JOINER.join(table.getColumns()),
                COMMA_JOINER.join(Collections.nCopies(table.getColumns().size(), "?")));
    }

    @VisibleForTesting
    static String serverInsertSql(SqlDialect dialect, BenchmarkTable table, ScaleParameters scale)
    {
        String id = dialect.rowSequenceColumn();
        String values;
        switch (table) {
            case COURSE:
                values = COMMA_JOINER.join(
                        id,
                        format("'Course ' || CAST(%s AS VARCHAR(20)) || ' ' || %s", id, dialect.randomChoiceSql(RowGenerator.SUBJECTS)),
                        dialect.randomIntegerSql(RowGenerator.MIN_CREDITS, RowGenerator.MAX_CREDITS));
                break;
            case STUDENT:
                values = COMMA_JOINER.join(
                        id,
                        nameSql(dialect),
                        nameSql(dialect),
                        dialect.randomChoiceSql(ImmutableList.of("M", "F")));
                break;
            case CLASS:
                values = COMMA_JOINER.join(
                        id,
                        dialect.randomIntegerSql(1, scale.getCourses()));
                break;
            case ENROLLMENT:
                values = COMMA_JOINER.join(
                        id,
                        dialect.randomIntegerSql(1, scale.getClasses()),
                        dialect.randomIntegerSql(1, scale.getStudents()));
                break;
            default:
                throw new IllegalArgumentException("Unknown table: " + table);
        }
        return format("INSERT INTO %s (%s) SELECT %s FROM %s",
                table.getTableName(),
                COMMA_JOINER.join(table.getColumns()),
                values,
                dialect.rowSequence(scale.getRowCount(table)));
    }

    /**
     * Two or three syllables, the first one capitalized, as {@link RowGenerator#nextName()} builds them.
     */
    private static String nameSql(SqlDialect dialect)
    {
        List<String> capitalized = RowGenerator.SYLLABLES.stream()
                .map(syllable -> Character.toUpperCase(syllable.charAt(0)) + syllable.substring(1))
                .collect(toImmutableList());
        List<String> optional = ImmutableList.<String>builder()
                .addAll(RowGenerator.SYLLABLES)
                .addAll(Collections.nCopies(RowGenerator.SYLLABLES.size(), ""))
                .build();
        return format("(%s || %s || %s)",
                dialect.randomChoiceSql(capitalized),
                dialect.randomChoiceSql(RowGenerator.SYLLABLES),
                dialect.randomChoiceSql(optional));
    }
}
