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
package io.viewbench.schema;

import io.airlift.log.Logger;
import io.viewbench.ViewBenchException;
import io.viewbench.dialect.SqlDialect;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import static io.viewbench.ViewBenchErrorCode.SCHEMA_PROVISIONING_FAILED;
import static java.util.Objects.requireNonNull;

/**
 * Creates and drops the base tables. Views and materialized views built on top
 * of the tables must be dropped before calling {@link #create()} or {@link #drop()}.
 */
public class SchemaProvisioner
{
    private static final Logger log = Logger.get(SchemaProvisioner.class);

    private final Jdbi jdbi;
    private final SqlDialect dialect;

    public SchemaProvisioner(Jdbi jdbi, SqlDialect dialect)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public void create()
    {
        drop();
        try {
            jdbi.useHandle(handle -> {
                for (BenchmarkTable table : BenchmarkTable.creationOrder()) {
                    log.debug("Creating table %s", table.getTableName());
                    handle.execute(table.getCreateSql());
                }
            });
        }
        catch (JdbiException e) {
            throw new ViewBenchException(SCHEMA_PROVISIONING_FAILED, "Failed to create benchmark tables", e);
        }
        log.info("Created tables %s", BenchmarkTable.creationOrder());
    }

    public void drop()
    {
        try {
            jdbi.useHandle(handle -> {
                for (BenchmarkTable table : BenchmarkTable.dropOrder()) {
                    handle.execute(dialect.dropTableSql(table.getTableName()));
                }
            });
        }
        catch (JdbiException e) {
            throw new ViewBenchException(SCHEMA_PROVISIONING_FAILED, "Failed to drop benchmark tables", e);
        }
    }

    /**
     * Refreshes the optimizer statistics of every base table.
     */
    public void analyze()
    {
        try {
            jdbi.useHandle(handle -> {
                for (BenchmarkTable table : BenchmarkTable.creationOrder()) {
                    handle.execute(dialect.analyzeTableSql(table.getTableName()));
                }
            });
        }
        catch (JdbiException e) {
            throw new ViewBenchException(SCHEMA_PROVISIONING_FAILED, "Failed to analyze benchmark tables", e);
        }
    }
}
