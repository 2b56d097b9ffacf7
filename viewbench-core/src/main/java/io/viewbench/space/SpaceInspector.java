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
package io.viewbench.space;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.airlift.units.DataSize;
import io.viewbench.ViewBenchException;
import io.viewbench.dialect.SqlDialect;
import io.viewbench.schema.BenchmarkTable;
import io.viewbench.variant.QueryVariantRegistry;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.util.List;
import java.util.Map;

import static io.airlift.units.DataSize.succinctBytes;
import static io.viewbench.ViewBenchErrorCode.CATALOG_INSPECTION_FAILED;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads the storage footprint of benchmark objects from the database catalog.
 */
public class SpaceInspector
{
    private static final Logger log = Logger.get(SpaceInspector.class);

    private final Jdbi jdbi;
    private final SqlDialect dialect;

    public SpaceInspector(Jdbi jdbi, SqlDialect dialect)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public List<ObjectSize> inspect(List<String> objectNames)
    {
        requireNonNull(objectNames, "objectNames is null");
        try {
            return jdbi.withHandle(handle -> {
                ImmutableList.Builder<ObjectSize> sizes = ImmutableList.builder();
                for (String name : objectNames) {
                    ObjectSize size = inspect(handle, name, kindOf(name));
                    log.debug("%s", size);
                    sizes.add(size);
                }
                return sizes.build();
            });
        }
        catch (JdbiException e) {
            throw new ViewBenchException(CATALOG_INSPECTION_FAILED, format("Failed to inspect %s", objectNames), e);
        }
    }

    public boolean isPopulated(String materializedViewName)
    {
        requireNonNull(materializedViewName, "materializedViewName is null");
        try {
            return jdbi.withHandle(handle -> isPopulated(handle, materializedViewName));
        }
        catch (JdbiException e) {
            throw new ViewBenchException(CATALOG_INSPECTION_FAILED, format("Failed to read state of materialized view %s", materializedViewName), e);
        }
    }

    private ObjectSize inspect(Handle handle, String name, ObjectKind kind)
    {
        // a plain view stores only its definition
        if (kind == ObjectKind.VIEW) {
            return new ObjectSize(name, kind, Persistence.PERMANENT, succinctBytes(0), false);
        }

        Map<String, Object> row = handle.createQuery(dialect.objectStorageSql())
                .bind("name", dialect.catalogName(name))
                .mapToMap()
                .findOne()
                .orElseThrow(() -> new ViewBenchException(CATALOG_INSPECTION_FAILED, format("Object %s does not exist", name)));

        Persistence persistence = Persistence.fromCode(row.get("persistence") == null ? null : row.get("persistence").toString());
        Object sizeBytes = row.get("size_bytes");
        DataSize size = succinctBytes(sizeBytes == null ? 0 : ((Number) sizeBytes).longValue());
        boolean populated = kind == ObjectKind.TABLE || isPopulated(handle, name);
        return new ObjectSize(name, kind, persistence, size, populated);
    }

    private boolean isPopulated(Handle handle, String materializedViewName)
    {
        return handle.createQuery(dialect.materializedViewPopulatedSql(materializedViewName))
                .mapTo(Boolean.class)
                .findOne()
                .orElse(false);
    }

    /**
     * Kind of a benchmark object, known from its name.
     */
    public static ObjectKind kindOf(String name)
    {
        if (QueryVariantRegistry.VIEW_NAME.equals(name)) {
            return ObjectKind.VIEW;
        }
        if (QueryVariantRegistry.MATERIALIZED_VIEW_NAME.equals(name)) {
            return ObjectKind.MATERIALIZED_VIEW;
        }
        for (BenchmarkTable table : BenchmarkTable.values()) {
            if (table.getTableName().equals(name)) {
                return ObjectKind.TABLE;
            }
        }
        throw new IllegalArgumentException("Unknown benchmark object: " + name);
    }
}
