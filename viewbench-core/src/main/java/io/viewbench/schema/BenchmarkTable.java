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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Base tables of the benchmark schema, declared in creation order:
 * every table appears after the tables its foreign keys reference.
 */
public enum BenchmarkTable
{
    COURSE("course", ImmutableList.of("id", "name", "credits"), ImmutableList.of(), "" +
            "CREATE TABLE course (\n" +
            "  id BIGINT PRIMARY KEY\n" +
            ", name VARCHAR(128) NOT NULL\n" +
            ", credits INTEGER NOT NULL CHECK (credits BETWEEN 1 AND 5)\n" +
            ")"),
    STUDENT("student", ImmutableList.of("id", "first_name", "last_name", "gender"), ImmutableList.of(), "" +
            "CREATE TABLE student (\n" +
            "  id BIGINT PRIMARY KEY\n" +
            ", first_name VARCHAR(64) NOT NULL\n" +
            ", last_name VARCHAR(64) NOT NULL\n" +
            ", gender CHAR(1) NOT NULL CHECK (gender IN ('M', 'F'))\n" +
            ")"),
    CLASS("class", ImmutableList.of("id", "course_id"), ImmutableList.of("course"), "" +
            "CREATE TABLE class (\n" +
            "  id BIGINT PRIMARY KEY\n" +
            ", course_id BIGINT NOT NULL REFERENCES course (id)\n" +
            ")"),
    ENROLLMENT("enrollment", ImmutableList.of("id", "class_id", "student_id"), ImmutableList.of("class", "student"), "" +
            "CREATE TABLE enrollment (\n" +
            "  id BIGINT PRIMARY KEY\n" +
            ", class_id BIGINT NOT NULL REFERENCES class (id)\n" +
            ", student_id BIGINT NOT NULL REFERENCES student (id)\n" +
            ")");

    private final String tableName;
    private final List<String> columns;
    private final List<String> parentTables;
    private final String createSql;

    BenchmarkTable(String tableName, List<String> columns, List<String> parentTables, String createSql)
    {
        this.tableName = requireNonNull(tableName, "tableName is null");
        this.columns = requireNonNull(columns, "columns is null");
        this.parentTables = requireNonNull(parentTables, "parentTables is null");
        this.createSql = requireNonNull(createSql, "createSql is null");
    }

    public String getTableName()
    {
        return tableName;
    }

    public List<String> getColumns()
    {
        return columns;
    }

    public List<String> getParentTables()
    {
        return parentTables;
    }

    public String getCreateSql()
    {
        return createSql;
    }

    public static ImmutableList<BenchmarkTable> creationOrder()
    {
        return ImmutableList.copyOf(values());
    }

    public static ImmutableList<BenchmarkTable> dropOrder()
    {
        return creationOrder().reverse();
    }
}
