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
package io.viewbench.variant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class QueryVariant
{
    private final String name;
    private final VariantType type;
    private final String sql;

    @JsonCreator
    public QueryVariant(
            @JsonProperty("name") String name,
            @JsonProperty("type") VariantType type,
            @JsonProperty("sql") String sql)
    {
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
        this.sql = requireNonNull(sql, "sql is null");
    }

    @JsonProperty
    public String getName()
    {
        return name;
    }

    @JsonProperty
    public VariantType getType()
    {
        return type;
    }

    @JsonProperty
    public String getSql()
    {
        return sql;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryVariant that = (QueryVariant) o;
        return name.equals(that.name) &&
                type == that.type &&
                sql.equals(that.sql);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, type, sql);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("type", type)
                .toString();
    }
}
