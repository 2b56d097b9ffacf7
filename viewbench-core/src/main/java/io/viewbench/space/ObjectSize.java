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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.airlift.units.DataSize;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class ObjectSize
{
    private final String name;
    private final ObjectKind kind;
    private final Persistence persistence;
    private final DataSize size;
    private final boolean populated;

    @JsonCreator
    public ObjectSize(
            @JsonProperty("name") String name,
            @JsonProperty("kind") ObjectKind kind,
            @JsonProperty("persistence") Persistence persistence,
            @JsonProperty("size") DataSize size,
            @JsonProperty("populated") boolean populated)
    {
        this.name = requireNonNull(name, "name is null");
        this.kind = requireNonNull(kind, "kind is null");
        this.persistence = requireNonNull(persistence, "persistence is null");
        this.size = requireNonNull(size, "size is null");
        this.populated = populated;
    }

    @JsonProperty
    public String getName()
    {
        return name;
    }

    @JsonProperty
    public ObjectKind getKind()
    {
        return kind;
    }

    @JsonProperty
    public Persistence getPersistence()
    {
        return persistence;
    }

    @JsonProperty
    public DataSize getSize()
    {
        return size;
    }

    /**
     * Whether the object stores rows. Views never do, tables always do, and a
     * materialized view does once it has been populated.
     */
    @JsonProperty
    public boolean isPopulated()
    {
        return populated;
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
        ObjectSize that = (ObjectSize) o;
        return populated == that.populated &&
                name.equals(that.name) &&
                kind == that.kind &&
                persistence == that.persistence &&
                size.equals(that.size);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, kind, persistence, size, populated);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("kind", kind)
                .add("persistence", persistence)
                .add("size", size.convertToMostSuccinctDataSize())
                .add("populated", populated)
                .toString();
    }
}
