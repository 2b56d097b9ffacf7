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

import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum Persistence
{
    PERMANENT('p'),
    TEMPORARY('t'),
    UNLOGGED('u'),
    UNKNOWN('?');

    private final char code;

    Persistence(char code)
    {
        this.code = code;
    }

    /**
     * Maps a PostgreSQL {@code relpersistence} code.
     */
    public static Persistence fromCode(String code)
    {
        if (code != null && code.length() == 1) {
            for (Persistence persistence : values()) {
                if (persistence.code == code.charAt(0)) {
                    return persistence;
                }
            }
        }
        return UNKNOWN;
    }

    @JsonValue
    public String getDisplayName()
    {
        return name().toLowerCase(ENGLISH);
    }
}
