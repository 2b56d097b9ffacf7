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
package io.viewbench.dialect;

import static java.util.Objects.requireNonNull;

public enum DialectType
{
    POSTGRESQL(PostgreSqlDialect.INSTANCE),
    H2(H2Dialect.INSTANCE);

    private final SqlDialect dialect;

    DialectType(SqlDialect dialect)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public SqlDialect getDialect()
    {
        return dialect;
    }

    public static DialectType fromJdbcUrl(String url)
    {
        requireNonNull(url, "url is null");
        if (url.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (url.startsWith("jdbc:h2:")) {
            return H2;
        }
        throw new IllegalArgumentException("Unsupported JDBC url: " + url);
    }
}
