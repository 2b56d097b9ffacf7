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
package io.viewbench.driver;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;

import javax.validation.constraints.NotNull;

public class DatabaseConfig
{
    private String url = "jdbc:postgresql://localhost:5432/postgres";
    private String user = "postgres";
    private String password;

    @NotNull
    public String getUrl()
    {
        return url;
    }

    @Config("database.url")
    @ConfigDescription("JDBC URL of the database to benchmark, either PostgreSQL or H2")
    public DatabaseConfig setUrl(String url)
    {
        this.url = url;
        return this;
    }

    public String getUser()
    {
        return user;
    }

    @Config("database.user")
    public DatabaseConfig setUser(String user)
    {
        this.user = user;
        return this;
    }

    public String getPassword()
    {
        return password;
    }

    @Config("database.password")
    @ConfigSecuritySensitive
    public DatabaseConfig setPassword(String password)
    {
        this.password = password;
        return this;
    }
}
