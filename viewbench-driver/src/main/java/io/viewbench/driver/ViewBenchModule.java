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

import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.viewbench.ViewBenchmark;
import io.viewbench.dialect.DialectType;
import io.viewbench.dialect.SqlDialect;
import io.viewbench.generator.DataGenerator;
import io.viewbench.generator.ScaleParameters;
import io.viewbench.report.ReportEmitter;
import io.viewbench.runner.BenchmarkRunner;
import io.viewbench.schema.SchemaProvisioner;
import io.viewbench.space.SpaceInspector;
import io.viewbench.variant.QueryVariantRegistry;
import io.viewbench.verifier.ResultVerifier;
import org.jdbi.v3.core.Jdbi;

import javax.inject.Singleton;

import static com.google.common.base.Strings.nullToEmpty;
import static io.airlift.configuration.ConfigBinder.configBinder;

public class ViewBenchModule
        extends AbstractConfigurationAwareModule
{
    private final boolean debug;

    public ViewBenchModule(boolean debug)
    {
        this.debug = debug;
    }

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(DatabaseConfig.class);
        configBinder(binder).bindConfig(GeneratorConfig.class);
        configBinder(binder).bindConfig(BenchmarkConfig.class);
        configBinder(binder).bindConfig(ReportConfig.class);
        configBinder(binder).bindConfig(ContainerConfig.class);

        binder.bind(CommandExecutor.class).to(ProcessCommandExecutor.class).in(Scopes.SINGLETON);
        binder.bind(DockerCommands.class).in(Scopes.SINGLETON);
        binder.bind(ContainerManager.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public static SqlDialect createDialect(DatabaseConfig config)
    {
        return DialectType.fromJdbcUrl(config.getUrl()).getDialect();
    }

    @Provides
    @Singleton
    public static Jdbi createJdbi(DatabaseConfig config)
    {
        if (config.getUser() == null) {
            return Jdbi.create(config.getUrl());
        }
        return Jdbi.create(config.getUrl(), config.getUser(), nullToEmpty(config.getPassword()));
    }

    @Provides
    @Singleton
    public static ScaleParameters createScaleParameters(GeneratorConfig config)
    {
        ScaleParameters scale = ScaleParameters.withScaleFactor(config.getScaleFactor());
        if (config.getCourses() != null) {
            scale = scale.withCourses(config.getCourses());
        }
        if (config.getStudents() != null) {
            scale = scale.withStudents(config.getStudents());
        }
        if (config.getClasses() != null) {
            scale = scale.withClasses(config.getClasses());
        }
        if (config.getEnrollments() != null) {
            scale = scale.withEnrollments(config.getEnrollments());
        }
        return scale;
    }

    @Provides
    @Singleton
    public static SchemaProvisioner createSchemaProvisioner(Jdbi jdbi, SqlDialect dialect)
    {
        return new SchemaProvisioner(jdbi, dialect);
    }

    @Provides
    @Singleton
    public static DataGenerator createDataGenerator(Jdbi jdbi, SqlDialect dialect, GeneratorConfig config)
    {
        return new DataGenerator(jdbi, dialect, config.getMode(), config.getSeed(), config.getBatchSize());
    }

    @Provides
    @Singleton
    public static QueryVariantRegistry createQueryVariantRegistry(Jdbi jdbi, SqlDialect dialect)
    {
        return new QueryVariantRegistry(jdbi, dialect);
    }

    @Provides
    @Singleton
    public BenchmarkRunner createBenchmarkRunner(Jdbi jdbi, BenchmarkConfig config)
    {
        return new BenchmarkRunner(
                jdbi,
                config.getWarm(),
                config.getRuns(),
                config.getMaxFailures(),
                config.getQueryTimeout(),
                config.getFailureBackoff(),
                debug);
    }

    @Provides
    @Singleton
    public static ResultVerifier createResultVerifier(Jdbi jdbi, BenchmarkConfig config)
    {
        return new ResultVerifier(jdbi, config.getVerifyMaxRows(), config.getVerifyPrecision());
    }

    @Provides
    @Singleton
    public static SpaceInspector createSpaceInspector(Jdbi jdbi, SqlDialect dialect)
    {
        return new SpaceInspector(jdbi, dialect);
    }

    @Provides
    @Singleton
    public static ViewBenchmark createViewBenchmark(
            SqlDialect dialect,
            SchemaProvisioner provisioner,
            DataGenerator generator,
            QueryVariantRegistry registry,
            BenchmarkRunner runner,
            ResultVerifier verifier,
            SpaceInspector inspector,
            ScaleParameters scale,
            BenchmarkConfig config)
    {
        return new ViewBenchmark(
                dialect,
                provisioner,
                generator,
                registry,
                runner,
                verifier,
                inspector,
                scale,
                config.getMaterializedViewPopulation(),
                config.isCleanup());
    }

    @Provides
    @Singleton
    public static ReportEmitter createReportEmitter(ReportConfig config)
    {
        return config.getFormat().createEmitter();
    }
}
