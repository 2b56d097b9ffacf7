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
package io.viewbench;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.viewbench.dialect.SqlDialect;
import io.viewbench.generator.DataGenerator;
import io.viewbench.generator.GenerationResult;
import io.viewbench.generator.ScaleParameters;
import io.viewbench.report.BenchmarkReport;
import io.viewbench.runner.BenchmarkRunner;
import io.viewbench.runner.VariantResult;
import io.viewbench.schema.BenchmarkTable;
import io.viewbench.schema.SchemaProvisioner;
import io.viewbench.space.ObjectSize;
import io.viewbench.space.SpaceInspector;
import io.viewbench.variant.MaterializedViewPopulation;
import io.viewbench.variant.QueryVariant;
import io.viewbench.variant.QueryVariantRegistry;
import io.viewbench.variant.VariantType;
import io.viewbench.verifier.ResultVerifier;
import io.viewbench.verifier.Verification;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static io.airlift.units.Duration.nanosSince;
import static io.viewbench.variant.QueryVariantRegistry.MATERIALIZED_VIEW_NAME;
import static io.viewbench.variant.QueryVariantRegistry.VIEW_NAME;
import static java.util.Objects.requireNonNull;
import static java.util.function.Function.identity;

/**
 * One end-to-end comparison of the raw join, the view and the materialized view.
 */
public class ViewBenchmark
        implements Closeable
{
    private static final Logger log = Logger.get(ViewBenchmark.class);

    private final SqlDialect dialect;
    private final SchemaProvisioner provisioner;
    private final DataGenerator generator;
    private final QueryVariantRegistry registry;
    private final BenchmarkRunner runner;
    private final ResultVerifier verifier;
    private final SpaceInspector inspector;
    private final ScaleParameters scale;
    private final MaterializedViewPopulation population;
    private final boolean cleanup;

    public ViewBenchmark(
            SqlDialect dialect,
            SchemaProvisioner provisioner,
            DataGenerator generator,
            QueryVariantRegistry registry,
            BenchmarkRunner runner,
            ResultVerifier verifier,
            SpaceInspector inspector,
            ScaleParameters scale,
            MaterializedViewPopulation population,
            boolean cleanup)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.provisioner = requireNonNull(provisioner, "provisioner is null");
        this.generator = requireNonNull(generator, "generator is null");
        this.registry = requireNonNull(registry, "registry is null");
        this.runner = requireNonNull(runner, "runner is null");
        this.verifier = requireNonNull(verifier, "verifier is null");
        this.inspector = requireNonNull(inspector, "inspector is null");
        this.scale = requireNonNull(scale, "scale is null");
        this.population = requireNonNull(population, "population is null");
        this.cleanup = cleanup;
    }

    public BenchmarkReport run()
    {
        long start = System.nanoTime();
        GenerationResult generation = provision();

        log.info("Creating %s and %s", VIEW_NAME, MATERIALIZED_VIEW_NAME);
        registry.createDerivedObjects(population);

        ImmutableList.Builder<ObjectSize> objectSizes = ImmutableList.builder();
        if (population == MaterializedViewPopulation.DEFERRED) {
            objectSizes.addAll(inspector.inspect(ImmutableList.of(MATERIALIZED_VIEW_NAME)));
            registry.refreshMaterializedView();
        }
        registry.analyzeMaterializedView();

        log.info("Benchmarking %s variants", registry.getVariants().size());
        ImmutableList.Builder<VariantResult> variantResults = ImmutableList.builder();
        for (QueryVariant variant : registry.getVariants()) {
            variantResults.add(runner.execute(variant));
        }
        List<VariantResult> results = variantResults.build();

        log.info("Verifying results against %s", VariantType.RAW_JOIN);
        List<Verification> verifications = verify(results);

        log.info("Inspecting object sizes");
        ImmutableList.Builder<String> objectNames = ImmutableList.builder();
        for (BenchmarkTable table : BenchmarkTable.creationOrder()) {
            objectNames.add(table.getTableName());
        }
        objectNames.add(VIEW_NAME, MATERIALIZED_VIEW_NAME);
        objectSizes.addAll(inspector.inspect(objectNames.build()));

        if (cleanup) {
            drop();
        }

        BenchmarkReport report = new BenchmarkReport(
                dialect.getName(),
                scale,
                generation,
                population,
                results,
                verifications,
                objectSizes.build());
        log.info("Benchmark finished in %s", nanosSince(start).convertToMostSuccinctTimeUnit());
        return report;
    }

    /**
     * Recreates the base tables and fills them, leaving no views behind.
     */
    public GenerationResult provision()
    {
        log.info("Provisioning schema on %s", dialect.getName());
        registry.dropDerivedObjects();
        provisioner.create();

        log.info("Generating data for %s", scale);
        GenerationResult generation = generator.generate(scale);
        provisioner.analyze();
        return generation;
    }

    public void drop()
    {
        log.info("Dropping benchmark objects");
        registry.dropDerivedObjects();
        provisioner.drop();
    }

    private List<Verification> verify(List<VariantResult> results)
    {
        Map<VariantType, VariantResult> byType = results.stream()
                .collect(toImmutableMap(result -> result.getVariant().getType(), identity()));
        VariantResult control = byType.get(VariantType.RAW_JOIN);
        if (control == null || !control.isPassed()) {
            log.warn("Skipping verification, %s did not pass", VariantType.RAW_JOIN);
            return ImmutableList.of();
        }

        ImmutableList.Builder<Verification> verifications = ImmutableList.builder();
        for (VariantResult result : results) {
            if (result == control) {
                continue;
            }
            if (!result.isPassed()) {
                log.warn("Skipping verification of %s, it did not pass", result.getVariant().getName());
                continue;
            }
            verifications.add(verifier.verify(control.getVariant(), result.getVariant()));
        }
        return verifications.build();
    }

    @Override
    public void close()
    {
        runner.close();
    }
}
