/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package software.amazon.s3.uploadbenchmark;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.s3.uploadbenchmark.client.S3ClientFactory;
import software.amazon.s3.uploadbenchmark.common.telemetry.Attribute;
import software.amazon.s3.uploadbenchmark.common.telemetry.Operation;
import software.amazon.s3.uploadbenchmark.common.telemetry.OperationMeasurement;
import software.amazon.s3.uploadbenchmark.common.telemetry.Telemetry;
import software.amazon.s3.uploadbenchmark.common.telemetry.TelemetryReporter;
import software.amazon.s3.uploadbenchmark.dataset.Dataset;
import software.amazon.s3.uploadbenchmark.dataset.DatasetLoader;
import software.amazon.s3.uploadbenchmark.dataset.DatasetPartitioner;
import software.amazon.s3.uploadbenchmark.key.RunId;
import software.amazon.s3.uploadbenchmark.strategy.UploadContext;
import software.amazon.s3.uploadbenchmark.strategy.UploadStrategy;
import software.amazon.s3.uploadbenchmark.strategy.UploadStrategyKind;

/**
 * One benchmark run at a fixed concurrency. Loads the dataset, uploads its partitions with every
 * {@link UploadStrategyKind} in declaration order, then reports the time each strategy took.
 * Client construction happens before the clock starts; loading and partitioning happen before and
 * inside it respectively.
 */
public class UploadBenchmark {
  private static final Logger LOG = LoggerFactory.getLogger(UploadBenchmark.class);

  public static final String CONCURRENCY_ATTRIBUTE = "concurrency";
  public static final String METHOD_ATTRIBUTE = "method";
  public static final String RUN_ATTRIBUTE = "run";

  @NonNull private final UploadBenchmarkConfiguration configuration;
  @NonNull private final S3ClientFactory clientFactory;
  @NonNull private final DatasetLoader datasetLoader;
  @NonNull private final DatasetPartitioner partitioner;
  @NonNull private final Telemetry telemetry;
  @NonNull private final TelemetryReporter reporter;
  @NonNull private final Random random;

  /**
   * Creates a new instance of {@link UploadBenchmark}
   *
   * @param configuration benchmark configuration
   * @param concurrency concurrency of this run
   */
  public UploadBenchmark(@NonNull UploadBenchmarkConfiguration configuration, int concurrency) {
    this(
        configuration,
        new S3ClientFactory(configuration.getClientFactoryConfiguration(), concurrency),
        new DatasetLoader(),
        new DatasetPartitioner(),
        Telemetry.createDefault(),
        TelemetryReporter.create(configuration.getTelemetryConfiguration()),
        new Random());
  }

  UploadBenchmark(
      @NonNull UploadBenchmarkConfiguration configuration,
      @NonNull S3ClientFactory clientFactory,
      @NonNull DatasetLoader datasetLoader,
      @NonNull DatasetPartitioner partitioner,
      @NonNull Telemetry telemetry,
      @NonNull TelemetryReporter reporter,
      @NonNull Random random) {
    this.configuration = configuration;
    this.clientFactory = clientFactory;
    this.datasetLoader = datasetLoader;
    this.partitioner = partitioner;
    this.telemetry = telemetry;
    this.reporter = reporter;
    this.random = random;
  }

  /**
   * Runs every strategy once and reports the measurements.
   *
   * @return one measurement per strategy, in the order the strategies ran
   * @throws IOException if the dataset cannot be loaded
   * @throws InterruptedException if interrupted while waiting for uploads
   */
  public List<OperationMeasurement> run() throws IOException, InterruptedException {
    int concurrency = clientFactory.getConcurrency();
    LOG.info("Running with concurrency {}", concurrency);

    Dataset dataset = datasetLoader.load(configuration.getDatasetUrl());
    RunId runId = RunId.random(random);
    LOG.info(
        "Loaded {} rows from {}; run id {}", dataset.size(), configuration.getDatasetUrl(), runId);
    UploadContext context =
        UploadContext.builder()
            .bucket(configuration.getBucket())
            .runId(runId)
            .clientFactory(clientFactory)
            .selectionPolicy(configuration.getClientSelectionPolicy())
            .random(random)
            .build();

    List<OperationMeasurement> measurements = new ArrayList<>();
    for (UploadStrategyKind kind : UploadStrategyKind.values()) {
      try (UploadStrategy strategy = kind.createStrategy(context)) {
        Operation operation =
            Operation.builder()
                .name(kind.getValue())
                .attribute(Attribute.of(CONCURRENCY_ATTRIBUTE, concurrency))
                .attribute(Attribute.of(METHOD_ATTRIBUTE, strategy.getMethodTag()))
                .attribute(Attribute.of(RUN_ATTRIBUTE, runId))
                .build();
        measurements.add(
            telemetry.measure(
                operation,
                () ->
                    strategy.upload(
                        partitioner.partition(dataset, configuration.getGroupingColumns()))));
      }
    }

    measurements.forEach(reporter::report);
    return Collections.unmodifiableList(measurements);
  }
}
