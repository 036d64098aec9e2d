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

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.s3.uploadbenchmark.client.S3ClientFactoryConfiguration;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;
import software.amazon.s3.uploadbenchmark.common.telemetry.TelemetryConfiguration;
import software.amazon.s3.uploadbenchmark.strategy.ClientSelectionPolicy;

/** Configuration of the upload benchmark */
@Value
@Builder
public class UploadBenchmarkConfiguration {
  private static final Logger LOG = LoggerFactory.getLogger(UploadBenchmarkConfiguration.class);

  public static final String BUCKET_KEY = "BUCKET";
  public static final String DATASET_URL_KEY = "DATASET_URL";
  public static final String GROUPING_COLUMNS_KEY = "GROUPING_COLUMNS";
  public static final String CONCURRENCY_LEVELS_KEY = "CONCURRENCY_LEVELS";
  public static final String CLIENT_SELECTION_KEY = "CLIENT_SELECTION";
  public static final String ENV_FILE_KEY = "ENV_FILE";

  public static final String DEFAULT_ENV_FILE = ".env";
  public static final String DEFAULT_DATASET_URL =
      "https://github.com/mwaskom/seaborn-data/raw/master/taxis.csv";
  public static final List<String> DEFAULT_GROUPING_COLUMNS =
      Collections.unmodifiableList(Arrays.asList("color", "payment", "pickup_zone"));
  public static final List<Integer> DEFAULT_CONCURRENCY_LEVELS =
      Collections.unmodifiableList(Arrays.asList(4, 8, 20));

  @NonNull String bucket;
  @Builder.Default @NonNull String datasetUrl = DEFAULT_DATASET_URL;
  @Singular @NonNull List<String> groupingColumns;
  @Singular @NonNull List<Integer> concurrencyLevels;

  @Builder.Default @NonNull
  ClientSelectionPolicy clientSelectionPolicy = ClientSelectionPolicy.RANDOM;

  @Builder.Default @NonNull
  S3ClientFactoryConfiguration clientFactoryConfiguration =
      S3ClientFactoryConfiguration.builder().build();

  @Builder.Default @NonNull
  TelemetryConfiguration telemetryConfiguration = TelemetryConfiguration.DEFAULT;

  /**
   * Creates the {@link UploadBenchmarkConfiguration} from the supplied configuration
   *
   * @param configuration an instance of configuration
   * @return a new instance of {@link UploadBenchmarkConfiguration}
   * @throws IllegalArgumentException if a value is invalid
   */
  public static UploadBenchmarkConfiguration fromConfiguration(
      @NonNull PrefixedConfiguration configuration) {
    String bucket = configuration.getString(BUCKET_KEY, "");
    if (bucket.isEmpty()) {
      LOG.warn("`{}` is not set; uploads will target an empty bucket name", BUCKET_KEY);
    }
    List<String> groupingColumns =
        configuration.getStringList(GROUPING_COLUMNS_KEY, DEFAULT_GROUPING_COLUMNS);
    Preconditions.checkArgument(
        !groupingColumns.isEmpty(), "`%s` must name at least one column", GROUPING_COLUMNS_KEY);
    List<Integer> concurrencyLevels =
        configuration.getIntList(CONCURRENCY_LEVELS_KEY, DEFAULT_CONCURRENCY_LEVELS);
    for (int concurrency : concurrencyLevels) {
      Preconditions.checkArgument(
          concurrency > 0,
          "`%s` must only hold positive values, got %s",
          CONCURRENCY_LEVELS_KEY,
          concurrency);
    }

    return UploadBenchmarkConfiguration.builder()
        .bucket(bucket)
        .datasetUrl(configuration.getString(DATASET_URL_KEY, DEFAULT_DATASET_URL))
        .groupingColumns(groupingColumns)
        .concurrencyLevels(concurrencyLevels)
        .clientSelectionPolicy(
            ClientSelectionPolicy.fromName(
                configuration.getString(
                    CLIENT_SELECTION_KEY, ClientSelectionPolicy.RANDOM.name())))
        .clientFactoryConfiguration(S3ClientFactoryConfiguration.fromConfiguration(configuration))
        .telemetryConfiguration(TelemetryConfiguration.fromConfiguration(configuration))
        .build();
  }

  /**
   * Creates the {@link UploadBenchmarkConfiguration} from the environment, on top of the entries of
   * the file named by {@code ENV_FILE} ({@code .env} by default).
   *
   * @return a new instance of {@link UploadBenchmarkConfiguration}
   * @throws IOException if the env file exists but cannot be read
   */
  public static UploadBenchmarkConfiguration fromEnvironment() throws IOException {
    String envFile = System.getenv().getOrDefault(ENV_FILE_KEY, DEFAULT_ENV_FILE);
    return fromConfiguration(PrefixedConfiguration.fromEnvironment(Paths.get(envFile)));
  }
}
