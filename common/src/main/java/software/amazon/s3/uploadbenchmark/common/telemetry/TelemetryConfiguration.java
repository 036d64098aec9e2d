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
package software.amazon.s3.uploadbenchmark.common.telemetry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;

/** Configuration for {@link TelemetryReporter#create(TelemetryConfiguration)}. */
@Value
@Builder
public class TelemetryConfiguration {
  public static final String ENABLE_STD_OUT_KEY = "TELEMETRY_STDOUT";
  public static final String ENABLE_LOGGING_KEY = "TELEMETRY_LOGGING";
  public static final String LOGGER_NAME_KEY = "TELEMETRY_LOGGER";

  /** Enable standard output. */
  @Builder.Default boolean enableStdOut = false;
  /** Enable logging output. */
  @Builder.Default boolean enableLogging = true;
  /** Logger name. */
  @Builder.Default @NonNull String loggerName = LoggingTelemetryReporter.DEFAULT_LOGGER_NAME;

  /** Default configuration. */
  public static final TelemetryConfiguration DEFAULT = TelemetryConfiguration.builder().build();

  /**
   * Constructs {@link TelemetryConfiguration} from {@link PrefixedConfiguration}.
   *
   * @param configuration configuration to read from
   * @return a new instance of {@link TelemetryConfiguration}
   */
  public static TelemetryConfiguration fromConfiguration(
      @NonNull PrefixedConfiguration configuration) {
    return TelemetryConfiguration.builder()
        .enableStdOut(configuration.getBoolean(ENABLE_STD_OUT_KEY, DEFAULT.isEnableStdOut()))
        .enableLogging(configuration.getBoolean(ENABLE_LOGGING_KEY, DEFAULT.isEnableLogging()))
        .loggerName(configuration.getString(LOGGER_NAME_KEY, DEFAULT.getLoggerName()))
        .build();
  }
}
