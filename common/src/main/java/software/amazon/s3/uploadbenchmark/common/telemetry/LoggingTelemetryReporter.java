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

import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs one timing line per measurement at INFO level. */
@Getter
class LoggingTelemetryReporter implements TelemetryReporter {
  /** Logger name used when none is configured. */
  public static final String DEFAULT_LOGGER_NAME = "software.amazon.s3.uploadbenchmark.telemetry";

  @NonNull private final String loggerName;
  @NonNull private final EpochFormatter epochFormatter;
  private final Logger logger;

  /**
   * Creates a new instance of {@link LoggingTelemetryReporter}.
   *
   * @param loggerName name of the SLF4J logger to write to
   * @param epochFormatter formatter for start timestamps
   */
  LoggingTelemetryReporter(@NonNull String loggerName, @NonNull EpochFormatter epochFormatter) {
    this.loggerName = loggerName;
    this.epochFormatter = epochFormatter;
    this.logger = LoggerFactory.getLogger(loggerName);
  }

  @Override
  public void report(@NonNull OperationMeasurement operationMeasurement) {
    if (logger.isInfoEnabled()) {
      logger.info(TelemetryFormat.render(operationMeasurement, epochFormatter));
    }
  }
}
