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

import java.util.Locale;
import java.util.stream.Collectors;
import lombok.NonNull;

/** Renders an {@link OperationMeasurement} as a single timing line. */
final class TelemetryFormat {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private TelemetryFormat() {}

  /**
   * Renders the measurement, e.g. {@code [2024-01-01T10:00:00.000Z] Method transfer took 1.234s to
   * complete (concurrency=4)}.
   *
   * @param measurement measurement to render
   * @param epochFormatter formatter for the start timestamp
   * @return formatted line
   */
  static String render(
      @NonNull OperationMeasurement measurement, @NonNull EpochFormatter epochFormatter) {
    Operation operation = measurement.getOperation();
    StringBuilder line = new StringBuilder();
    line.append('[')
        .append(epochFormatter.formatNanos(measurement.getEpochTimestampNanos()))
        .append("] Method ")
        .append(operation.getName())
        .append(" took ")
        .append(
            String.format(
                Locale.ROOT, "%.3fs", measurement.getElapsedTimeNanos() / NANOS_PER_SECOND))
        .append(" to complete");
    if (!operation.getAttributes().isEmpty()) {
      line.append(" (")
          .append(
              operation.getAttributes().stream()
                  .map(Attribute::toString)
                  .collect(Collectors.joining(", ")))
          .append(')');
    }
    return line.toString();
  }
}
