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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Telemetry} driven by an epoch clock and an elapsed clock. */
@RequiredArgsConstructor
public class DefaultTelemetry implements Telemetry {
  private static final Logger LOG = LoggerFactory.getLogger(DefaultTelemetry.class);

  /** Epoch clock. Used to measure the wall time for {@link Operation} start. */
  @NonNull @Getter(AccessLevel.PACKAGE)
  private final Clock epochClock;
  /** Elapsed clock. Used to measure the duration for {@link Operation}. */
  @NonNull @Getter(AccessLevel.PACKAGE)
  private final Clock elapsedClock;

  /**
   * Executes a given {@link TelemetryAction} and measures it as {@link Operation}.
   *
   * @param operation operation to record this execution as.
   * @param operationCode code to execute.
   * @return the measurement of the execution
   */
  @Override
  @SneakyThrows
  public OperationMeasurement measure(
      @NonNull Operation operation, @NonNull TelemetryAction operationCode) {
    OperationMeasurement.OperationMeasurementBuilder builder = OperationMeasurement.builder();
    builder.operation(operation);
    builder.epochTimestampNanos(epochClock.getCurrentTimeNanos());
    long start = elapsedClock.getCurrentTimeNanos();
    builder.elapsedStartTimeNanos(start);
    try {
      operationCode.apply();
    } catch (Exception error) {
      LOG.error(
          "Operation `{}` failed after {} ns",
          operation,
          elapsedClock.getCurrentTimeNanos() - start,
          error);
      throw error;
    }
    builder.elapsedCompleteTimeNanos(elapsedClock.getCurrentTimeNanos());
    return builder.build();
  }
}
