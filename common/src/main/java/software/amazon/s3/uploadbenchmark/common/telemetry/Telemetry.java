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

import lombok.NonNull;

/** Measures the wall-clock duration of operations. */
public interface Telemetry {
  /**
   * Runs the given {@link TelemetryAction} and measures it as {@link Operation}. If the action
   * fails, the failure is rethrown unchanged and no measurement is produced.
   *
   * @param operation operation to record this execution as.
   * @param operationCode code to execute.
   * @return the measurement of the successful execution.
   */
  OperationMeasurement measure(
      @NonNull Operation operation, @NonNull TelemetryAction operationCode);

  /**
   * Creates a {@link Telemetry} that uses the system clocks.
   *
   * @return a new instance of {@link Telemetry}
   */
  static Telemetry createDefault() {
    return new DefaultTelemetry(DefaultEpochClock.DEFAULT, DefaultElapsedClock.DEFAULT);
  }
}
