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

import com.google.common.base.Preconditions;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/** The outcome of measuring a single {@link Operation}. */
@Getter
public class OperationMeasurement {
  /** Measured operation. */
  @NonNull private final Operation operation;
  /** Wall clock time of the operation start, in nanoseconds since the epoch. */
  private final long epochTimestampNanos;
  /** Elapsed clock reading at the start. */
  private final long elapsedStartTimeNanos;
  /** Elapsed clock reading at completion. */
  private final long elapsedCompleteTimeNanos;

  /**
   * Creates a new instance of {@link OperationMeasurement}.
   *
   * @param operation measured operation
   * @param epochTimestampNanos wall clock time of the start
   * @param elapsedStartTimeNanos elapsed clock at the start
   * @param elapsedCompleteTimeNanos elapsed clock at completion, not before the start
   */
  @Builder
  private OperationMeasurement(
      @NonNull Operation operation,
      long epochTimestampNanos,
      long elapsedStartTimeNanos,
      long elapsedCompleteTimeNanos) {
    Preconditions.checkArgument(
        elapsedCompleteTimeNanos >= elapsedStartTimeNanos,
        "Operation `%s` completed (%s) before it started (%s)",
        operation.getName(),
        elapsedCompleteTimeNanos,
        elapsedStartTimeNanos);
    this.operation = operation;
    this.epochTimestampNanos = epochTimestampNanos;
    this.elapsedStartTimeNanos = elapsedStartTimeNanos;
    this.elapsedCompleteTimeNanos = elapsedCompleteTimeNanos;
  }

  /**
   * Duration of the operation in nanoseconds. Never negative.
   *
   * @return elapsed time in nanoseconds
   */
  public long getElapsedTimeNanos() {
    return elapsedCompleteTimeNanos - elapsedStartTimeNanos;
  }

  /**
   * Duration of the operation.
   *
   * @return elapsed time as a {@link Duration}
   */
  public Duration getElapsedTime() {
    return Duration.ofNanos(getElapsedTimeNanos());
  }

  @Override
  public String toString() {
    return String.format("%s: %,d ns", operation, getElapsedTimeNanos());
  }
}
