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

import java.io.PrintStream;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Writes one timing line per measurement to a {@link PrintStream}. */
@Getter
@RequiredArgsConstructor
class PrintStreamTelemetryReporter implements TelemetryReporter {
  @NonNull private final PrintStream printStream;
  @NonNull private final EpochFormatter epochFormatter;

  @Override
  public void report(@NonNull OperationMeasurement operationMeasurement) {
    printStream.println(TelemetryFormat.render(operationMeasurement, epochFormatter));
  }
}
