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

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;

/** Interface that represents a telemetry reporter. */
public interface TelemetryReporter {
  /**
   * Reports telemetry for the operation execution.
   *
   * @param operationMeasurement operation execution.
   */
  void report(OperationMeasurement operationMeasurement);

  /**
   * Creates the reporter described by the configuration. Several enabled outputs are combined in a
   * {@link GroupTelemetryReporter}; no enabled output yields a reporter that does nothing.
   *
   * @param configuration an instance of {@link TelemetryConfiguration}
   * @return a new {@link TelemetryReporter}
   */
  static TelemetryReporter create(@NonNull TelemetryConfiguration configuration) {
    List<TelemetryReporter> reporters = new ArrayList<>();
    if (configuration.isEnableStdOut()) {
      reporters.add(new PrintStreamTelemetryReporter(System.out, EpochFormatter.DEFAULT));
    }
    if (configuration.isEnableLogging()) {
      reporters.add(
          new LoggingTelemetryReporter(configuration.getLoggerName(), EpochFormatter.DEFAULT));
    }
    switch (reporters.size()) {
      case 0:
        return new NoOpTelemetryReporter();
      case 1:
        return reporters.get(0);
      default:
        return new GroupTelemetryReporter(reporters);
    }
  }
}
