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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;

public class TelemetryConfigurationTest {
  @Test
  void testDefault() {
    TelemetryConfiguration configuration = TelemetryConfiguration.builder().build();
    assertEquals(TelemetryConfiguration.DEFAULT, configuration);
    assertFalse(configuration.isEnableStdOut());
    assertTrue(configuration.isEnableLogging());
    assertEquals(LoggingTelemetryReporter.DEFAULT_LOGGER_NAME, configuration.getLoggerName());
  }

  @Test
  void testFromConfiguration() {
    Map<String, String> map = new HashMap<>();
    map.put("TELEMETRY_STDOUT", "true");
    map.put("TELEMETRY_LOGGING", "false");
    map.put("TELEMETRY_LOGGER", "benchmark.report");

    TelemetryConfiguration configuration =
        TelemetryConfiguration.fromConfiguration(new PrefixedConfiguration(map, ""));

    assertTrue(configuration.isEnableStdOut());
    assertFalse(configuration.isEnableLogging());
    assertEquals("benchmark.report", configuration.getLoggerName());
  }

  @Test
  void testFromEmptyConfiguration() {
    assertEquals(
        TelemetryConfiguration.DEFAULT,
        TelemetryConfiguration.fromConfiguration(new PrefixedConfiguration(new HashMap<>(), "")));
  }

  @Test
  void testNulls() {
    assertThrows(
        NullPointerException.class,
        () -> TelemetryConfiguration.builder().loggerName(null).build());
    assertThrows(
        NullPointerException.class, () -> TelemetryConfiguration.fromConfiguration(null));
  }
}
