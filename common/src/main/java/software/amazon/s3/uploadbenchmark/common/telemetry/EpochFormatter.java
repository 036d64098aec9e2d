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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.Getter;
import lombok.NonNull;

/** Formats epoch timestamps for reports. */
@Getter
public class EpochFormatter {
  /** Default pattern. */
  public static final String DEFAULT_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

  /** Default instance, UTC. */
  public static final EpochFormatter DEFAULT = new EpochFormatter(DEFAULT_PATTERN);

  @NonNull private final String pattern;
  @NonNull private final DateTimeFormatter dateTimeFormatter;

  /**
   * Creates a new instance of {@link EpochFormatter}.
   *
   * @param pattern a {@link DateTimeFormatter} pattern, applied in UTC.
   */
  public EpochFormatter(@NonNull String pattern) {
    this.pattern = pattern;
    this.dateTimeFormatter = DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC);
  }

  /**
   * Formats nanoseconds since the epoch.
   *
   * @param epochNanos nanoseconds since the epoch
   * @return formatted timestamp
   */
  public String formatNanos(long epochNanos) {
    return dateTimeFormatter.format(
        Instant.ofEpochSecond(epochNanos / 1_000_000_000L, epochNanos % 1_000_000_000L));
  }
}
