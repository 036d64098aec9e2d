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
package software.amazon.s3.uploadbenchmark.key;

import java.util.Map;
import lombok.NonNull;
import software.amazon.s3.uploadbenchmark.dataset.PartitionKey;

/**
 * Builds object keys of the form {@code run=<id>/method=<tag>/<column>=<value>/.../data.csv}.
 * Values are used verbatim.
 */
public final class ObjectKeyBuilder {
  public static final String FILE_NAME = "data.csv";
  private static final char SEPARATOR = '/';

  private ObjectKeyBuilder() {}

  /**
   * Builds the key of a partition.
   *
   * @param runId run identifier
   * @param methodTag upload method tag
   * @param partitionKey ordered (column, value) pairs
   * @return the object key
   */
  public static String build(
      @NonNull String runId, @NonNull String methodTag, @NonNull PartitionKey partitionKey) {
    return build(runId, methodTag, partitionKey.getEntries());
  }

  /**
   * Builds the key from ordered (column, value) pairs.
   *
   * @param runId run identifier
   * @param methodTag upload method tag
   * @param segments ordered (column, value) pairs
   * @return the object key
   */
  public static String build(
      @NonNull String runId,
      @NonNull String methodTag,
      @NonNull Iterable<Map.Entry<String, String>> segments) {
    StringBuilder key = new StringBuilder();
    appendSegment(key, "run", runId);
    appendSegment(key, "method", methodTag);
    for (Map.Entry<String, String> segment : segments) {
      appendSegment(key, segment.getKey(), segment.getValue());
    }
    return key.append(FILE_NAME).toString();
  }

  private static void appendSegment(StringBuilder key, String name, String value) {
    key.append(name).append('=').append(value).append(SEPARATOR);
  }
}
