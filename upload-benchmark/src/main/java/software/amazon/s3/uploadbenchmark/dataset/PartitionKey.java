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
package software.amazon.s3.uploadbenchmark.dataset;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/** Values of the grouping columns shared by all rows of a {@link Partition}, in column order. */
@Getter
@EqualsAndHashCode
public final class PartitionKey {
  private final List<Map.Entry<String, String>> entries;

  private PartitionKey(List<Map.Entry<String, String>> entries) {
    this.entries = Collections.unmodifiableList(entries);
  }

  /**
   * Creates a key from parallel lists of column names and values.
   *
   * @param columns grouping column names
   * @param values values of these columns
   * @return a new {@link PartitionKey}
   */
  public static PartitionKey of(@NonNull List<String> columns, @NonNull List<String> values) {
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException(
          String.format("%s columns but %s values", columns.size(), values.size()));
    }
    List<Map.Entry<String, String>> entries = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      entries.add(
          new AbstractMap.SimpleImmutableEntry<>(
              Objects.requireNonNull(columns.get(i)), Objects.requireNonNull(values.get(i))));
    }
    return new PartitionKey(entries);
  }

  /**
   * Values of the key, in column order.
   *
   * @return values
   */
  public List<String> getValues() {
    List<String> values = new ArrayList<>(entries.size());
    entries.forEach(entry -> values.add(entry.getValue()));
    return values;
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
