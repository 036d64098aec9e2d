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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.NonNull;

/**
 * Splits a {@link Dataset} into {@link Partition}s, one per distinct combination of values across
 * the grouping columns. Every row lands in exactly one partition; rows with an empty grouping value
 * are grouped under the empty string.
 */
public class DatasetPartitioner {

  /**
   * Partitions the dataset. The columns are validated immediately; the grouping itself only runs
   * when the returned stream is consumed. Partitions come in order of the first row carrying their
   * key, which makes the order stable for a given dataset.
   *
   * @param dataset table to split
   * @param groupingColumns ordered, non-empty list of existing column names
   * @return a lazy stream of partitions
   * @throws IllegalArgumentException if the list is empty or names a column the dataset lacks
   */
  public Stream<Partition> partition(
      @NonNull Dataset dataset, @NonNull List<String> groupingColumns) {
    Preconditions.checkArgument(!groupingColumns.isEmpty(), "No grouping columns given");
    int[] positions = new int[groupingColumns.size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = dataset.columnIndex(groupingColumns.get(i));
    }
    List<String> columns = new ArrayList<>(groupingColumns);
    return Stream.of(dataset).flatMap(source -> group(source, columns, positions));
  }

  private static Stream<Partition> group(Dataset dataset, List<String> columns, int[] positions) {
    Map<List<String>, List<Row>> groups = new LinkedHashMap<>();
    for (Row row : dataset.getRows()) {
      List<String> values = new ArrayList<>(positions.length);
      for (int position : positions) {
        values.add(row.get(position));
      }
      groups.computeIfAbsent(values, key -> new ArrayList<>()).add(row);
    }
    return groups.entrySet().stream()
        .map(
            group ->
                new Partition(
                    PartitionKey.of(columns, group.getKey()), dataset.select(group.getValue())));
  }
}
