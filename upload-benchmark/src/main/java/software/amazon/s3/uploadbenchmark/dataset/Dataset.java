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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

/** An immutable in-memory table of rows with named columns. */
@Getter
public final class Dataset {
  private final List<String> columns;
  private final List<Row> rows;
  @Getter(AccessLevel.NONE)
  private final Map<String, Integer> columnIndexes;

  /**
   * Creates a dataset. Every row must have exactly one value per column.
   *
   * @param columns column names, unique
   * @param rows rows of the table
   */
  public Dataset(@NonNull List<String> columns, @NonNull List<Row> rows) {
    Map<String, Integer> indexes = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      Preconditions.checkArgument(
          indexes.put(columns.get(i), i) == null, "Duplicate column `%s`", columns.get(i));
    }
    for (Row row : rows) {
      Preconditions.checkArgument(
          row.getValues().size() == columns.size(),
          "Row %s has %s values, expected %s",
          row.getIndex(),
          row.getValues().size(),
          columns.size());
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    this.columnIndexes = Collections.unmodifiableMap(indexes);
  }

  /**
   * Position of a column.
   *
   * @param column column name
   * @return 0-based column position
   * @throws IllegalArgumentException if the dataset has no such column
   */
  public int columnIndex(@NonNull String column) {
    Integer index = columnIndexes.get(column);
    if (index == null) {
      throw new IllegalArgumentException(
          String.format("Column `%s` does not exist; available columns: %s", column, columns));
    }
    return index;
  }

  /**
   * Checks whether the dataset has a column.
   *
   * @param column column name
   * @return true if the column exists
   */
  public boolean hasColumn(@NonNull String column) {
    return columnIndexes.containsKey(column);
  }

  /**
   * Builds a sub-table with the same columns and the given rows.
   *
   * @param selectedRows rows to keep
   * @return a new {@link Dataset}
   */
  public Dataset select(@NonNull List<Row> selectedRows) {
    return new Dataset(columns, selectedRows);
  }

  /**
   * Number of rows.
   *
   * @return row count
   */
  public int size() {
    return rows.size();
  }
}
