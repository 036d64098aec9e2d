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

import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/** A single row of a {@link Dataset}, remembering its position in the loaded source. */
@Getter
@EqualsAndHashCode
public final class Row {
  /** 0-based position of the row in the source it was loaded from. */
  private final long index;

  private final List<String> values;

  /**
   * Creates a new row.
   *
   * @param index 0-based position of the row in its source
   * @param values cell values, in column order
   */
  public Row(long index, @NonNull List<String> values) {
    this.index = index;
    this.values = Collections.unmodifiableList(values);
  }

  /**
   * Value of the cell at the given column position.
   *
   * @param columnIndex 0-based column position
   * @return cell value, never null
   */
  public String get(int columnIndex) {
    return values.get(columnIndex);
  }

  @Override
  public String toString() {
    return index + ":" + values;
  }
}
