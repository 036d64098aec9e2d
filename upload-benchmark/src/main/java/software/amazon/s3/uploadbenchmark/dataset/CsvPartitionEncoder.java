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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Encodes the rows of a {@link Partition} as UTF-8 CSV. The first column holds each row's index in
 * the source dataset and has an empty, unquoted header; the remaining columns are the dataset
 * columns. Records are separated by {@code \n}, fields are quoted only when needed. The output
 * loads back through {@link DatasetLoader}.
 */
public class CsvPartitionEncoder {
  private static final CSVFormat FORMAT =
      CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

  /**
   * Encodes the partition.
   *
   * @param partition partition to encode
   * @return CSV bytes
   */
  public byte[] encode(@NonNull Partition partition) {
    Dataset data = partition.getData();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (Writer writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
      // the printer would quote an empty leading field
      if (data.getColumns().isEmpty()) {
        printer.println();
      } else {
        printer.getOut().append(FORMAT.getDelimiterString());
        printer.printRecord(data.getColumns());
      }
      for (Row row : data.getRows()) {
        List<String> record = new ArrayList<>(row.getValues().size() + 1);
        record.add(Long.toString(row.getIndex()));
        record.addAll(row.getValues());
        printer.printRecord(record);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode partition " + partition.getKey(), e);
    }
    return buffer.toByteArray();
  }
}
