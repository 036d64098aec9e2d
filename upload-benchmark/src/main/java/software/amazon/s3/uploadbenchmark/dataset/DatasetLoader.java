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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.NonNull;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link Dataset} from a CSV source with a header row. The source is a URL ({@code
 * https:}, {@code file:}, ...) or a plain file path. Nothing is cached: every call fetches the
 * source again.
 */
public class DatasetLoader {
  private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

  private static final CSVFormat FORMAT =
      CSVFormat.DEFAULT
          .builder()
          .setHeader()
          .setSkipHeaderRecord(true)
          .setAllowMissingColumnNames(true)
          .build();

  private static final Pattern URL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]+:");

  /**
   * Fetches and parses the source.
   *
   * @param source URL or file path of a CSV with a header row
   * @return the loaded {@link Dataset}
   * @throws IOException if the source cannot be read or parsed
   */
  public Dataset load(@NonNull String source) throws IOException {
    URL url = toUrl(source);
    LOG.info("Loading dataset from {}", url);
    try (CSVParser parser = CSVParser.parse(url, StandardCharsets.UTF_8, FORMAT)) {
      List<String> columns = parser.getHeaderNames();
      List<Row> rows = new ArrayList<>();
      long index = 0;
      for (CSVRecord record : parser) {
        rows.add(new Row(index++, valuesOf(record, columns.size())));
      }
      LOG.info("Loaded {} rows with columns {}", rows.size(), columns);
      return new Dataset(columns, rows);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new IOException("Unable to parse dataset from " + source, e);
    }
  }

  private static List<String> valuesOf(CSVRecord record, int columnCount) {
    List<String> values = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      // short records are padded, like missing cells
      values.add(i < record.size() ? record.get(i) : "");
    }
    return values;
  }

  static URL toUrl(String source) throws IOException {
    // a single letter before ':' is a Windows drive, not a scheme
    if (URL_SCHEME.matcher(source).find()) {
      return URI.create(source).toURL();
    }
    return Paths.get(source).toUri().toURL();
  }
}
