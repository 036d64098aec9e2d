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
package software.amazon.s3.uploadbenchmark.common;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.Getter;
import lombok.NonNull;

/**
 * A map based configuration for the upload benchmark. Each configuration item is a Key-Value pair,
 * where keys start with a common prefix. Constructors let the caller pass this common prefix as
 * well.
 *
 * <p>Example: Assume we have the following map bench.upload.concurrency = 8
 * bench.upload.bucket = "foo" bench.dataset.url = "https://..."
 *
 * <p>One can create a {@link PrefixedConfiguration} instance as follows: PrefixedConfiguration conf
 * = new PrefixedConfiguration(map, "bench"); and getInt("upload.concurrency", 0) will return 8.
 * Note that the getter does not require the initial prefix already passed to {@link
 * PrefixedConfiguration} (i.e. "bench").
 *
 * <p>An empty prefix keeps every entry and looks keys up verbatim. This is the shape used for
 * process environment variables, which cannot contain dots.
 */
public class PrefixedConfiguration {
  private static final String LIST_SEPARATOR = ",";
  private static final String EXPORT_PREFIX = "export ";
  private static final Splitter ENV_ENTRY_SPLITTER = Splitter.on('=').limit(2).trimResults();

  /**
   * Common prefix of all keys held by this configuration.
   *
   * @return String
   */
  @Getter private final String prefix;

  private final Map<String, String> configuration;

  /**
   * Constructs {@link PrefixedConfiguration} from Map<String, String> and prefix. Keys not starting
   * with prefix will be omitted from the map.
   *
   * @param configurationMap configuration entries
   * @param prefix common prefix of the keys
   */
  public PrefixedConfiguration(
      @NonNull Map<String, String> configurationMap, @NonNull String prefix) {
    this(configurationMap.entrySet(), prefix);
  }

  /**
   * Constructs {@link PrefixedConfiguration} from Iterable of Map.Entry<String, String> and prefix.
   * Keys not starting with prefix will be omitted from the map.
   *
   * @param iterableConfiguration Iterable of Map.Entry<String, String>
   * @param prefix common prefix of the keys
   */
  public PrefixedConfiguration(
      @NonNull Iterable<Map.Entry<String, String>> iterableConfiguration, @NonNull String prefix) {
    this.prefix = prefix;
    this.configuration =
        Collections.unmodifiableMap(
            StreamSupport.stream(iterableConfiguration.spliterator(), false)
                .filter(entry -> entry.getKey().startsWith(prefix))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
  }

  /**
   * Creates a configuration with an empty prefix from the process environment, overlaid on top of
   * the entries of a dotenv style file. Environment variables win over file entries. A missing file
   * is ignored.
   *
   * @param envFile path to a file of KEY=VALUE lines
   * @return a new {@link PrefixedConfiguration}
   * @throws IOException if the file exists but cannot be read
   */
  public static PrefixedConfiguration fromEnvironment(@NonNull Path envFile) throws IOException {
    Map<String, String> entries = new HashMap<>(readEnvFile(envFile));
    entries.putAll(System.getenv());
    return new PrefixedConfiguration(entries, "");
  }

  /**
   * Reads KEY=VALUE entries from a dotenv style file encoded in UTF-8.
   *
   * <p>Blank lines and lines starting with '#' are skipped, as are lines without a '='. An optional
   * leading "export " is dropped. Values may be wrapped in single or double quotes; single quoted
   * values are taken literally, double quoted ones unescape \" and \\. Unquoted values end at a
   * " #" comment. Any other backslash is kept as is.
   *
   * @param envFile path to the file
   * @return entries of the file, or an empty map if the file does not exist
   * @throws IOException if the file exists but cannot be read
   */
  static Map<String, String> readEnvFile(@NonNull Path envFile) throws IOException {
    if (!Files.isRegularFile(envFile)) {
      return Collections.emptyMap();
    }
    Map<String, String> entries = new HashMap<>();
    for (String line : Files.readAllLines(envFile, StandardCharsets.UTF_8)) {
      String entry = line.trim();
      if (entry.isEmpty() || entry.startsWith("#")) {
        continue;
      }
      if (entry.startsWith(EXPORT_PREFIX)) {
        entry = entry.substring(EXPORT_PREFIX.length()).trim();
      }
      List<String> keyAndValue = ENV_ENTRY_SPLITTER.splitToList(entry);
      if (keyAndValue.size() < 2 || keyAndValue.get(0).isEmpty()) {
        continue;
      }
      entries.put(keyAndValue.get(0), parseEnvValue(keyAndValue.get(1)));
    }
    return entries;
  }

  private static String parseEnvValue(String value) {
    if (value.startsWith("'")) {
      int end = value.indexOf('\'', 1);
      return end < 0 ? value : value.substring(1, end);
    }
    if (value.startsWith("\"")) {
      StringBuilder unquoted = new StringBuilder();
      for (int i = 1; i < value.length(); i++) {
        char c = value.charAt(i);
        if (c == '"') {
          return unquoted.toString();
        }
        if (c == '\\' && i + 1 < value.length()) {
          char next = value.charAt(i + 1);
          if (next == '"' || next == '\\') {
            unquoted.append(next);
            i++;
            continue;
          }
        }
        unquoted.append(c);
      }
      // No closing quote
      return value;
    }
    int comment = value.indexOf(" #");
    return comment < 0 ? value : value.substring(0, comment).trim();
  }

  /**
   * Return a new {@link PrefixedConfiguration} where the common prefix for keys is updated to
   * this.getPrefix() + "." + appendPrefix
   *
   * @param appendPrefix prefix to append to the common prefix for keys
   * @return {@link PrefixedConfiguration}
   */
  public PrefixedConfiguration map(@NonNull String appendPrefix) {
    return new PrefixedConfiguration(this.configuration, constructKey(appendPrefix));
  }

  /**
   * Get integer value for a given key. If key is not found, return default value.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return int
   * @throws NumberFormatException if the value is not a valid integer
   */
  public int getInt(String key, int defaultValue) throws NumberFormatException {
    String value = configuration.get(constructKey(key));
    return value != null ? Integer.parseInt(value.trim()) : defaultValue;
  }

  /**
   * Get Long value for a given key. If key is not found, return default value.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return long
   * @throws NumberFormatException if the value is not a valid long
   */
  public long getLong(String key, long defaultValue) throws NumberFormatException {
    String value = configuration.get(constructKey(key));
    return value != null ? Long.parseLong(value.trim()) : defaultValue;
  }

  /**
   * Get String value for a given key. If key is not found, return default value.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return String
   */
  public String getString(String key, String defaultValue) {
    String value = configuration.get(constructKey(key));
    return value != null ? value : defaultValue;
  }

  /**
   * Get String value for a given key, failing if it is not present.
   *
   * @param key suffix of the configuration to retrieve
   * @return String
   * @throws IllegalArgumentException if the key does not exist
   */
  public String getRequiredString(String key) {
    String value = configuration.get(constructKey(key));
    if (value == null) {
      throw new IllegalArgumentException(
          String.format("Required configuration `%s` is not set", constructKey(key)));
    }
    return value;
  }

  /**
   * Get Boolean value for a given key. If key is not found, return default value.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return boolean
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = configuration.get(constructKey(key));
    return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /**
   * Get Double value for a given key. If key is not found, return default value.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return Double
   * @throws NumberFormatException if the value is not a valid double
   */
  public double getDouble(String key, double defaultValue) throws NumberFormatException {
    String value = configuration.get(constructKey(key));
    return value != null ? Double.parseDouble(value.trim()) : defaultValue;
  }

  /**
   * Get a comma separated list of strings. Items are trimmed and blank items are skipped.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return List of String
   */
  public List<String> getStringList(String key, List<String> defaultValue) {
    String value = configuration.get(constructKey(key));
    if (value == null) {
      return defaultValue;
    }
    List<String> items = new ArrayList<>();
    for (String item : value.split(LIST_SEPARATOR)) {
      String trimmed = item.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return Collections.unmodifiableList(items);
  }

  /**
   * Get a comma separated list of integers.
   *
   * @param key suffix of the configuration to retrieve
   * @param defaultValue default value if provided key does not exist
   * @return List of Integer
   * @throws NumberFormatException if any item is not a valid integer
   */
  public List<Integer> getIntList(String key, List<Integer> defaultValue)
      throws NumberFormatException {
    List<String> items = getStringList(key, null);
    if (items == null) {
      return defaultValue;
    }
    return Collections.unmodifiableList(
        items.stream().map(Integer::parseInt).collect(Collectors.toList()));
  }

  private String constructKey(String key) {
    return this.prefix.isEmpty() ? key : this.prefix + '.' + key;
  }
}
