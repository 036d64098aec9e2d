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

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PrefixedConfigurationTest {
  private static final String TEST_PREFIX = "bench";

  @Test
  void testConstructorWithMap() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);

    assertEquals(TEST_PREFIX, configuration.getPrefix());
    assertEquals("stringConfigValue", configuration.getString("stringConfig", "randomString"));
  }

  @Test
  void testConstructorWithIterable() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(
            getDefaultConfigurationMap(TEST_PREFIX).entrySet(), TEST_PREFIX);

    assertEquals("stringConfigValue", configuration.getString("stringConfig", "randomString"));
  }

  @Test
  void testConstructorThrowsOnNulls() {
    assertThrows(
        NullPointerException.class,
        () -> new PrefixedConfiguration((Map<String, String>) null, TEST_PREFIX));
    assertThrows(
        NullPointerException.class,
        () -> new PrefixedConfiguration(Collections.emptyMap(), null));
  }

  @Test
  void testFilterDropsKeysWithoutPrefix() {
    Map<String, String> map = getDefaultConfigurationMap(TEST_PREFIX);
    map.put("other.stringConfig", "otherValue");
    PrefixedConfiguration configuration = new PrefixedConfiguration(map, TEST_PREFIX);

    assertEquals("stringConfigValue", configuration.getString("stringConfig", "randomString"));
    assertEquals(
        "randomString",
        new PrefixedConfiguration(map, "missing").getString("stringConfig", "randomString"));
  }

  @Test
  void testEmptyPrefixLooksKeysUpVerbatim() {
    Map<String, String> map = new HashMap<>();
    map.put("BUCKET", "my-bucket");
    map.put("CONCURRENCY_LEVELS", "4, 8,20");
    PrefixedConfiguration configuration = new PrefixedConfiguration(map, "");

    assertEquals("my-bucket", configuration.getString("BUCKET", ""));
    assertEquals(Arrays.asList(4, 8, 20), configuration.getIntList("CONCURRENCY_LEVELS", null));
  }

  @Test
  void testReturnsDefault() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);
    assertEquals(1, configuration.getInt("KeyNotExists", 1));
    assertEquals(1.0, configuration.getDouble("KeyNotExists", 1.0));
    assertTrue(configuration.getBoolean("KeyNotExists", true));
    assertFalse(configuration.getBoolean("KeyNotExists", false));
    assertEquals(0L, configuration.getLong("KeyNotExists", 0));
    assertEquals("randomstring", configuration.getString("KeyNotExists", "randomstring"));
    assertEquals(
        Collections.singletonList("a"),
        configuration.getStringList("KeyNotExists", Collections.singletonList("a")));
    assertEquals(
        Collections.singletonList(7),
        configuration.getIntList("KeyNotExists", Collections.singletonList(7)));
  }

  @Test
  void testTypedGetters() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);
    assertEquals(1, configuration.getInt("intConfig", 0));
    assertEquals(1L, configuration.getLong("longConfig", 0));
    assertEquals(1.0, configuration.getDouble("doubleConfig", 0.0));
    assertTrue(configuration.getBoolean("booleanConfig", false));
  }

  @Test
  void testInvalidNumberThrows() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);
    assertThrows(NumberFormatException.class, () -> configuration.getInt("stringConfig", 0));
    assertThrows(
        NumberFormatException.class,
        () -> configuration.getIntList("stringListConfig", Collections.emptyList()));
  }

  @Test
  void testGetRequiredString() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);
    assertEquals("stringConfigValue", configuration.getRequiredString("stringConfig"));

    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> configuration.getRequiredString("missing"));
    assertTrue(exception.getMessage().contains("bench.missing"));
  }

  @Test
  void testGetStringListTrimsAndSkipsBlanks() {
    PrefixedConfiguration configuration =
        new PrefixedConfiguration(getDefaultConfigurationMap(TEST_PREFIX), TEST_PREFIX);
    List<String> items = configuration.getStringList("stringListConfig", null);
    assertEquals(Arrays.asList("color", "payment", "pickup_zone"), items);
  }

  @Test
  void testMapAppendsPrefix() {
    Map<String, String> map = new HashMap<>();
    map.put("bench.upload.concurrency", "8");
    PrefixedConfiguration configuration = new PrefixedConfiguration(map, TEST_PREFIX);

    PrefixedConfiguration subConfiguration = configuration.map("upload");
    assertEquals("bench.upload", subConfiguration.getPrefix());
    assertEquals(8, subConfiguration.getInt("concurrency", 0));
  }

  @Test
  void testReadEnvFile(@TempDir Path tempDir) throws IOException {
    Path envFile = tempDir.resolve(".env");
    Files.write(
        envFile,
        Arrays.asList("# credentials", "BUCKET=my-bucket", "KEY = abc ", ""),
        StandardCharsets.UTF_8);

    Map<String, String> entries = PrefixedConfiguration.readEnvFile(envFile);
    assertEquals(2, entries.size());
    assertEquals("my-bucket", entries.get("BUCKET"));
    assertEquals("abc", entries.get("KEY"));
  }

  @Test
  void testReadEnvFileDotenvSyntax(@TempDir Path tempDir) throws IOException {
    Path envFile = tempDir.resolve(".env");
    Files.write(
        envFile,
        Arrays.asList(
            "BUCKET=\"my-bucket\"",
            "SECRET='abc/def+ghi'",
            "export REGION=us-east-1",
            "PREFIX=runs\\daily",
            "QUOTED=\"say \\\"hi\\\" to C:\\\\temp\"",
            "TOKEN=a=b==",
            "ZONE=Zürich # pickup area",
            "not an entry"),
        StandardCharsets.UTF_8);

    Map<String, String> entries = PrefixedConfiguration.readEnvFile(envFile);
    assertEquals(7, entries.size());
    assertEquals("my-bucket", entries.get("BUCKET"));
    assertEquals("abc/def+ghi", entries.get("SECRET"));
    assertEquals("us-east-1", entries.get("REGION"));
    assertEquals("runs\\daily", entries.get("PREFIX"));
    assertEquals("say \"hi\" to C:\\temp", entries.get("QUOTED"));
    assertEquals("a=b==", entries.get("TOKEN"));
    assertEquals("Zürich", entries.get("ZONE"));
  }

  @Test
  void testEnvFileQuotesFeedTypedGetters(@TempDir Path tempDir) throws IOException {
    Path envFile = tempDir.resolve(".env");
    Files.write(
        envFile,
        Arrays.asList("CONCURRENCY='8'", "FORCE_PATH_STYLE=\"true\""),
        StandardCharsets.UTF_8);

    PrefixedConfiguration configuration =
        new PrefixedConfiguration(PrefixedConfiguration.readEnvFile(envFile), "");
    assertEquals(8, configuration.getInt("CONCURRENCY", 0));
    assertTrue(configuration.getBoolean("FORCE_PATH_STYLE", false));
  }

  @Test
  void testMissingEnvFileIsIgnored(@TempDir Path tempDir) throws IOException {
    assertTrue(PrefixedConfiguration.readEnvFile(tempDir.resolve("missing.env")).isEmpty());

    PrefixedConfiguration configuration =
        PrefixedConfiguration.fromEnvironment(tempDir.resolve("missing.env"));
    assertEquals("", configuration.getPrefix());
  }

  @Test
  void testEnvironmentOverridesEnvFile(@TempDir Path tempDir) throws IOException {
    String path = System.getenv("PATH");
    assumeTrue(path != null);
    Path envFile = tempDir.resolve(".env");
    Files.write(
        envFile,
        Arrays.asList("PATH=fromFile", "UPLOAD_BENCH_ONLY_IN_FILE=yes"),
        StandardCharsets.UTF_8);

    PrefixedConfiguration configuration = PrefixedConfiguration.fromEnvironment(envFile);
    assertEquals(path, configuration.getString("PATH", null));
    assertEquals("yes", configuration.getString("UPLOAD_BENCH_ONLY_IN_FILE", null));
  }

  private Map<String, String> getDefaultConfigurationMap(String prefix) {
    Map<String, String> defaultMap = new HashMap<>();
    defaultMap.put(prefix + ".intConfig", "1");
    defaultMap.put(prefix + ".doubleConfig", "1.0");
    defaultMap.put(prefix + ".longConfig", "1");
    defaultMap.put(prefix + ".booleanConfig", "true");
    defaultMap.put(prefix + ".stringConfig", "stringConfigValue");
    defaultMap.put(prefix + ".stringListConfig", "color, payment,,pickup_zone ");
    return defaultMap;
  }
}
