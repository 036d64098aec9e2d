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
package software.amazon.s3.uploadbenchmark;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point of the upload benchmark. */
public class UploadBenchmarkDriver {
  private static final Logger LOG = LoggerFactory.getLogger(UploadBenchmarkDriver.class);

  /**
   * Runs the benchmark once per configured concurrency level, in order. Settings come from the
   * environment and the optional env file; see {@link UploadBenchmarkConfiguration}.
   *
   * @param args program arguments are currently ignored
   * @throws IOException if the configuration or the dataset cannot be read
   * @throws InterruptedException if interrupted while waiting for uploads
   */
  public static void main(String[] args) throws IOException, InterruptedException {
    UploadBenchmarkConfiguration configuration = UploadBenchmarkConfiguration.fromEnvironment();
    LOG.info("Starting upload benchmark: {}", configuration);
    for (int concurrency : configuration.getConcurrencyLevels()) {
      new UploadBenchmark(configuration, concurrency).run();
    }
  }
}
