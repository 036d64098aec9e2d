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
package software.amazon.s3.uploadbenchmark.strategy;

import java.util.Random;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import software.amazon.s3.uploadbenchmark.client.S3ClientFactory;
import software.amazon.s3.uploadbenchmark.dataset.CsvPartitionEncoder;
import software.amazon.s3.uploadbenchmark.key.RunId;

/** Everything an {@link UploadStrategy} needs to be created. */
@Value
@Builder
public class UploadContext {
  @NonNull String bucket;
  @NonNull RunId runId;
  @NonNull S3ClientFactory clientFactory;
  @Builder.Default @NonNull ClientSelectionPolicy selectionPolicy = ClientSelectionPolicy.RANDOM;
  @Builder.Default @NonNull CsvPartitionEncoder encoder = new CsvPartitionEncoder();
  @Builder.Default @NonNull Random random = new Random();

  /**
   * Concurrency of this run, as configured on the client factory.
   *
   * @return concurrency
   */
  public int getConcurrency() {
    return clientFactory.getConcurrency();
  }
}
