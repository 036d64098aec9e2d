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

import java.io.Closeable;
import java.util.stream.Stream;
import software.amazon.s3.uploadbenchmark.dataset.Partition;

/**
 * A way of uploading every partition of a dataset. Clients are created when the strategy is
 * created, so that {@link #upload(Stream)} measures the uploads only.
 */
public interface UploadStrategy extends Closeable {
  /**
   * Tag placed in the {@code method=} segment of every key this strategy writes.
   *
   * @return method tag
   */
  String getMethodTag();

  /**
   * Uploads every partition as one object and returns once all uploads have completed.
   *
   * @param partitions partitions to upload
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void upload(Stream<Partition> partitions) throws InterruptedException;

  /** Releases the clients owned by this strategy. */
  @Override
  void close();
}
