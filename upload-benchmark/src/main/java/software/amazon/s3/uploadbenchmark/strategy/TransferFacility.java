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

/**
 * Accepts in-memory buffers for upload and schedules them with its own internal concurrency. The
 * calling thread does not wait for a transfer to finish when submitting it.
 */
public interface TransferFacility extends Closeable {
  /**
   * Schedules the upload of a buffer.
   *
   * @param buffer object content
   * @param bucket destination bucket
   * @param key destination key
   * @return a handle on the transfer
   */
  TransferHandle submit(byte[] buffer, String bucket, String key);

  /**
   * Blocks until every transfer submitted so far has finished.
   *
   * @throws RuntimeException the failure of a failed transfer
   */
  void awaitAll();

  /** Shuts the facility and its client down. */
  @Override
  void close();
}
