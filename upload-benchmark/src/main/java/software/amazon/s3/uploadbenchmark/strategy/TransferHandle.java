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

import java.util.concurrent.CompletableFuture;
import lombok.NonNull;
import lombok.Value;
import software.amazon.s3.uploadbenchmark.key.S3URI;

/** An in-flight transfer submitted to a {@link TransferFacility}. */
@Value
public class TransferHandle {
  @NonNull S3URI location;
  @NonNull CompletableFuture<?> completion;

  /**
   * Whether the transfer has finished, successfully or not.
   *
   * @return true if finished
   */
  public boolean isDone() {
    return completion.isDone();
  }
}
