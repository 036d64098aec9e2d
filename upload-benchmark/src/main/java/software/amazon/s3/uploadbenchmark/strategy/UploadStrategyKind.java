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

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Upload strategies compared by the benchmark, in the order they run. */
@AllArgsConstructor
@Getter
public enum UploadStrategyKind {
  MANAGED_TRANSFER("transfer"),
  PER_TASK_CLIENT("multithread_client"),
  SHARED_CLIENT("multithread_shared_client");

  private final String value;

  /**
   * Creates a strategy for a given context and strategy kind
   *
   * @param context upload context
   * @return a new instance of {@link UploadStrategy}
   */
  public UploadStrategy createStrategy(UploadContext context) {
    switch (this) {
      case MANAGED_TRANSFER:
        return new ManagedTransferUploadStrategy(context);
      case PER_TASK_CLIENT:
        return new PerTaskClientUploadStrategy(context);
      case SHARED_CLIENT:
        return new SharedClientUploadStrategy(context);
      default:
        throw new IllegalArgumentException("Unsupported kind: " + this);
    }
  }
}
