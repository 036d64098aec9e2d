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

import java.util.stream.Stream;
import lombok.Getter;
import lombok.NonNull;
import software.amazon.s3.uploadbenchmark.dataset.Partition;
import software.amazon.s3.uploadbenchmark.key.ObjectKeyBuilder;

/**
 * Hands every encoded partition to a {@link TransferFacility} and waits for all of them at the end.
 * Concurrency is governed by the facility.
 */
public class ManagedTransferUploadStrategy implements UploadStrategy {
  public static final String METHOD_TAG = "manager";

  @NonNull private final UploadContext context;
  @Getter @NonNull private final TransferFacility transferFacility;

  /**
   * Creates a new instance of {@link ManagedTransferUploadStrategy}
   *
   * @param context upload context; its client factory provides the transfer facility
   */
  public ManagedTransferUploadStrategy(@NonNull UploadContext context) {
    this(context, context.getClientFactory().createTransferFacility());
  }

  /**
   * Creates a new instance of {@link ManagedTransferUploadStrategy}
   *
   * @param context upload context
   * @param transferFacility facility to submit transfers to; owned by the strategy from now on
   */
  ManagedTransferUploadStrategy(
      @NonNull UploadContext context, @NonNull TransferFacility transferFacility) {
    this.context = context;
    this.transferFacility = transferFacility;
  }

  @Override
  public String getMethodTag() {
    return METHOD_TAG;
  }

  @Override
  public void upload(@NonNull Stream<Partition> partitions) {
    String runId = context.getRunId().getValue();
    partitions.forEach(
        partition ->
            transferFacility.submit(
                context.getEncoder().encode(partition),
                context.getBucket(),
                ObjectKeyBuilder.build(runId, METHOD_TAG, partition.getKey())));
    transferFacility.awaitAll();
  }

  @Override
  public void close() {
    transferFacility.close();
  }
}
