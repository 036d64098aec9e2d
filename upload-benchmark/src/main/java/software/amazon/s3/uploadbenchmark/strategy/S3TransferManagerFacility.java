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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.awssdk.transfer.s3.model.Upload;
import software.amazon.awssdk.transfer.s3.model.UploadRequest;
import software.amazon.s3.uploadbenchmark.key.S3URI;

/** {@link TransferFacility} on top of the {@link S3TransferManager}. */
public class S3TransferManagerFacility implements TransferFacility {
  private static final Logger LOG = LoggerFactory.getLogger(S3TransferManagerFacility.class);

  @Getter @NonNull private final S3TransferManager transferManager;
  @NonNull private final S3AsyncClient s3AsyncClient;
  private final List<TransferHandle> pending = new ArrayList<>();

  /**
   * Creates a new instance of {@link S3TransferManagerFacility}
   *
   * @param transferManager transfer manager to submit uploads to
   * @param s3AsyncClient client underneath the transfer manager, closed with the facility
   */
  public S3TransferManagerFacility(
      @NonNull S3TransferManager transferManager, @NonNull S3AsyncClient s3AsyncClient) {
    this.transferManager = transferManager;
    this.s3AsyncClient = s3AsyncClient;
  }

  @Override
  public TransferHandle submit(
      @NonNull byte[] buffer, @NonNull String bucket, @NonNull String key) {
    S3URI location = S3URI.of(bucket, key);
    UploadRequest uploadRequest =
        UploadRequest.builder()
            .putObjectRequest(PutObjectRequest.builder().bucket(bucket).key(key).build())
            .requestBody(AsyncRequestBody.fromBytes(buffer))
            .build();
    Upload upload = transferManager.upload(uploadRequest);
    LOG.debug("Submitted {} ({} bytes)", location.toURIString(), buffer.length);
    TransferHandle handle = new TransferHandle(location, upload.completionFuture());
    synchronized (pending) {
      pending.add(handle);
    }
    return handle;
  }

  @Override
  public void awaitAll() {
    CompletableFuture<?>[] futures;
    synchronized (pending) {
      futures =
          pending.stream().map(TransferHandle::getCompletion).toArray(CompletableFuture[]::new);
      pending.clear();
    }
    try {
      CompletableFuture.allOf(futures).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  @Override
  public void close() {
    try {
      transferManager.close();
    } finally {
      s3AsyncClient.close();
    }
  }
}
