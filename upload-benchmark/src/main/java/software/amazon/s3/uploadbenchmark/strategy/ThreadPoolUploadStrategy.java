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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.s3.uploadbenchmark.dataset.Partition;
import software.amazon.s3.uploadbenchmark.key.ObjectKeyBuilder;
import software.amazon.s3.uploadbenchmark.key.S3URI;

/**
 * Uploads partitions from a fixed pool of worker threads, one blocking put per partition. The pool
 * has as many threads as the context's concurrency, which bounds the number of uploads in flight.
 * Subclasses decide which clients the uploads are spread over.
 */
public abstract class ThreadPoolUploadStrategy implements UploadStrategy {
  private static final Logger LOG = LoggerFactory.getLogger(ThreadPoolUploadStrategy.class);

  @Getter @NonNull private final UploadContext context;
  @Getter @NonNull private final List<S3Client> clients;
  @NonNull private final Supplier<S3Client> selector;

  /**
   * Creates a new instance of {@link ThreadPoolUploadStrategy}
   *
   * @param context upload context
   * @param clients clients owned by this strategy
   */
  protected ThreadPoolUploadStrategy(
      @NonNull UploadContext context, @NonNull List<S3Client> clients) {
    this.context = context;
    this.clients = Collections.unmodifiableList(new ArrayList<>(clients));
    this.selector =
        context.getSelectionPolicy().createSelector(this.clients, context.getRandom());
  }

  /**
   * Uploads every partition. The client of each upload is chosen when the upload is scheduled.
   * Waits for the uploads in completion order; on the first failure, stops waiting, lets the
   * already scheduled uploads run to completion and rethrows that failure. If the wait for those
   * uploads is interrupted, the interruption is attached to the failure as suppressed and the
   * thread's interrupt status is restored.
   *
   * @param partitions partitions to upload
   * @throws InterruptedException if interrupted while waiting
   */
  @Override
  public void upload(@NonNull Stream<Partition> partitions) throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(context.getConcurrency());
    try {
      scheduleAndWait(executor, partitions);
    } catch (RuntimeException | Error | InterruptedException failure) {
      try {
        awaitShutdown(executor);
      } catch (InterruptedException e) {
        failure.addSuppressed(e);
        Thread.currentThread().interrupt();
      }
      throw failure;
    }
    awaitShutdown(executor);
  }

  private void scheduleAndWait(ExecutorService executor, Stream<Partition> partitions)
      throws InterruptedException {
    CompletionService<S3URI> completionService = new ExecutorCompletionService<>(executor);
    int scheduled = 0;
    Iterator<Partition> iterator = partitions.iterator();
    while (iterator.hasNext()) {
      Partition partition = iterator.next();
      S3Client client = selector.get();
      completionService.submit(() -> put(client, partition));
      scheduled++;
    }
    for (int i = 0; i < scheduled; i++) {
      try {
        completionService.take().get();
      } catch (ExecutionException e) {
        throw rethrow(e.getCause());
      }
    }
  }

  private void awaitShutdown(ExecutorService executor) throws InterruptedException {
    executor.shutdown();
    while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
      LOG.warn("Waiting for {} uploads to finish", getMethodTag());
    }
  }

  private S3URI put(S3Client client, Partition partition) {
    S3URI location =
        S3URI.of(
            context.getBucket(),
            ObjectKeyBuilder.build(
                context.getRunId().getValue(), getMethodTag(), partition.getKey()));
    byte[] buffer = context.getEncoder().encode(partition);
    client.putObject(
        PutObjectRequest.builder().bucket(location.getBucket()).key(location.getKey()).build(),
        RequestBody.fromBytes(buffer));
    LOG.debug("Uploaded {} ({} bytes)", location.toURIString(), buffer.length);
    return location;
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new CompletionException(cause);
  }

  @Override
  public void close() {
    RuntimeException failure = null;
    for (S3Client client : clients) {
      try {
        client.close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
