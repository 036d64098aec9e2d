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

import java.util.List;
import lombok.NonNull;
import software.amazon.awssdk.services.s3.S3Client;

/** Spreads uploads over as many independent clients as there are worker threads. */
public class PerTaskClientUploadStrategy extends ThreadPoolUploadStrategy {
  private final String methodTag;

  /**
   * Creates a new instance of {@link PerTaskClientUploadStrategy}
   *
   * @param context upload context; its client factory builds one client per worker thread
   */
  public PerTaskClientUploadStrategy(@NonNull UploadContext context) {
    this(context, context.getClientFactory().createClients(context.getConcurrency()));
  }

  PerTaskClientUploadStrategy(@NonNull UploadContext context, @NonNull List<S3Client> clients) {
    super(context, clients);
    this.methodTag = clients.size() > 1 ? "clients[" + clients.size() + "]" : "client";
  }

  @Override
  public String getMethodTag() {
    return methodTag;
  }
}
