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

import java.util.Collections;
import lombok.NonNull;
import software.amazon.awssdk.services.s3.S3Client;

/** Sends every upload through one client shared by all worker threads. */
public class SharedClientUploadStrategy extends ThreadPoolUploadStrategy {
  public static final String METHOD_TAG = "client";

  /**
   * Creates a new instance of {@link SharedClientUploadStrategy}
   *
   * @param context upload context; its client factory builds the shared client
   */
  public SharedClientUploadStrategy(@NonNull UploadContext context) {
    this(context, context.getClientFactory().createClient());
  }

  SharedClientUploadStrategy(@NonNull UploadContext context, @NonNull S3Client client) {
    super(context, Collections.singletonList(client));
  }

  @Override
  public String getMethodTag() {
    return METHOD_TAG;
  }
}
