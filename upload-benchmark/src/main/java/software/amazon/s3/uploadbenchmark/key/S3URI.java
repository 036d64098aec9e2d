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
package software.amazon.s3.uploadbenchmark.key;

import com.google.common.base.Preconditions;
import lombok.Data;

/** Bucket and key of an uploaded object. */
@Data
public class S3URI {
  private static final String SCHEME = "s3://";

  private final String bucket;
  private final String key;

  private S3URI(String bucket, String key) {
    this.bucket = bucket;
    this.key = key;
  }

  /**
   * Creates a new instance of {@link S3URI}.
   *
   * @param bucket bucket name
   * @param key object key
   * @return a new {@link S3URI}
   */
  public static S3URI of(String bucket, String key) {
    Preconditions.checkNotNull(bucket, "bucket must be non-null");
    Preconditions.checkNotNull(key, "key must be non-null");

    return new S3URI(bucket, key);
  }

  /**
   * Renders the location as {@code s3://bucket/key}.
   *
   * @return the location
   */
  public String toURIString() {
    return SCHEME + bucket + "/" + key;
  }
}
