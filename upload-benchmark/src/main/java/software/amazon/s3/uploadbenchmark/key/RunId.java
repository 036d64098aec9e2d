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

import java.util.Random;
import lombok.NonNull;
import lombok.Value;

/**
 * Scopes the object keys of one benchmark invocation, so that repeated runs do not overwrite each
 * other's objects.
 */
@Value
public class RunId {
  private static final int PARTS = 4;
  private static final int MAX_PART = 255;

  @NonNull String value;

  /**
   * Generates a run id: four random integers in [0, 255], concatenated as decimal text.
   *
   * @param random source of randomness
   * @return a new {@link RunId}
   */
  public static RunId random(@NonNull Random random) {
    StringBuilder value = new StringBuilder();
    for (int i = 0; i < PARTS; i++) {
      value.append(random.nextInt(MAX_PART + 1));
    }
    return new RunId(value.toString());
  }

  @Override
  public String toString() {
    return value;
  }
}
