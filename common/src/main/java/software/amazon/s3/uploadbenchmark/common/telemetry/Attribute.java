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
package software.amazon.s3.uploadbenchmark.common.telemetry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Telemetry attribute. An attribute is a key/value pair associated with a telemetry item, such as
 * an operation.
 */
@Getter
@EqualsAndHashCode
public class Attribute {
  /** Attribute name. */
  @NonNull private final String name;

  /** Attribute value. */
  @NonNull private final Object value;

  private Attribute(@NonNull String name, @NonNull Object value) {
    this.name = name;
    this.value = value;
  }

  /**
   * Constructs a new instance of the {@link Attribute}
   *
   * @param name attribute name
   * @param value attribute value
   * @return a new instance of {@link Attribute}
   */
  public static Attribute of(@NonNull String name, @NonNull Object value) {
    return new Attribute(name, value);
  }

  @Override
  public String toString() {
    return this.name + "=" + this.value;
  }
}
