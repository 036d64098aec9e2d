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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A named unit of work that is measured by {@link Telemetry}. */
@Value
@Builder
public class Operation {
  /** Operation name. */
  @NonNull String name;

  /** Attributes, in the order they were added. */
  @Singular @NonNull List<Attribute> attributes;

  /**
   * Looks up an attribute by name.
   *
   * @param name attribute name
   * @return the first attribute with this name, if any
   */
  public Optional<Attribute> getAttribute(@NonNull String name) {
    return attributes.stream().filter(attribute -> attribute.getName().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    if (attributes.isEmpty()) {
      return name;
    }
    return name
        + " ("
        + attributes.stream().map(Attribute::toString).collect(Collectors.joining(", "))
        + ")";
  }
}
