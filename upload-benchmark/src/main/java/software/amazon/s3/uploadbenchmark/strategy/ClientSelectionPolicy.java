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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.NonNull;

/** How a thread pool strategy picks the client for each upload. */
public enum ClientSelectionPolicy {
  /** Uniformly random, independently for each upload. */
  RANDOM,
  /** Cycles through the clients in order. */
  ROUND_ROBIN;

  /**
   * Creates a selector over the given clients.
   *
   * @param items clients to select from
   * @param random source of randomness for {@link #RANDOM}
   * @param <T> client type
   * @return a supplier returning the next client on every call
   */
  public <T> Supplier<T> createSelector(@NonNull List<T> items, @NonNull Random random) {
    Preconditions.checkArgument(!items.isEmpty(), "Nothing to select from");
    List<T> candidates = new ArrayList<>(items);
    switch (this) {
      case RANDOM:
        return () -> candidates.get(random.nextInt(candidates.size()));
      case ROUND_ROBIN:
        AtomicInteger next = new AtomicInteger();
        return () -> candidates.get(Math.floorMod(next.getAndIncrement(), candidates.size()));
      default:
        throw new IllegalArgumentException("Unsupported policy: " + this);
    }
  }

  /**
   * Parses a policy name, ignoring case and accepting '-' for '_'.
   *
   * @param name policy name
   * @return the policy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ClientSelectionPolicy fromName(@NonNull String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (ClientSelectionPolicy policy : values()) {
      if (policy.name().equals(normalized)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown client selection policy: " + name);
  }
}
