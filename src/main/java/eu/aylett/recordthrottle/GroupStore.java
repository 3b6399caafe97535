/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.recordthrottle;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Group state, ordered from least to most recently touched.
 * <p>
 * Not thread safe: each throttle has its own store.
 * </p>
 */
final class GroupStore {
  private final long bucketLimit;
  // Insertion ordered; touch re-inserts, so the first entry is the stalest.
  private final LinkedHashMap<GroupKey, GroupState> groups = new LinkedHashMap<>();

  GroupStore(long bucketLimit) {
    this.bucketLimit = bucketLimit;
  }

  /**
   * Find the state for {@code key}, creating it if this is the first we've seen
   * of the group, and mark it as the most recently used.
   */
  GroupState touch(GroupKey key, Instant now) {
    var state = groups.remove(key);
    if (state == null) {
      state = new GroupState(now, bucketLimit);
    }
    groups.put(key, state);
    return state;
  }

  /**
   * The least recently touched entry, left in place.
   */
  Map.@Nullable Entry<GroupKey, GroupState> oldest() {
    var iterator = groups.entrySet().iterator();
    return iterator.hasNext() ? iterator.next() : null;
  }

  /**
   * Remove the least recently touched entry. Removal goes through the
   * iterator, so it finds the entry even if its key no longer hashes the way it
   * did when it was stored.
   */
  void evictOldest() {
    var iterator = groups.entrySet().iterator();
    if (iterator.hasNext()) {
      iterator.next();
      iterator.remove();
    }
  }

  /**
   * Look up a group without changing its position.
   */
  @Nullable
  GroupState peek(GroupKey key) {
    return groups.get(key);
  }

  int size() {
    return groups.size();
  }
}
