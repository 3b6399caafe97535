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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Forgets groups that have gone quiet.
 * <p>
 * Only the stalest group is looked at, once per record. That keeps the cost
 * per record constant, but it also means a store can grow faster than it's
 * cleaned if new groups keep turning up.
 * </p>
 */
final class EvictionPolicy {
  private static final Logger log = LoggerFactory.getLogger(EvictionPolicy.class);

  private final Duration idleTimeout;

  EvictionPolicy(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  /**
   * @return the key that was evicted, if any
   */
  @Nullable
  GroupKey evictIdle(GroupStore store, Instant now) {
    var oldest = store.oldest();
    if (oldest == null) {
      return null;
    }
    var key = oldest.getKey();
    var idle = Duration.between(oldest.getValue().rateLastReset(), now);
    if (idle.compareTo(idleTimeout) <= 0) {
      return null;
    }
    store.evictOldest();
    log.atDebug().setMessage("evicted idle group").addKeyValue("group_key", key).addKeyValue("idle", idle).log();
    return key;
  }
}
