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

import org.jetbrains.annotations.Contract;

import java.time.Instant;

/**
 * Decides whether a record fits in its group's budget.
 * <p>
 * Time is cut into fixed periods aligned to the epoch. Each group may have
 * {@code bucketLimit} records per period; the next one puts the group into
 * {@link BucketState.Exceeded}, and everything after that is suppressed until
 * a record arrives in a later period. With a reset rate configured, that
 * record must also find the group's sampled rate below the reset rate, or the
 * group stays exceeded for another period.
 * </p>
 * <p>
 * Periods only roll over when a record arrives, and any periods with no
 * records are skipped entirely.
 * </p>
 */
final class BucketLimiter {
  private final long bucketPeriodSeconds;
  private final long bucketLimit;
  private final long resetRate;
  private final Notifier notifier;

  BucketLimiter(GroupThrottleConfig config, Notifier notifier) {
    this.bucketPeriodSeconds = config.bucketPeriodSeconds();
    this.bucketLimit = config.bucketLimit();
    this.resetRate = config.resetRate();
    this.notifier = notifier;
  }

  ThrottleDecision decide(GroupKey key, GroupState state, Instant now) {
    if (periodIndex(now) > periodIndex(state.bucketLastReset())) {
      if (state.isExceeded() && resetRate != GroupThrottleConfig.ALWAYS_RESET) {
        if (state.approxRate() < resetRate) {
          notifier.rateBackDown(key, state, now);
        } else {
          notifier.rateExceeded(key, state, now);
          return ThrottleDecision.SUPPRESS;
        }
      }
      state.resetBucket(now);
    } else if (state.isExceeded()) {
      notifier.rateExceeded(key, state, now);
      return ThrottleDecision.SUPPRESS;
    }

    var bucket = ((BucketState.Normal) state.bucket()).increment();
    state.setBucket(bucket);
    if (bucket.count() > bucketLimit) {
      notifier.rateExceeded(key, state, now);
      state.setBucket(BucketState.Exceeded.INSTANCE);
      return ThrottleDecision.SUPPRESS;
    }
    return ThrottleDecision.PASS;
  }

  @Contract(pure = true)
  long periodIndex(Instant instant) {
    return Math.floorDiv(instant.getEpochSecond(), bucketPeriodSeconds);
  }
}
