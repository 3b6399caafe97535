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

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps a rough records-per-second figure for each group.
 * <p>
 * At most one sample a second: the records counted since the last sample,
 * divided by the time since then. There's no smoothing, so a group that sends
 * a burst and goes quiet will report the burst until its next record after the
 * quiet spell, which then reports close to zero.
 * </p>
 */
final class RateEstimator {
  private static final Duration SAMPLE_INTERVAL = Duration.ofSeconds(1);
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final long bucketLimit;

  RateEstimator(long bucketLimit) {
    this.bucketLimit = bucketLimit;
  }

  void sample(GroupState state, Instant now) {
    state.incrementRateCount();
    var sinceLastSample = Duration.between(state.rateLastReset(), now);
    if (sinceLastSample.compareTo(SAMPLE_INTERVAL) >= 0) {
      state.resetRate(now, rate(state.rateCount(), sinceLastSample), bucketLimit);
    }
  }

  @Contract(pure = true)
  static long rate(long count, Duration elapsed) {
    return Math.round(count / seconds(elapsed));
  }

  @Contract(pure = true)
  static double seconds(Duration elapsed) {
    return elapsed.toNanos() / NANOS_PER_SECOND;
  }
}
