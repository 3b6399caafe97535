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

/**
 * The counters kept for a single group.
 * <p>
 * Owned by the throttle that created it and updated on every record for the
 * group. Read it straight after a call if you need to, but don't hold on to it.
 * </p>
 */
public final class GroupState {
  private long rateCount;
  private Instant rateLastReset;
  private long approxRate;
  private BucketState bucket;
  private Instant bucketLastReset;
  private @Nullable Instant lastWarning;
  private long rateCountLast;

  GroupState(Instant now, long bucketLimit) {
    this.rateCount = 0;
    this.rateLastReset = now;
    this.approxRate = 0;
    this.bucket = BucketState.EMPTY;
    this.bucketLastReset = now;
    this.lastWarning = null;
    this.rateCountLast = bucketLimit;
  }

  /**
   * Records seen since the rate was last sampled.
   */
  public long rateCount() {
    return rateCount;
  }

  /**
   * When the rate was last sampled.
   */
  public Instant rateLastReset() {
    return rateLastReset;
  }

  /**
   * The most recent records-per-second sample.
   */
  public long approxRate() {
    return approxRate;
  }

  public BucketState bucket() {
    return bucket;
  }

  /**
   * When the current accounting period started for this group.
   */
  public Instant bucketLastReset() {
    return bucketLastReset;
  }

  public @Nullable Instant lastWarning() {
    return lastWarning;
  }

  /**
   * The rate count the exceeded metric was last brought up to.
   */
  public long rateCountLast() {
    return rateCountLast;
  }

  public boolean isExceeded() {
    return bucket == BucketState.Exceeded.INSTANCE;
  }

  void incrementRateCount() {
    rateCount++;
  }

  void resetRate(Instant now, long approxRate, long rateCountLast) {
    this.approxRate = approxRate;
    this.rateCount = 0;
    this.rateCountLast = rateCountLast;
    this.rateLastReset = now;
  }

  void setBucket(BucketState bucket) {
    this.bucket = bucket;
  }

  void resetBucket(Instant now) {
    this.bucket = BucketState.EMPTY;
    this.bucketLastReset = now;
  }

  void setLastWarning(Instant lastWarning) {
    this.lastWarning = lastWarning;
  }

  void setRateCountLast(long rateCountLast) {
    this.rateCountLast = rateCountLast;
  }

  @Override
  public String toString() {
    return "GroupState{rateCount=" + rateCount + ", rateLastReset=" + rateLastReset + ", approxRate=" + approxRate
        + ", bucket=" + bucket + ", bucketLastReset=" + bucketLastReset + ", lastWarning=" + lastWarning
        + ", rateCountLast=" + rateCountLast + "}";
  }
}
