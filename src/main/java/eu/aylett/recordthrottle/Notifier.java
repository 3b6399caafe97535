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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tells people when a group is being throttled, without becoming the noisiest
 * thing in the pipeline itself.
 * <p>
 * Warnings for a group that stays over its limit are repeated at most once per
 * warning delay. Recoveries are always logged. When metrics are enabled, a
 * counter tagged with the group's key tracks how far over the limit groups
 * have gone.
 * </p>
 * <p>
 * Tag values can't be null, so a key field the record didn't have is tagged
 * with the empty string. Groups that differ only in having that field missing
 * or empty therefore share a counter; their warnings still name the groups
 * separately.
 * </p>
 */
final class Notifier {
  static final String EXCEEDED_METRIC = "throttle.rate.limit.exceeded";
  static final String EXCEEDED_DESCRIPTION = "The exceeded rate of groups";
  static final String ABSENT_TAG_VALUE = "";

  private static final Logger log = LoggerFactory.getLogger(Notifier.class);

  private final GroupThrottleConfig config;
  private final @Nullable MeterRegistry registry;
  private final Tags baseTags;
  private final List<String> labelNames;

  Notifier(GroupThrottleConfig config, @Nullable MeterRegistry registry, List<String> labelNames) {
    this.config = config;
    this.registry = config.emitMetrics() ? registry : null;
    var tags = new ArrayList<Tag>();
    config.labels().forEach((key, value) -> tags.add(Tag.of(key, value)));
    this.baseTags = Tags.of(tags);
    this.labelNames = List.copyOf(labelNames);
  }

  void rateExceeded(GroupKey key, GroupState state, Instant now) {
    var registry = this.registry;
    if (registry != null) {
      var counter = counter(registry, key);
      log.atDebug().setMessage("current rate").addKeyValue("rate_count", state.rateCount())
          .addKeyValue("current_metric", counter.count()).log();
      // Approximate: rateCount restarts with every rate sample but the baseline only moves here.
      var delta = state.rateCount() - state.rateCountLast();
      if (delta > 0) {
        counter.increment(delta);
      }
      state.setRateCountLast(state.rateCount());
    }

    var lastWarning = state.lastWarning();
    if (lastWarning == null || Duration.between(lastWarning, now).compareTo(config.warningDelay()) >= 0) {
      withLogItems(log.atWarn(), key, state, now).setMessage("rate exceeded").log();
      state.setLastWarning(now);
    }
  }

  void rateBackDown(GroupKey key, GroupState state, Instant now) {
    withLogItems(log.atInfo(), key, state, now).setMessage("rate back down").log();
  }

  private LoggingEventBuilder withLogItems(LoggingEventBuilder builder, GroupKey key, GroupState state, Instant now) {
    return builder.addKeyValue("group_key", key)
        .addKeyValue("rate_s", reportedRate(state, now))
        .addKeyValue("period_s", config.bucketPeriodSeconds())
        .addKeyValue("limit", config.bucketLimit())
        .addKeyValue("rate_limit_s", config.rateLimit())
        .addKeyValue("reset_rate_s", config.resetRate());
  }

  /**
   * The higher of the last rate sample and the rate implied by this period's
   * count so far. Unbounded if the period has only just started.
   */
  @Contract(pure = true)
  static double reportedRate(GroupState state, Instant now) {
    var sincePeriodStart = RateEstimator.seconds(Duration.between(state.bucketLastReset(), now));
    if (sincePeriodStart <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    var periodRate = 0L;
    if (state.bucket() instanceof BucketState.Normal normal) {
      periodRate = Math.round(normal.count() / sincePeriodStart);
    }
    return Math.max(state.approxRate(), periodRate);
  }

  private Counter counter(MeterRegistry registry, GroupKey key) {
    var tags = new ArrayList<Tag>(labelNames.size());
    for (var i = 0; i < labelNames.size(); i++) {
      var value = key.values().get(i);
      tags.add(Tag.of(labelNames.get(i), value == null ? ABSENT_TAG_VALUE : value.toString()));
    }
    // The registry hands back the existing counter for the same name and tags.
    return Counter.builder(EXCEEDED_METRIC).description(EXCEEDED_DESCRIPTION).tags(baseTags.and(tags))
        .register(registry);
  }
}
