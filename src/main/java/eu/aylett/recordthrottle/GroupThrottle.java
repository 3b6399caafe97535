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

import io.micrometer.core.instrument.MeterRegistry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Map;

/**
 * Rate limits records per group, letting through at most
 * {@link GroupThrottleConfig#bucketLimit()} records for each group in each
 * period.
 * <p>
 * Not thread safe. The host should feed records to an instance one at a time;
 * run one instance per worker if there's more than one. The meter registry may
 * be shared between instances.
 * </p>
 */
public class GroupThrottle implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(GroupThrottle.class);

  private final GroupThrottleConfig config;
  private final InstantSource clock;
  private final GroupKeyExtractor extractor;
  private final GroupStore store;
  private final RateEstimator rateEstimator;
  private final EvictionPolicy evictionPolicy;
  private final BucketLimiter limiter;

  /**
   * A fully configurable throttle.
   *
   * @param config
   *          how records are grouped and limited
   * @param clock
   *          the time source, read once per record (mainly for testing)
   * @param registry
   *          where the exceeded counter is registered; only used, and then
   *          required, if the config enables metrics
   * @throws ThrottleConfigurationException
   *           if metrics are enabled but there's no registry to put them in
   */
  public GroupThrottle(GroupThrottleConfig config, InstantSource clock, @Nullable MeterRegistry registry) {
    if (config.emitMetrics() && registry == null) {
      throw new ThrottleConfigurationException("group_emit_metrics", "needs a meter registry");
    }
    this.config = config;
    this.clock = clock;
    this.extractor = new GroupKeyExtractor(config.groupKey());
    this.store = new GroupStore(config.bucketLimit());
    this.rateEstimator = new RateEstimator(config.bucketLimit());
    this.evictionPolicy = new EvictionPolicy(config.idleTimeout());
    this.limiter = new BucketLimiter(config, new Notifier(config, registry, extractor.labelNames()));
    log.atDebug().setMessage("configured throttle").addKeyValue("config", config).log();
  }

  /**
   * Throttle on the system clock, without metrics.
   */
  public GroupThrottle(GroupThrottleConfig config) {
    this(config, Clock.systemUTC(), null);
  }

  /**
   * Pass the record on, or return null if its group is over the limit and
   * records are being dropped.
   */
  public <R extends Map<?, ?>> @Nullable R filter(R record) {
    return filter(record, clock.instant());
  }

  /**
   * As {@link #filter(Map)}, at a given time.
   */
  public <R extends Map<?, ?>> @Nullable R filter(R record, Instant now) {
    var decision = decide(record, now);
    if (decision == ThrottleDecision.SUPPRESS && config.dropRecords()) {
      return null;
    }
    return record;
  }

  /**
   * Account for the record and say whether it's within its group's budget,
   * whatever the drop policy.
   */
  public ThrottleDecision decide(Map<?, ?> record, Instant now) {
    var key = extractor.extract(record);
    var state = store.touch(key, now);
    rateEstimator.sample(state, now);
    evictionPolicy.evictIdle(store, now);
    return limiter.decide(key, state, now);
  }

  /**
   * The state held for a group, if there is any. Doesn't count as a use of the
   * group.
   */
  public @Nullable GroupState groupState(GroupKey key) {
    return store.peek(key);
  }

  /**
   * The number of groups currently tracked.
   */
  public int groupCount() {
    return store.size();
  }

  public GroupThrottleConfig config() {
    return config;
  }

  /**
   * The key a record would be grouped under.
   */
  public GroupKey groupKey(Map<?, ?> record) {
    return extractor.extract(record);
  }

  /**
   * Logs a summary of the tracked groups. The throttle can carry on being used
   * afterwards.
   */
  @Override
  public void close() {
    log.atDebug().setMessage("group summary").addKeyValue("groups", store.size()).log();
  }
}
