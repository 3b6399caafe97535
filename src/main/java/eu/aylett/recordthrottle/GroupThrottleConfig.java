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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How a {@link GroupThrottle} groups and limits records.
 * <p>
 * Built with {@link #builder()}, which checks the options and resolves label
 * placeholders. A config that has been built is valid; nothing is checked
 * again once records start flowing.
 * </p>
 */
public final class GroupThrottleConfig {
  /**
   * A reset rate meaning "recover at the next period, however busy the group
   * still is".
   */
  public static final int ALWAYS_RESET = -1;

  public static final List<String> DEFAULT_GROUP_KEY = List.of("kubernetes.container_name");
  public static final int DEFAULT_BUCKET_PERIOD_SECONDS = 60;
  public static final int DEFAULT_BUCKET_LIMIT = 6000;
  public static final int DEFAULT_WARNING_DELAY_SECONDS = 10;

  private final List<String> groupKey;
  private final int bucketPeriodSeconds;
  private final int bucketLimit;
  private final boolean dropRecords;
  private final int resetRate;
  private final int warningDelaySeconds;
  private final boolean emitMetrics;
  private final Map<String, String> labels;

  private GroupThrottleConfig(Builder builder, int resetRate, Map<String, String> labels) {
    this.groupKey = List.copyOf(builder.groupKey);
    this.bucketPeriodSeconds = builder.bucketPeriodSeconds;
    this.bucketLimit = builder.bucketLimit;
    this.dropRecords = builder.dropRecords;
    this.resetRate = resetRate;
    this.warningDelaySeconds = builder.warningDelaySeconds;
    this.emitMetrics = builder.emitMetrics;
    this.labels = labels;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dotted paths to the fields whose values make up a group's key.
   */
  public List<String> groupKey() {
    return groupKey;
  }

  public int bucketPeriodSeconds() {
    return bucketPeriodSeconds;
  }

  public Duration bucketPeriod() {
    return Duration.ofSeconds(bucketPeriodSeconds);
  }

  /**
   * Records allowed per group per period.
   */
  public int bucketLimit() {
    return bucketLimit;
  }

  /**
   * Whether suppressed records are dropped, or only reported.
   */
  public boolean dropRecords() {
    return dropRecords;
  }

  /**
   * The rate (records per second) an exceeded group must drop below before it
   * can recover, or {@link #ALWAYS_RESET}.
   */
  public int resetRate() {
    return resetRate;
  }

  public int warningDelaySeconds() {
    return warningDelaySeconds;
  }

  public Duration warningDelay() {
    return Duration.ofSeconds(warningDelaySeconds);
  }

  public boolean emitMetrics() {
    return emitMetrics;
  }

  /**
   * Static metric labels, with placeholders already expanded.
   */
  public Map<String, String> labels() {
    return labels;
  }

  /**
   * The bucket limit as a per-second rate, rounded down.
   */
  public int rateLimit() {
    return bucketLimit / bucketPeriodSeconds;
  }

  /**
   * How long a group can go without a record before its state may be thrown
   * away.
   */
  public Duration idleTimeout() {
    return bucketPeriod().multipliedBy(2);
  }

  @Override
  public String toString() {
    return "GroupThrottleConfig{groupKey=" + groupKey + ", bucketPeriodSeconds=" + bucketPeriodSeconds
        + ", bucketLimit=" + bucketLimit + ", dropRecords=" + dropRecords + ", resetRate=" + resetRate
        + ", warningDelaySeconds=" + warningDelaySeconds + ", emitMetrics=" + emitMetrics + ", labels=" + labels
        + "}";
  }

  /**
   * Collects options for a {@link GroupThrottleConfig}. Anything not set keeps
   * its default.
   */
  public static final class Builder {
    private List<String> groupKey = DEFAULT_GROUP_KEY;
    private int bucketPeriodSeconds = DEFAULT_BUCKET_PERIOD_SECONDS;
    private int bucketLimit = DEFAULT_BUCKET_LIMIT;
    private boolean dropRecords = true;
    private @Nullable Integer resetRate;
    private int warningDelaySeconds = DEFAULT_WARNING_DELAY_SECONDS;
    private boolean emitMetrics;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private @Nullable String hostname;
    private String workerId = "0";

    private Builder() {
    }

    /**
     * {@code group_key}: the fields to group by. An empty list puts every record
     * in the same group.
     */
    public Builder groupKey(List<String> groupKey) {
      this.groupKey = List.copyOf(groupKey);
      return this;
    }

    public Builder groupKey(String... groupKey) {
      return groupKey(List.of(groupKey));
    }

    /**
     * {@code group_bucket_period_s}: the length of each period, in seconds.
     */
    public Builder bucketPeriodSeconds(int bucketPeriodSeconds) {
      this.bucketPeriodSeconds = bucketPeriodSeconds;
      return this;
    }

    /**
     * {@code group_bucket_limit}: records allowed per group per period.
     */
    public Builder bucketLimit(int bucketLimit) {
      this.bucketLimit = bucketLimit;
      return this;
    }

    /**
     * {@code group_drop_logs}: false to let suppressed records through anyway,
     * still logging and counting them.
     */
    public Builder dropRecords(boolean dropRecords) {
      this.dropRecords = dropRecords;
      return this;
    }

    /**
     * {@code group_reset_rate_s}: defaults to the rate limit.
     */
    public Builder resetRate(int resetRate) {
      this.resetRate = resetRate;
      return this;
    }

    /**
     * {@code group_warning_delay_s}: the least time between repeated warnings
     * for a group.
     */
    public Builder warningDelaySeconds(int warningDelaySeconds) {
      this.warningDelaySeconds = warningDelaySeconds;
      return this;
    }

    /**
     * {@code group_emit_metrics}: count exceeded records in a metric.
     */
    public Builder emitMetrics(boolean emitMetrics) {
      this.emitMetrics = emitMetrics;
      return this;
    }

    public Builder label(String name, String value) {
      labels.put(name, value);
      return this;
    }

    public Builder labels(Map<String, String> labels) {
      this.labels.putAll(labels);
      return this;
    }

    /**
     * Overrides the host name used for {@code ${hostname}}.
     */
    public Builder hostname(String hostname) {
      this.hostname = hostname;
      return this;
    }

    /**
     * The id of the worker this throttle runs in, used for {@code ${worker_id}}.
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * @throws ThrottleConfigurationException
     *           if any option is out of range or a label isn't literal
     */
    public GroupThrottleConfig build() {
      if (bucketPeriodSeconds <= 0) {
        throw new ThrottleConfigurationException("group_bucket_period_s", "must be > 0");
      }
      if (bucketLimit <= 0) {
        throw new ThrottleConfigurationException("group_bucket_limit", "must be > 0");
      }

      var rateLimit = bucketLimit / bucketPeriodSeconds;
      var resetRate = this.resetRate == null ? rateLimit : this.resetRate;
      if (resetRate < ALWAYS_RESET) {
        throw new ThrottleConfigurationException("group_reset_rate_s", "must be >= -1");
      }
      if (resetRate > rateLimit) {
        throw new ThrottleConfigurationException("group_reset_rate_s",
            "must be <= group_bucket_limit / group_bucket_period_s (" + rateLimit + ")");
      }

      if (warningDelaySeconds < 1) {
        throw new ThrottleConfigurationException("group_warning_delay_s", "must be >= 1");
      }

      var resolvedLabels = Map.<String, String>of();
      if (!labels.isEmpty()) {
        var host = hostname == null ? LabelTemplate.localHostName() : hostname;
        resolvedLabels = Collections.unmodifiableMap(LabelTemplate.forWorker(host, workerId).resolve(labels));
      }
      return new GroupThrottleConfig(this, resetRate, resolvedLabels);
    }
  }
}
