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

/**
 * Exception thrown when a throttle can't be configured.
 * <p>
 * Raised while building a {@link GroupThrottleConfig} or constructing a
 * {@link GroupThrottle}, never while records are being processed.
 * </p>
 */
public class ThrottleConfigurationException extends RuntimeException {
  /**
   * The name of the option that was rejected, as the host configuration spells
   * it (for example {@code group_bucket_limit}).
   */
  public final String option;

  /**
   * Constructs a new ThrottleConfigurationException for a rejected option.
   *
   * @param option
   *          the configuration option that was rejected
   * @param message
   *          what's wrong with it
   */
  public ThrottleConfigurationException(String option, String message) {
    super(option + " " + message);
    this.option = option;
  }

  /**
   * Constructs a new ThrottleConfigurationException with an underlying cause.
   *
   * @param option
   *          the configuration option that was rejected
   * @param message
   *          what's wrong with it
   * @param cause
   *          the failure that prevented the option from being resolved
   */
  public ThrottleConfigurationException(String option, String message, Throwable cause) {
    super(option + " " + message, cause);
    this.option = option;
  }
}
