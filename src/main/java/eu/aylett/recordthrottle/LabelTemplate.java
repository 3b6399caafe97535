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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills in {@code ${name}} placeholders in static metric labels.
 * <p>
 * Labels are resolved once, when the throttle is configured. Placeholders we
 * don't know about are left as they are. Values that look like record
 * accessors ({@code $.field} or {@code $[...]}) are refused: every record in a
 * group shares the same counter, so labels can't depend on the record.
 * </p>
 */
public final class LabelTemplate {
  public static final String HOSTNAME = "hostname";
  public static final String WORKER_ID = "worker_id";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

  private final Map<String, String> placeholders;

  public LabelTemplate(Map<String, String> placeholders) {
    this.placeholders = Map.copyOf(placeholders);
  }

  /**
   * A template knowing {@code ${hostname}} and {@code ${worker_id}}.
   */
  public static LabelTemplate forWorker(String hostname, String workerId) {
    return new LabelTemplate(Map.of(HOSTNAME, hostname, WORKER_ID, workerId));
  }

  /**
   * The name of this host, as used for {@code ${hostname}} by default.
   *
   * @throws ThrottleConfigurationException
   *           if the host name can't be determined
   */
  public static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      throw new ThrottleConfigurationException("labels", "could not resolve ${hostname}", e);
    }
  }

  public String expand(String value) {
    var matcher = PLACEHOLDER.matcher(value);
    var result = new StringBuilder();
    while (matcher.find()) {
      var replacement = placeholders.getOrDefault(matcher.group(1), matcher.group());
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /**
   * Expand every label value, keeping the labels in order.
   *
   * @throws ThrottleConfigurationException
   *           if a value is a record accessor rather than a literal
   */
  public Map<String, String> resolve(Map<String, String> labels) {
    var resolved = new LinkedHashMap<String, String>();
    labels.forEach((name, value) -> {
      if (isRecordAccessor(value)) {
        throw new ThrottleConfigurationException("labels",
            "can't use record accessor " + value + " for " + name + ": metric labels must be literal");
      }
      resolved.put(name, expand(value));
    });
    return resolved;
  }

  private static boolean isRecordAccessor(String value) {
    return value.startsWith("$.") || value.startsWith("$[");
  }
}
