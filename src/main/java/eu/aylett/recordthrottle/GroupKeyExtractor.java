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
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pulls the group key out of a record.
 * <p>
 * Each configured field is a dotted path into nested maps, so
 * {@code kubernetes.container_name} reads {@code record["kubernetes"]["container_name"]}.
 * Missing fields, and paths that run into something other than a map, come out
 * as {@code null}.
 * </p>
 * <p>
 * Records don't always use plain strings as keys. If a path can't be followed
 * with string keys, it's followed again matching keys by their
 * {@code toString()}, which finds enum and other symbol-like keys. That
 * includes sorted maps, whose lookups reject a string key outright.
 * </p>
 */
public final class GroupKeyExtractor {
  private static final Pattern NOT_A_LABEL_CHARACTER = Pattern.compile("[^a-zA-Z0-9_]");

  private final List<String> fields;
  private final List<String[]> paths;

  /**
   * @param fields
   *          dotted field paths, in key order
   */
  public GroupKeyExtractor(List<String> fields) {
    this.fields = List.copyOf(fields);
    var split = new ArrayList<String[]>(fields.size());
    for (var field : fields) {
      split.add(field.split("\\.", -1));
    }
    this.paths = List.copyOf(split);
  }

  public GroupKey extract(Map<?, ?> record) {
    var values = new ArrayList<@Nullable Object>(paths.size());
    for (var path : paths) {
      var value = dig(record, path, false);
      if (value == null) {
        value = dig(record, path, true);
      }
      values.add(value);
    }
    return new GroupKey(values);
  }

  /**
   * The configured field paths, as given.
   */
  public List<String> fields() {
    return fields;
  }

  /**
   * The configured fields made safe to use as metric tag keys: anything other
   * than ASCII letters, digits and underscores becomes an underscore.
   */
  public List<String> labelNames() {
    var names = new ArrayList<String>(fields.size());
    for (var field : fields) {
      names.add(sanitize(field));
    }
    return names;
  }

  @Contract(pure = true)
  static String sanitize(String field) {
    return NOT_A_LABEL_CHARACTER.matcher(field).replaceAll("_");
  }

  private static @Nullable Object dig(Map<?, ?> record, String[] path, boolean symbolic) {
    @Nullable Object current = record;
    for (var segment : path) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = symbolic ? getBySymbol(map, segment) : getByString(map, segment);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  private static @Nullable Object getByString(Map<?, ?> map, String segment) {
    try {
      return map.get(segment);
    } catch (ClassCastException e) {
      // A sorted map of some other key type can't compare a string: no such key.
      return null;
    }
  }

  private static @Nullable Object getBySymbol(Map<?, ?> map, String segment) {
    for (var entry : map.entrySet()) {
      var key = entry.getKey();
      if (key != null && !(key instanceof String) && segment.equals(key.toString())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
