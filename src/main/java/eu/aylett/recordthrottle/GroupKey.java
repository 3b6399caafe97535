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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The values a record has for each of the configured group fields, in order.
 * <p>
 * A field the record doesn't have is {@code null} here; records missing the
 * same fields still group together.
 * </p>
 * <p>
 * List, set and map values are copied, so a record changed after it was
 * grouped doesn't change its key.
 * </p>
 *
 * @param values
 *          one element per configured field
 */
public record GroupKey(List<@Nullable Object> values) {

  /**
   * Copies {@code values}, keeping any nulls.
   */
  public GroupKey(List<@Nullable Object> values) {
    var copy = new ArrayList<@Nullable Object>(values.size());
    for (var value : values) {
      copy.add(snapshot(value));
    }
    this.values = Collections.unmodifiableList(copy);
  }

  /**
   * Convenience for building keys by hand, mostly in tests.
   */
  @Contract(pure = true)
  public static GroupKey of(@Nullable Object... values) {
    return new GroupKey(Arrays.asList(values));
  }

  /**
   * The number of fields in the key.
   */
  public int arity() {
    return values.size();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  private static @Nullable Object snapshot(@Nullable Object value) {
    if (value instanceof List<?> list) {
      var copy = new ArrayList<@Nullable Object>(list.size());
      for (var element : list) {
        copy.add(snapshot(element));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Set<?> set) {
      var copy = new LinkedHashSet<@Nullable Object>();
      for (var element : set) {
        copy.add(snapshot(element));
      }
      return Collections.unmodifiableSet(copy);
    }
    if (value instanceof Map<?, ?> map) {
      var copy = new LinkedHashMap<@Nullable Object, @Nullable Object>();
      map.forEach((k, v) -> copy.put(snapshot(k), snapshot(v)));
      return Collections.unmodifiableMap(copy);
    }
    return value;
  }
}
