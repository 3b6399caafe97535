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

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

class GroupKeyExtractorTest {
  private enum Field {
    kubernetes, container_name, namespace,
  }

  @Test
  void readsNestedFields() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name", "kubernetes.namespace", "level"));
    var record = Map.of("kubernetes", Map.of("container_name", "api", "namespace", "prod"), "level", "info");
    assertThat(extractor.extract(record), equalTo(GroupKey.of("api", "prod", "info")));
  }

  @Test
  void missingFieldsAreNull() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name", "kubernetes.pod", "stream"));
    var record = Map.of("kubernetes", Map.of("container_name", "api"));
    assertThat(extractor.extract(record), equalTo(GroupKey.of("api", null, null)));
  }

  @Test
  void pathThroughNonMapIsNull() {
    var extractor = new GroupKeyExtractor(List.of("message.length"));
    var record = Map.of("message", "hello");
    assertThat(extractor.extract(record), equalTo(GroupKey.of((Object) null)));
  }

  @Test
  void nullValuesAreMissing() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name"));
    var inner = new HashMap<String, Object>();
    inner.put("container_name", null);
    assertThat(extractor.extract(Map.of("kubernetes", inner)), equalTo(GroupKey.of((Object) null)));
  }

  @Test
  void keepsNonStringValues() {
    var extractor = new GroupKeyExtractor(List.of("code"));
    assertThat(extractor.extract(Map.of("code", 503)), equalTo(GroupKey.of(503)));
  }

  @Test
  void followsSymbolicKeys() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name"));
    var inner = new EnumMap<Field, Object>(Field.class);
    inner.put(Field.container_name, "api");
    var record = new EnumMap<Field, Object>(Field.class);
    record.put(Field.kubernetes, inner);
    assertThat(extractor.extract(record), equalTo(GroupKey.of("api")));

    // Sorted maps can't even be asked about a string key.
    var sorted = new TreeMap<Field, Object>(
        Map.of(Field.kubernetes, new TreeMap<>(Map.of(Field.container_name, "api"))));
    assertThat(extractor.extract(sorted), equalTo(GroupKey.of("api")));
    var skipList = new ConcurrentSkipListMap<Field, Object>(Map.of(Field.kubernetes, Map.of("container_name", "api")));
    assertThat(extractor.extract(skipList), equalTo(GroupKey.of("api")));
  }

  @Test
  void sortedMapWithoutTheFieldIsMissing() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name"));
    var sorted = new TreeMap<Field, Object>(Map.of(Field.namespace, "prod"));
    assertThat(extractor.extract(sorted), equalTo(GroupKey.of((Object) null)));
    var numbered = new TreeMap<Integer, Object>(Map.of(1, "one"));
    assertThat(extractor.extract(numbered), equalTo(GroupKey.of((Object) null)));
  }

  @Test
  void prefersStringKeys() {
    var extractor = new GroupKeyExtractor(List.of("namespace"));
    var record = new HashMap<Object, Object>();
    record.put(Field.namespace, "from-symbol");
    record.put("namespace", "from-string");
    assertThat(extractor.extract(record), equalTo(GroupKey.of("from-string")));
  }

  @Test
  void noFieldsMeansOneGroup() {
    var extractor = new GroupKeyExtractor(List.of());
    assertThat(extractor.extract(Map.of("a", "b")), equalTo(extractor.extract(Map.of("c", "d"))));
    assertThat(extractor.extract(Map.of()).arity(), equalTo(0));
  }

  @Test
  void labelNamesAreSanitized() {
    var extractor = new GroupKeyExtractor(List.of("kubernetes.container_name", "app-name", "plain_1"));
    assertThat(extractor.labelNames(), contains("kubernetes_container_name", "app_name", "plain_1"));
    assertThat(extractor.fields(), contains("kubernetes.container_name", "app-name", "plain_1"));
  }
}
