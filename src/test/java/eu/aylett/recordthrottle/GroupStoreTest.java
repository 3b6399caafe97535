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
import org.junit.jupiter.api.Test;

import java.util.Objects;

import static eu.aylett.recordthrottle.InstantAnswer.START;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

class GroupStoreTest {
  private static final GroupKey A = GroupKey.of("a");
  private static final GroupKey B = GroupKey.of("b");
  private static final GroupKey C = GroupKey.of("c");

  @Test
  void touchCreatesDefaultState() {
    var store = new GroupStore(120);
    var state = store.touch(A, START);

    assertThat(state.rateCount(), equalTo(0L));
    assertThat(state.rateLastReset(), equalTo(START));
    assertThat(state.approxRate(), equalTo(0L));
    assertThat(state.bucket(), equalTo(BucketState.EMPTY));
    assertThat(state.bucketLastReset(), equalTo(START));
    assertThat(state.lastWarning(), nullValue());
    assertThat(state.rateCountLast(), equalTo(120L));
    assertThat(store.size(), equalTo(1));
  }

  @Test
  void touchReturnsExistingState() {
    var store = new GroupStore(120);
    var first = store.touch(A, START);
    var second = store.touch(A, START.plusSeconds(5));

    assertThat(second, sameInstance(first));
    // Not reinitialised by the later touch
    assertThat(second.rateLastReset(), equalTo(START));
    assertThat(store.size(), equalTo(1));
  }

  @Test
  void emptyStoreHasNoOldest() {
    assertThat(new GroupStore(1).oldest(), nullValue());
  }

  @Test
  void oldestFollowsInsertionOrder() {
    var store = new GroupStore(1);
    store.touch(A, START);
    store.touch(B, START);
    store.touch(C, START);
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(A));
  }

  @Test
  void touchMovesToMostRecent() {
    var store = new GroupStore(1);
    store.touch(A, START);
    store.touch(B, START);
    store.touch(A, START);
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(B));

    store.touch(B, START);
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(A));
  }

  @Test
  void peekDoesNotMove() {
    var store = new GroupStore(1);
    var a = store.touch(A, START);
    store.touch(B, START);

    assertThat(store.peek(A), sameInstance(a));
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(A));
    assertThat(store.peek(C), nullValue());
  }

  @Test
  void oldestIsNotRemoved() {
    var store = new GroupStore(1);
    store.touch(A, START);
    store.oldest();
    assertThat(store.size(), equalTo(1));
  }

  @Test
  void evictOldestRemovesEntry() {
    var store = new GroupStore(1);
    store.touch(A, START);
    store.touch(B, START);
    store.evictOldest();

    assertThat(store.size(), equalTo(1));
    assertThat(store.peek(A), nullValue());
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(B));

    // Coming back after eviction starts from scratch
    var again = store.touch(A, START.plusSeconds(10));
    assertThat(again.rateLastReset(), equalTo(START.plusSeconds(10)));
  }

  @Test
  void evictOldestOnEmptyStoreDoesNothing() {
    var store = new GroupStore(1);
    store.evictOldest();
    assertThat(store.size(), equalTo(0));
  }

  @Test
  void evictsKeyWhoseHashHasChanged() {
    var store = new GroupStore(1);
    var shifty = new Shifty("a");
    store.touch(GroupKey.of(shifty), START);
    store.touch(B, START);
    shifty.name = "changed";

    store.evictOldest();
    assertThat(store.size(), equalTo(1));
    assertThat(Objects.requireNonNull(store.oldest()).getKey(), equalTo(B));
  }

  private static final class Shifty {
    String name;

    Shifty(String name) {
      this.name = name;
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof Shifty other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }
}
