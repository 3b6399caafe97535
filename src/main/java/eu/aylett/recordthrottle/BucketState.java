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
 * Where a group stands against its budget for the current period.
 */
public sealed interface BucketState {

  /**
   * The state every group starts a period in.
   */
  Normal EMPTY = new Normal(0);

  /**
   * Records are being let through and counted.
   *
   * @param count
   *          records accepted so far this period
   */
  record Normal(long count) implements BucketState {
    Normal increment() {
      return new Normal(count + 1);
    }
  }

  /**
   * The budget has been spent: records are suppressed until a new period
   * starts and the group is allowed to recover.
   */
  enum Exceeded implements BucketState {
    INSTANCE;

    @Override
    public String toString() {
      return "Exceeded";
    }
  }
}
