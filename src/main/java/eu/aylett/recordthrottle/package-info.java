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

/**
 * A log pipeline can't usually tell a chatty container from a broken one, but
 * it can stop either from drowning out everyone else.
 * <p>
 * Records are grouped by the values of a few configured fields. Each group gets
 * a budget of records per fixed period; once the budget is spent the rest of
 * the group's records are suppressed until a later period starts <i>and</i>
 * (optionally) the group's observed rate has come back down.
 * </p>
 * <p>
 * Nothing happens in the background: periods roll over, rates are sampled and
 * idle groups are forgotten only as records arrive. A group that goes quiet
 * keeps whatever state it had until its next record, or until it's noticed as
 * the stalest group and evicted.
 * </p>
 * <p>
 * Use one {@link eu.aylett.recordthrottle.GroupThrottle} per worker. Instances
 * don't share state, so limits are per worker rather than global.
 * </p>
 */
@NullMarked
package eu.aylett.recordthrottle;

import org.jspecify.annotations.NullMarked;
