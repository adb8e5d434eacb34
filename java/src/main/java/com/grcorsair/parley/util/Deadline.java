//
// Copyright 2026 The Parley Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.grcorsair.parley.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A caller-supplied point in time after which an operation should be abandoned.
 */
public final class Deadline {
  private static final Deadline NONE = new Deadline(Clock.systemUTC(), Instant.MAX);

  private final Clock clock;
  private final Instant expiresAt;

  private Deadline(Clock clock, Instant expiresAt) {
    this.clock = clock;
    this.expiresAt = expiresAt;
  }

  /** A deadline that never expires. */
  public static Deadline none() {
    return NONE;
  }

  public static Deadline after(Duration timeout) {
    return after(timeout, Clock.systemUTC());
  }

  public static Deadline after(Duration timeout, Clock clock) {
    return new Deadline(clock, clock.instant().plus(timeout));
  }

  public static Deadline at(Instant expiresAt, Clock clock) {
    return new Deadline(clock, expiresAt);
  }

  /** True for {@link #none()}. */
  public boolean isUnbounded() {
    return expiresAt.equals(Instant.MAX);
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  /** Time left before expiry, never negative. */
  public Duration remaining() {
    if (expiresAt.equals(Instant.MAX)) {
      return Duration.ofSeconds(Long.MAX_VALUE);
    }
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /** The smaller of {@code cap} and the time remaining. */
  public Duration remainingOrAtMost(Duration cap) {
    Duration left = remaining();
    return left.compareTo(cap) < 0 ? left : cap;
  }

  @Override
  public String toString() {
    return expiresAt.equals(Instant.MAX) ? "Deadline(none)" : "Deadline(" + expiresAt + ")";
  }
}
