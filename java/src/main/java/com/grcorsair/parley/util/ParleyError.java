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

import java.util.Objects;

/** Error value carried by {@link Result}s throughout the engine. */
public final class ParleyError {
  private final ErrorKind kind;
  private final String reason;

  public ParleyError(ErrorKind kind, String reason) {
    this.kind = Objects.requireNonNull(kind);
    this.reason = Objects.requireNonNull(reason);
  }

  public static ParleyError of(ErrorKind kind, String format, Object... args) {
    return new ParleyError(kind, args.length == 0 ? format : String.format(format, args));
  }

  public static <R> Result<R, ParleyError> failure(ErrorKind kind, String format, Object... args) {
    return Result.error(of(kind, format, args));
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getReason() {
    return reason;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParleyError)) {
      return false;
    }
    ParleyError other = (ParleyError) o;
    return kind == other.kind && reason.equals(other.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, reason);
  }

  @Override
  public String toString() {
    return kind + ": " + reason;
  }
}
