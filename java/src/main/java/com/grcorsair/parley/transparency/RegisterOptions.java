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

package com.grcorsair.parley.transparency;

import com.grcorsair.parley.util.Deadline;
import java.util.Objects;

/** Options for {@link TransparencyLog#register}. */
public final class RegisterOptions {
  private static final RegisterOptions DEFAULT = new RegisterOptions(false, Deadline.none());

  private final boolean proofOnly;
  private final Deadline deadline;

  private RegisterOptions(boolean proofOnly, Deadline deadline) {
    this.proofOnly = proofOnly;
    this.deadline = Objects.requireNonNull(deadline);
  }

  /** Keep the token body, no deadline. */
  public static RegisterOptions defaults() {
    return DEFAULT;
  }

  public static RegisterOptions proofOnly() {
    return new RegisterOptions(true, Deadline.none());
  }

  public RegisterOptions withProofOnly(boolean proofOnly) {
    return new RegisterOptions(proofOnly, deadline);
  }

  public RegisterOptions withDeadline(Deadline deadline) {
    return new RegisterOptions(proofOnly, deadline);
  }

  /** When set, only the token's hash is stored; its body is discarded. */
  public boolean isProofOnly() {
    return proofOnly;
  }

  public Deadline getDeadline() {
    return deadline;
  }
}
