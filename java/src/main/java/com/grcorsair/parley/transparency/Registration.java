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

import java.time.Instant;

/** Outcome of a successful registration. */
public final class Registration {
  /** Entries have a single, terminal state. */
  public static final String STATUS_REGISTERED = "registered";

  private final LogEntry entry;
  private final Receipt receipt;

  Registration(LogEntry entry, Receipt receipt) {
    this.entry = entry;
    this.receipt = receipt;
  }

  public String getEntryId() {
    return entry.getEntryId();
  }

  public Instant getRegistrationTime() {
    return entry.getRegistrationTime();
  }

  public String getStatus() {
    return STATUS_REGISTERED;
  }

  public LogEntry getEntry() {
    return entry;
  }

  public Receipt getReceipt() {
    return receipt;
  }

  @Override
  public String toString() {
    return "Registration{" + entry + "}";
  }
}
