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

package com.grcorsair.parley.evidence;

/** Outcome of testing a single control. */
public enum ControlStatus {
  PASSED("passed"),
  FAILED("failed"),
  NOT_TESTED("not-tested");

  private final String id;

  ControlStatus(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }
}
