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

import com.google.gson.JsonObject;
import java.util.Objects;

/** Result of one control within a framework. */
public final class ControlResult {
  private final String controlId;
  private final ControlStatus status;

  public ControlResult(String controlId, ControlStatus status) {
    this.controlId = Objects.requireNonNull(controlId);
    this.status = Objects.requireNonNull(status);
  }

  public static ControlResult passed(String controlId) {
    return new ControlResult(controlId, ControlStatus.PASSED);
  }

  public static ControlResult failed(String controlId) {
    return new ControlResult(controlId, ControlStatus.FAILED);
  }

  public String getControlId() {
    return controlId;
  }

  public ControlStatus getStatus() {
    return status;
  }

  JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("controlId", controlId);
    json.addProperty("status", status.getId());
    return json;
  }
}
