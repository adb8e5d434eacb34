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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;

/**
 * Per-control results mapped to one compliance framework. Every control that did not pass counts
 * as failed.
 */
public final class FrameworkResult {
  private final String framework;
  private final ImmutableList<ControlResult> controls;

  public FrameworkResult(String framework, List<ControlResult> controls) {
    this.framework = Objects.requireNonNull(framework);
    this.controls = ImmutableList.copyOf(controls);
  }

  public String getFramework() {
    return framework;
  }

  public List<ControlResult> getControls() {
    return controls;
  }

  public int getControlsMapped() {
    return controls.size();
  }

  public int getPassed() {
    return (int) controls.stream().filter(c -> c.getStatus() == ControlStatus.PASSED).count();
  }

  public int getFailed() {
    return getControlsMapped() - getPassed();
  }

  public JsonObject toJson() {
    JsonArray controlsJson = new JsonArray();
    for (ControlResult control : controls) {
      controlsJson.add(control.toJson());
    }
    JsonObject json = new JsonObject();
    json.addProperty("controlsMapped", getControlsMapped());
    json.addProperty("passed", getPassed());
    json.addProperty("failed", getFailed());
    json.add("controls", controlsJson);
    return json;
  }
}
