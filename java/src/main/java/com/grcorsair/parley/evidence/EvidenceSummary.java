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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate control counts and score of an assessment. This is the normalised shape every evidence
 * parser produces.
 */
public final class EvidenceSummary {
  private final int controlsTested;
  private final int controlsPassed;
  private final int controlsFailed;
  private final int overallScore;

  /**
   * @throws IllegalArgumentException if a count is negative, passed and failed exceed the tested
   *     count, or the score is outside 0-100
   */
  public EvidenceSummary(int controlsTested, int controlsPassed, int controlsFailed, int overallScore) {
    Preconditions.checkArgument(controlsTested >= 0 && controlsPassed >= 0 && controlsFailed >= 0,
        "control counts must not be negative");
    Preconditions.checkArgument((long) controlsPassed + controlsFailed <= controlsTested,
        "passed (%s) + failed (%s) exceeds tested (%s)", controlsPassed, controlsFailed,
        controlsTested);
    Preconditions.checkArgument(overallScore >= 0 && overallScore <= 100,
        "overall score %s outside 0-100", overallScore);
    this.controlsTested = controlsTested;
    this.controlsPassed = controlsPassed;
    this.controlsFailed = controlsFailed;
    this.overallScore = overallScore;
  }

  /**
   * Derives the summary from per-control framework results.
   *
   * @throws IllegalArgumentException if a total does not fit an {@code int}
   */
  public static EvidenceSummary fromFrameworks(List<FrameworkResult> frameworks) {
    long tested = 0;
    long passed = 0;
    long failed = 0;
    for (FrameworkResult framework : frameworks) {
      tested += framework.getControlsMapped();
      passed += framework.getPassed();
      failed += framework.getFailed();
    }
    int testedTotal = Ints.checkedCast(tested);
    int passedTotal = Ints.checkedCast(passed);
    return new EvidenceSummary(
        testedTotal, passedTotal, Ints.checkedCast(failed), score(passedTotal, testedTotal));
  }

  /** Percentage of passed controls, rounded half up; 0 when nothing was tested. */
  public static int score(int passed, int tested) {
    return tested > 0 ? (int) Math.round(100.0 * passed / tested) : 0;
  }

  /**
   * @throws IllegalArgumentException if a field is missing or the counts are inconsistent
   */
  public static EvidenceSummary fromJson(JsonObject json) {
    try {
      return new EvidenceSummary(
          json.get("controlsTested").getAsInt(),
          json.get("controlsPassed").getAsInt(),
          json.get("controlsFailed").getAsInt(),
          json.get("overallScore").getAsInt());
    } catch (NullPointerException | UnsupportedOperationException | IllegalStateException
        | NumberFormatException e) {
      throw new IllegalArgumentException("malformed summary: " + json, e);
    }
  }

  public int getControlsTested() {
    return controlsTested;
  }

  public int getControlsPassed() {
    return controlsPassed;
  }

  public int getControlsFailed() {
    return controlsFailed;
  }

  public int getOverallScore() {
    return overallScore;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("controlsTested", controlsTested);
    json.addProperty("controlsPassed", controlsPassed);
    json.addProperty("controlsFailed", controlsFailed);
    json.addProperty("overallScore", overallScore);
    return json;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EvidenceSummary)) {
      return false;
    }
    EvidenceSummary other = (EvidenceSummary) o;
    return controlsTested == other.controlsTested && controlsPassed == other.controlsPassed
        && controlsFailed == other.controlsFailed && overallScore == other.overallScore;
  }

  @Override
  public int hashCode() {
    return Objects.hash(controlsTested, controlsPassed, controlsFailed, overallScore);
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
