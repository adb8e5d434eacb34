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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvidenceSummaryTest {
  @Test
  public void testFromFrameworksCountsUntestedAsFailed() {
    FrameworkResult soc2 = new FrameworkResult("SOC2", ImmutableList.of(
        ControlResult.passed("CC6.1"),
        ControlResult.passed("CC6.2"),
        ControlResult.failed("CC7.1")));
    FrameworkResult nist = new FrameworkResult("NIST-800-53", ImmutableList.of(
        ControlResult.passed("AC-2"),
        new ControlResult("AC-3", ControlStatus.NOT_TESTED)));

    EvidenceSummary summary = EvidenceSummary.fromFrameworks(ImmutableList.of(soc2, nist));
    assertEquals(5, summary.getControlsTested());
    assertEquals(3, summary.getControlsPassed());
    assertEquals(2, summary.getControlsFailed());
    assertEquals(60, summary.getOverallScore());
    assertEquals(1, nist.getFailed());
  }

  @Test
  public void testScoreRoundsHalfUp() {
    assertEquals(0, EvidenceSummary.score(0, 0));
    assertEquals(67, EvidenceSummary.score(2, 3));
    assertEquals(33, EvidenceSummary.score(1, 3));
    assertEquals(13, EvidenceSummary.score(1, 8));
    assertEquals(100, EvidenceSummary.score(7, 7));
  }

  @Test
  public void testRejectsInconsistentCounts() {
    assertThrows(IllegalArgumentException.class, () -> new EvidenceSummary(-1, 0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new EvidenceSummary(5, 4, 2, 80));
    assertThrows(IllegalArgumentException.class, () -> new EvidenceSummary(5, 4, 1, 101));
  }

  @Test
  public void testCountsThatOverflowIntAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new EvidenceSummary(0, Integer.MAX_VALUE, 1, 0));
    assertThrows(IllegalArgumentException.class,
        () -> new EvidenceSummary(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE, 0));
    JsonObject json = JsonParser.parseString("{\"controlsTested\":0,"
        + "\"controlsPassed\":2147483647,\"controlsFailed\":1,\"overallScore\":0}")
        .getAsJsonObject();
    assertThrows(IllegalArgumentException.class, () -> EvidenceSummary.fromJson(json));

    EvidenceSummary full = new EvidenceSummary(Integer.MAX_VALUE, Integer.MAX_VALUE, 0, 100);
    assertEquals(Integer.MAX_VALUE, full.getControlsPassed());
  }

  @Test
  public void testJsonRoundTripAndMissingFields() {
    EvidenceSummary summary = new EvidenceSummary(10, 8, 2, 80);
    assertEquals(summary, EvidenceSummary.fromJson(summary.toJson()));

    JsonObject partial = JsonParser.parseString("{\"controlsTested\":10}").getAsJsonObject();
    assertThrows(IllegalArgumentException.class, () -> EvidenceSummary.fromJson(partial));
    JsonObject text = JsonParser.parseString(
        "{\"controlsTested\":\"ten\",\"controlsPassed\":8,\"controlsFailed\":2,\"overallScore\":80}")
        .getAsJsonObject();
    assertThrows(IllegalArgumentException.class, () -> EvidenceSummary.fromJson(text));
  }

  @Test
  public void testProvenanceFromFormat() {
    Provenance provenance = EvidenceFormat.fromId("prowler").get().provenance("prowler-v3");
    assertEquals(ProvenanceSource.TOOL, provenance.getSource());
    assertEquals("prowler-v3", provenance.getSourceIdentity().get());
    assertFalse(provenance.getSourceDocument().isPresent());
    assertEquals(ProvenanceSource.AUDITOR, EvidenceFormat.SOC2.getProvenanceSource());
    assertFalse(EvidenceFormat.fromId("csv").isPresent());
    assertEquals(provenance, Provenance.fromJson(provenance.toJson()));
    assertThrows(IllegalArgumentException.class,
        () -> Provenance.fromJson(JsonParser.parseString("{\"source\":\"oracle\"}")
            .getAsJsonObject()));
  }
}
