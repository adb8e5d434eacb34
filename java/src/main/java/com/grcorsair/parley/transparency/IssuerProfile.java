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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.grcorsair.parley.evidence.ProvenanceSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Aggregate view of everything one issuer has registered with full body. */
public final class IssuerProfile {
  /** How many of the most recent credentials {@link #getHistory()} holds. */
  public static final int HISTORY_LIMIT = 20;

  /** One registered credential in an issuer's history. */
  public static final class HistoryItem {
    private final String entryId;
    private final Instant registrationTime;
    private final String scope;
    private final int score;
    private final String provenanceSource;

    HistoryItem(ListedEntry entry) {
      this.entryId = entry.getEntryId();
      this.registrationTime = entry.getRegistrationTime();
      this.scope = entry.getScope();
      this.score = entry.getSummary().map(s -> s.getOverallScore()).orElse(0);
      this.provenanceSource = entry.getProvenanceSource();
    }

    public String getEntryId() {
      return entryId;
    }

    public Instant getRegistrationTime() {
      return registrationTime;
    }

    public String getScope() {
      return scope;
    }

    public int getScore() {
      return score;
    }

    public String getProvenanceSource() {
      return provenanceSource;
    }
  }

  private final String issuerDid;
  private final int totalCredentials;
  private final ImmutableSet<String> frameworks;
  private final int averageScore;
  private final ImmutableMap<ProvenanceSource, Integer> provenanceSummary;
  private final Instant lastCredentialDate;
  private final ImmutableList<HistoryItem> history;

  IssuerProfile(String issuerDid, int totalCredentials, Set<String> frameworks, int averageScore,
      Map<ProvenanceSource, Integer> provenanceSummary, Instant lastCredentialDate,
      List<HistoryItem> history) {
    this.issuerDid = issuerDid;
    this.totalCredentials = totalCredentials;
    this.frameworks = ImmutableSet.copyOf(frameworks);
    this.averageScore = averageScore;
    this.provenanceSummary = ImmutableMap.copyOf(provenanceSummary);
    this.lastCredentialDate = lastCredentialDate;
    this.history = ImmutableList.copyOf(history);
  }

  public String getIssuerDid() {
    return issuerDid;
  }

  public int getTotalCredentials() {
    return totalCredentials;
  }

  public Set<String> getFrameworks() {
    return frameworks;
  }

  /** Mean overall score, rounded; credentials without a summary count as 0. */
  public int getAverageScore() {
    return averageScore;
  }

  /** Credential count per provenance source; every source has an entry. */
  public Map<ProvenanceSource, Integer> getProvenanceSummary() {
    return provenanceSummary;
  }

  public Instant getLastCredentialDate() {
    return lastCredentialDate;
  }

  /** Newest first. */
  public List<HistoryItem> getHistory() {
    return history;
  }

  @Override
  public String toString() {
    return "IssuerProfile{" + issuerDid + ", total=" + totalCredentials + ", averageScore="
        + averageScore + "}";
  }
}
