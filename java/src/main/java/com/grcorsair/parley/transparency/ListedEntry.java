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

import com.google.common.collect.ImmutableSet;
import com.grcorsair.parley.evidence.EvidenceSummary;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * One row of the log's read API. Proof-only entries report {@code "unknown"} for every field that
 * would need the token body.
 */
public final class ListedEntry {
  private final String entryId;
  private final Instant registrationTime;
  private final long treeSize;
  private final String issuer;
  private final String scope;
  private final String provenanceSource;
  private final String sourceIdentity;
  private final EvidenceSummary summary;
  private final ImmutableSet<String> frameworks;
  private final boolean proofOnly;

  ListedEntry(LogEntry entry, StatementMetadata metadata) {
    this.entryId = entry.getEntryId();
    this.registrationTime = entry.getRegistrationTime();
    this.treeSize = entry.getTreeSize();
    this.issuer = metadata.issuer;
    this.scope = metadata.scope;
    this.provenanceSource = metadata.source;
    this.sourceIdentity = metadata.sourceIdentity;
    this.summary = metadata.summary;
    this.frameworks = metadata.frameworks;
    this.proofOnly = entry.isProofOnly();
  }

  public String getEntryId() {
    return entryId;
  }

  public Instant getRegistrationTime() {
    return registrationTime;
  }

  public long getTreeSize() {
    return treeSize;
  }

  public String getIssuer() {
    return issuer;
  }

  public String getScope() {
    return scope;
  }

  /** {@code self}, {@code tool}, {@code auditor} or {@code unknown}. */
  public String getProvenanceSource() {
    return provenanceSource;
  }

  public Optional<String> getSourceIdentity() {
    return Optional.ofNullable(sourceIdentity);
  }

  public Optional<EvidenceSummary> getSummary() {
    return Optional.ofNullable(summary);
  }

  public Set<String> getFrameworks() {
    return frameworks;
  }

  public boolean isProofOnly() {
    return proofOnly;
  }

  @Override
  public String toString() {
    return "ListedEntry{" + entryId + ", treeSize=" + treeSize + ", issuer=" + issuer
        + (proofOnly ? ", proofOnly" : "") + "}";
  }
}
