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
import java.util.Objects;
import java.util.Optional;

/** An immutable row of the log. Entries are never updated or deleted once appended. */
public final class LogEntry {
  private final String entryId;
  private final String statementHash;
  private final String statement;
  private final long treeSize;
  private final String treeHash;
  private final String parentHash;
  private final Instant registrationTime;

  public LogEntry(String entryId, String statementHash, String statement, long treeSize,
      String treeHash, String parentHash, Instant registrationTime) {
    this.entryId = Objects.requireNonNull(entryId);
    this.statementHash = Objects.requireNonNull(statementHash);
    this.statement = statement;
    this.treeSize = treeSize;
    this.treeHash = Objects.requireNonNull(treeHash);
    this.parentHash = parentHash;
    this.registrationTime = Objects.requireNonNull(registrationTime);
  }

  public String getEntryId() {
    return entryId;
  }

  /** Hex SHA-256 of the registered token. */
  public String getStatementHash() {
    return statementHash;
  }

  /** The registered token; empty for proof-only registrations. */
  public Optional<String> getStatement() {
    return Optional.ofNullable(statement);
  }

  public boolean isProofOnly() {
    return statement == null;
  }

  /** One-based position in the log. */
  public long getTreeSize() {
    return treeSize;
  }

  public String getTreeHash() {
    return treeHash;
  }

  /** Tree hash of the previous entry; empty for the first entry. */
  public Optional<String> getParentHash() {
    return Optional.ofNullable(parentHash);
  }

  public Instant getRegistrationTime() {
    return registrationTime;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof LogEntry)) {
      return false;
    }
    LogEntry other = (LogEntry) o;
    return entryId.equals(other.entryId) && statementHash.equals(other.statementHash)
        && Objects.equals(statement, other.statement) && treeSize == other.treeSize
        && treeHash.equals(other.treeHash) && Objects.equals(parentHash, other.parentHash)
        && registrationTime.equals(other.registrationTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entryId, statementHash, treeSize, treeHash);
  }

  @Override
  public String toString() {
    return "LogEntry{" + entryId + ", treeSize=" + treeSize + ", treeHash=" + treeHash
        + (isProofOnly() ? ", proofOnly" : "") + "}";
  }
}
