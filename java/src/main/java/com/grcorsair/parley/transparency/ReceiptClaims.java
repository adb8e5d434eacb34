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

import com.grcorsair.parley.cbor.CborDecoder;
import com.grcorsair.parley.cbor.CborEncoder;
import com.grcorsair.parley.cbor.CborException;
import com.grcorsair.parley.cbor.CborInteger;
import com.grcorsair.parley.cbor.CborMap;
import com.grcorsair.parley.cbor.CborText;
import com.grcorsair.parley.cbor.CborValue;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/** The fields a receipt binds: where the statement sits in which log, and when it got there. */
public final class ReceiptClaims {
  private final String logId;
  private final String entryId;
  private final long treeSize;
  private final String treeHash;
  private final String statementHash;
  private final Instant registrationTime;

  public ReceiptClaims(String logId, String entryId, long treeSize, String treeHash,
      String statementHash, Instant registrationTime) {
    this.logId = Objects.requireNonNull(logId);
    this.entryId = Objects.requireNonNull(entryId);
    this.treeSize = treeSize;
    this.treeHash = Objects.requireNonNull(treeHash);
    this.statementHash = Objects.requireNonNull(statementHash);
    this.registrationTime = Objects.requireNonNull(registrationTime);
  }

  static ReceiptClaims of(String logId, LogEntry entry) {
    return new ReceiptClaims(logId, entry.getEntryId(), entry.getTreeSize(), entry.getTreeHash(),
        entry.getStatementHash(), entry.getRegistrationTime());
  }

  byte[] encode() {
    return CborEncoder.encode(CborMap.builder()
        .put("logId", logId)
        .put("entryId", entryId)
        .put("treeSize", treeSize)
        .put("treeHash", treeHash)
        .put("statementHash", statementHash)
        .put("registrationTime", registrationTime.toString())
        .build());
  }

  /**
   * @throws CborException if {@code payload} is not a claims map
   */
  static ReceiptClaims decode(byte[] payload) throws CborException {
    CborMap map = CborDecoder.decode(payload).as(CborMap.class);
    Instant registrationTime;
    try {
      registrationTime = Instant.parse(text(map, "registrationTime"));
    } catch (DateTimeParseException e) {
      throw new CborException("bad registrationTime: " + e.getMessage());
    }
    return new ReceiptClaims(
        text(map, "logId"),
        text(map, "entryId"),
        map.require("treeSize").as(CborInteger.class).getValue(),
        hash(map, "treeHash"),
        hash(map, "statementHash"),
        registrationTime);
  }

  private static String hash(CborMap map, String key) throws CborException {
    String value = text(map, key);
    if (!Hashes.isSha256Hex(value)) {
      throw new CborException(key + " is not a hex SHA-256 digest");
    }
    return value;
  }

  private static String text(CborMap map, String key) throws CborException {
    CborValue value = map.require(key);
    return value.as(CborText.class).getText();
  }

  /** True when these claims describe {@code entry} in log {@code expectedLogId}. */
  boolean matches(String expectedLogId, LogEntry entry) {
    return logId.equals(expectedLogId) && entryId.equals(entry.getEntryId())
        && treeSize == entry.getTreeSize() && treeHash.equals(entry.getTreeHash())
        && statementHash.equals(entry.getStatementHash())
        && registrationTime.equals(entry.getRegistrationTime());
  }

  public String getLogId() {
    return logId;
  }

  public String getEntryId() {
    return entryId;
  }

  public long getTreeSize() {
    return treeSize;
  }

  public String getTreeHash() {
    return treeHash;
  }

  public String getStatementHash() {
    return statementHash;
  }

  public Instant getRegistrationTime() {
    return registrationTime;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ReceiptClaims)) {
      return false;
    }
    ReceiptClaims other = (ReceiptClaims) o;
    return logId.equals(other.logId) && entryId.equals(other.entryId)
        && treeSize == other.treeSize && treeHash.equals(other.treeHash)
        && statementHash.equals(other.statementHash)
        && registrationTime.equals(other.registrationTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(logId, entryId, treeSize, treeHash, statementHash, registrationTime);
  }

  @Override
  public String toString() {
    return "ReceiptClaims{" + entryId + "@" + logId + ", treeSize=" + treeSize + "}";
  }
}
