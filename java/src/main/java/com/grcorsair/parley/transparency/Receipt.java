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

import com.google.common.io.BaseEncoding;
import java.time.Instant;
import java.util.Objects;

/**
 * Signed proof that an entry was registered. {@link #getProof()} is a COSE_Sign1 message whose
 * payload is the CBOR encoding of {@link ReceiptClaims}, signed with the log's key.
 */
public final class Receipt {
  private final String entryId;
  private final String logId;
  private final byte[] proof;
  private final Instant issuedAt;

  public Receipt(String entryId, String logId, byte[] proof, Instant issuedAt) {
    this.entryId = Objects.requireNonNull(entryId);
    this.logId = Objects.requireNonNull(logId);
    this.proof = proof.clone();
    this.issuedAt = Objects.requireNonNull(issuedAt);
  }

  public String getEntryId() {
    return entryId;
  }

  public String getLogId() {
    return logId;
  }

  public byte[] getProof() {
    return proof.clone();
  }

  /** The proof in standard base64, as published by the log's read API. */
  public String getProofBase64() {
    return BaseEncoding.base64().encode(proof);
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  @Override
  public String toString() {
    return "Receipt{" + entryId + ", logId=" + logId + ", issuedAt=" + issuedAt + "}";
  }
}
