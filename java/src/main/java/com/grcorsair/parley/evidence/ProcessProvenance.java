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

/**
 * Digest of the signed receipts produced by each pipeline step that turned raw evidence into the
 * credential.
 */
public final class ProcessProvenance {
  private final String chainDigest;
  private final int receiptCount;
  private final boolean chainVerified;

  public ProcessProvenance(String chainDigest, int receiptCount, boolean chainVerified) {
    this.chainDigest = chainDigest;
    this.receiptCount = receiptCount;
    this.chainVerified = chainVerified;
  }

  public String getChainDigest() {
    return chainDigest;
  }

  public int getReceiptCount() {
    return receiptCount;
  }

  public boolean isChainVerified() {
    return chainVerified;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("chainDigest", chainDigest);
    json.addProperty("receiptCount", receiptCount);
    json.addProperty("chainVerified", chainVerified);
    return json;
  }
}
