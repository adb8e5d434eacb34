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

/** Summary of the hash-chained evidence records an assessment was built from. */
public final class EvidenceChain {
  private final String hashChainRoot;
  private final int recordCount;
  private final boolean chainVerified;

  public EvidenceChain(String hashChainRoot, int recordCount, boolean chainVerified) {
    this.hashChainRoot = hashChainRoot;
    this.recordCount = recordCount;
    this.chainVerified = chainVerified;
  }

  public String getHashChainRoot() {
    return hashChainRoot;
  }

  public int getRecordCount() {
    return recordCount;
  }

  public boolean isChainVerified() {
    return chainVerified;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("hashChainRoot", hashChainRoot);
    json.addProperty("recordCount", recordCount);
    json.addProperty("chainVerified", chainVerified);
    return json;
  }
}
