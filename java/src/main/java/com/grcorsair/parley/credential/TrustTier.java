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

package com.grcorsair.parley.credential;

/** How much a relying party can trust a credential's issuer. */
public enum TrustTier {
  /** Signed by a configured canonical issuer and verified. */
  PRIMARY_ISSUER_VERIFIED("primary-issuer-verified"),
  /** Signed by some other issuer whose key resolved and verified. */
  SELF_SIGNED_VALID("self-signed-valid"),
  /** Verification completed and failed. */
  INVALID("invalid"),
  /** Verification could not complete, e.g. the issuer's identity was unreachable. */
  UNVERIFIABLE("unverifiable");

  private final String id;

  TrustTier(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public boolean isVerified() {
    return this == PRIMARY_ISSUER_VERIFIED || this == SELF_SIGNED_VALID;
  }
}
