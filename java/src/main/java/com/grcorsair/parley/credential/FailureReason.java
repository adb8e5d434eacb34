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

import com.grcorsair.parley.util.ErrorKind;

/** Why a credential failed verification, in the order the checks run. */
public enum FailureReason {
  MALFORMED("malformed", ErrorKind.MALFORMED_INPUT, TrustTier.INVALID),
  UNREACHABLE("unreachable", ErrorKind.UNREACHABLE_IDENTITY, TrustTier.UNVERIFIABLE),
  KEY_NOT_FOUND("key_not_found", ErrorKind.KEY_NOT_FOUND, TrustTier.UNVERIFIABLE),
  SIGNATURE_INVALID("signature_invalid", ErrorKind.INVALID_SIGNATURE, TrustTier.INVALID),
  /** The payload names a different issuer than the key that signed it. */
  ISSUER_MISMATCH("issuer_mismatch", ErrorKind.INVALID_SIGNATURE, TrustTier.INVALID),
  EXPIRED("expired", ErrorKind.EXPIRED, TrustTier.INVALID),
  SCHEMA_INVALID("schema_invalid", ErrorKind.MALFORMED_INPUT, TrustTier.INVALID);

  private final String id;
  private final ErrorKind kind;
  private final TrustTier tier;

  FailureReason(String id, ErrorKind kind, TrustTier tier) {
    this.id = id;
    this.kind = kind;
    this.tier = tier;
  }

  public String getId() {
    return id;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** The tier reported alongside this failure. */
  public TrustTier getTier() {
    return tier;
  }
}
