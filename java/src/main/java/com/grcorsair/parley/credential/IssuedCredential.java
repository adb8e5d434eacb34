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

import java.time.Instant;

/** A freshly signed credential and the identifiers assigned to it. */
public final class IssuedCredential {
  private final String token;
  private final String credentialId;
  private final Instant validFrom;
  private final Instant validUntil;

  IssuedCredential(String token, String credentialId, Instant validFrom, Instant validUntil) {
    this.token = token;
    this.credentialId = credentialId;
    this.validFrom = validFrom;
    this.validUntil = validUntil;
  }

  /** The three-segment signed token. */
  public String getToken() {
    return token;
  }

  /** The {@code marque-<uuid>} subject identifier. */
  public String getCredentialId() {
    return credentialId;
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  public Instant getValidUntil() {
    return validUntil;
  }

  @Override
  public String toString() {
    return "IssuedCredential{" + credentialId + ", validUntil=" + validUntil + "}";
  }
}
