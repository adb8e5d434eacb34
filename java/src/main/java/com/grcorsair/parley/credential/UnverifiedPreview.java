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

import com.google.gson.JsonObject;
import java.util.Optional;

/**
 * Fields decoded from a token whose signature has NOT been checked. Suitable for display while
 * verification is in progress, never for a trust decision.
 */
public final class UnverifiedPreview {
  private final String keyId;
  private final String issuer;
  private final String credentialId;
  private final String scope;
  private final String validUntil;

  UnverifiedPreview(
      String keyId, String issuer, String credentialId, String scope, String validUntil) {
    this.keyId = keyId;
    this.issuer = issuer;
    this.credentialId = credentialId;
    this.scope = scope;
    this.validUntil = validUntil;
  }

  static UnverifiedPreview of(CredentialToken token) {
    JsonObject payload = token.getPayload();
    String scope = null;
    String validUntil = null;
    if (payload.has("vc") && payload.get("vc").isJsonObject()) {
      JsonObject vc = payload.getAsJsonObject("vc");
      validUntil = CredentialToken.stringMember(vc, "validUntil");
      if (vc.has("credentialSubject") && vc.get("credentialSubject").isJsonObject()) {
        scope = CredentialToken.stringMember(vc.getAsJsonObject("credentialSubject"), "scope");
      }
    }
    return new UnverifiedPreview(token.getHeaderString("kid"), token.getPayloadString("iss"),
        token.getPayloadString("jti"), scope, validUntil);
  }

  /** Always false. */
  public boolean isVerified() {
    return false;
  }

  public Optional<String> getKeyId() {
    return Optional.ofNullable(keyId);
  }

  public Optional<String> getIssuer() {
    return Optional.ofNullable(issuer);
  }

  public Optional<String> getCredentialId() {
    return Optional.ofNullable(credentialId);
  }

  public Optional<String> getScope() {
    return Optional.ofNullable(scope);
  }

  public Optional<String> getValidUntil() {
    return Optional.ofNullable(validUntil);
  }

  @Override
  public String toString() {
    return "UnverifiedPreview{issuer=" + issuer + ", credentialId=" + credentialId + ", scope="
        + scope + "}";
  }
}
