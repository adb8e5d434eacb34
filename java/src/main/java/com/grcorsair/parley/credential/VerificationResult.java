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

import com.grcorsair.parley.util.ParleyError;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of verifying a credential. A valid result carries the claims that were covered by the
 * verified signature; a failed one carries only the reason.
 */
public final class VerificationResult {
  private final TrustTier trustTier;
  private final FailureReason failureReason;
  private final ParleyError error;
  private final String issuer;
  private final String credentialId;
  private final Instant issuedAt;
  private final Instant expiresAt;
  private final CredentialSubject subject;

  private VerificationResult(TrustTier trustTier, FailureReason failureReason, ParleyError error,
      String issuer, String credentialId, Instant issuedAt, Instant expiresAt,
      CredentialSubject subject) {
    this.trustTier = trustTier;
    this.failureReason = failureReason;
    this.error = error;
    this.issuer = issuer;
    this.credentialId = credentialId;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.subject = subject;
  }

  static VerificationResult verified(TrustTier trustTier, String issuer, String credentialId,
      Instant issuedAt, Instant expiresAt, CredentialSubject subject) {
    return new VerificationResult(Objects.requireNonNull(trustTier), null, null, issuer,
        credentialId, issuedAt, expiresAt, subject);
  }

  static VerificationResult failed(FailureReason reason, String format, Object... args) {
    return new VerificationResult(reason.getTier(), reason,
        ParleyError.of(reason.getKind(), format, args), null, null, null, null, null);
  }

  /** Converts a resolver or parser error into a failed result. */
  static VerificationResult failed(FailureReason reason, ParleyError cause) {
    return new VerificationResult(reason.getTier(), reason,
        new ParleyError(reason.getKind(), cause.getReason()), null, null, null, null, null);
  }

  public boolean isValid() {
    return failureReason == null;
  }

  public TrustTier getTrustTier() {
    return trustTier;
  }

  public Optional<FailureReason> getFailureReason() {
    return Optional.ofNullable(failureReason);
  }

  /** The failure, with its error kind; empty for a valid result. */
  public Optional<ParleyError> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<String> getIssuer() {
    return Optional.ofNullable(issuer);
  }

  public Optional<String> getCredentialId() {
    return Optional.ofNullable(credentialId);
  }

  public Optional<Instant> getIssuedAt() {
    return Optional.ofNullable(issuedAt);
  }

  public Optional<Instant> getExpiresAt() {
    return Optional.ofNullable(expiresAt);
  }

  public Optional<CredentialSubject> getSubject() {
    return Optional.ofNullable(subject);
  }

  @Override
  public String toString() {
    if (!isValid()) {
      return "VerificationResult{" + trustTier.getId() + ", " + failureReason.getId() + ": "
          + error.getReason() + "}";
    }
    return "VerificationResult{" + trustTier.getId() + ", issuer=" + issuer + ", credentialId="
        + credentialId + ", expiresAt=" + expiresAt + "}";
  }
}
