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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.did.DidResolver;
import com.grcorsair.parley.did.DidWeb;
import com.grcorsair.parley.keys.Ed25519PublicKey;
import com.grcorsair.parley.util.Deadline;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Verifies CPOE credentials. The checks run in a fixed order and the first failure ends
 * verification: token shape, issuer key resolution, signature, expiry, credential schema. No
 * payload field is read for a decision before the signature has been verified.
 */
public class CredentialVerifier {
  private static final Logger logger = Logger.getLogger(CredentialVerifier.class.getName());

  private final DidResolver resolver;
  private final ImmutableSet<String> canonicalIssuers;
  private final Clock clock;

  public CredentialVerifier(DidResolver resolver, Set<String> canonicalIssuers, Clock clock) {
    this.resolver = Objects.requireNonNull(resolver);
    this.canonicalIssuers = ImmutableSet.copyOf(canonicalIssuers);
    this.clock = Objects.requireNonNull(clock);
  }

  /** Decodes {@code token} without verifying anything. */
  public Result<UnverifiedPreview, ParleyError> preview(String token) {
    return CredentialToken.parse(token).map(UnverifiedPreview::of);
  }

  /**
   * Verifies {@code token}, resolving the signing key from the issuer's did:web document. The
   * resolution honours {@code deadline}.
   */
  public VerificationResult verify(String token, Deadline deadline) {
    Result<CredentialToken, ParleyError> parsed = parseSigned(token);
    if (parsed.isError()) {
      return log(VerificationResult.failed(FailureReason.MALFORMED, parsed.error().get()));
    }
    CredentialToken credential = parsed.success().get();
    String keyId = credential.getHeaderString("kid");
    if (keyId == null || !keyId.startsWith(DidWeb.PREFIX) || keyId.indexOf('#') < 0) {
      return log(VerificationResult.failed(
          FailureReason.MALFORMED, "header kid is not a did:web key id: %s", keyId));
    }

    Result<Ed25519PublicKey, ParleyError> key = resolver.resolveKey(keyId, deadline);
    if (key.isError()) {
      ParleyError error = key.error().get();
      switch (error.getKind()) {
        case UNREACHABLE_IDENTITY:
        case DEADLINE_EXCEEDED:
          return log(VerificationResult.failed(FailureReason.UNREACHABLE, error));
        case KEY_NOT_FOUND:
          return log(VerificationResult.failed(FailureReason.KEY_NOT_FOUND, error));
        default:
          return log(VerificationResult.failed(FailureReason.MALFORMED, error));
      }
    }
    return log(checkSigned(
        credential, ImmutableList.of(key.success().get()), Optional.of(DidWeb.stripFragment(keyId))));
  }

  /**
   * Verifies {@code token} against already trusted keys, without network access. The token is
   * accepted if any of the keys verifies its signature.
   */
  public VerificationResult verifyWithKeys(String token, Collection<Ed25519PublicKey> keys) {
    Result<CredentialToken, ParleyError> parsed = parseSigned(token);
    if (parsed.isError()) {
      return log(VerificationResult.failed(FailureReason.MALFORMED, parsed.error().get()));
    }
    return log(checkSigned(parsed.success().get(), keys, Optional.empty()));
  }

  private static Result<CredentialToken, ParleyError> parseSigned(String token) {
    return CredentialToken.parse(token).<CredentialToken>andThen(credential -> {
      String algorithm = credential.getHeaderString("alg");
      if (!CpoeVocabulary.ALGORITHM.equals(algorithm)) {
        return ParleyError.failure(ErrorKind.MALFORMED_INPUT,
            "unsupported algorithm: %s", algorithm);
      }
      return Result.success(credential);
    });
  }

  private VerificationResult checkSigned(
      CredentialToken credential, Collection<Ed25519PublicKey> keys, Optional<String> signerDid) {
    byte[] signingInput = credential.getSigningInput();
    byte[] signature = credential.getSignature();
    if (keys.stream().noneMatch(key -> key.verify(signingInput, signature))) {
      return VerificationResult.failed(
          FailureReason.SIGNATURE_INVALID, "signature does not verify under the issuer key");
    }

    JsonObject payload = credential.getPayload();
    String issuer = credential.getPayloadString("iss");
    if (signerDid.isPresent() && !DidWeb.sameDid(signerDid.get(), issuer)) {
      return VerificationResult.failed(FailureReason.ISSUER_MISMATCH,
          "token signed by %s claims issuer %s", signerDid.get(), issuer);
    }

    JsonObject vc = payload.has("vc") && payload.get("vc").isJsonObject()
        ? payload.getAsJsonObject("vc")
        : null;
    Instant now = clock.instant();
    Instant expiresAt;
    Instant issuedAt;
    try {
      expiresAt = expiry(payload, vc);
      issuedAt = payload.has("iat") ? Instant.ofEpochSecond(payload.get("iat").getAsLong()) : null;
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException
        | DateTimeException e) {
      return VerificationResult.failed(
          FailureReason.SCHEMA_INVALID, "unreadable validity period: %s", e.getMessage());
    }
    if (expiresAt == null) {
      return VerificationResult.failed(FailureReason.SCHEMA_INVALID, "no expiry");
    }
    if (!now.isBefore(expiresAt)) {
      return VerificationResult.failed(
          FailureReason.EXPIRED, "credential expired at %s", expiresAt);
    }

    if (issuer == null || vc == null) {
      return VerificationResult.failed(FailureReason.SCHEMA_INVALID, "iss or vc missing");
    }
    if (!contains(vc.get("@context"), CpoeVocabulary.VC_CONTEXT)) {
      return VerificationResult.failed(
          FailureReason.SCHEMA_INVALID, "@context does not include %s", CpoeVocabulary.VC_CONTEXT);
    }
    if (!contains(vc.get("type"), CpoeVocabulary.VC_TYPE)) {
      return VerificationResult.failed(
          FailureReason.SCHEMA_INVALID, "type does not include %s", CpoeVocabulary.VC_TYPE);
    }
    CredentialSubject subject;
    try {
      JsonElement subjectJson = vc.get("credentialSubject");
      if (subjectJson == null || !subjectJson.isJsonObject()) {
        throw new IllegalArgumentException("credentialSubject missing");
      }
      subject = CredentialSubject.fromJson(subjectJson.getAsJsonObject());
    } catch (IllegalArgumentException e) {
      return VerificationResult.failed(FailureReason.SCHEMA_INVALID, e.getMessage());
    }

    TrustTier tier = canonicalIssuers.contains(issuer)
        ? TrustTier.PRIMARY_ISSUER_VERIFIED
        : TrustTier.SELF_SIGNED_VALID;
    String credentialId = credential.getPayloadString("jti") != null
        ? credential.getPayloadString("jti")
        : credential.getPayloadString("sub");
    return VerificationResult.verified(tier, issuer, credentialId, issuedAt, expiresAt, subject);
  }

  /** The earlier of {@code exp} and {@code vc.validUntil}, or null when neither is present. */
  private static Instant expiry(JsonObject payload, JsonObject vc) {
    Instant expiresAt = null;
    if (payload.has("exp")) {
      expiresAt = Instant.ofEpochSecond(payload.get("exp").getAsLong());
    }
    String validUntil = vc == null ? null : CredentialToken.stringMember(vc, "validUntil");
    if (validUntil != null) {
      Instant parsed = Instant.parse(validUntil);
      expiresAt = expiresAt == null || parsed.isBefore(expiresAt) ? parsed : expiresAt;
    }
    return expiresAt;
  }

  private static boolean contains(JsonElement values, String expected) {
    if (values == null) {
      return false;
    }
    if (values.isJsonArray()) {
      for (JsonElement value : values.getAsJsonArray()) {
        if (value.isJsonPrimitive() && expected.equals(value.getAsString())) {
          return true;
        }
      }
      return false;
    }
    return values.isJsonPrimitive() && expected.equals(values.getAsString());
  }

  private static VerificationResult log(VerificationResult result) {
    if (result.isValid()) {
      logger.fine("Verified " + result);
    } else {
      logger.warning("Credential verification failed: " + result);
    }
    return result;
  }
}
