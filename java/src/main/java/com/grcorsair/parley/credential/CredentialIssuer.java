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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.grcorsair.parley.did.DidWeb;
import com.grcorsair.parley.evidence.FrameworkResult;
import com.grcorsair.parley.keys.SigningKeyPair;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Signs CPOE credentials on behalf of one did:web issuer.
 *
 * <p>Issuance has no shared mutable state; one instance may be used from many threads.
 */
public class CredentialIssuer {
  private static final Logger logger = Logger.getLogger(CredentialIssuer.class.getName());

  private final String issuerDid;
  private final String issuerName;
  private final SigningKeyPair keyPair;
  private final Clock clock;

  /**
   * @param issuerDid did:web identifier whose document publishes {@code keyPair}'s public key
   * @param issuerName display name embedded in the credential, or null
   * @throws IllegalArgumentException if {@code issuerDid} is not a did:web identifier
   */
  public CredentialIssuer(String issuerDid, String issuerName, SigningKeyPair keyPair, Clock clock) {
    this.issuerDid = DidWeb.parse(issuerDid).toDid();
    this.issuerName = issuerName;
    this.keyPair = Objects.requireNonNull(keyPair);
    this.clock = Objects.requireNonNull(clock);
  }

  public String getIssuerDid() {
    return issuerDid;
  }

  /** The key id placed in every token header. */
  public String getKeyId() {
    return issuerDid + CpoeVocabulary.KEY_FRAGMENT;
  }

  /**
   * Builds, sanitises and signs a credential for {@code request}. Every call assigns a new
   * credential id, so identical requests still produce distinct tokens.
   *
   * @throws GeneralSecurityException if the signing provider fails
   */
  public IssuedCredential issue(IssueRequest request) throws GeneralSecurityException {
    Instant validFrom = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant validUntil = validFrom.plus(request.getValidity());
    String credentialId = CpoeVocabulary.CREDENTIAL_ID_PREFIX + UUID.randomUUID();

    JsonObject header = new JsonObject();
    header.addProperty("alg", CpoeVocabulary.ALGORITHM);
    header.addProperty("typ", CpoeVocabulary.TOKEN_TYPE);
    header.addProperty("kid", getKeyId());

    JsonObject payload = new JsonObject();
    payload.addProperty("iss", issuerDid);
    payload.addProperty("sub", credentialId);
    payload.addProperty("jti", credentialId);
    payload.addProperty("iat", validFrom.getEpochSecond());
    payload.addProperty("exp", validUntil.getEpochSecond());
    payload.addProperty(CpoeVocabulary.PROTOCOL_CLAIM, CpoeVocabulary.PROTOCOL_VERSION);
    payload.add("vc", credentialBody(request, validFrom, validUntil));

    String token = CredentialToken.sign(header, payload, keyPair);
    logger.fine("Issued " + credentialId + " for " + issuerDid + " valid until " + validUntil);
    return new IssuedCredential(token, credentialId, validFrom, validUntil);
  }

  private JsonObject credentialBody(IssueRequest request, Instant validFrom, Instant validUntil) {
    JsonArray context = new JsonArray();
    context.add(CpoeVocabulary.VC_CONTEXT);
    context.add(CpoeVocabulary.CORSAIR_CONTEXT);
    JsonArray type = new JsonArray();
    type.add(CpoeVocabulary.VC_TYPE);
    type.add(CpoeVocabulary.CPOE_TYPE);

    JsonObject body = new JsonObject();
    body.add("@context", context);
    body.add("type", type);
    body.add("issuer", issuerJson());
    body.addProperty("validFrom", validFrom.toString());
    body.addProperty("validUntil", validUntil.toString());
    body.add("credentialSubject", Sanitizer.sanitize(subjectJson(request)));
    return body;
  }

  private JsonElement issuerJson() {
    if (issuerName == null) {
      return new JsonPrimitive(issuerDid);
    }
    JsonObject issuer = new JsonObject();
    issuer.addProperty("id", issuerDid);
    issuer.addProperty("name", issuerName);
    return issuer;
  }

  private static JsonObject subjectJson(IssueRequest request) {
    JsonObject subject = new JsonObject();
    subject.addProperty("type", CpoeVocabulary.CPOE_TYPE);
    subject.addProperty("scope", request.getScope());
    subject.add("provenance", request.getProvenance().toJson());
    subject.add("summary", request.getSummary().toJson());
    if (!request.getFrameworks().isEmpty()) {
      JsonObject frameworks = new JsonObject();
      for (FrameworkResult framework : request.getFrameworks()) {
        frameworks.add(framework.getFramework(), framework.toJson());
      }
      subject.add("frameworks", frameworks);
    }
    request.getEvidenceChain().ifPresent(chain -> subject.add("evidenceChain", chain.toJson()));
    request.getProcessProvenance()
        .ifPresent(process -> subject.add("processProvenance", process.toJson()));
    return subject;
  }
}
