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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import com.grcorsair.parley.did.DidDocument;
import com.grcorsair.parley.did.DidResolver;
import com.grcorsair.parley.did.FakeDocumentFetcher;
import com.grcorsair.parley.evidence.EvidenceSummary;
import com.grcorsair.parley.evidence.Provenance;
import com.grcorsair.parley.evidence.ProvenanceSource;
import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.util.Deadline;
import com.grcorsair.parley.util.ErrorKind;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.Consumer;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CredentialVerifierTest {
  private static final String DID = "did:web:acme.com";
  private static final String CANONICAL = "did:web:grcorsair.com";
  private static final Instant ISSUED = Instant.parse("2026-03-01T12:00:00Z");
  private static final Clock VERIFY_CLOCK = Clock.fixed(ISSUED.plus(Duration.ofDays(1)), ZoneOffset.UTC);

  private SigningKeyPair keyPair;
  private FakeDocumentFetcher fetcher;
  private DidResolver resolver;
  private CredentialVerifier verifier;
  private IssuedCredential issued;

  @Before
  public void setUp() throws Exception {
    keyPair = SigningKeyPair.generate();
    fetcher = new FakeDocumentFetcher().publish(DID, keyPair.getPublicKey());
    resolver = new DidResolver(fetcher, Duration.ofSeconds(5), false);
    verifier = new CredentialVerifier(resolver, ImmutableSet.of(CANONICAL), VERIFY_CLOCK);
    issued = issue(DID, keyPair);
  }

  private static IssuedCredential issue(String did, SigningKeyPair signer) throws Exception {
    CredentialIssuer issuer =
        new CredentialIssuer(did, "Acme", signer, Clock.fixed(ISSUED, ZoneOffset.UTC));
    return issuer.issue(IssueRequest.builder()
        .setScope("ISO 27001 - Acme Platform")
        .setProvenance(Provenance.builder(ProvenanceSource.AUDITOR)
            .setSourceIdentity("Example Audit LLP")
            .build())
        .setSummary(new EvidenceSummary(10, 8, 2, 80))
        .build());
  }

  /** Applies {@code edit} to the issued payload and signs it again with the issuer key. */
  private String resign(Consumer<JsonObject> edit) throws Exception {
    CredentialToken token = CredentialToken.parse(issued.getToken()).success().get();
    JsonObject payload = token.getPayload();
    edit.accept(payload);
    return CredentialToken.sign(token.getHeader(), payload, keyPair);
  }

  private static JsonObject vc(JsonObject payload) {
    return payload.getAsJsonObject("vc");
  }

  private static void assertFailure(
      VerificationResult result, FailureReason reason, TrustTier tier) {
    assertFalse(result.isValid());
    assertEquals(reason, result.getFailureReason().get());
    assertEquals(tier, result.getTrustTier());
    assertEquals(reason.getKind(), result.getError().get().getKind());
    assertFalse(result.getSubject().isPresent());
    assertFalse(result.getIssuer().isPresent());
  }

  @Test
  public void testSelfSignedIssuer() {
    VerificationResult result = verifier.verify(issued.getToken(), Deadline.none());
    assertTrue(result.isValid());
    assertEquals(TrustTier.SELF_SIGNED_VALID, result.getTrustTier());
    assertTrue(result.getTrustTier().isVerified());
    assertEquals(DID, result.getIssuer().get());
    assertEquals(issued.getCredentialId(), result.getCredentialId().get());
    assertEquals(ISSUED, result.getIssuedAt().get());
    assertEquals(issued.getValidUntil(), result.getExpiresAt().get());

    CredentialSubject subject = result.getSubject().get();
    assertEquals("ISO 27001 - Acme Platform", subject.getScope());
    assertEquals(ProvenanceSource.AUDITOR, subject.getProvenance().getSource());
    assertEquals(new EvidenceSummary(10, 8, 2, 80), subject.getSummary());
    assertTrue(subject.getFrameworks().isEmpty());
  }

  @Test
  public void testCanonicalIssuerIsPrimary() throws Exception {
    SigningKeyPair corsairKey = SigningKeyPair.generate();
    fetcher.publish(CANONICAL, corsairKey.getPublicKey());
    VerificationResult result =
        verifier.verify(issue(CANONICAL, corsairKey).getToken(), Deadline.none());
    assertEquals(TrustTier.PRIMARY_ISSUER_VERIFIED, result.getTrustTier());
  }

  @Test
  public void testUnreachableIssuerIsUnverifiable() {
    fetcher.fail(DID, new IOException("connection refused"));
    VerificationResult result = verifier.verify(issued.getToken(), Deadline.none());
    assertFailure(result, FailureReason.UNREACHABLE, TrustTier.UNVERIFIABLE);
    assertEquals(ErrorKind.UNREACHABLE_IDENTITY, result.getError().get().getKind());
  }

  @Test
  public void testTimeoutIsUnverifiable() {
    fetcher.timeOut(DID);
    assertFailure(verifier.verify(issued.getToken(), Deadline.none()),
        FailureReason.UNREACHABLE, TrustTier.UNVERIFIABLE);
  }

  @Test
  public void testExpiredDeadlineIsUnverifiable() {
    VerificationResult result =
        verifier.verify(issued.getToken(), Deadline.at(Instant.EPOCH, Clock.systemUTC()));
    assertFailure(result, FailureReason.UNREACHABLE, TrustTier.UNVERIFIABLE);
    assertTrue(fetcher.getRequests().isEmpty());
  }

  @Test
  public void testMissingKeyIsUnverifiable() {
    fetcher.respond(DID, 200,
        DidDocument.forKey(DID, keyPair.getPublicKey()).toJson().replace("#key-1", "#key-9"));
    assertFailure(verifier.verify(issued.getToken(), Deadline.none()),
        FailureReason.KEY_NOT_FOUND, TrustTier.UNVERIFIABLE);
  }

  @Test
  public void testRotatedKeyIsInvalid() throws Exception {
    fetcher.publish(DID, SigningKeyPair.generate().getPublicKey());
    assertFailure(verifier.verify(issued.getToken(), Deadline.none()),
        FailureReason.SIGNATURE_INVALID, TrustTier.INVALID);
  }

  @Test
  public void testTamperedPayloadIsInvalid() throws Exception {
    String original = issued.getToken();
    String forged = resign(payload -> vc(payload).getAsJsonObject("credentialSubject")
        .getAsJsonObject("summary").addProperty("overallScore", 100));
    String[] forgedParts = forged.split("\\.");
    String[] originalParts = original.split("\\.");
    String tampered = originalParts[0] + "." + forgedParts[1] + "." + originalParts[2];

    assertFailure(verifier.verify(tampered, Deadline.none()),
        FailureReason.SIGNATURE_INVALID, TrustTier.INVALID);
  }

  @Test
  public void testSignatureCheckedBeforeExpiry() throws Exception {
    CredentialVerifier later = new CredentialVerifier(resolver, ImmutableSet.of(),
        Clock.fixed(ISSUED.plus(Duration.ofDays(400)), ZoneOffset.UTC));
    assertFailure(later.verify(issued.getToken(), Deadline.none()),
        FailureReason.EXPIRED, TrustTier.INVALID);

    fetcher.publish(DID, SigningKeyPair.generate().getPublicKey());
    assertFailure(later.verify(issued.getToken(), Deadline.none()),
        FailureReason.SIGNATURE_INVALID, TrustTier.INVALID);
  }

  @Test
  public void testEarlierValidUntilWins() throws Exception {
    String token = resign(payload -> vc(payload).addProperty("validUntil", "2026-03-01T18:00:00Z"));
    assertFailure(verifier.verify(token, Deadline.none()),
        FailureReason.EXPIRED, TrustTier.INVALID);
  }

  @Test
  public void testIssuerMustMatchSigningKey() throws Exception {
    String token = resign(payload -> payload.addProperty("iss", CANONICAL));
    assertFailure(verifier.verify(token, Deadline.none()),
        FailureReason.ISSUER_MISMATCH, TrustTier.INVALID);
  }

  @Test
  public void testSchemaViolations() throws Exception {
    String noSummary = resign(payload -> vc(payload).getAsJsonObject("credentialSubject")
        .remove("summary"));
    assertFailure(verifier.verify(noSummary, Deadline.none()),
        FailureReason.SCHEMA_INVALID, TrustTier.INVALID);

    String wrongContext = resign(payload -> vc(payload).addProperty("@context", "urn:other"));
    assertFailure(verifier.verify(wrongContext, Deadline.none()),
        FailureReason.SCHEMA_INVALID, TrustTier.INVALID);

    String noExpiry = resign(payload -> {
      payload.remove("exp");
      vc(payload).remove("validUntil");
    });
    assertFailure(verifier.verify(noExpiry, Deadline.none()),
        FailureReason.SCHEMA_INVALID, TrustTier.INVALID);

    String badDate = resign(payload -> vc(payload).addProperty("validUntil", "next year"));
    assertFailure(verifier.verify(badDate, Deadline.none()),
        FailureReason.SCHEMA_INVALID, TrustTier.INVALID);
  }

  @Test
  public void testMalformedTokens() throws Exception {
    assertFailure(verifier.verify("not-a-token", Deadline.none()),
        FailureReason.MALFORMED, TrustTier.INVALID);

    CredentialToken token = CredentialToken.parse(issued.getToken()).success().get();
    JsonObject header = token.getHeader();
    header.addProperty("alg", "none");
    assertFailure(verifier.verify(CredentialToken.sign(header, token.getPayload(), keyPair),
        Deadline.none()), FailureReason.MALFORMED, TrustTier.INVALID);

    header.addProperty("alg", "EdDSA");
    header.addProperty("kid", "https://acme.com/keys/1");
    assertFailure(verifier.verify(CredentialToken.sign(header, token.getPayload(), keyPair),
        Deadline.none()), FailureReason.MALFORMED, TrustTier.INVALID);
    assertTrue(fetcher.getRequests().isEmpty());
  }

  @Test
  public void testVerifyWithTrustedKeys() throws Exception {
    FakeDocumentFetcher offline = new FakeDocumentFetcher();
    CredentialVerifier offlineVerifier = new CredentialVerifier(
        new DidResolver(offline, Duration.ofSeconds(5), false), ImmutableSet.of(), VERIFY_CLOCK);

    VerificationResult result = offlineVerifier.verifyWithKeys(issued.getToken(),
        ImmutableList.of(SigningKeyPair.generate().getPublicKey(), keyPair.getPublicKey()));
    assertEquals(TrustTier.SELF_SIGNED_VALID, result.getTrustTier());

    assertFailure(offlineVerifier.verifyWithKeys(issued.getToken(),
        ImmutableList.of(SigningKeyPair.generate().getPublicKey())),
        FailureReason.SIGNATURE_INVALID, TrustTier.INVALID);
    assertFailure(offlineVerifier.verifyWithKeys(issued.getToken(), ImmutableList.of()),
        FailureReason.SIGNATURE_INVALID, TrustTier.INVALID);
    assertTrue(offline.getRequests().isEmpty());
  }

  @Test
  public void testPreviewIsNeverVerified() throws Exception {
    String forged = issue(DID, SigningKeyPair.generate()).getToken();
    UnverifiedPreview preview = verifier.preview(forged).success().get();
    assertFalse(preview.isVerified());
    assertEquals(DID, preview.getIssuer().get());
    assertEquals("did:web:acme.com#key-1", preview.getKeyId().get());
    assertEquals("ISO 27001 - Acme Platform", preview.getScope().get());
    assertTrue(preview.getCredentialId().get().startsWith("marque-"));
    assertEquals(ErrorKind.MALFORMED_INPUT,
        verifier.preview("x.y").error().get().getKind());
  }

  @Test
  public void testDescribeForCommandLine() {
    String valid = CredentialVerifierMain.describe(
        verifier.verify(issued.getToken(), Deadline.none()));
    assertTrue(valid.startsWith("trustTier: self-signed-valid\n"));
    assertTrue(valid.contains("score: 80\n"));

    fetcher.timeOut(DID);
    String invalid = CredentialVerifierMain.describe(
        verifier.verify(issued.getToken(), Deadline.none()));
    assertTrue(invalid.contains("reason: unreachable\n"));
  }
}
