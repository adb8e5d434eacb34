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

package com.grcorsair.parley;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import com.grcorsair.parley.config.ParleyConfig;
import com.grcorsair.parley.credential.CredentialIssuer;
import com.grcorsair.parley.credential.CredentialVerifier;
import com.grcorsair.parley.credential.IssueRequest;
import com.grcorsair.parley.credential.IssuedCredential;
import com.grcorsair.parley.credential.TrustTier;
import com.grcorsair.parley.credential.VerificationResult;
import com.grcorsair.parley.did.DidResolver;
import com.grcorsair.parley.did.FakeDocumentFetcher;
import com.grcorsair.parley.evidence.EvidenceSummary;
import com.grcorsair.parley.evidence.Provenance;
import com.grcorsair.parley.evidence.ProvenanceSource;
import com.grcorsair.parley.keys.KeyManager;
import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.transparency.ListOptions;
import com.grcorsair.parley.transparency.ListedEntry;
import com.grcorsair.parley.transparency.Receipt;
import com.grcorsair.parley.transparency.ReceiptClaims;
import com.grcorsair.parley.transparency.ReceiptVerifier;
import com.grcorsair.parley.transparency.RegisterOptions;
import com.grcorsair.parley.transparency.Registration;
import com.grcorsair.parley.transparency.TransparencyLog;
import com.grcorsair.parley.util.Deadline;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Issues, registers, and verifies a credential the way a relying party would see it. */
@RunWith(JUnit4.class)
public class AttestationFlowTest {
  private static final String DID = "did:web:acme.com";

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testIssueRegisterVerify() throws Exception {
    ParleyConfig config = ParleyConfig.defaults();
    SigningKeyPair issuerKey = new KeyManager(folder.getRoot().toPath()).generateKeypair();
    Instant issuedAt = Instant.parse("2026-04-01T08:30:00Z");
    CredentialIssuer issuer =
        new CredentialIssuer(DID, "Acme", issuerKey, Clock.fixed(issuedAt, ZoneOffset.UTC));
    IssuedCredential credential = issuer.issue(IssueRequest.builder()
        .setScope("SOC 2 Type II - Acme Cloud")
        .setProvenance(Provenance.builder(ProvenanceSource.SELF).build())
        .setSummary(new EvidenceSummary(10, 8, 2, 80))
        .setValidity(config.getCredentialValidity())
        .build());

    TransparencyLog log = TransparencyLog.create(SigningKeyPair.generate(), config);
    Registration registration = log.register(credential.getToken(), RegisterOptions.proofOnly())
        .unwrap("Registering credential");
    Receipt receipt = log.getReceipt(registration.getEntryId()).unwrap("Fetching receipt");
    ReceiptClaims claims = ReceiptVerifier.verify(receipt, log.getPublicKey(), credential.getToken())
        .unwrap("Verifying receipt");
    assertEquals(1, claims.getTreeSize());
    assertEquals(log.currentTreeHash().get(), claims.getTreeHash());

    List<ListedEntry> listed = log.listEntries(ListOptions.defaults());
    assertEquals("unknown", listed.get(0).getIssuer());
    assertTrue(log.listEntries(ListOptions.builder().setIssuer(DID).build()).isEmpty());

    FakeDocumentFetcher fetcher = new FakeDocumentFetcher().publish(DID, issuerKey.getPublicKey());
    CredentialVerifier verifier = new CredentialVerifier(
        new DidResolver(fetcher, config.getResolverTimeout(), config.allowPrivateHosts()),
        config.getCanonicalIssuers(), Clock.fixed(issuedAt.plus(Duration.ofDays(30)), ZoneOffset.UTC));
    VerificationResult result = verifier.verify(credential.getToken(), Deadline.none());
    assertTrue(result.isValid());
    assertEquals(TrustTier.SELF_SIGNED_VALID, result.getTrustTier());
    assertEquals(80, result.getSubject().get().getSummary().getOverallScore());
    assertFalse(log.verifyChain().isPresent());

    CredentialVerifier primary = new CredentialVerifier(
        new DidResolver(fetcher, config.getResolverTimeout(), false),
        ImmutableSet.of(DID), Clock.fixed(issuedAt, ZoneOffset.UTC));
    assertEquals(TrustTier.PRIMARY_ISSUER_VERIFIED,
        primary.verify(credential.getToken(), Deadline.none()).getTrustTier());
  }
}
