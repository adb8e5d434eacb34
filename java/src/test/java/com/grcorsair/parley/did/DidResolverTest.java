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

package com.grcorsair.parley.did;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.util.Deadline;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DidResolverTest {
  private static final String DID = "did:web:acme.com";
  private static final String KEY_ID = DID + "#key-1";

  private SigningKeyPair keyPair;
  private FakeDocumentFetcher fetcher;
  private DidResolver resolver;

  @Before
  public void setUp() throws Exception {
    keyPair = SigningKeyPair.generate();
    fetcher = new FakeDocumentFetcher();
    resolver = new DidResolver(fetcher, Duration.ofSeconds(5), false);
  }

  private static ErrorKind kindOf(Result<?, ParleyError> result) {
    return result.error().get().getKind();
  }

  @Test
  public void testResolvesPublishedKey() {
    fetcher.publish(DID, keyPair.getPublicKey());
    assertEquals(keyPair.getPublicKey(), resolver.resolveKey(KEY_ID, Deadline.none()).success().get());
    assertEquals(URI.create("https://acme.com/.well-known/did.json"), fetcher.getRequests().get(0));
  }

  @Test
  public void testResolvesRelativeMethodIds() {
    String json = DidDocument.forKey(DID, keyPair.getPublicKey()).toJson()
        .replace("\"" + KEY_ID + "\"", "\"#key-1\"");
    fetcher.respond(DID, 200, json);
    assertTrue(resolver.resolveKey(KEY_ID, Deadline.none()).isSuccess());
  }

  @Test
  public void testMissingMethodIsKeyNotFound() {
    fetcher.publish(DID, keyPair.getPublicKey());
    assertEquals(ErrorKind.KEY_NOT_FOUND, kindOf(resolver.resolveKey(DID + "#key-2", Deadline.none())));
  }

  @Test
  public void testNonEd25519KeyIsKeyNotFound() {
    String json = DidDocument.forKey(DID, keyPair.getPublicKey()).toJson()
        .replace("\"Ed25519\"", "\"P-256\"");
    fetcher.respond(DID, 200, json);
    assertEquals(ErrorKind.KEY_NOT_FOUND, kindOf(resolver.resolveKey(KEY_ID, Deadline.none())));
  }

  @Test
  public void testHttpErrorIsUnreachable() {
    fetcher.respond(DID, 503, "unavailable");
    Result<DidDocument, ParleyError> result = resolver.resolve(DID, Deadline.none());
    assertEquals(ErrorKind.UNREACHABLE_IDENTITY, kindOf(result));
    assertTrue(result.error().get().isRetryable());
    assertEquals("HTTP 503 from https://acme.com/.well-known/did.json",
        result.error().get().getReason());
  }

  @Test
  public void testMissingDocumentIsUnreachable() {
    assertEquals(ErrorKind.UNREACHABLE_IDENTITY, kindOf(resolver.resolve(DID, Deadline.none())));
  }

  @Test
  public void testTimeoutHasDistinctReason() {
    fetcher.timeOut(DID);
    Result<DidDocument, ParleyError> result = resolver.resolve(DID, Deadline.none());
    assertEquals(ErrorKind.UNREACHABLE_IDENTITY, kindOf(result));
    assertTrue(result.error().get().getReason().startsWith("Resolution timed out after 5000 ms"));
  }

  @Test
  public void testNetworkFailureIsUnreachable() {
    fetcher.fail(DID, new IOException("connection refused"));
    assertEquals(ErrorKind.UNREACHABLE_IDENTITY, kindOf(resolver.resolve(DID, Deadline.none())));
  }

  @Test
  public void testDeadlineBoundsFetchTimeout() {
    Instant now = Instant.parse("2026-03-01T10:00:00Z");
    Deadline deadline = Deadline.at(now.plusSeconds(2), Clock.fixed(now, ZoneOffset.UTC));
    fetcher.publish(DID, keyPair.getPublicKey());
    resolver.resolve(DID, deadline);
    assertEquals(Duration.ofSeconds(2), fetcher.getTimeouts().get(0));
  }

  @Test
  public void testExpiredDeadlineSkipsFetch() {
    Instant now = Instant.parse("2026-03-01T10:00:00Z");
    Deadline deadline = Deadline.at(now, Clock.fixed(now, ZoneOffset.UTC));
    assertEquals(ErrorKind.DEADLINE_EXCEEDED, kindOf(resolver.resolve(DID, deadline)));
    assertTrue(fetcher.getRequests().isEmpty());
  }

  @Test
  public void testMalformedDocument() {
    fetcher.respond(DID, 200, "{not json");
    assertEquals(ErrorKind.MALFORMED_INPUT, kindOf(resolver.resolve(DID, Deadline.none())));
  }

  @Test
  public void testDocumentForAnotherDidIsRejected() {
    fetcher.respond(DID, 200,
        DidDocument.forKey("did:web:evil.com", keyPair.getPublicKey()).toJson());
    assertEquals(ErrorKind.MALFORMED_INPUT, kindOf(resolver.resolve(DID, Deadline.none())));
  }

  @Test
  public void testPrivateHostsAreBlockedUnlessAllowed() {
    String local = "did:web:localhost%3A3000";
    fetcher.publish(local, keyPair.getPublicKey());
    assertEquals(ErrorKind.MALFORMED_INPUT, kindOf(resolver.resolve(local, Deadline.none())));
    assertEquals(ErrorKind.MALFORMED_INPUT,
        kindOf(resolver.resolve("did:web:10.0.0.8", Deadline.none())));
    assertTrue(fetcher.getRequests().isEmpty());

    DidResolver permissive = new DidResolver(fetcher, Duration.ofSeconds(5), true);
    assertTrue(permissive.resolve(local, Deadline.none()).isSuccess());
  }

  @Test
  public void testPercentEncodingCaseDoesNotMatter() {
    DidResolver permissive = new DidResolver(fetcher, Duration.ofSeconds(5), true);
    fetcher.publish("did:web:localhost%3A3000", keyPair.getPublicKey());

    assertTrue(permissive.resolve("did:web:localhost%3a3000", Deadline.none()).isSuccess());
    assertEquals(keyPair.getPublicKey(),
        permissive.resolveKey("did:web:localhost%3a3000#key-1", Deadline.none()).success().get());
  }

  @Test
  public void testNotDidWeb() {
    assertEquals(ErrorKind.MALFORMED_INPUT, kindOf(resolver.resolve("did:key:abc", Deadline.none())));
    assertEquals(ErrorKind.MALFORMED_INPUT, kindOf(resolver.resolveKey(DID, Deadline.none())));
  }
}
