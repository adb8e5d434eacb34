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

import com.grcorsair.parley.keys.Ed25519PublicKey;
import com.grcorsair.parley.util.Deadline;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves did:web identifiers to DID documents and verification keys.
 *
 * <p>Each resolution performs a single fetch bounded by the smaller of the configured timeout and
 * the caller's deadline. Failures to obtain the document are reported as
 * {@link ErrorKind#UNREACHABLE_IDENTITY}, which callers may retry; documents that were fetched but
 * do not carry the requested key are reported as {@link ErrorKind#KEY_NOT_FOUND}.
 */
public class DidResolver {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private static final Logger logger = Logger.getLogger(DidResolver.class.getName());

  private final DocumentFetcher fetcher;
  private final Duration timeout;
  private final boolean allowPrivateHosts;

  public DidResolver(DocumentFetcher fetcher, Duration timeout, boolean allowPrivateHosts) {
    this.fetcher = fetcher;
    this.timeout = timeout;
    this.allowPrivateHosts = allowPrivateHosts;
  }

  /** A resolver over HTTPS with the default timeout that refuses private hosts. */
  public static DidResolver createDefault() {
    return new DidResolver(new HttpDocumentFetcher(DEFAULT_TIMEOUT), DEFAULT_TIMEOUT, false);
  }

  /**
   * Fetches and parses the DID document of {@code did}.
   *
   * @param did a did:web identifier without fragment
   * @param deadline abandons the fetch when it passes
   */
  public Result<DidDocument, ParleyError> resolve(String did, Deadline deadline) {
    DidWeb parsed;
    try {
      parsed = DidWeb.parse(did);
    } catch (IllegalArgumentException e) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "%s", e.getMessage());
    }
    if (!allowPrivateHosts && HostGuard.isBlocked(parsed.getHost())) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT,
          "Blocked: DID resolves to private/reserved address: %s", parsed.getHost());
    }
    if (deadline.isExpired()) {
      return ParleyError.failure(ErrorKind.DEADLINE_EXCEEDED, "deadline passed before resolving %s", did);
    }

    URI url = parsed.toUrl();
    Duration budget = deadline.remainingOrAtMost(timeout);
    FetchResponse response;
    try {
      logger.fine("Resolving " + did + " via " + url);
      response = fetcher.fetch(url, budget);
    } catch (HttpTimeoutException e) {
      logger.warning("Resolution of " + did + " timed out after " + budget);
      return ParleyError.failure(ErrorKind.UNREACHABLE_IDENTITY,
          "Resolution timed out after %d ms: %s", budget.toMillis(), url);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Resolution of " + did + " failed", e);
      return ParleyError.failure(ErrorKind.UNREACHABLE_IDENTITY,
          "Resolution failed: %s", e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ParleyError.failure(ErrorKind.UNREACHABLE_IDENTITY, "Resolution interrupted: %s", url);
    }

    if (!response.isSuccessful()) {
      return ParleyError.failure(ErrorKind.UNREACHABLE_IDENTITY,
          "HTTP %d from %s", response.getStatusCode(), url);
    }

    DidDocument document;
    try {
      document = DidDocument.fromJson(response.getBody());
    } catch (IllegalArgumentException e) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "%s", e.getMessage());
    }
    if (document.getId() == null || !parsed.equals(parseOrNull(document.getId()))) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT,
          "DID document id %s does not match %s", document.getId(), did);
    }
    return Result.success(document);
  }

  private static DidWeb parseOrNull(String did) {
    try {
      return DidWeb.parse(did);
    } catch (IllegalArgumentException e) {
      logger.fine("DID document id " + did + " is not a did:web identifier: " + e.getMessage());
      return null;
    }
  }

  /**
   * Resolves the verification key named by {@code keyId}, e.g. {@code did:web:example.com#key-1}.
   */
  public Result<Ed25519PublicKey, ParleyError> resolveKey(String keyId, Deadline deadline) {
    if (keyId == null || !keyId.startsWith(DidWeb.PREFIX) || !keyId.contains("#")) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT,
          "key id must be a did:web URL with a fragment, got %s", keyId);
    }
    return resolve(DidWeb.stripFragment(keyId), deadline).<Ed25519PublicKey>andThen(document -> {
      Optional<DidDocument.VerificationMethod> method = document.findVerificationMethod(keyId);
      if (method.isEmpty()) {
        return ParleyError.failure(ErrorKind.KEY_NOT_FOUND,
            "no verification method %s in DID document", keyId);
      }
      return Ed25519PublicKey.fromJwk(method.get().getPublicKeyJwk());
    });
  }
}
