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
import com.grcorsair.parley.config.ParleyConfig;
import com.grcorsair.parley.did.DidResolver;
import com.grcorsair.parley.did.HttpDocumentFetcher;
import com.grcorsair.parley.keys.KeyManager;
import com.grcorsair.parley.util.Deadline;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/** Verifies a credential token stored in a file. */
public class CredentialVerifierMain {
  private static final Logger logger = Logger.getLogger(CredentialVerifierMain.class.getName());

  /**
   * Needs the path of a token file, and optionally the path of a trusted public key file (as
   * written by {@link KeyManager}) to verify offline instead of resolving the issuer. Exits with 0
   * when the credential verifies, 1 when it does not and 2 on bad usage.
   */
  public static void main(String[] args) throws Exception {
    if (args.length < 1 || args.length > 2) {
      System.err.println("usage: CredentialVerifierMain <token-file> [<public-key-file>]");
      System.exit(2);
    }

    String token = new String(Files.readAllBytes(Path.of(args[0])), StandardCharsets.UTF_8).trim();
    ParleyConfig config = ParleyConfig.load();
    DidResolver resolver = new DidResolver(new HttpDocumentFetcher(config.getResolverTimeout()),
        config.getResolverTimeout(), config.allowPrivateHosts());
    CredentialVerifier verifier =
        new CredentialVerifier(resolver, config.getCanonicalIssuers(), Clock.systemUTC());

    verifier.preview(token).ifSuccess(preview -> logger.fine("Verifying " + preview));
    VerificationResult result = args.length == 2
        ? verifier.verifyWithKeys(token, ImmutableList.of(KeyManager.readPublicKey(Path.of(args[1]))))
        : verifier.verify(token, Deadline.after(config.getResolverTimeout()));

    System.out.println(describe(result));
    System.exit(result.isValid() ? 0 : 1);
  }

  static String describe(VerificationResult result) {
    StringBuilder out = new StringBuilder();
    out.append("trustTier: ").append(result.getTrustTier().getId()).append('\n');
    if (!result.isValid()) {
      out.append("reason: ").append(result.getFailureReason().get().getId()).append('\n');
      out.append("detail: ").append(result.getError().get().getReason()).append('\n');
      return out.toString();
    }
    out.append("issuer: ").append(result.getIssuer().orElse("")).append('\n');
    out.append("credentialId: ").append(result.getCredentialId().orElse("")).append('\n');
    Optional<CredentialSubject> subject = result.getSubject();
    subject.ifPresent(s -> {
      out.append("scope: ").append(s.getScope()).append('\n');
      out.append("provenance: ").append(s.getProvenance().getSource().getId()).append('\n');
      out.append("score: ").append(s.getSummary().getOverallScore()).append('\n');
    });
    result.getExpiresAt().ifPresent(expiry -> out.append("expires: ").append(expiry).append('\n'));
    return out.toString();
  }
}
