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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.config.ParleyConfig;
import com.grcorsair.parley.evidence.EvidenceSummary;
import com.grcorsair.parley.evidence.Provenance;
import com.grcorsair.parley.keys.KeyManager;
import com.grcorsair.parley.keys.SigningKeyPair;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Issues a credential from a JSON request file and prints the signed token. The signing keypair is
 * read from the configured key directory and generated there on first use.
 */
public class CredentialIssuerMain {
  private static final Logger logger = Logger.getLogger(CredentialIssuerMain.class.getName());

  /**
   * Needs the issuer DID and the path of a request file holding {@code scope}, {@code provenance}
   * and {@code summary} in the shape they take inside a credential subject. Exits with 2 on bad
   * usage.
   */
  public static void main(String[] args) throws Exception {
    if (args.length != 2) {
      System.err.println("usage: CredentialIssuerMain <issuer-did> <request-file>");
      System.exit(2);
    }

    ParleyConfig config = ParleyConfig.load();
    Optional<Path> keyDirectory = config.getKeyDirectory();
    if (!keyDirectory.isPresent()) {
      System.err.println(ParleyConfig.KEY_DIRECTORY + " is not set");
      System.exit(2);
    }
    SigningKeyPair keyPair = loadOrGenerate(new KeyManager(keyDirectory.get()));

    String requestJson =
        new String(Files.readAllBytes(Path.of(args[1])), StandardCharsets.UTF_8);
    IssueRequest request = parseRequest(StrictJson.parseObject(requestJson), config);
    CredentialIssuer issuer = new CredentialIssuer(args[0], null, keyPair, Clock.systemUTC());
    IssuedCredential credential = issuer.issue(request);
    logger.info("Issued " + credential);
    System.out.println(credential.getToken());
  }

  private static SigningKeyPair loadOrGenerate(KeyManager keyManager) throws Exception {
    Optional<SigningKeyPair> existing = keyManager.loadKeypair();
    if (existing.isPresent()) {
      return existing.get();
    }
    logger.info("No signing keypair in " + keyManager.getKeyDirectory() + ", generating one");
    return keyManager.generateKeypair();
  }

  /**
   * @throws IllegalArgumentException if a required member is missing or malformed
   */
  static IssueRequest parseRequest(JsonObject json, ParleyConfig config) {
    JsonElement scope = json.get("scope");
    JsonElement provenance = json.get("provenance");
    JsonElement summary = json.get("summary");
    if (scope == null || !scope.isJsonPrimitive()) {
      throw new IllegalArgumentException("request has no scope");
    }
    if (provenance == null || !provenance.isJsonObject()
        || summary == null || !summary.isJsonObject()) {
      throw new IllegalArgumentException("request needs provenance and summary objects");
    }
    return IssueRequest.builder()
        .setScope(scope.getAsString())
        .setProvenance(Provenance.fromJson(provenance.getAsJsonObject()))
        .setSummary(EvidenceSummary.fromJson(summary.getAsJsonObject()))
        .setValidity(config.getCredentialValidity())
        .build();
  }
}
