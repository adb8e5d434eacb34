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

package com.grcorsair.parley.transparency;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.credential.CredentialToken;
import com.grcorsair.parley.evidence.EvidenceSummary;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Display metadata read from a stored statement. The statement is decoded but not verified: the
 * log only records what was submitted and makes no claim about its validity.
 */
final class StatementMetadata {
  static final String UNKNOWN = "unknown";

  private static final Logger logger = Logger.getLogger(StatementMetadata.class.getName());

  private static final StatementMetadata PROOF_ONLY = new StatementMetadata(
      UNKNOWN, UNKNOWN, UNKNOWN, null, null, ImmutableSet.of());

  final String issuer;
  final String scope;
  final String source;
  final String sourceIdentity;
  final EvidenceSummary summary;
  final ImmutableSet<String> frameworks;

  private StatementMetadata(String issuer, String scope, String source, String sourceIdentity,
      EvidenceSummary summary, ImmutableSet<String> frameworks) {
    this.issuer = issuer;
    this.scope = scope;
    this.source = source;
    this.sourceIdentity = sourceIdentity;
    this.summary = summary;
    this.frameworks = frameworks;
  }

  static StatementMetadata of(LogEntry entry) {
    return entry.getStatement().map(StatementMetadata::decode).orElse(PROOF_ONLY);
  }

  /** Missing or unreadable fields decode as {@value #UNKNOWN}. */
  static StatementMetadata decode(String statement) {
    Optional<CredentialToken> token = CredentialToken.parse(statement).success();
    if (!token.isPresent()) {
      return PROOF_ONLY;
    }
    JsonObject payload = token.get().getPayload();
    JsonObject subject = object(object(payload, "vc"), "credentialSubject");
    JsonObject provenance = object(subject, "provenance");

    JsonObject frameworks = object(subject, "frameworks");
    return new StatementMetadata(
        string(payload, "iss", UNKNOWN),
        string(subject, "scope", UNKNOWN),
        string(provenance, "source", UNKNOWN),
        string(provenance, "sourceIdentity", null),
        summary(object(subject, "summary")),
        frameworks == null ? ImmutableSet.of() : ImmutableSet.copyOf(frameworks.keySet()));
  }

  Set<String> getFrameworks() {
    return frameworks;
  }

  private static EvidenceSummary summary(JsonObject json) {
    if (json == null) {
      return null;
    }
    try {
      return EvidenceSummary.fromJson(json);
    } catch (IllegalArgumentException e) {
      logger.fine("Ignoring unreadable summary: " + e.getMessage());
      return null;
    }
  }

  private static JsonObject object(JsonObject parent, String name) {
    JsonElement element = parent == null ? null : parent.get(name);
    return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
  }

  private static String string(JsonObject parent, String name, String defaultValue) {
    JsonElement element = parent == null ? null : parent.get(name);
    if (element == null || !element.isJsonPrimitive() || element.getAsString().isEmpty()) {
      return defaultValue;
    }
    return element.getAsString();
  }
}
