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

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.evidence.EvidenceSummary;
import com.grcorsair.parley.evidence.Provenance;
import java.util.Objects;
import java.util.Set;

/** The claims a credential makes about an assessment, as read back from a token payload. */
public final class CredentialSubject {
  private final String scope;
  private final Provenance provenance;
  private final EvidenceSummary summary;
  private final ImmutableSet<String> frameworks;

  public CredentialSubject(
      String scope, Provenance provenance, EvidenceSummary summary, Set<String> frameworks) {
    this.scope = Objects.requireNonNull(scope);
    this.provenance = Objects.requireNonNull(provenance);
    this.summary = Objects.requireNonNull(summary);
    this.frameworks = ImmutableSet.copyOf(frameworks);
  }

  /**
   * Reads the {@code credentialSubject} object of a credential.
   *
   * @throws IllegalArgumentException if the type, scope, provenance or summary is missing or
   *     malformed
   */
  public static CredentialSubject fromJson(JsonObject json) {
    if (!CpoeVocabulary.CPOE_TYPE.equals(CredentialToken.stringMember(json, "type"))) {
      throw new IllegalArgumentException("credentialSubject.type is not " + CpoeVocabulary.CPOE_TYPE);
    }
    String scope = CredentialToken.stringMember(json, "scope");
    if (scope == null) {
      throw new IllegalArgumentException("credentialSubject.scope missing");
    }
    Provenance provenance = Provenance.fromJson(object(json, "provenance"));
    EvidenceSummary summary = EvidenceSummary.fromJson(object(json, "summary"));
    ImmutableSet.Builder<String> frameworks = ImmutableSet.builder();
    JsonElement frameworksJson = json.get("frameworks");
    if (frameworksJson != null && frameworksJson.isJsonObject()) {
      frameworks.addAll(frameworksJson.getAsJsonObject().keySet());
    }
    return new CredentialSubject(scope, provenance, summary, frameworks.build());
  }

  private static JsonObject object(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || !element.isJsonObject()) {
      throw new IllegalArgumentException("credentialSubject." + name + " missing");
    }
    return element.getAsJsonObject();
  }

  public String getScope() {
    return scope;
  }

  public Provenance getProvenance() {
    return provenance;
  }

  public EvidenceSummary getSummary() {
    return summary;
  }

  /** Names of the frameworks the credential maps controls to; empty when none were supplied. */
  public Set<String> getFrameworks() {
    return frameworks;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CredentialSubject)) {
      return false;
    }
    CredentialSubject other = (CredentialSubject) o;
    return scope.equals(other.scope) && provenance.equals(other.provenance)
        && summary.equals(other.summary) && frameworks.equals(other.frameworks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scope, provenance, summary, frameworks);
  }

  @Override
  public String toString() {
    return "CredentialSubject{scope=" + scope + ", provenance=" + provenance + ", summary="
        + summary + ", frameworks=" + frameworks + "}";
  }
}
