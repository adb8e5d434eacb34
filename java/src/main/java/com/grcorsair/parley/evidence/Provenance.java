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

package com.grcorsair.parley.evidence;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Objects;
import java.util.Optional;

/** Describes where the evidence behind a credential came from. */
public final class Provenance {
  private final ProvenanceSource source;
  private final String sourceIdentity;
  private final String sourceDocument;
  private final String sourceDate;

  private Provenance(Builder builder) {
    this.source = Objects.requireNonNull(builder.source);
    this.sourceIdentity = builder.sourceIdentity;
    this.sourceDocument = builder.sourceDocument;
    this.sourceDate = builder.sourceDate;
  }

  public static Builder builder(ProvenanceSource source) {
    return new Builder(source);
  }

  /**
   * Reads a provenance object as written by {@link #toJson()}.
   *
   * @throws IllegalArgumentException if {@code source} is missing or unknown
   */
  public static Provenance fromJson(JsonObject json) {
    String sourceId = optionalString(json, "source");
    ProvenanceSource source = ProvenanceSource.fromId(sourceId).orElseThrow(
        () -> new IllegalArgumentException("unknown provenance source: " + sourceId));
    return builder(source)
        .setSourceIdentity(optionalString(json, "sourceIdentity"))
        .setSourceDocument(optionalString(json, "sourceDocument"))
        .setSourceDate(optionalString(json, "sourceDate"))
        .build();
  }

  private static String optionalString(JsonObject json, String name) {
    JsonElement element = json.get(name);
    return element == null || element.isJsonNull() ? null : element.getAsString();
  }

  public ProvenanceSource getSource() {
    return source;
  }

  public Optional<String> getSourceIdentity() {
    return Optional.ofNullable(sourceIdentity);
  }

  /** SHA-256 of the source document, if known. */
  public Optional<String> getSourceDocument() {
    return Optional.ofNullable(sourceDocument);
  }

  /** Date of the source assessment (ISO 8601), if known. */
  public Optional<String> getSourceDate() {
    return Optional.ofNullable(sourceDate);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("source", source.getId());
    if (sourceIdentity != null) {
      json.addProperty("sourceIdentity", sourceIdentity);
    }
    if (sourceDocument != null) {
      json.addProperty("sourceDocument", sourceDocument);
    }
    if (sourceDate != null) {
      json.addProperty("sourceDate", sourceDate);
    }
    return json;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Provenance)) {
      return false;
    }
    Provenance other = (Provenance) o;
    return source == other.source && Objects.equals(sourceIdentity, other.sourceIdentity)
        && Objects.equals(sourceDocument, other.sourceDocument)
        && Objects.equals(sourceDate, other.sourceDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, sourceIdentity, sourceDocument, sourceDate);
  }

  @Override
  public String toString() {
    return toJson().toString();
  }

  /** Builder for {@link Provenance}. */
  public static final class Builder {
    private final ProvenanceSource source;
    private String sourceIdentity;
    private String sourceDocument;
    private String sourceDate;

    private Builder(ProvenanceSource source) {
      this.source = source;
    }

    public Builder setSourceIdentity(String sourceIdentity) {
      this.sourceIdentity = sourceIdentity;
      return this;
    }

    public Builder setSourceDocument(String sourceDocument) {
      this.sourceDocument = sourceDocument;
      return this;
    }

    public Builder setSourceDate(String sourceDate) {
      this.sourceDate = sourceDate;
      return this;
    }

    public Provenance build() {
      return new Provenance(this);
    }
  }
}
