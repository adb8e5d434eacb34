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

import com.google.common.base.Preconditions;
import com.grcorsair.parley.evidence.ProvenanceSource;
import java.util.Optional;

/** Paging and filters for {@link TransparencyLog#listEntries}. */
public final class ListOptions {
  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  private final int limit;
  private final int offset;
  private final String issuer;
  private final String framework;
  private final ProvenanceSource source;

  private ListOptions(Builder builder) {
    this.limit = builder.limit;
    this.offset = builder.offset;
    this.issuer = builder.issuer;
    this.framework = builder.framework;
    this.source = builder.source;
  }

  public static ListOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getLimit() {
    return limit;
  }

  public int getOffset() {
    return offset;
  }

  public Optional<String> getIssuer() {
    return Optional.ofNullable(issuer);
  }

  public Optional<String> getFramework() {
    return Optional.ofNullable(framework);
  }

  public Optional<ProvenanceSource> getSource() {
    return Optional.ofNullable(source);
  }

  /** Proof-only entries carry no metadata, so any filter excludes them. */
  boolean hasFilter() {
    return issuer != null || framework != null || source != null;
  }

  /** Builder for {@link ListOptions}. */
  public static final class Builder {
    private int limit = DEFAULT_LIMIT;
    private int offset;
    private String issuer;
    private String framework;
    private ProvenanceSource source;

    private Builder() {}

    public Builder setLimit(int limit) {
      Preconditions.checkArgument(limit > 0 && limit <= MAX_LIMIT,
          "limit must be in 1-%s: %s", MAX_LIMIT, limit);
      this.limit = limit;
      return this;
    }

    public Builder setOffset(int offset) {
      Preconditions.checkArgument(offset >= 0, "negative offset: %s", offset);
      this.offset = offset;
      return this;
    }

    public Builder setIssuer(String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder setFramework(String framework) {
      this.framework = framework;
      return this;
    }

    public Builder setSource(ProvenanceSource source) {
      this.source = source;
      return this;
    }

    public ListOptions build() {
      return new ListOptions(this);
    }
  }
}
