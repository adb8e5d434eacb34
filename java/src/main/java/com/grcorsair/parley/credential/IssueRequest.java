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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.grcorsair.parley.evidence.EvidenceChain;
import com.grcorsair.parley.evidence.EvidenceSummary;
import com.grcorsair.parley.evidence.FrameworkResult;
import com.grcorsair.parley.evidence.ProcessProvenance;
import com.grcorsair.parley.evidence.Provenance;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a credential should say. Either a summary or per-framework control results must be given;
 * when framework results are present the summary is derived from them.
 */
public final class IssueRequest {
  public static final Duration DEFAULT_VALIDITY = Duration.ofDays(90);

  private final String scope;
  private final Provenance provenance;
  private final EvidenceSummary summary;
  private final ImmutableList<FrameworkResult> frameworks;
  private final EvidenceChain evidenceChain;
  private final ProcessProvenance processProvenance;
  private final Duration validity;

  private IssueRequest(Builder builder) {
    this.scope = builder.scope;
    this.provenance = builder.provenance;
    this.frameworks = builder.frameworks.build();
    this.evidenceChain = builder.evidenceChain;
    this.processProvenance = builder.processProvenance;
    this.validity = builder.validity;
    if (frameworks.isEmpty()) {
      this.summary = builder.summary;
    } else {
      EvidenceSummary derived = EvidenceSummary.fromFrameworks(frameworks);
      Preconditions.checkArgument(builder.summary == null || builder.summary.equals(derived),
          "summary %s disagrees with the framework results %s", builder.summary, derived);
      this.summary = derived;
    }
  }

  public static Builder builder() {
    return new Builder();
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

  public List<FrameworkResult> getFrameworks() {
    return frameworks;
  }

  public Optional<EvidenceChain> getEvidenceChain() {
    return Optional.ofNullable(evidenceChain);
  }

  public Optional<ProcessProvenance> getProcessProvenance() {
    return Optional.ofNullable(processProvenance);
  }

  public Duration getValidity() {
    return validity;
  }

  /** Builder for {@link IssueRequest}. */
  public static final class Builder {
    private String scope;
    private Provenance provenance;
    private EvidenceSummary summary;
    private final ImmutableList.Builder<FrameworkResult> frameworks = ImmutableList.builder();
    private EvidenceChain evidenceChain;
    private ProcessProvenance processProvenance;
    private Duration validity = DEFAULT_VALIDITY;

    private Builder() {}

    public Builder setScope(String scope) {
      this.scope = scope;
      return this;
    }

    public Builder setProvenance(Provenance provenance) {
      this.provenance = provenance;
      return this;
    }

    public Builder setSummary(EvidenceSummary summary) {
      this.summary = summary;
      return this;
    }

    public Builder addFramework(FrameworkResult framework) {
      this.frameworks.add(framework);
      return this;
    }

    public Builder setEvidenceChain(EvidenceChain evidenceChain) {
      this.evidenceChain = evidenceChain;
      return this;
    }

    public Builder setProcessProvenance(ProcessProvenance processProvenance) {
      this.processProvenance = processProvenance;
      return this;
    }

    public Builder setValidity(Duration validity) {
      this.validity = validity;
      return this;
    }

    /**
     * @throws IllegalArgumentException if the scope or provenance is missing, neither a summary
     *     nor framework results were given, or the validity is not positive
     */
    public IssueRequest build() {
      Preconditions.checkArgument(scope != null && !scope.isEmpty(), "scope is required");
      Objects.requireNonNull(provenance, "provenance is required");
      Objects.requireNonNull(validity, "validity");
      Preconditions.checkArgument(!validity.isNegative() && !validity.isZero(),
          "validity must be positive: %s", validity);
      IssueRequest request = new IssueRequest(this);
      Preconditions.checkArgument(request.summary != null,
          "either a summary or framework results are required");
      return request;
    }
  }
}
