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

import java.util.Optional;

/**
 * Formats of evidence that upstream parsers normalise into an {@link EvidenceSummary}. The format
 * is resolved once, when evidence enters the system, and determines the provenance recorded in the
 * credential.
 */
public enum EvidenceFormat {
  SOC2("soc2", ProvenanceSource.AUDITOR),
  ISO27001("iso27001", ProvenanceSource.AUDITOR),
  PROWLER("prowler", ProvenanceSource.TOOL),
  SECURITY_HUB("securityhub", ProvenanceSource.TOOL),
  PENTEST("pentest", ProvenanceSource.TOOL),
  MANUAL("manual", ProvenanceSource.SELF);

  private final String id;
  private final ProvenanceSource provenanceSource;

  EvidenceFormat(String id, ProvenanceSource provenanceSource) {
    this.id = id;
    this.provenanceSource = provenanceSource;
  }

  public String getId() {
    return id;
  }

  public ProvenanceSource getProvenanceSource() {
    return provenanceSource;
  }

  public static Optional<EvidenceFormat> fromId(String id) {
    for (EvidenceFormat format : values()) {
      if (format.id.equals(id)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Provenance for evidence of this format produced by {@code sourceIdentity}. */
  public Provenance provenance(String sourceIdentity) {
    return Provenance.builder(provenanceSource).setSourceIdentity(sourceIdentity).build();
  }
}
