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

import java.util.Locale;
import java.util.Optional;

/** Who produced the evidence behind a credential. */
public enum ProvenanceSource {
  /** Self-reported by the organisation being assessed. */
  SELF,
  /** Generated by an automated scanning tool. */
  TOOL,
  /** Attested by an independent auditor. */
  AUDITOR;

  /** The lower-case name used in credentials. */
  public String getId() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ProvenanceSource> fromId(String id) {
    for (ProvenanceSource source : values()) {
      if (source.getId().equals(id)) {
        return Optional.of(source);
      }
    }
    return Optional.empty();
  }
}
