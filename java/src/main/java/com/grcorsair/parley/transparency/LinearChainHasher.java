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
import java.util.List;
import java.util.Optional;

/**
 * Hash chain over statement hashes: {@code h1 = H(s1)}, {@code hn = H(h(n-1) + sn)}. Cheap to
 * extend, but membership can only be shown by replaying the whole chain.
 */
public final class LinearChainHasher implements TreeHasher {
  @Override
  public String rootHash(List<String> statementHashes) {
    Preconditions.checkArgument(!statementHashes.isEmpty(), "empty chain has no head");
    String head = Hashes.sha256Hex(statementHashes.get(0));
    for (String statementHash : statementHashes.subList(1, statementHashes.size())) {
      head = Hashes.sha256Hex(head + statementHash);
    }
    return head;
  }

  @Override
  public Optional<InclusionProof> inclusionProof(List<String> statementHashes, int leafIndex) {
    return Optional.empty();
  }
}
