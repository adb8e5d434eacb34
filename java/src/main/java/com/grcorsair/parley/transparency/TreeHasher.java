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

import java.util.List;
import java.util.Optional;

/**
 * Folds the ordered statement hashes of a log into the single hash recorded as an entry's
 * {@code treeHash}. Implementations must be pure functions of the sequence.
 */
public interface TreeHasher {
  /**
   * @param statementHashes hex SHA-256 statement hashes in tree order, at least one
   * @return hex hash committing to the whole sequence
   */
  String rootHash(List<String> statementHashes);

  /**
   * Proves that the statement at {@code leafIndex} is part of the tree over {@code statementHashes},
   * or returns empty if this hasher cannot produce compact proofs.
   */
  Optional<InclusionProof> inclusionProof(List<String> statementHashes, int leafIndex);
}
