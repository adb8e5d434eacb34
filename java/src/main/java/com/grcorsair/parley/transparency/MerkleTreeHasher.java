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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binary Merkle tree over hex strings. A leaf is {@code H(statementHash)}, an inner node is
 * {@code H(left + right)} over the concatenated hex strings, and a level with an odd number of
 * nodes pairs its last node with itself.
 */
public final class MerkleTreeHasher implements TreeHasher {
  public static String leafHash(String statementHash) {
    return Hashes.sha256Hex(statementHash);
  }

  public static String nodeHash(String left, String right) {
    return Hashes.sha256Hex(left + right);
  }

  @Override
  public String rootHash(List<String> statementHashes) {
    Preconditions.checkArgument(!statementHashes.isEmpty(), "empty tree has no root");
    List<String> level = leaves(statementHashes);
    while (level.size() > 1) {
      level = nextLevel(level);
    }
    return level.get(0);
  }

  @Override
  public Optional<InclusionProof> inclusionProof(List<String> statementHashes, int leafIndex) {
    Preconditions.checkElementIndex(leafIndex, statementHashes.size());
    ImmutableList.Builder<InclusionProof.Step> path = ImmutableList.builder();
    List<String> level = leaves(statementHashes);
    int index = leafIndex;
    while (level.size() > 1) {
      boolean isRight = index % 2 == 1;
      int siblingIndex = isRight ? index - 1 : Math.min(index + 1, level.size() - 1);
      path.add(new InclusionProof.Step(
          level.get(siblingIndex), isRight ? InclusionProof.Side.LEFT : InclusionProof.Side.RIGHT));
      level = nextLevel(level);
      index /= 2;
    }
    return Optional.of(new InclusionProof(
        statementHashes.get(leafIndex), leafIndex, statementHashes.size(), path.build(),
        level.get(0)));
  }

  /**
   * Recomputes the root from {@code proof}'s path and compares it to {@code expectedRoot}. Also
   * checks that the path has the length a tree of the claimed size requires.
   */
  public static boolean verifyInclusion(InclusionProof proof, String expectedRoot) {
    if (proof.getLeafIndex() < 0 || proof.getLeafIndex() >= proof.getTreeSize()
        || proof.getPath().size() != depth(proof.getTreeSize())) {
      return false;
    }
    String hash = leafHash(proof.getStatementHash());
    for (InclusionProof.Step step : proof.getPath()) {
      hash = step.getSide() == InclusionProof.Side.LEFT
          ? nodeHash(step.getHash(), hash)
          : nodeHash(hash, step.getHash());
    }
    return hash.equals(expectedRoot) && hash.equals(proof.getRootHash());
  }

  private static int depth(long treeSize) {
    int depth = 0;
    for (long width = treeSize; width > 1; width = (width + 1) / 2) {
      depth++;
    }
    return depth;
  }

  private static List<String> leaves(List<String> statementHashes) {
    List<String> leaves = new ArrayList<>(statementHashes.size());
    for (String statementHash : statementHashes) {
      leaves.add(leafHash(statementHash));
    }
    return leaves;
  }

  private static List<String> nextLevel(List<String> level) {
    List<String> next = new ArrayList<>((level.size() + 1) / 2);
    for (int i = 0; i < level.size(); i += 2) {
      String left = level.get(i);
      String right = i + 1 < level.size() ? level.get(i + 1) : left;
      next.add(nodeHash(left, right));
    }
    return next;
  }
}
