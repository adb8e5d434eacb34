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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Audit path from one statement to the Merkle root of the tree it was proven against. */
public final class InclusionProof {
  /** Which side of the running hash a sibling sits on. */
  public enum Side {
    LEFT,
    RIGHT
  }

  /** One sibling hash on the path to the root. */
  public static final class Step {
    private final String hash;
    private final Side side;

    public Step(String hash, Side side) {
      this.hash = Objects.requireNonNull(hash);
      this.side = Objects.requireNonNull(side);
    }

    public String getHash() {
      return hash;
    }

    public Side getSide() {
      return side;
    }

    @Override
    public String toString() {
      return side + ":" + hash;
    }
  }

  private final String statementHash;
  private final int leafIndex;
  private final long treeSize;
  private final ImmutableList<Step> path;
  private final String rootHash;

  public InclusionProof(
      String statementHash, int leafIndex, long treeSize, List<Step> path, String rootHash) {
    this.statementHash = Objects.requireNonNull(statementHash);
    this.leafIndex = leafIndex;
    this.treeSize = treeSize;
    this.path = ImmutableList.copyOf(path);
    this.rootHash = Objects.requireNonNull(rootHash);
  }

  public String getStatementHash() {
    return statementHash;
  }

  /** Zero-based position of the statement; its entry's treeSize is {@code leafIndex + 1}. */
  public int getLeafIndex() {
    return leafIndex;
  }

  public long getTreeSize() {
    return treeSize;
  }

  public List<Step> getPath() {
    return path;
  }

  public String getRootHash() {
    return rootHash;
  }

  @Override
  public String toString() {
    return "InclusionProof{leaf=" + leafIndex + "/" + treeSize + ", root=" + rootHash + "}";
  }
}
