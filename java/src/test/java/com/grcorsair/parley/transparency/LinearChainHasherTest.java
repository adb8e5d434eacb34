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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LinearChainHasherTest {
  private final LinearChainHasher hasher = new LinearChainHasher();

  private static final List<String> STATEMENTS = ImmutableList.of(
      Hashes.sha256Hex("statement-1"),
      Hashes.sha256Hex("statement-2"),
      Hashes.sha256Hex("statement-3"));

  @Test
  public void testChainHead() {
    assertEquals("294e0f76b3c9cbc794c0a61ba49ee627ef26812f7b84996de96487e17e237a93",
        hasher.rootHash(STATEMENTS));
    String second = hasher.rootHash(STATEMENTS.subList(0, 2));
    assertEquals(Hashes.sha256Hex(second + STATEMENTS.get(2)), hasher.rootHash(STATEMENTS));
  }

  @Test
  public void testAgreesWithMerkleOnlyForOneStatement() {
    MerkleTreeHasher merkle = new MerkleTreeHasher();
    assertEquals(merkle.rootHash(STATEMENTS.subList(0, 1)),
        hasher.rootHash(STATEMENTS.subList(0, 1)));
    assertNotEquals(merkle.rootHash(STATEMENTS), hasher.rootHash(STATEMENTS));
  }

  @Test
  public void testNoInclusionProofs() {
    assertFalse(hasher.inclusionProof(STATEMENTS, 1).isPresent());
    assertThrows(IllegalArgumentException.class, () -> hasher.rootHash(ImmutableList.of()));
  }
}
