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

package com.grcorsair.parley.cbor;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import co.nstant.in.cbor.CborBuilder;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;
import com.google.common.io.BaseEncoding;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Checks the mapping between {@link CborValue} and {@code co.nstant.in} data items. */
@RunWith(JUnit4.class)
public class CborInteropTest {
  @Test
  public void testValuesMapToLibraryItems() throws Exception {
    byte[] encoded = CborEncoder.encode(CborMap.builder()
        .put("treeSize", 65536)
        .put("treeHash", "ab")
        .put(CborValue.of("alg"), CborValue.of(-8))
        .put(CborValue.of("sig"), CborValue.of(new byte[] {9, 8}))
        .put(CborValue.of("path"), CborValue.array(CborValue.of(300), CborValue.of("")))
        .build());

    List<DataItem> items =
        new co.nstant.in.cbor.CborDecoder(new ByteArrayInputStream(encoded)).decode();
    assertEquals(1, items.size());
    co.nstant.in.cbor.model.Map map = (co.nstant.in.cbor.model.Map) items.get(0);
    assertEquals(BigInteger.valueOf(65536),
        ((UnsignedInteger) map.get(new UnicodeString("treeSize"))).getValue());
    assertEquals("ab", ((UnicodeString) map.get(new UnicodeString("treeHash"))).getString());
    assertEquals(BigInteger.valueOf(-8),
        ((NegativeInteger) map.get(new UnicodeString("alg"))).getValue());
    assertArrayEquals(new byte[] {9, 8},
        ((ByteString) map.get(new UnicodeString("sig"))).getBytes());
    Array path = (Array) map.get(new UnicodeString("path"));
    assertEquals(BigInteger.valueOf(300), ((UnsignedInteger) path.getDataItems().get(0)).getValue());
    assertEquals("", ((UnicodeString) path.getDataItems().get(1)).getString());
  }

  @Test
  public void testLibraryItemsMapToValues() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    new co.nstant.in.cbor.CborEncoder(out).encode(new CborBuilder()
        .addArray()
            .add(255)
            .add(-257)
            .add("Signature1")
            .add(new byte[0])
            .end()
        .build());

    CborArray array = CborDecoder.decode(out.toByteArray()).as(CborArray.class);
    assertEquals(CborValue.of(255), array.get(0));
    assertEquals(CborValue.of(-257), array.get(1));
    assertEquals(CborValue.of("Signature1"), array.get(2));
    assertArrayEquals(new byte[0], array.get(3).as(CborBytes.class).getBytes());
  }

  @Test
  public void testLibraryMapsKeepInsertionOrder() throws Exception {
    co.nstant.in.cbor.model.Map map = new co.nstant.in.cbor.model.Map();
    map.put(new UnicodeString("bb"), new UnsignedInteger(1));
    map.put(new UnicodeString("a"), new UnsignedInteger(2));
    assertEquals("a262626201616102", hex(CborEncoder.encode(map)));
  }

  @Test
  public void testDecodeItemReturnsLibraryItem() throws Exception {
    DataItem item = CborDecoder.decodeItem(CborEncoder.encode(CborMap.builder().put(1, -8).build()));
    co.nstant.in.cbor.model.Map header = (co.nstant.in.cbor.model.Map) item;
    assertEquals(new NegativeInteger(-8), header.get(new UnsignedInteger(1)));
  }

  private static String hex(byte[] bytes) {
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }
}
