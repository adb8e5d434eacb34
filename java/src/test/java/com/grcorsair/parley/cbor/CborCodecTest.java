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
import static org.junit.Assert.assertThrows;

import com.google.common.io.BaseEncoding;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CborCodecTest {
  private static byte[] hex(String hex) {
    return BaseEncoding.base16().lowerCase().decode(hex);
  }

  private static String hex(byte[] bytes) {
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }

  private static void assertRoundTrip(CborValue value) throws CborException {
    assertEquals(value, CborDecoder.decode(CborEncoder.encode(value)));
  }

  @Test
  public void testUnsignedHeadsAtLengthBoundaries() throws Exception {
    assertEquals("17", hex(CborEncoder.encode(CborValue.of(23))));
    assertEquals("1818", hex(CborEncoder.encode(CborValue.of(24))));
    assertEquals("18ff", hex(CborEncoder.encode(CborValue.of(255))));
    assertEquals("190100", hex(CborEncoder.encode(CborValue.of(256))));
    assertEquals("19ffff", hex(CborEncoder.encode(CborValue.of(65535))));
    assertEquals("1a00010000", hex(CborEncoder.encode(CborValue.of(65536))));
    assertEquals("1affffffff", hex(CborEncoder.encode(CborValue.of(0xffffffffL))));
    for (long value : new long[] {0, 23, 24, 255, 256, 65535, 65536, 0xffffffffL}) {
      assertRoundTrip(CborValue.of(value));
    }
  }

  @Test
  public void testNegativeIntegers() throws Exception {
    assertEquals("20", hex(CborEncoder.encode(CborValue.of(-1))));
    assertEquals("27", hex(CborEncoder.encode(CborValue.of(-8))));
    assertEquals("3818", hex(CborEncoder.encode(CborValue.of(-25))));
    assertEquals("390100", hex(CborEncoder.encode(CborValue.of(-257))));
    for (long value : new long[] {-1, -24, -25, -256, -257, -65536, -65537}) {
      assertRoundTrip(CborValue.of(value));
    }
  }

  @Test
  public void testStringsAtLengthBoundaries() throws Exception {
    assertEquals("40", hex(CborEncoder.encode(CborValue.of(new byte[0]))));
    assertEquals("60", hex(CborEncoder.encode(CborValue.of(""))));
    for (int length : new int[] {0, 23, 24, 255, 256, 65535, 65536}) {
      assertRoundTrip(CborValue.of(new byte[length]));
      assertRoundTrip(CborValue.of("x".repeat(length)));
    }
    assertRoundTrip(CborValue.of("héllo ☃"));
  }

  @Test
  public void testNestedArraysAndMaps() throws Exception {
    CborValue value = CborValue.array(
        CborValue.array(),
        CborMap.builder().build(),
        CborMap.builder()
            .put(CborValue.of("inner"), CborValue.array(CborValue.of(1), CborValue.of("two"), CborValue.of(-3)))
            .put(CborValue.of(7), CborMap.builder().put(1, -8).build())
            .build(),
        CborValue.of(new byte[] {1, 2, 3}));
    assertRoundTrip(value);
  }

  @Test
  public void testCoseProtectedHeaderBytes() {
    assertArrayEquals(hex("a10127"), CborEncoder.encode(CborMap.builder().put(1, -8).build()));
  }

  @Test
  public void testMapsKeepInsertionOrder() {
    CborMap map = CborMap.builder().put("b", 1).put("a", 2).build();
    assertEquals("a2616201616102", hex(CborEncoder.encode(map)));
  }

  @Test
  public void testEncoderRejectsArgumentsAboveFourBytes() {
    assertThrows(IllegalArgumentException.class, () -> CborValue.of(0x100000000L));
    assertThrows(IllegalArgumentException.class, () -> CborValue.of(-0x100000001L));
  }

  @Test
  public void testDecoderRejectsTruncatedInput() {
    assertThrows(CborException.class, () -> CborDecoder.decode(new byte[0]));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("19ff")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("430102")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("8201")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("a16161")));
  }

  @Test
  public void testDecoderRejectsUnsupportedItems() {
    // 8-byte argument
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("1b0000000100000000")));
    // indefinite-length array
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("9fff")));
    // tag
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("c11a514b67b0")));
    // simple value true
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("f5")));
  }

  @Test
  public void testDecoderRejectsNonMinimalHeads() throws Exception {
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("1805")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("190017")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("1a0000ffff")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("3817")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("580161")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("780161")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("9800")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("b800")));
    assertThrows(CborException.class, () -> CborDecoder.decodeItem(hex("1805")));
    assertEquals(CborValue.of(24), CborDecoder.decode(hex("1818")));
    assertEquals(CborValue.of(65536), CborDecoder.decode(hex("1a00010000")));
  }

  @Test
  public void testDecoderRejectsTrailingBytes() {
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("0101")));
  }

  @Test
  public void testDecoderRejectsDuplicateKeysAndBadUtf8() {
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("a2616101616102")));
    assertThrows(CborException.class, () -> CborDecoder.decode(hex("62c328")));
  }

  @Test
  public void testDecoderLimitsNesting() {
    byte[] deep = new byte[200];
    for (int i = 0; i < deep.length - 1; i++) {
      deep[i] = (byte) 0x81;
    }
    deep[deep.length - 1] = 0x00;
    assertThrows(CborException.class, () -> CborDecoder.decode(deep));
  }

  @Test
  public void testAsChecksType() throws Exception {
    CborValue value = CborDecoder.decode(hex("6161"));
    assertEquals("a", value.as(CborText.class).getText());
    assertThrows(CborException.class, () -> value.as(CborMap.class));
  }
}
