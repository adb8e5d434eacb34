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

import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;
import java.io.ByteArrayOutputStream;
import java.util.Map;

/**
 * Encodes {@link CborValue}s through the {@code co.nstant.in} CBOR encoder. Heads are always the
 * shortest form: values up to 23 are stored in the initial byte, then one, two or four follow
 * bytes. Maps are written in insertion order and indefinite lengths are never produced.
 */
public final class CborEncoder {
  /** Largest argument that fits the four-byte head. */
  public static final long MAX_ARGUMENT = 0xffffffffL;

  public static byte[] encode(CborValue value) {
    return encode(toDataItem(value));
  }

  /** Encodes a single library data item without reordering map keys. */
  public static byte[] encode(DataItem item) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    co.nstant.in.cbor.CborEncoder encoder = new co.nstant.in.cbor.CborEncoder(out);
    encoder.nonCanonical();
    try {
      encoder.encode(item);
    } catch (co.nstant.in.cbor.CborException e) {
      // Writes to an in-memory stream only fail on an item the encoder does not support.
      throw new IllegalArgumentException("failed to encode CBOR item: " + item, e);
    }
    return out.toByteArray();
  }

  static DataItem toDataItem(CborValue value) {
    switch (value.getMajorType()) {
      case UNSIGNED_INTEGER:
        return new UnsignedInteger(((CborUnsigned) value).getValue());
      case NEGATIVE_INTEGER:
        return new NegativeInteger(((CborNegative) value).getValue());
      case BYTE_STRING:
        return new ByteString(((CborBytes) value).rawBytes());
      case UNICODE_STRING:
        return new UnicodeString(((CborText) value).getText());
      case ARRAY: {
        Array array = new Array();
        for (CborValue item : ((CborArray) value).getItems()) {
          array.add(toDataItem(item));
        }
        return array;
      }
      case MAP: {
        co.nstant.in.cbor.model.Map map = new co.nstant.in.cbor.model.Map();
        for (Map.Entry<CborValue, CborValue> entry : ((CborMap) value).getEntries().entrySet()) {
          map.put(toDataItem(entry.getKey()), toDataItem(entry.getValue()));
        }
        return map;
      }
      default:
        throw new IllegalArgumentException("unsupported CBOR major type: " + value.getMajorType());
    }
  }

  private CborEncoder() {}
}
