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
import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes exactly one CBOR data item of the subset written by {@link CborEncoder}, using the
 * {@code co.nstant.in} decoder for parsing. Anything else is rejected with a
 * {@link CborException}: trailing bytes, tags, floats, simple values, indefinite lengths,
 * arguments above four bytes, duplicate map keys and heads longer than necessary.
 */
public final class CborDecoder {
  /** Maximum nesting of arrays and maps. */
  static final int MAX_DEPTH = 64;

  /** Decodes {@code data} into the immutable {@link CborValue} model. */
  public static CborValue decode(byte[] data) throws CborException {
    return checkCanonical(data, readSingleItem(data));
  }

  /**
   * Decodes {@code data} into a library data item after applying the same checks as
   * {@link #decode(byte[])}.
   */
  public static DataItem decodeItem(byte[] data) throws CborException {
    DataItem item = readSingleItem(data);
    checkCanonical(data, item);
    return item;
  }

  private static DataItem readSingleItem(byte[] data) throws CborException {
    if (data == null || data.length == 0) {
      throw new CborException("empty CBOR input");
    }
    co.nstant.in.cbor.CborDecoder decoder =
        new co.nstant.in.cbor.CborDecoder(new ByteArrayInputStream(data));
    decoder.setRejectDuplicateKeys(true);
    List<DataItem> items;
    try {
      items = decoder.decode();
    } catch (co.nstant.in.cbor.CborException e) {
      throw new CborException("malformed CBOR: " + e.getMessage(), e);
    }
    if (items.size() != 1) {
      throw new CborException(
          String.format("expected one CBOR item, found %d", items.size()));
    }
    return items.get(0);
  }

  // The library accepts non-minimal heads, invalid UTF-8 and padded lengths; re-encoding the
  // decoded value must reproduce the input exactly.
  private static CborValue checkCanonical(byte[] data, DataItem item) throws CborException {
    CborValue value = toValue(item, 0);
    if (!Arrays.equals(CborEncoder.encode(value), data)) {
      throw new CborException("CBOR item is not in minimal-length encoding");
    }
    return value;
  }

  private static CborValue toValue(DataItem item, int depth) throws CborException {
    if (item == null) {
      throw new CborException("unexpected end of CBOR data");
    }
    if (depth > MAX_DEPTH) {
      throw new CborException("CBOR nesting deeper than " + MAX_DEPTH);
    }
    if (item.hasTag()) {
      throw new CborException("unsupported CBOR tag: " + item.getTag());
    }
    if ((item instanceof ByteString && ((ByteString) item).isChunked())
        || (item instanceof UnicodeString && ((UnicodeString) item).isChunked())
        || (item instanceof Array && ((Array) item).isChunked())
        || (item instanceof co.nstant.in.cbor.model.Map
            && ((co.nstant.in.cbor.model.Map) item).isChunked())) {
      throw new CborException("unsupported indefinite-length CBOR item");
    }

    switch (item.getMajorType()) {
      case UNSIGNED_INTEGER: {
        BigInteger value = ((UnsignedInteger) item).getValue();
        checkArgument(value);
        return new CborUnsigned(value.longValue());
      }
      case NEGATIVE_INTEGER: {
        BigInteger value = ((NegativeInteger) item).getValue();
        checkArgument(BigInteger.ONE.negate().subtract(value));
        return new CborNegative(value.longValue());
      }
      case BYTE_STRING:
        return new CborBytes(((ByteString) item).getBytes());
      case UNICODE_STRING:
        return new CborText(((UnicodeString) item).getString());
      case ARRAY: {
        List<CborValue> items = new ArrayList<>();
        for (DataItem child : ((Array) item).getDataItems()) {
          items.add(toValue(child, depth + 1));
        }
        return new CborArray(items);
      }
      case MAP: {
        co.nstant.in.cbor.model.Map map = (co.nstant.in.cbor.model.Map) item;
        Map<CborValue, CborValue> entries = new LinkedHashMap<>();
        for (DataItem key : map.getKeys()) {
          entries.put(toValue(key, depth + 1), toValue(map.get(key), depth + 1));
        }
        return new CborMap(entries);
      }
      default:
        throw new CborException("unsupported CBOR major type: " + item.getMajorType());
    }
  }

  private static void checkArgument(BigInteger argument) throws CborException {
    if (argument.signum() < 0 || argument.bitLength() > 32) {
      throw new CborException("CBOR argument does not fit four bytes: " + argument);
    }
  }

  private CborDecoder() {}
}
