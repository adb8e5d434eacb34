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

import co.nstant.in.cbor.model.MajorType;
import java.util.List;

/**
 * A decoded CBOR data item. Instances are immutable and compare structurally, so a value equals
 * the result of decoding its own encoding.
 */
public abstract class CborValue {
  private final MajorType majorType;

  CborValue(MajorType majorType) {
    this.majorType = majorType;
  }

  public MajorType getMajorType() {
    return majorType;
  }

  /** Returns an unsigned or negative integer item for {@code value}. */
  public static CborInteger of(long value) {
    return value >= 0 ? new CborUnsigned(value) : new CborNegative(value);
  }

  public static CborText of(String value) {
    return new CborText(value);
  }

  public static CborBytes of(byte[] value) {
    return new CborBytes(value);
  }

  public static CborArray array(CborValue... items) {
    return new CborArray(List.of(items));
  }

  /**
   * Casts this item to {@code type}.
   *
   * @throws CborException if the item has a different type
   */
  public <T extends CborValue> T as(Class<T> type) throws CborException {
    if (!type.isInstance(this)) {
      throw new CborException(
          String.format("expected %s, found %s", type.getSimpleName(), majorType));
    }
    return type.cast(this);
  }
}
