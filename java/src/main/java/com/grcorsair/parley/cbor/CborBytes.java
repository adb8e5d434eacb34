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
import com.google.common.io.BaseEncoding;
import java.util.Arrays;

/** Major type 2. */
public final class CborBytes extends CborValue {
  private final byte[] bytes;

  public CborBytes(byte[] bytes) {
    super(MajorType.BYTE_STRING);
    this.bytes = bytes.clone();
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  byte[] rawBytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CborBytes && Arrays.equals(((CborBytes) o).bytes, bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "h'" + BaseEncoding.base16().lowerCase().encode(bytes) + "'";
  }
}
