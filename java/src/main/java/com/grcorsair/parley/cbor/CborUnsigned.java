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

/** Major type 0. */
public final class CborUnsigned extends CborInteger {
  public CborUnsigned(long value) {
    super(MajorType.UNSIGNED_INTEGER, value);
    if (value < 0 || value > CborEncoder.MAX_ARGUMENT) {
      throw new IllegalArgumentException("unsigned integer out of range: " + value);
    }
  }
}
