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

/** Major type 4. */
public final class CborArray extends CborValue {
  private final List<CborValue> items;

  public CborArray(List<CborValue> items) {
    super(MajorType.ARRAY);
    this.items = List.copyOf(items);
  }

  public List<CborValue> getItems() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public CborValue get(int index) {
    return items.get(index);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CborArray && ((CborArray) o).items.equals(items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }

  @Override
  public String toString() {
    return items.toString();
  }
}
