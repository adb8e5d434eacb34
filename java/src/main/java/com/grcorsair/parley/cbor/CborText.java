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
import java.util.Objects;

/** Major type 3, a UTF-8 text string. */
public final class CborText extends CborValue {
  private final String text;

  public CborText(String text) {
    super(MajorType.UNICODE_STRING);
    this.text = Objects.requireNonNull(text);
  }

  public String getText() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CborText && ((CborText) o).text.equals(text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return '"' + text + '"';
  }
}
