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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Major type 5. Entries keep their insertion order, which is also the order in which they are
 * encoded.
 */
public final class CborMap extends CborValue {
  private final Map<CborValue, CborValue> entries;

  public CborMap(Map<CborValue, CborValue> entries) {
    super(MajorType.MAP);
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<CborValue, CborValue> getEntries() {
    return entries;
  }

  public CborValue get(CborValue key) {
    return entries.get(key);
  }

  /**
   * Returns the value stored under the text key {@code key}.
   *
   * @throws CborException if the key is absent
   */
  public CborValue require(String key) throws CborException {
    CborValue value = entries.get(CborValue.of(key));
    if (value == null) {
      throw new CborException("missing map key: " + key);
    }
    return value;
  }

  public int size() {
    return entries.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CborMap && ((CborMap) o).entries.equals(entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }

  /** Accumulates entries in insertion order. */
  public static final class Builder {
    private final Map<CborValue, CborValue> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(CborValue key, CborValue value) {
      entries.put(key, value);
      return this;
    }

    public Builder put(long key, long value) {
      return put(CborValue.of(key), CborValue.of(value));
    }

    public Builder put(String key, String value) {
      return put(CborValue.of(key), CborValue.of(value));
    }

    public Builder put(String key, long value) {
      return put(CborValue.of(key), CborValue.of(value));
    }

    public CborMap build() {
      return new CborMap(entries);
    }
  }
}
