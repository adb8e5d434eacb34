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

package com.grcorsair.parley.credential;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;

/** Parses untrusted JSON without Gson's lenient extensions. */
final class StrictJson {
  private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER =
      new Gson().getAdapter(JsonElement.class);

  /**
   * Parses {@code json}, which must hold exactly one JSON object.
   *
   * @throws IllegalArgumentException if it does not
   */
  static JsonObject parseObject(String json) {
    JsonElement element;
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      element = ELEMENT_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new IllegalArgumentException("trailing data after JSON object");
      }
    } catch (IOException | JsonParseException | IllegalStateException e) {
      throw new IllegalArgumentException("invalid JSON: " + e.getMessage(), e);
    }
    if (element == null || !element.isJsonObject()) {
      throw new IllegalArgumentException("expected a JSON object");
    }
    return element.getAsJsonObject();
  }

  private StrictJson() {}
}
