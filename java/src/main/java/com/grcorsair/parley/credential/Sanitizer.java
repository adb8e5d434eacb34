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

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Redacts infrastructure identifiers (ARNs, account ids, keys, IP addresses, home directory paths)
 * from text that ends up in a publicly verifiable credential.
 */
final class Sanitizer {
  // Order matters: the most specific patterns are applied first.
  private static final Map<Pattern, String> REDACTIONS = ImmutableMap.<Pattern, String>builder()
      .put(Pattern.compile("arn:aws:[a-zA-Z0-9\\-]+:[a-zA-Z0-9\\-]*:\\d{12}:[^\\s,\"}\\]]+"),
          "[REDACTED-ARN]")
      .put(Pattern.compile("\\b(us|eu|ap|sa|ca|me|af)-[a-z]+-\\d+_[A-Za-z0-9]+\\b"),
          "[REDACTED-POOL]")
      .put(Pattern.compile("AKIA[A-Z0-9]{16}"), "[REDACTED-KEY]")
      .put(Pattern.compile("sk-[a-zA-Z0-9\\-_]+"), "[REDACTED-SECRET]")
      .put(Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"), "[REDACTED-IP]")
      .put(Pattern.compile("/Users/[^\\s,\"}\\]]+|/home/[^\\s,\"}\\]]+"), "[REDACTED-PATH]")
      .put(Pattern.compile("C:\\\\[^\\s,\"}\\]]+"), "[REDACTED-PATH]")
      .put(Pattern.compile("\\b\\d{12}\\b"), "[REDACTED-ACCOUNT]")
      .build();

  static String sanitize(String value) {
    String sanitized = value;
    for (Map.Entry<Pattern, String> redaction : REDACTIONS.entrySet()) {
      sanitized = redaction.getKey().matcher(sanitized).replaceAll(redaction.getValue());
    }
    return sanitized;
  }

  /** Returns a copy of {@code element} with every string value sanitized. Keys are kept. */
  static JsonElement sanitize(JsonElement element) {
    if (element.isJsonObject()) {
      JsonObject copy = new JsonObject();
      for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
        copy.add(member.getKey(), sanitize(member.getValue()));
      }
      return copy;
    }
    if (element.isJsonArray()) {
      JsonArray copy = new JsonArray();
      for (JsonElement item : element.getAsJsonArray()) {
        copy.add(sanitize(item));
      }
      return copy;
    }
    if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
      return new JsonPrimitive(sanitize(element.getAsString()));
    }
    return element.deepCopy();
  }

  private Sanitizer() {}
}
