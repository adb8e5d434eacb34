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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.security.GeneralSecurityException;
import java.util.List;

/**
 * A three-segment signed token, {@code base64url(header).base64url(payload).base64url(signature)},
 * where the signature covers the ASCII bytes of {@code header.payload}.
 *
 * <p>A parsed token has only been decoded. Nothing in its payload may be trusted until its
 * signature has been checked by {@link CredentialVerifier}.
 */
public final class CredentialToken {
  private static final BaseEncoding BASE64URL = BaseEncoding.base64Url().omitPadding();
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private final String encoded;
  private final JsonObject header;
  private final JsonObject payload;
  private final byte[] signature;
  private final byte[] signingInput;

  private CredentialToken(
      String encoded, JsonObject header, JsonObject payload, byte[] signature, byte[] signingInput) {
    this.encoded = encoded;
    this.header = header;
    this.payload = payload;
    this.signature = signature;
    this.signingInput = signingInput;
  }

  /**
   * Signs {@code header} and {@code payload} with {@code keyPair}. The result depends only on its
   * arguments.
   */
  public static String sign(JsonObject header, JsonObject payload, SigningKeyPair keyPair)
      throws GeneralSecurityException {
    String signingInput = BASE64URL.encode(GSON.toJson(header).getBytes(UTF_8)) + "."
        + BASE64URL.encode(GSON.toJson(payload).getBytes(UTF_8));
    byte[] signature = keyPair.sign(signingInput.getBytes(US_ASCII));
    return signingInput + "." + BASE64URL.encode(signature);
  }

  /**
   * Splits and decodes {@code token}. Fails with {@link ErrorKind#MALFORMED_INPUT} when it does not
   * have three base64url segments or the first two are not JSON objects.
   */
  public static Result<CredentialToken, ParleyError> parse(String token) {
    if (token == null || token.isEmpty()) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "empty token");
    }
    String trimmed = token.trim();
    List<String> segments = Splitter.on('.').splitToList(trimmed);
    if (segments.size() != 3) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT,
          "token must have 3 segments, found %d", segments.size());
    }
    try {
      JsonObject header = StrictJson.parseObject(new String(decodeSegment(segments.get(0)), UTF_8));
      JsonObject payload = StrictJson.parseObject(new String(decodeSegment(segments.get(1)), UTF_8));
      byte[] signature = decodeSegment(segments.get(2));
      byte[] signingInput = (segments.get(0) + "." + segments.get(1)).getBytes(US_ASCII);
      return Result.success(new CredentialToken(trimmed, header, payload, signature, signingInput));
    } catch (IllegalArgumentException e) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "malformed token: %s", e.getMessage());
    }
  }

  private static byte[] decodeSegment(String segment) {
    if (segment.isEmpty()) {
      throw new IllegalArgumentException("empty segment");
    }
    return BASE64URL.decode(segment);
  }

  /** The token exactly as parsed. */
  public String getEncoded() {
    return encoded;
  }

  public JsonObject getHeader() {
    return header.deepCopy();
  }

  public JsonObject getPayload() {
    return payload.deepCopy();
  }

  public byte[] getSignature() {
    return signature.clone();
  }

  /** The bytes covered by the signature. */
  public byte[] getSigningInput() {
    return signingInput.clone();
  }

  public String getHeaderString(String name) {
    return stringMember(header, name);
  }

  public String getPayloadString(String name) {
    return stringMember(payload, name);
  }

  static String stringMember(JsonObject object, String name) {
    JsonElement element = object == null ? null : object.get(name);
    return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()
        ? element.getAsString()
        : null;
  }
}
