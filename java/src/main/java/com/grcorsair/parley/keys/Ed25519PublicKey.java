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

package com.grcorsair.parley.keys;

import com.google.common.io.BaseEncoding;
import com.google.crypto.tink.subtle.Ed25519Verify;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/** A raw 32-byte Ed25519 public key, as published in identity documents. */
public final class Ed25519PublicKey {
  public static final int KEY_SIZE_BYTES = Ed25519Verify.PUBLIC_KEY_LEN;

  private static final BaseEncoding BASE64URL = BaseEncoding.base64Url().omitPadding();

  private final byte[] publicKey;

  public Ed25519PublicKey(byte[] publicKey) {
    if (publicKey == null || publicKey.length != KEY_SIZE_BYTES) {
      throw new IllegalArgumentException(String.format(
          "Ed25519 public key must be %d bytes", KEY_SIZE_BYTES));
    }
    this.publicKey = publicKey.clone();
  }

  /**
   * Parses a JSON Web Key of type {@code OKP} on curve {@code Ed25519}.
   *
   * @return the key, or a {@link ErrorKind#KEY_NOT_FOUND} error when the JWK is not a usable
   *     Ed25519 key
   */
  public static Result<Ed25519PublicKey, ParleyError> fromJwk(JsonObject jwk) {
    if (jwk == null) {
      return ParleyError.failure(ErrorKind.KEY_NOT_FOUND, "verification method has no publicKeyJwk");
    }
    if (!"OKP".equals(stringMember(jwk, "kty")) || !"Ed25519".equals(stringMember(jwk, "crv"))) {
      return ParleyError.failure(ErrorKind.KEY_NOT_FOUND,
          "unsupported JWK: kty=%s crv=%s; only OKP/Ed25519 is supported",
          stringMember(jwk, "kty"), stringMember(jwk, "crv"));
    }
    String x = stringMember(jwk, "x");
    if (x == null) {
      return ParleyError.failure(ErrorKind.KEY_NOT_FOUND, "JWK has no 'x' coordinate");
    }
    byte[] raw;
    try {
      raw = BASE64URL.decode(x.replace("=", ""));
    } catch (IllegalArgumentException e) {
      return ParleyError.failure(
          ErrorKind.KEY_NOT_FOUND, "JWK 'x' is not base64url: %s", e.getMessage());
    }
    if (raw.length != KEY_SIZE_BYTES) {
      return ParleyError.failure(
          ErrorKind.KEY_NOT_FOUND, "JWK 'x' has %d bytes, expected %d", raw.length, KEY_SIZE_BYTES);
    }
    return Result.success(new Ed25519PublicKey(raw));
  }

  private static String stringMember(JsonObject object, String name) {
    JsonElement element = object.get(name);
    return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()
        ? element.getAsString()
        : null;
  }

  public JsonObject toJwk() {
    JsonObject jwk = new JsonObject();
    jwk.addProperty("kty", "OKP");
    jwk.addProperty("crv", "Ed25519");
    jwk.addProperty("x", BASE64URL.encode(publicKey));
    return jwk;
  }

  /**
   * Verifies the {@code signature} value over {@code data}. Any malformed input yields false.
   */
  public boolean verify(byte[] data, byte[] signature) {
    if (data == null || signature == null || signature.length != Ed25519Verify.SIGNATURE_LEN) {
      return false;
    }
    try {
      new Ed25519Verify(publicKey).verify(signature, data);
      return true;
    } catch (GeneralSecurityException e) {
      return false;
    }
  }

  public byte[] getBytes() {
    return publicKey.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Ed25519PublicKey && Arrays.equals(((Ed25519PublicKey) o).publicKey, publicKey);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(publicKey);
  }

  @Override
  public String toString() {
    return "Ed25519PublicKey(" + BASE64URL.encode(publicKey) + ")";
  }
}
