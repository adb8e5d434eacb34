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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.gson.JsonObject;
import com.grcorsair.parley.util.ErrorKind;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class Ed25519PublicKeyTest {
  @Test
  public void testJwkRoundTrip() throws Exception {
    Ed25519PublicKey key = SigningKeyPair.generate().getPublicKey();
    JsonObject jwk = key.toJwk();
    assertEquals("OKP", jwk.get("kty").getAsString());
    assertEquals("Ed25519", jwk.get("crv").getAsString());
    assertFalse(jwk.get("x").getAsString().contains("="));
    assertEquals(key, Ed25519PublicKey.fromJwk(jwk).success().get());
  }

  @Test
  public void testRejectsOtherKeyTypes() throws Exception {
    JsonObject jwk = SigningKeyPair.generate().getPublicKey().toJwk();
    jwk.addProperty("kty", "EC");
    assertEquals(ErrorKind.KEY_NOT_FOUND, Ed25519PublicKey.fromJwk(jwk).error().get().getKind());
  }

  @Test
  public void testRejectsShortCoordinate() {
    JsonObject jwk = new JsonObject();
    jwk.addProperty("kty", "OKP");
    jwk.addProperty("crv", "Ed25519");
    jwk.addProperty("x", "AAAA");
    assertEquals(ErrorKind.KEY_NOT_FOUND, Ed25519PublicKey.fromJwk(jwk).error().get().getKind());
    jwk.addProperty("x", "!!!");
    assertTrue(Ed25519PublicKey.fromJwk(jwk).isError());
    assertTrue(Ed25519PublicKey.fromJwk(null).isError());
  }

  @Test
  public void testVerifyIsFalseOnBadInput() throws Exception {
    SigningKeyPair keyPair = SigningKeyPair.generate();
    byte[] data = "data".getBytes(StandardCharsets.UTF_8);
    byte[] signature = keyPair.sign(data);
    assertTrue(keyPair.getPublicKey().verify(data, signature));
    assertFalse(keyPair.getPublicKey().verify(data, new byte[10]));
    assertFalse(keyPair.getPublicKey().verify(null, signature));
    signature[0] ^= 1;
    assertFalse(keyPair.getPublicKey().verify(data, signature));
  }

  @Test
  public void testRejectsWrongLength() {
    assertThrows(IllegalArgumentException.class, () -> new Ed25519PublicKey(new byte[31]));
  }
}
