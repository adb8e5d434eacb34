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

import com.google.crypto.tink.subtle.Ed25519Sign;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * An Ed25519 signing keypair. Ed25519 signatures are deterministic: signing the same bytes twice
 * with the same key yields the same signature.
 */
public final class SigningKeyPair {
  private final byte[] privateKey;
  private final Ed25519PublicKey publicKey;
  private final Ed25519Sign signer;

  private SigningKeyPair(byte[] privateKey, byte[] publicKey) throws GeneralSecurityException {
    this.privateKey = privateKey.clone();
    this.publicKey = new Ed25519PublicKey(publicKey);
    this.signer = new Ed25519Sign(privateKey);
  }

  public static SigningKeyPair generate() throws GeneralSecurityException {
    Ed25519Sign.KeyPair keyPair = Ed25519Sign.KeyPair.newKeyPair();
    return new SigningKeyPair(keyPair.getPrivateKey(), keyPair.getPublicKey());
  }

  /**
   * Rebuilds a keypair from its 32-byte private seed.
   *
   * @throws GeneralSecurityException if the seed is not a valid Ed25519 private key
   */
  public static SigningKeyPair fromPrivateKey(byte[] privateKey) throws GeneralSecurityException {
    Ed25519Sign.KeyPair keyPair = Ed25519Sign.KeyPair.newKeyPairFromSeed(privateKey);
    return new SigningKeyPair(keyPair.getPrivateKey(), keyPair.getPublicKey());
  }

  public byte[] sign(byte[] data) throws GeneralSecurityException {
    return signer.sign(data);
  }

  public boolean verify(byte[] data, byte[] signature) {
    return publicKey.verify(data, signature);
  }

  public Ed25519PublicKey getPublicKey() {
    return publicKey;
  }

  byte[] getPrivateKeyBytes() {
    return privateKey.clone();
  }

  /** Two keypairs are equal when their private seeds are equal. */
  @Override
  public boolean equals(Object o) {
    return o instanceof SigningKeyPair && Arrays.equals(((SigningKeyPair) o).privateKey, privateKey);
  }

  @Override
  public int hashCode() {
    return publicKey.hashCode();
  }

  @Override
  public String toString() {
    return "SigningKeyPair(" + publicKey + ")";
  }
}
