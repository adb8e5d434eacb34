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

import static java.nio.charset.StandardCharsets.US_ASCII;

import com.google.common.io.BaseEncoding;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Persists exactly one Ed25519 signing keypair in a directory. Keys are stored as base64 text in
 * {@value #PRIVATE_KEY_FILENAME} and {@value #PUBLIC_KEY_FILENAME}.
 */
public class KeyManager {
  static final String PRIVATE_KEY_FILENAME = "parley-signing.key";
  static final String PUBLIC_KEY_FILENAME = "parley-signing.pub";

  private static final Logger logger = Logger.getLogger(KeyManager.class.getName());
  private static final Set<PosixFilePermission> OWNER_ONLY =
      PosixFilePermissions.fromString("rw-------");

  private final Path keyDirectory;

  public KeyManager(Path keyDirectory) {
    this.keyDirectory = keyDirectory;
  }

  public Path getKeyDirectory() {
    return keyDirectory;
  }

  /**
   * Generates a new keypair and stores both halves, replacing any keypair already stored here.
   *
   * @throws IOException if either half cannot be written
   */
  public SigningKeyPair generateKeypair() throws IOException, GeneralSecurityException {
    SigningKeyPair keyPair = SigningKeyPair.generate();
    Files.createDirectories(keyDirectory);
    writeAtomically(PRIVATE_KEY_FILENAME, keyPair.getPrivateKeyBytes(), true);
    writeAtomically(PUBLIC_KEY_FILENAME, keyPair.getPublicKey().getBytes(), false);
    logger.info("Generated signing keypair in " + keyDirectory);
    return keyPair;
  }

  /**
   * Loads the stored keypair. Never generates one.
   *
   * @return the keypair, or empty if either file is missing
   * @throws IOException if the files exist but cannot be read or do not belong together
   */
  public Optional<SigningKeyPair> loadKeypair() throws IOException {
    Path privatePath = keyDirectory.resolve(PRIVATE_KEY_FILENAME);
    Path publicPath = keyDirectory.resolve(PUBLIC_KEY_FILENAME);
    if (!Files.exists(privatePath) || !Files.exists(publicPath)) {
      return Optional.empty();
    }

    SigningKeyPair keyPair;
    byte[] storedPublicKey;
    try {
      keyPair = SigningKeyPair.fromPrivateKey(readBase64(privatePath));
      storedPublicKey = readBase64(publicPath);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new IOException("Stored signing key in " + keyDirectory + " is corrupt", e);
    }
    if (!new Ed25519PublicKey(storedPublicKey).equals(keyPair.getPublicKey())) {
      throw new IOException("Stored public key does not match the private key in " + keyDirectory);
    }
    return Optional.of(keyPair);
  }

  /** Same as {@link #loadKeypair()}, reporting absence and read failures as errors. */
  public Result<SigningKeyPair, ParleyError> loadOrFail() {
    try {
      return loadKeypair()
          .map(Result::<SigningKeyPair, ParleyError>success)
          .orElseGet(() -> ParleyError.failure(
              ErrorKind.NOT_FOUND, "no signing keypair in %s", keyDirectory));
    } catch (IOException e) {
      return ParleyError.failure(ErrorKind.NOT_FOUND, "%s", e.getMessage());
    }
  }

  /**
   * Reads a public key file in the format written by {@link #generateKeypair()}.
   *
   * @throws IOException if the file cannot be read or does not hold a 32-byte key
   */
  public static Ed25519PublicKey readPublicKey(Path path) throws IOException {
    try {
      return new Ed25519PublicKey(readBase64(path));
    } catch (IllegalArgumentException e) {
      throw new IOException("Not an Ed25519 public key: " + path, e);
    }
  }

  private void writeAtomically(String filename, byte[] key, boolean secret) throws IOException {
    Path target = keyDirectory.resolve(filename);
    Path temp = Files.createTempFile(keyDirectory, filename, ".tmp");
    try {
      if (secret) {
        restrictPermissions(temp);
      }
      Files.write(temp, BaseEncoding.base64().encode(key).getBytes(US_ASCII));
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static void restrictPermissions(Path path) throws IOException {
    try {
      Files.setPosixFilePermissions(path, OWNER_ONLY);
    } catch (UnsupportedOperationException e) {
      logger.fine("POSIX permissions unsupported for " + path);
    }
  }

  private static byte[] readBase64(Path path) throws IOException {
    return BaseEncoding.base64().decode(new String(Files.readAllBytes(path), US_ASCII).trim());
  }
}
