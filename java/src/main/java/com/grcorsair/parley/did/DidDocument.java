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

package com.grcorsair.parley.did;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.grcorsair.parley.keys.Ed25519PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Represents the subset of a DID document used for key discovery.
 *
 * <p>Based on <https://www.w3.org/TR/did-core/#did-documents>. The fields are not explicitly made
 * final to allow instantiation with Gson.
 */
public final class DidDocument {
  static final String DID_CONTEXT = "https://www.w3.org/ns/did/v1";
  static final String JWK_CONTEXT = "https://w3id.org/security/suites/jws-2020/v1";
  static final String KEY_TYPE = "JsonWebKey2020";
  static final String DEFAULT_KEY_FRAGMENT = "#key-1";

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  /** A public key entry of the document. */
  public static final class VerificationMethod {
    String id;
    String type;
    String controller;
    JsonObject publicKeyJwk;

    public String getId() {
      return id;
    }

    public String getType() {
      return type;
    }

    public String getController() {
      return controller;
    }

    public JsonObject getPublicKeyJwk() {
      return publicKeyJwk == null ? null : publicKeyJwk.deepCopy();
    }
  }

  @SerializedName("@context")
  List<String> context;

  String id;

  List<VerificationMethod> verificationMethod;

  List<String> authentication;

  List<String> assertionMethod;

  /**
   * Creates an instance from the given JSON string.
   *
   * @throws IllegalArgumentException if the JSON is malformed or has no {@code id}
   */
  public static DidDocument fromJson(String json) {
    DidDocument document;
    try {
      document = GSON.fromJson(json, DidDocument.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed DID document: " + e.getMessage(), e);
    }
    if (document == null || document.id == null) {
      throw new IllegalArgumentException("Malformed DID document: missing id");
    }
    return document;
  }

  /** Builds the document an issuer publishes for a single Ed25519 key. */
  public static DidDocument forKey(String did, Ed25519PublicKey publicKey) {
    VerificationMethod method = new VerificationMethod();
    method.id = did + DEFAULT_KEY_FRAGMENT;
    method.type = KEY_TYPE;
    method.controller = did;
    method.publicKeyJwk = publicKey.toJwk();

    DidDocument document = new DidDocument();
    document.context = List.of(DID_CONTEXT, JWK_CONTEXT);
    document.id = did;
    document.verificationMethod = List.of(method);
    document.authentication = List.of(method.id);
    document.assertionMethod = List.of(method.id);
    return document;
  }

  public String toJson() {
    return GSON.toJson(this);
  }

  public String getId() {
    return id;
  }

  public List<VerificationMethod> getVerificationMethods() {
    return verificationMethod == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(verificationMethod));
  }

  /**
   * Finds the verification method whose id equals {@code keyId}. Relative ids ({@code #key-1}) in
   * the document are resolved against the document id.
   */
  public Optional<VerificationMethod> findVerificationMethod(String keyId) {
    for (VerificationMethod method : getVerificationMethods()) {
      if (method == null || method.id == null) {
        continue;
      }
      String absoluteId = method.id.startsWith("#") ? id + method.id : method.id;
      if (DidWeb.sameKeyId(absoluteId, keyId)) {
        return Optional.of(method);
      }
    }
    return Optional.empty();
  }
}
