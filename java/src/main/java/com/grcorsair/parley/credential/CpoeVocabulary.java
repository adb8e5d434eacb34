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

/** Names and values shared by the issuer and the verifier. */
public final class CpoeVocabulary {
  /** W3C Verifiable Credentials Data Model v2 context. */
  public static final String VC_CONTEXT = "https://www.w3.org/ns/credentials/v2";
  public static final String CORSAIR_CONTEXT = "https://grcorsair.com/credentials/v1";
  public static final String VC_TYPE = "VerifiableCredential";
  public static final String CPOE_TYPE = "CorsairCPOE";

  /** JOSE header values. */
  public static final String ALGORITHM = "EdDSA";
  public static final String TOKEN_TYPE = "vc+jwt";
  public static final String KEY_FRAGMENT = "#key-1";

  /** Payload claim carrying the protocol version, and its current value. */
  public static final String PROTOCOL_CLAIM = "parley";
  public static final String PROTOCOL_VERSION = "2.0";

  /** Prefix of credential (subject) identifiers. */
  static final String CREDENTIAL_ID_PREFIX = "marque-";

  private CpoeVocabulary() {}
}
