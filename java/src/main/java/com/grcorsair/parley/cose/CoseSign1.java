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

package com.grcorsair.parley.cose;

import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.MajorType;
import co.nstant.in.cbor.model.Map;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;
import com.grcorsair.parley.cbor.CborDecoder;
import com.grcorsair.parley.cbor.CborEncoder;
import com.grcorsair.parley.cbor.CborException;
import com.grcorsair.parley.keys.Ed25519PublicKey;
import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.security.GeneralSecurityException;
import java.util.List;

/**
 * Builds and verifies single-signer COSE_Sign1 messages (RFC 9052, section 4.2).
 *
 * <pre>
 * COSE_Sign1 = [protected : bstr, unprotected : {}, payload : bstr, signature : bstr]
 * Sig_structure = ["Signature1", protected, external_aad : h'', payload]
 * </pre>
 *
 * <p>The protected header is encoded once and the same bytes are placed in the message and in the
 * {@code Sig_structure}. Verification rebuilds the {@code Sig_structure} from the bytes carried in
 * the message, so any change to header, payload or context string invalidates the signature.
 */
public final class CoseSign1 {
  /** Context string of a single-signer signature structure. */
  static final String SIGNATURE1_CONTEXT = "Signature1";

  /** Header label of the algorithm parameter. */
  static final DataItem HEADER_ALG = new UnsignedInteger(1);

  /** COSE algorithm identifier of EdDSA. */
  public static final long ALG_EDDSA = -8;

  private static final byte[] EMPTY_EXTERNAL_AAD = new byte[0];

  /**
   * Signs {@code payload} with {@code keyPair} and returns the encoded COSE_Sign1 message.
   */
  public static byte[] sign(byte[] payload, SigningKeyPair keyPair)
      throws GeneralSecurityException {
    Map header = new Map();
    header.put(HEADER_ALG, new NegativeInteger(ALG_EDDSA));
    byte[] protectedHeader = CborEncoder.encode(header);
    byte[] signature = keyPair.sign(sigStructure(protectedHeader, payload));

    Array message = new Array();
    message.add(new ByteString(protectedHeader));
    message.add(new Map());
    message.add(new ByteString(payload));
    message.add(new ByteString(signature));
    return CborEncoder.encode(message);
  }

  /**
   * Verifies an encoded COSE_Sign1 message.
   *
   * @return the payload if the signature verifies under {@code publicKey}; a
   *     {@link ErrorKind#MALFORMED_INPUT} error if the message cannot be parsed; a
   *     {@link ErrorKind#INVALID_SIGNATURE} error otherwise
   */
  public static Result<byte[], ParleyError> verify(byte[] message, Ed25519PublicKey publicKey) {
    byte[] protectedHeader;
    byte[] payload;
    byte[] signature;
    try {
      List<DataItem> elements = elements(message);
      protectedHeader = bytes(elements.get(0), "protected header");
      expect(elements.get(1), MajorType.MAP, "unprotected header");
      payload = bytes(elements.get(2), "payload");
      signature = bytes(elements.get(3), "signature");
      checkAlgorithm(protectedHeader);
    } catch (CborException e) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "invalid COSE_Sign1: %s", e.getMessage());
    }

    if (!publicKey.verify(sigStructure(protectedHeader, payload), signature)) {
      return ParleyError.failure(ErrorKind.INVALID_SIGNATURE, "COSE_Sign1 signature does not verify");
    }
    return Result.success(payload);
  }

  /**
   * Returns the payload of a COSE_Sign1 message without checking its signature. Only for
   * displaying messages whose signature is checked separately.
   */
  public static byte[] unverifiedPayload(byte[] message) throws CborException {
    return bytes(elements(message).get(2), "payload");
  }

  static byte[] sigStructure(byte[] protectedHeader, byte[] payload) {
    Array structure = new Array();
    structure.add(new UnicodeString(SIGNATURE1_CONTEXT));
    structure.add(new ByteString(protectedHeader));
    structure.add(new ByteString(EMPTY_EXTERNAL_AAD));
    structure.add(new ByteString(payload));
    return CborEncoder.encode(structure);
  }

  private static List<DataItem> elements(byte[] message) throws CborException {
    DataItem item = CborDecoder.decodeItem(message);
    expect(item, MajorType.ARRAY, "COSE_Sign1");
    List<DataItem> elements = ((Array) item).getDataItems();
    if (elements.size() != 4) {
      throw new CborException(
          String.format("COSE_Sign1 must have 4 elements, found %d", elements.size()));
    }
    return elements;
  }

  private static byte[] bytes(DataItem item, String name) throws CborException {
    expect(item, MajorType.BYTE_STRING, name);
    return ((ByteString) item).getBytes();
  }

  private static void expect(DataItem item, MajorType majorType, String name)
      throws CborException {
    if (item.getMajorType() != majorType) {
      throw new CborException(
          String.format("%s must be %s, found %s", name, majorType, item.getMajorType()));
    }
  }

  private static void checkAlgorithm(byte[] protectedHeader) throws CborException {
    DataItem item = CborDecoder.decodeItem(protectedHeader);
    expect(item, MajorType.MAP, "protected header");
    Map header = (Map) item;
    DataItem alg = header.get(HEADER_ALG);
    if (alg == null) {
      throw new CborException("protected header has no algorithm");
    }
    if (!alg.equals(new NegativeInteger(ALG_EDDSA))) {
      throw new CborException("unsupported COSE algorithm: " + alg);
    }
    if (header.getKeys().size() != 1) {
      throw new CborException("unexpected protected header parameters: " + header.getKeys());
    }
  }

  private CoseSign1() {}
}
