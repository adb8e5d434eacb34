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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * A parsed {@code did:web} identifier.
 *
 * <pre>
 * did:web:example.com            -&gt; https://example.com/.well-known/did.json
 * did:web:example.com:users:bob  -&gt; https://example.com/users/bob/did.json
 * did:web:localhost%3A3000       -&gt; https://localhost:3000/.well-known/did.json
 * </pre>
 *
 * See <https://w3c-ccg.github.io/did-method-web/>.
 */
public final class DidWeb {
  public static final String PREFIX = "did:web:";

  private final HostAndPort authority;
  private final ImmutableList<String> path;

  private DidWeb(HostAndPort authority, List<String> path) {
    this.authority = authority;
    this.path = ImmutableList.copyOf(path);
  }

  /**
   * Parses {@code did}. A key fragment ({@code #key-1}) is not allowed here; strip it with
   * {@link #stripFragment(String)} first.
   *
   * @throws IllegalArgumentException if {@code did} is not a well-formed did:web identifier
   */
  public static DidWeb parse(String did) {
    if (did == null || !did.startsWith(PREFIX)) {
      throw new IllegalArgumentException(
          String.format("Invalid did:web identifier: must start with \"%s\", got \"%s\"", PREFIX, did));
    }
    String remainder = did.substring(PREFIX.length());
    if (remainder.isEmpty()) {
      throw new IllegalArgumentException("Invalid did:web identifier: empty domain");
    }
    if (remainder.contains("#") || remainder.contains("/") || remainder.contains("?")) {
      throw new IllegalArgumentException("Invalid did:web identifier: unexpected character in " + did);
    }

    List<String> segments = Splitter.on(':').splitToList(remainder);
    HostAndPort authority = parseAuthority(percentDecode(segments.get(0)));
    List<String> path = segments.subList(1, segments.size());
    for (String segment : path) {
      if (segment.isEmpty()) {
        throw new IllegalArgumentException("Invalid did:web identifier: empty path segment in " + did);
      }
    }
    return new DidWeb(authority, path);
  }

  /** Returns the DID part of a key identifier such as {@code did:web:example.com#key-1}. */
  public static String stripFragment(String keyId) {
    int hash = keyId.indexOf('#');
    return hash < 0 ? keyId : keyId.substring(0, hash);
  }

  /**
   * Returns whether {@code a} and {@code b} name the same did:web identifier, ignoring the case of
   * percent-encoded octets. Strings that do not parse only match themselves.
   */
  public static boolean sameDid(String a, String b) {
    if (a.equals(b)) {
      return true;
    }
    try {
      return parse(a).equals(parse(b));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Returns whether two key identifiers carry the same fragment on the same did:web identifier.
   */
  static boolean sameKeyId(String a, String b) {
    int hashA = a.indexOf('#');
    int hashB = b.indexOf('#');
    if (hashA < 0 || hashB < 0) {
      return a.equals(b);
    }
    return a.substring(hashA).equals(b.substring(hashB))
        && sameDid(a.substring(0, hashA), b.substring(0, hashB));
  }

  /**
   * Formats a domain (optionally with a port) and an optional slash-separated path as a did:web
   * identifier. This is the inverse of {@link #parse(String)}.
   */
  public static String format(String domain, String path) {
    String encodedDomain = domain.replace(":", "%3A");
    if (path == null || path.isEmpty()) {
      return PREFIX + encodedDomain;
    }
    return PREFIX + encodedDomain + ":" + String.join(":", Splitter.on('/').omitEmptyStrings().split(path));
  }

  /** The HTTPS location of the DID document. */
  public URI toUrl() {
    String suffix = path.isEmpty() ? "/.well-known/did.json" : "/" + String.join("/", path) + "/did.json";
    return URI.create("https://" + authority + suffix);
  }

  public String getHost() {
    return authority.getHost();
  }

  /** The authority as it appears in the URL, e.g. {@code localhost:3000}. */
  public String getDomain() {
    return authority.toString();
  }

  public List<String> getPath() {
    return path;
  }

  /** The canonical identifier string. */
  public String toDid() {
    return format(getDomain(), String.join("/", path));
  }

  private static HostAndPort parseAuthority(String domain) {
    HostAndPort authority;
    try {
      authority = HostAndPort.fromString(domain);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid did:web domain: " + domain, e);
    }
    String host = authority.getHost();
    if (!InternetDomainName.isValid(host) && !InetAddresses.isUriInetAddress(host)
        && !InetAddresses.isInetAddress(host)) {
      throw new IllegalArgumentException("Invalid did:web domain: " + domain);
    }
    return authority;
  }

  private static String percentDecode(String value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '%') {
        if (i + 2 >= value.length()) {
          throw new IllegalArgumentException("Invalid percent-encoding in " + value);
        }
        int hi = Character.digit(value.charAt(i + 1), 16);
        int lo = Character.digit(value.charAt(i + 2), 16);
        if (hi < 0 || lo < 0) {
          throw new IllegalArgumentException("Invalid percent-encoding in " + value);
        }
        out.write((hi << 4) | lo);
        i += 2;
      } else {
        out.writeBytes(String.valueOf(c).getBytes(StandardCharsets.UTF_8));
      }
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DidWeb)) {
      return false;
    }
    DidWeb other = (DidWeb) o;
    return authority.equals(other.authority) && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authority, path);
  }

  @Override
  public String toString() {
    return toDid();
  }
}
