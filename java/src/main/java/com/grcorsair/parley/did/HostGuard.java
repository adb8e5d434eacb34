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

import com.google.common.net.InetAddresses;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Locale;

/**
 * Rejects identity hosts that name the local machine or a private network. Only literal addresses
 * and well-known local names are checked; no DNS lookups are made.
 */
final class HostGuard {
  static boolean isBlocked(String host) {
    String normalized = host.toLowerCase(Locale.ROOT);
    if (normalized.startsWith("[") && normalized.endsWith("]")) {
      normalized = normalized.substring(1, normalized.length() - 1);
    }
    if (normalized.equals("localhost") || normalized.endsWith(".localhost")
        || normalized.endsWith(".local") || normalized.endsWith(".internal")) {
      return true;
    }
    if (!InetAddresses.isInetAddress(normalized)) {
      return false;
    }
    InetAddress address = InetAddresses.forString(normalized);
    if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
        || address.isSiteLocalAddress() || address.isMulticastAddress()) {
      return true;
    }
    if (address instanceof Inet6Address) {
      // Unique local addresses, fc00::/7.
      return (address.getAddress()[0] & 0xfe) == 0xfc;
    }
    byte[] octets = address.getAddress();
    // Carrier-grade NAT, 100.64.0.0/10.
    return (octets[0] & 0xff) == 100 && (octets[1] & 0xc0) == 64;
  }

  private HostGuard() {}
}
