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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HostGuardTest {
  @Test
  public void testBlocksLocalAndPrivateHosts() {
    for (String host : new String[] {"localhost", "LOCALHOST", "printer.local", "db.internal",
        "127.0.0.1", "10.1.2.3", "172.16.0.1", "192.168.1.1", "169.254.169.254", "100.64.0.1",
        "0.0.0.0", "::1", "[::1]", "fd00::1", "fe80::1"}) {
      assertTrue(host, HostGuard.isBlocked(host));
    }
  }

  @Test
  public void testAllowsPublicHosts() {
    for (String host : new String[] {"acme.com", "grcorsair.com", "8.8.8.8", "100.128.0.1",
        "2001:4860:4860::8888"}) {
      assertFalse(host, HostGuard.isBlocked(host));
    }
  }
}
