// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.examples;

import sh.ballast.core.types.Address;

final class Addresses {

    private Addresses() {
    }

    static Address of(int n) {
        return new Address(String.format("0x%040x", n));
    }
}
