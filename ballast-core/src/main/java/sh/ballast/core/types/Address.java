// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.types;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hex-encoded 20-byte account identity.
 * <p>
 * Identifies users, collateral tokens, price feeds, the debt token and the
 * engine's own custody account.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses differing only in case are equal.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * The null identity. Never a valid token, feed or account.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true if this is the zero address.
     *
     * @return whether this address is {@link #ZERO}
     */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return HEX_FORMAT.parseHex(value, 2, value.length());
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + HEX_FORMAT.formatHex(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
