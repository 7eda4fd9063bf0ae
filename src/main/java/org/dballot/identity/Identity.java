package org.dballot.identity;

import org.dballot.crypto.SignatureUtil;

import java.security.PublicKey;
import java.util.Objects;

/**
 * Opaque caller identity. Remote callers use their Base64 encoded public key,
 * local callers (CLI, tests) may use any non-blank name.
 */
public final class Identity {

    private final String value;

    private Identity(String value) {
        this.value = value;
    }

    public static Identity of(String value) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("Identity must not be blank");
        return new Identity(value.trim());
    }

    public static Identity fromPublicKey(PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        return new Identity(SignatureUtil.getStringFromKey(publicKey));
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((Identity) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.length() > 24 ? value.substring(0, 12) + "…" + value.substring(value.length() - 8) : value;
    }
}
