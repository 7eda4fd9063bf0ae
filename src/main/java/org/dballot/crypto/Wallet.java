package org.dballot.crypto;

import org.dballot.identity.Identity;

import java.security.KeyPair;
import java.util.Base64;

/**
 * A caller's key pair and the ballot identity derived from it.
 */
public class Wallet {
    private final KeyPair keyPair;

    public Wallet() {
        this(SignatureUtil.generateKeyPair());
    }

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
    }

    public KeyPair getKeyPair() {
        return keyPair;
    }

    public Identity identity() {
        return Identity.fromPublicKey(keyPair.getPublic());
    }

    /**
     * Signs {@code data} and returns the Base64 encoded signature.
     */
    public String sign(String data) {
        return Base64.getEncoder().encodeToString(SignatureUtil.sign(keyPair.getPrivate(), data));
    }
}
