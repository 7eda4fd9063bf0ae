package org.dballot.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * ECDSA key handling and request signatures for ballot callers.
 * This class requires the Bouncy Castle security provider, which it registers on first use.
 */
public class SignatureUtil {

    private static final String ALGORITHM = "SHA256withECDSA";
    private static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

    static {
        if (Security.getProvider(PROVIDER) == null)
            Security.addProvider(new BouncyCastleProvider());
    }

    private SignatureUtil() {
    }

    /**
     * Generates a new prime256v1 KeyPair.
     * @return A new KeyPair object.
     */
    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("ECDSA", PROVIDER);
            keyGen.initialize(new ECGenParameterSpec("prime256v1"), new SecureRandom());
            return keyGen.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate key pair", e);
        }
    }

    /**
     * Signs a string of data using a private key.
     * @param privateKey The private key to sign with.
     * @param data The data to be signed.
     * @return An array of bytes representing the signature.
     */
    public static byte[] sign(PrivateKey privateKey, String data) {
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initSign(privateKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign data", e);
        }
    }

    /**
     * Verifies a digital signature.
     * @param publicKey The public key corresponding to the private key used for signing.
     * @param signature The signature to be verified.
     * @param data The original data that was signed.
     * @return true if the signature is valid, false otherwise.
     */
    public static boolean verify(PublicKey publicKey, byte[] signature, String data) {
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initVerify(publicKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.verify(signature);
        } catch (GeneralSecurityException e) {
            // Can be caused by an invalid signature format
            return false;
        }
    }

    /**
     * @return A Base64 encoded string representation of the key.
     */
    public static String getStringFromKey(Key key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    /**
     * Converts a Base64 X.509 public key string into a PublicKey object.
     */
    public static PublicKey getPublicKeyFromString(String key) throws GeneralSecurityException {
        byte[] keyBytes = decode(key);
        KeyFactory keyFactory = KeyFactory.getInstance("ECDSA", PROVIDER);
        return keyFactory.generatePublic(new X509EncodedKeySpec(keyBytes));
    }

    /**
     * Converts a Base64 PKCS#8 private key string into a PrivateKey object.
     */
    public static PrivateKey getPrivateKeyFromString(String key) throws GeneralSecurityException {
        byte[] keyBytes = decode(key);
        KeyFactory keyFactory = KeyFactory.getInstance("ECDSA", PROVIDER);
        return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
    }

    private static byte[] decode(String key) throws GeneralSecurityException {
        try {
            return Base64.getDecoder().decode(key.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyException("Key is not valid Base64", e);
        }
    }
}
