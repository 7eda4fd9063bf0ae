package org.dballot.web;

import org.dballot.crypto.SignatureUtil;
import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.identity.Identity;
import org.dballot.util.TimeUtil;
import spark.Request;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Base64;
import java.util.function.LongSupplier;

/**
 * Establishes the caller identity of an HTTP request from its signature headers.
 * <p>
 * The caller signs {@code METHOD\ntarget\ntimestamp\nbody} with its private key, where the target is
 * the path followed by {@code ?query} when the request has one. The identity is the Base64 X.509
 * encoding of the matching public key.
 */
public class RequestAuthenticator {

    public static final String IDENTITY_HEADER = "X-Ballot-Identity";
    public static final String TIMESTAMP_HEADER = "X-Ballot-Timestamp";
    public static final String SIGNATURE_HEADER = "X-Ballot-Signature";

    private final long windowSeconds;
    private final LongSupplier clock;

    public RequestAuthenticator(long windowSeconds) {
        this(windowSeconds, TimeUtil::getCurrentUnixTime);
    }

    public RequestAuthenticator(long windowSeconds, LongSupplier clock) {
        this.windowSeconds = windowSeconds;
        this.clock = clock;
    }

    public static String signingPayload(String method, String target, long timestamp, String body) {
        return method.toUpperCase() + "\n" + target + "\n" + timestamp + "\n" + (body == null ? "" : body);
    }

    /**
     * Path plus query string, as signed by the caller.
     */
    public static String requestTarget(String path, String query) {
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    public Identity authenticate(Request request) {
        return authenticate(request.requestMethod(),
                requestTarget(request.pathInfo(), request.queryString()), request.body(),
                request.headers(IDENTITY_HEADER),
                request.headers(TIMESTAMP_HEADER),
                request.headers(SIGNATURE_HEADER));
    }

    /**
     * @return the verified caller identity
     * @throws BallotException {@link BallotError#NOT_AUTHORIZED} if any header is missing or malformed,
     *                         the timestamp is outside the window, or the signature does not verify
     */
    public Identity authenticate(String method, String target, String body,
                                 String identityHeader, String timestampHeader, String signatureHeader) {
        if (isBlank(identityHeader) || isBlank(timestampHeader) || isBlank(signatureHeader))
            throw unauthorized("Missing signature headers");

        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException e) {
            throw unauthorized("Malformed timestamp");
        }
        if (!TimeUtil.isWithinSeconds(timestamp, clock.getAsLong(), windowSeconds))
            throw unauthorized("Request timestamp outside the accepted window");

        PublicKey publicKey;
        byte[] signature;
        try {
            publicKey = SignatureUtil.getPublicKeyFromString(identityHeader);
            signature = Base64.getDecoder().decode(signatureHeader.trim());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw unauthorized("Malformed identity or signature");
        }

        if (!SignatureUtil.verify(publicKey, signature, signingPayload(method, target, timestamp, body)))
            throw unauthorized("Signature does not match");
        return Identity.fromPublicKey(publicKey);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static BallotException unauthorized(String message) {
        return new BallotException(BallotError.NOT_AUTHORIZED, message);
    }
}
