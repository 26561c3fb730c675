package warden.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import warden.core.model.auth.ApiKeyCandidate;
import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthResult;
import warden.core.model.auth.MacAlgorithm;

/**
 * Verifies API-key request signatures.
 *
 * <p>The signed message is the UTF-8 encoding of, in this order and without separators:
 * <ol>
 *   <li>the resource path</li>
 *   <li>the nonce as an unsigned decimal number</li>
 *   <li>the canonical JSON of the payload (see {@link PayloadCanonicalizer})</li>
 * </ol>
 * The signature is the hex encoding of the keyed MAC over that message.
 */
public class ApiKeySignatureValidator {

    private static final HexFormat HEX = HexFormat.of();

    private final PayloadCanonicalizer canonicalizer;

    public ApiKeySignatureValidator() {
        this(new PayloadCanonicalizer());
    }

    public ApiKeySignatureValidator(PayloadCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Compare the supplied hex signature to the MAC recomputed over the candidate, in constant time.
     *
     * @param secret            shared secret
     * @param algorithm         MAC algorithm
     * @param candidate         data the client signed
     * @param suppliedSignature hex signature from the request
     * @return authorized if the signatures match
     */
    public AuthResult validate(
            byte[] secret, MacAlgorithm algorithm, ApiKeyCandidate candidate, String suppliedSignature) {
        byte[] supplied;
        try {
            supplied = HEX.parseHex(suppliedSignature);
        } catch (IllegalArgumentException e) {
            return AuthResult.rejected(new AuthFailure.Malformed("Signature must be hex encoded"));
        }
        return validate(secret, algorithm, candidate, supplied);
    }

    public AuthResult validate(byte[] secret, MacAlgorithm algorithm, ApiKeyCandidate candidate, byte[] supplied) {
        byte[] expected = mac(secret, algorithm, canonicalMessage(candidate));
        if (!MessageDigest.isEqual(expected, supplied)) {
            return AuthResult.rejected(new AuthFailure.InvalidSignature());
        }
        return AuthResult.authorized();
    }

    /**
     * Produce the hex signature a client must present for the candidate.
     */
    public String sign(byte[] secret, MacAlgorithm algorithm, ApiKeyCandidate candidate) {
        return HEX.formatHex(mac(secret, algorithm, canonicalMessage(candidate)));
    }

    public byte[] canonicalMessage(ApiKeyCandidate candidate) {
        String message =
                candidate.resourcePath() + candidate.nonceText() + canonicalizer.canonicalize(candidate.payload());
        return message.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] mac(byte[] secret, MacAlgorithm algorithm, byte[] message) {
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(new SecretKeySpec(secret, algorithm.jcaName()));
            return mac.doFinal(message);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            // HmacSHA256/384/512 are mandatory JCA algorithms
            throw new IllegalStateException(algorithm.jcaName() + " not available", e);
        }
    }
}
