/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.msgseal;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and parses envelopes. An envelope is the concatenation of
 * <ol>
 *     <li>the 8-byte ASCII marker {@code MESSAGE:},</li>
 *     <li>the session key wrapped for the recipient, as long as the recipient's RSA modulus,</li>
 *     <li>the 16-byte IV, in clear,</li>
 *     <li>the CBC ciphertext of the recognition tag {@code MSG} followed by the payload.</li>
 * </ol>
 * No lengths are stored. The wrapped key size is derived from the recipient's key and the ciphertext runs to the
 * end of the envelope.
 * <p>
 * Opening an envelope consumes the fields strictly in order, and stops at the first one that fails.
 */
final class MessageCodec {
    private static final Logger logger = LoggerFactory.getLogger(MessageCodec.class);

    static final byte[] MARKER = "MESSAGE:".getBytes(US_ASCII);
    static final byte[] RECOGNITION_TAG = "MSG".getBytes(US_ASCII);
    static final int IV_SIZE_BYTES = Crypto.AES_BLOCK_SIZE_BYTES;

    private final KeyWrap keyWrap;
    private final DEM dem;
    private final SecureRandom random;

    MessageCodec(KeyWrap keyWrap, DEM dem, SecureRandom random) {
        this.keyWrap = requireNonNull(keyWrap, "keyWrap");
        this.dem = requireNonNull(dem, "dem");
        this.random = requireNonNull(random, "random");
        logger.debug("Envelopes use {} key wrapping and {} payload encryption", keyWrap.getIdentifier(),
                dem.getIdentifier());
    }

    /**
     * Encrypts a payload for the holder of the private key matching {@code recipientPublicKey}. Every call uses a
     * fresh session key and IV, so sealing the same payload twice gives different envelopes.
     *
     * @param plaintext the payload, which may be empty.
     * @param recipientPublicKey the recipient's PEM-encoded public key.
     * @return the envelope.
     * @throws KeyWrapException if the public key cannot be parsed or used.
     * @throws EntropyException if the secure random generator fails while generating the session key or padding
     * the wrapped key.
     */
    byte[] seal(byte[] plaintext, String recipientPublicKey) {
        requireNonNull(plaintext, "plaintext");
        var publicKey = parsePublicKey(recipientPublicKey);

        byte[] tagged = Utils.concat(RECOGNITION_TAG, plaintext);
        try (var sessionKey = SessionKey.generate(random)) {
            var ciphertext = dem.encrypt(sessionKey, tagged);
            var wrappedKey = keyWrap.wrap(sessionKey.key(), publicKey);
            return Utils.concat(MARKER, wrappedKey, sessionKey.iv(), ciphertext);
        } finally {
            Utils.wipe(tagged);
        }
    }

    /**
     * Decrypts an envelope.
     *
     * @param envelope the envelope produced by {@link #seal(byte[], String)}.
     * @param recipientPrivateKey the recipient's PEM-encoded private key.
     * @return the original payload.
     * @throws FormatException if the envelope does not start with the marker or is too short to hold an IV.
     * @throws KeyUnwrapException if the private key cannot be parsed or the session key cannot be recovered.
     * @throws AuthenticityException if the payload cannot be decrypted or does not carry the recognition tag,
     * meaning that the envelope was sealed for another key or has been corrupted.
     */
    byte[] open(byte[] envelope, String recipientPrivateKey) {
        requireNonNull(envelope, "envelope");
        var reader = new EnvelopeReader(envelope);
        reader.expect(MARKER, "envelope marker");

        var privateKey = parsePrivateKey(recipientPrivateKey);
        var wrappedKey = reader.readAtMost(keyWrap.wrappedKeySize(privateKey));

        try (var key = keyWrap.unwrap(wrappedKey, privateKey)) {
            var iv = reader.readFixedLengthBytes(IV_SIZE_BYTES, "IV");
            var ciphertext = reader.readRemaining();
            try (var sessionKey = new SessionKey(key, iv)) {
                return decryptAndStripTag(sessionKey, ciphertext);
            }
        }
    }

    private byte[] decryptAndStripTag(SessionKey sessionKey, byte[] ciphertext) {
        byte[] tagged = null;
        try {
            tagged = dem.decrypt(sessionKey, ciphertext);
            if (!Utils.startsWith(tagged, RECOGNITION_TAG)) {
                logger.debug("Recognition tag mismatch");
                throw new AuthenticityException("Wrong key or corrupted data");
            }
            return Arrays.copyOfRange(tagged, RECOGNITION_TAG.length, tagged.length);
        } catch (DecryptionException e) {
            logger.debug("Payload decryption failed");
            throw new AuthenticityException("Wrong key or corrupted data", e);
        } finally {
            Utils.wipe(tagged);
        }
    }

    /**
     * Returns true if the given data starts with the envelope marker. This does not check that the rest of the
     * envelope is well-formed.
     */
    static boolean isEnvelope(byte[] data) {
        return data != null && Utils.startsWith(data, MARKER);
    }

    private static RSAPublicKey parsePublicKey(String pem) {
        try {
            return PemKeys.readPublicKey(pem);
        } catch (IOException e) {
            logger.debug("Invalid recipient public key", e);
            throw new KeyWrapException("Unable to parse recipient public key", e);
        }
    }

    private static RSAPrivateKey parsePrivateKey(String pem) {
        try {
            return PemKeys.readPrivateKey(pem);
        } catch (IOException e) {
            logger.debug("Invalid recipient private key", e);
            throw new KeyUnwrapException("Unable to parse recipient private key", e);
        }
    }
}
