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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.security.SecureRandom;

/**
 * Hybrid public-key encryption and signing of byte messages.
 * <p>
 * A message is <em>sealed</em> for a recipient by encrypting it with a fresh AES-256-CBC key, wrapping that key
 * with the recipient's RSA public key (OAEP), and packing both into a self-describing envelope. Only the holder of
 * the matching private key can <em>open</em> the envelope again. Independently of encryption, a private key holder
 * can produce a detached RSA/SHA-256 signature that anyone with the public key can verify.
 * <p>
 * Keys are exchanged as PEM strings, as produced by {@link #generateKeyPair()}. This class holds no mutable state
 * and may be shared freely between threads.
 * <pre>{@code
 * var crypto = MessageCrypto.create();
 * var keys = crypto.generateKeyPair();
 * byte[] envelope = crypto.seal("hello", keys.getPublicKey());
 * byte[] message = crypto.open(envelope, keys.getPrivateKey());
 * }</pre>
 * All failures are reported as subclasses of {@link MessageCryptoException}.
 */
public final class MessageCrypto {
    private final RsaKeyPairGenerator keyPairGenerator;
    private final MessageCodec codec;
    private final RsaSigner signer;
    private final KeyPairMatcher matcher;

    private MessageCrypto(SecureRandom random) {
        this.keyPairGenerator = new RsaKeyPairGenerator(random);
        this.codec = new MessageCodec(new RsaOaepKeyWrap(random), new AesCbcDem(), random);
        this.signer = new RsaSigner();
        this.matcher = new KeyPairMatcher();
    }

    /**
     * Creates an instance that draws all randomness from a default {@link SecureRandom}.
     */
    public static MessageCrypto create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Generates a new 2048-bit RSA key pair.
     *
     * @return the PEM-encoded key pair.
     * @throws KeyGenerationException if generation or encoding fails.
     */
    public RsaKeyPair generateKeyPair() {
        return keyPairGenerator.generate();
    }

    /**
     * Seals a message for a recipient.
     *
     * @param plaintext the message. May be empty.
     * @param recipientPublicKey the recipient's PEM-encoded public key.
     * @return the envelope: marker, wrapped key, IV and ciphertext.
     * @throws KeyWrapException if the public key is invalid.
     * @throws EntropyException if the random number generator fails.
     */
    public byte[] seal(byte[] plaintext, String recipientPublicKey) {
        return codec.seal(plaintext, recipientPublicKey);
    }

    /**
     * Seals the UTF-8 encoding of a string.
     *
     * @see #seal(byte[], String)
     */
    public byte[] seal(String plaintext, String recipientPublicKey) {
        return seal(requireNonNull(plaintext, "plaintext").getBytes(UTF_8), recipientPublicKey);
    }

    /**
     * Opens an envelope.
     * <p>
     * Security-sensitive callers should treat every {@link MessageRejectedException} the same way and not reveal
     * which subclass was thrown.
     *
     * @param envelope the envelope.
     * @param recipientPrivateKey the recipient's PEM-encoded private key.
     * @return the original message.
     * @throws FormatException if the data is not an envelope or is truncated.
     * @throws KeyUnwrapException if the private key is invalid or the wrapped key cannot be recovered.
     * @throws AuthenticityException if the envelope was sealed for a different key or has been corrupted.
     */
    public byte[] open(byte[] envelope, String recipientPrivateKey) {
        return codec.open(envelope, recipientPrivateKey);
    }

    /**
     * Produces a detached signature over the exact message bytes.
     *
     * @throws SigningException if the key is invalid or signing fails.
     */
    public byte[] sign(String privateKey, byte[] message) {
        return signer.sign(privateKey, message);
    }

    /**
     * Checks a detached signature.
     *
     * @return true if the signature is valid for the message, false if it is not, including when it has the wrong
     * length.
     * @throws VerificationException only if the verification itself could not be carried out, for example because
     * the public key is invalid.
     */
    public boolean verify(String publicKey, byte[] message, byte[] signature) {
        return signer.verify(publicKey, message, signature);
    }

    /**
     * Returns true if the two keys are halves of the same RSA key pair. Never throws for malformed keys.
     */
    public boolean matches(String publicKey, String privateKey) {
        return matcher.matches(publicKey, privateKey);
    }

    /**
     * Returns true if the data starts with the envelope marker, which is a cheap way to tell sealed messages from
     * plain ones. A true result does not mean the envelope can be opened.
     */
    public static boolean isEnvelope(byte[] data) {
        return MessageCodec.isEnvelope(data);
    }

    public static final class Builder {
        private SecureRandom secureRandom;

        private Builder() {}

        /**
         * Sets the generator used for key pairs, session keys, IVs and OAEP padding. It must be cryptographically
         * secure.
         */
        public Builder secureRandom(SecureRandom secureRandom) {
            this.secureRandom = requireNonNull(secureRandom, "secureRandom");
            return this;
        }

        public MessageCrypto build() {
            return new MessageCrypto(secureRandom != null ? secureRandom : new SecureRandom());
        }
    }
}
