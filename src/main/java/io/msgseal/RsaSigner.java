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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.Signature;
import java.security.SignatureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detached RSASSA-PKCS1-v1_5 signatures over SHA-256. Signatures are exactly as long as the signer's modulus.
 * <p>
 * Verification keeps two outcomes apart. An operational failure, such as an unparseable key, is reported as a
 * {@link VerificationException}. A signature that is checked and rejected, including one of the wrong length, is
 * reported by returning {@code false}.
 */
final class RsaSigner {
    private static final Logger logger = LoggerFactory.getLogger(RsaSigner.class);
    static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    /**
     * Signs a message.
     *
     * @param privateKeyPem the signer's PEM-encoded private key.
     * @param message the exact message bytes.
     * @return the signature.
     * @throws SigningException if the key cannot be parsed, signing fails, or the signature is not as long as the
     * modulus.
     */
    byte[] sign(String privateKeyPem, byte[] message) {
        requireNonNull(message, "message");
        try {
            var privateKey = PemKeys.readPrivateKey(privateKeyPem);
            var signature = newSignature();
            signature.initSign(privateKey);
            signature.update(message);
            var result = signature.sign();

            int expectedLength = Crypto.modulusSizeBytes(privateKey);
            if (result.length != expectedLength) {
                throw new SigningException("Signature has length " + result.length + ", expected " +
                        expectedLength);
            }
            return result;
        } catch (IOException | GeneralSecurityException | ProviderException e) {
            logger.debug("Signing failed", e);
            throw new SigningException("Unable to sign message", e);
        }
    }

    /**
     * Verifies a signature.
     *
     * @param publicKeyPem the signer's PEM-encoded public key.
     * @param message the exact message bytes that were signed.
     * @param signature the detached signature.
     * @return true if the signature is valid, otherwise false.
     * @throws VerificationException if the key cannot be parsed or the signature engine fails.
     */
    boolean verify(String publicKeyPem, byte[] message, byte[] signature) {
        requireNonNull(message, "message");
        requireNonNull(signature, "signature");
        Signature verifier;
        int expectedLength;
        try {
            var publicKey = PemKeys.readPublicKey(publicKeyPem);
            expectedLength = Crypto.modulusSizeBytes(publicKey);
            verifier = newSignature();
            verifier.initVerify(publicKey);
            verifier.update(message);
        } catch (IOException | GeneralSecurityException | ProviderException e) {
            logger.debug("Unable to set up signature verification", e);
            throw new VerificationException("Unable to verify signature", e);
        }

        if (signature.length != expectedLength) {
            logger.debug("Rejecting signature of length {}, expected {}", signature.length, expectedLength);
            return false;
        }
        try {
            return verifier.verify(signature);
        } catch (SignatureException e) {
            // The verifier is initialised, so this only means the signature is malformed
            logger.debug("Rejecting malformed signature: {}", e.getMessage());
            return false;
        }
    }

    private static Signature newSignature() throws NoSuchAlgorithmException {
        return Signature.getInstance(SIGNATURE_ALGORITHM);
    }
}
