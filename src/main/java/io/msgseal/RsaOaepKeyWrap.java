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

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.interfaces.RSAKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.MGF1ParameterSpec;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RSA-OAEP key wrapping with SHA-1 and MGF1-SHA-1 and an empty label. These are OpenSSL's defaults for
 * {@code RSA_PKCS1_OAEP_PADDING}, so keys wrapped here can be unwrapped by OpenSSL and vice versa.
 */
final class RsaOaepKeyWrap implements KeyWrap {
    private static final Logger logger = LoggerFactory.getLogger(RsaOaepKeyWrap.class);
    private static final String ALGORITHM = "RSA/ECB/OAEPPadding";
    private static final OAEPParameterSpec OAEP_PARAMS =
            new OAEPParameterSpec("SHA-1", "MGF1", MGF1ParameterSpec.SHA1, PSource.PSpecified.DEFAULT);

    private final SecureRandom random;

    RsaOaepKeyWrap(SecureRandom random) {
        this.random = requireNonNull(random, "random");
    }

    @Override
    public String getIdentifier() {
        return "RSA-OAEP";
    }

    @Override
    public int wrappedKeySize(RSAKey key) {
        return Crypto.modulusSizeBytes(key);
    }

    @Override
    public byte[] wrap(DestroyableSecretKey sessionKey, RSAPublicKey recipientKey) {
        requireNonNull(sessionKey, "sessionKey");
        requireNonNull(recipientKey, "recipientKey");
        byte[] keyBytes = sessionKey.getEncoded();
        try {
            var cipher = newCipher();
            cipher.init(Cipher.ENCRYPT_MODE, recipientKey, OAEP_PARAMS, random);
            var wrapped = cipher.doFinal(keyBytes);
            if (wrapped.length != wrappedKeySize(recipientKey)) {
                throw new KeyWrapException("Wrapped key has unexpected length " + wrapped.length);
            }
            return wrapped;
        } catch (GeneralSecurityException e) {
            logger.debug("{} key wrapping failed", getIdentifier(), e);
            throw new KeyWrapException("Unable to wrap session key", e);
        } catch (ProviderException e) {
            // OAEP draws its seed from the secure random generator
            logger.debug("{} padding could not obtain randomness", getIdentifier(), e);
            throw new EntropyException("Secure random generator failed", e);
        } finally {
            Utils.wipe(keyBytes);
        }
    }

    @Override
    public DestroyableSecretKey unwrap(byte[] wrappedKey, RSAPrivateKey recipientKey) {
        requireNonNull(wrappedKey, "wrappedKey");
        requireNonNull(recipientKey, "recipientKey");
        int size = wrappedKeySize(recipientKey);
        if (wrappedKey.length < size) {
            throw new KeyUnwrapException("Wrapped key is truncated");
        }
        byte[] keyBytes = null;
        try {
            var cipher = newCipher();
            cipher.init(Cipher.DECRYPT_MODE, recipientKey, OAEP_PARAMS);
            keyBytes = cipher.doFinal(wrappedKey, 0, size);
            if (keyBytes.length != Crypto.AES_KEY_SIZE_BYTES) {
                throw new KeyUnwrapException("Unwrapped key has unexpected length");
            }
            return new DestroyableSecretKey("AES", keyBytes);
        } catch (GeneralSecurityException e) {
            logger.debug("{} key unwrapping failed: {}", getIdentifier(), e.getMessage());
            throw new KeyUnwrapException("Unable to unwrap session key", e);
        } finally {
            Utils.wipe(keyBytes);
        }
    }

    private static Cipher newCipher() {
        try {
            return Cipher.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support RSA-OAEP", e);
        }
    }
}
