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

import static io.msgseal.Crypto.AES_BLOCK_SIZE_BYTES;
import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256 in CBC mode with PKCS#7 padding (called PKCS5Padding by the JCA).
 */
final class AesCbcDem implements DEM {
    private static final Logger logger = LoggerFactory.getLogger(AesCbcDem.class);
    private static final String ENC_ALGORITHM = "AES/CBC/PKCS5Padding";

    @Override
    public String getIdentifier() {
        return "A256CBC";
    }

    @Override
    public byte[] encrypt(SessionKey sessionKey, byte[] plaintext) {
        requireNonNull(plaintext, "plaintext");
        var cipher = getCipher(Cipher.ENCRYPT_MODE, sessionKey);
        try {
            var ciphertext = cipher.doFinal(plaintext);
            assert ciphertext.length == paddedLength(plaintext.length);
            return ciphertext;
        } catch (GeneralSecurityException e) {
            // Cannot happen when encrypting with padding enabled
            throw new IllegalStateException(e);
        }
    }

    @Override
    public byte[] decrypt(SessionKey sessionKey, byte[] ciphertext) {
        requireNonNull(ciphertext, "ciphertext");
        if (!isBlockAligned(ciphertext.length)) {
            throw new DecryptionException("Ciphertext is not a positive multiple of the block size");
        }
        var cipher = getCipher(Cipher.DECRYPT_MODE, sessionKey);
        try {
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            logger.trace("{} decryption failed", getIdentifier(), e);
            throw new DecryptionException("Unable to decrypt ciphertext", e);
        }
    }

    /**
     * Returns the ciphertext length for a plaintext of the given length. PKCS#7 padding always adds at least one
     * byte, so an exact multiple of the block size gains a whole extra block.
     */
    static int paddedLength(int plaintextLength) {
        return plaintextLength + AES_BLOCK_SIZE_BYTES - (plaintextLength % AES_BLOCK_SIZE_BYTES);
    }

    static boolean isBlockAligned(int ciphertextLength) {
        return ciphertextLength > 0 && ciphertextLength % AES_BLOCK_SIZE_BYTES == 0;
    }

    /**
     * Returns a new, uninitialised cipher. Ciphers are never cached, so no key schedule survives the call that
     * created it.
     */
    static Cipher newCipher() {
        try {
            return Cipher.getInstance(ENC_ALGORITHM);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support AES/CBC encryption", e);
        }
    }

    private static Cipher getCipher(int mode, SessionKey sessionKey) {
        requireNonNull(sessionKey, "sessionKey");
        var cipher = newCipher();
        try {
            cipher.init(mode, sessionKey.key(), sessionKey.ivSpec());
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
