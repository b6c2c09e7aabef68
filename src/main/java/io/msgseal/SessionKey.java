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

import java.security.SecureRandom;

import javax.crypto.spec.IvParameterSpec;

/**
 * A one-time AES-256 key and CBC initialisation vector. A new session key is generated for every sealed message and
 * destroyed as soon as it has been wrapped and used. Only the IV ever appears in clear in an envelope.
 */
final class SessionKey implements AutoCloseable {
    private final DestroyableSecretKey key;
    private final byte[] iv;

    SessionKey(DestroyableSecretKey key, byte[] iv) {
        this.key = requireNonNull(key, "key");
        this.iv = requireNonNull(iv, "iv").clone();
        Utils.require(key.length() == Crypto.AES_KEY_SIZE_BYTES, "Session key must be 32 bytes");
        Utils.require(iv.length == Crypto.AES_BLOCK_SIZE_BYTES, "IV must be 16 bytes");
    }

    /**
     * Generates a fresh session key and IV.
     *
     * @param random the CSPRNG to draw both values from.
     * @return the new session key.
     * @throws EntropyException if the CSPRNG fails.
     */
    static SessionKey generate(SecureRandom random) {
        byte[] keyBytes = Crypto.randomBytes(random, Crypto.AES_KEY_SIZE_BYTES);
        try {
            byte[] iv = Crypto.randomBytes(random, Crypto.AES_BLOCK_SIZE_BYTES);
            return new SessionKey(new DestroyableSecretKey("AES", keyBytes), iv);
        } finally {
            Utils.wipe(keyBytes);
        }
    }

    DestroyableSecretKey key() {
        return key;
    }

    byte[] iv() {
        return iv.clone();
    }

    IvParameterSpec ivSpec() {
        return new IvParameterSpec(iv);
    }

    @Override
    public void close() {
        key.destroy();
        Utils.wipe(iv);
    }
}
