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

import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.interfaces.RSAKey;

final class Crypto {
    static final int AES_KEY_SIZE_BYTES = 32;
    static final int AES_BLOCK_SIZE_BYTES = 16;

    /**
     * Fills a new array with output from the given CSPRNG. There is deliberately no fallback to a weaker source if
     * the generator fails.
     *
     * @param random the secure random generator.
     * @param numBytes the number of bytes to generate.
     * @return the random bytes.
     * @throws EntropyException if the generator could not produce output.
     */
    static byte[] randomBytes(SecureRandom random, int numBytes) {
        requireNonNull(random, "random");
        byte[] bytes = new byte[numBytes];
        try {
            random.nextBytes(bytes);
            return bytes;
        } catch (ProviderException | IllegalStateException e) {
            Utils.wipe(bytes);
            throw new EntropyException("Secure random generator failed", e);
        }
    }

    /**
     * The size of the RSA modulus in bytes, which is also the size of every OAEP ciphertext and signature produced
     * with the key.
     */
    static int modulusSizeBytes(RSAKey key) {
        return (key.getModulus().bitLength() + 7) >>> 3;
    }

    private Crypto() {}
}
