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

import java.security.interfaces.RSAKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Encrypts a one-time session key for a recipient so that only the holder of the matching private key can recover
 * it.
 */
interface KeyWrap {

    /**
     * A unique identifier for this key-wrapping algorithm.
     */
    String getIdentifier();

    /**
     * The size of a wrapped key produced for the given key, which is the RSA modulus size in bytes. Envelopes do
     * not store this length, so readers must derive it from the private key before slicing.
     */
    int wrappedKeySize(RSAKey key);

    /**
     * Wraps the session key for the given recipient.
     *
     * @param sessionKey the key to wrap.
     * @param recipientKey the recipient's public key.
     * @return the wrapped key, exactly {@link #wrappedKeySize} bytes long.
     * @throws KeyWrapException if the key cannot be wrapped.
     * @throws EntropyException if the padding needs randomness and the secure random generator fails.
     */
    byte[] wrap(DestroyableSecretKey sessionKey, RSAPublicKey recipientKey);

    /**
     * Recovers a session key. The caller owns the returned key and must destroy it.
     *
     * @param wrappedKey the wrapped key. Must be at least {@link #wrappedKeySize} bytes long; only that many
     *                   bytes are used.
     * @param recipientKey the recipient's private key.
     * @return the unwrapped session key.
     * @throws KeyUnwrapException if the wrapped key is truncated, cannot be decrypted, or does not decrypt to a key
     * of the expected length.
     */
    DestroyableSecretKey unwrap(byte[] wrappedKey, RSAPrivateKey recipientKey);
}
