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

/**
 * A Data Encapsulation Mechanism (DEM) encrypts the body of a message under a one-time {@link SessionKey}.
 * The DEM provides confidentiality only: it does not authenticate the ciphertext, so a successful decryption says
 * nothing about whether the right key was used. That check is done by {@link MessageCodec} using the recognition
 * tag.
 */
interface DEM {

    /**
     * A unique identifier for this DEM algorithm.
     */
    String getIdentifier();

    /**
     * Encrypts the given plaintext.
     *
     * @param sessionKey the one-time key and IV.
     * @param plaintext the data to encrypt. Any length, including zero, is accepted.
     * @return the ciphertext, padded to the next block boundary.
     */
    byte[] encrypt(SessionKey sessionKey, byte[] plaintext);

    /**
     * Decrypts the given ciphertext.
     *
     * @param sessionKey the one-time key and IV used to encrypt the data.
     * @param ciphertext the ciphertext.
     * @return the plaintext with padding removed.
     * @throws DecryptionException if the ciphertext is not a positive multiple of the block size or cannot be
     * decrypted. Padding errors are not distinguished from any other failure.
     */
    byte[] decrypt(SessionKey sessionKey, byte[] ciphertext);
}
