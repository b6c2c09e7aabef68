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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether a public key and a private key belong to the same RSA key pair by comparing their moduli.
 */
final class KeyPairMatcher {
    private static final Logger logger = LoggerFactory.getLogger(KeyPairMatcher.class);

    /**
     * Returns true only if both keys parse and have the same modulus. Malformed or missing keys give false rather
     * than an exception.
     */
    boolean matches(String publicKeyPem, String privateKeyPem) {
        if (publicKeyPem == null || privateKeyPem == null) {
            return false;
        }
        try {
            var publicKey = PemKeys.readPublicKey(publicKeyPem);
            var privateKey = PemKeys.readPrivateKey(privateKeyPem);
            return publicKey.getModulus().equals(privateKey.getModulus());
        } catch (IOException e) {
            logger.debug("Key parsing failed, treating keys as not matching: {}", e.getMessage());
            return false;
        }
    }
}
