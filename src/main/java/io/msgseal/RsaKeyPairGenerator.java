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
import java.security.KeyPairGenerator;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.spec.RSAKeyGenParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates 2048-bit RSA key pairs with public exponent 65537 and serializes them to PEM.
 */
final class RsaKeyPairGenerator {
    private static final Logger logger = LoggerFactory.getLogger(RsaKeyPairGenerator.class);

    static final int MODULUS_SIZE_BITS = 2048;

    private final SecureRandom random;

    RsaKeyPairGenerator(SecureRandom random) {
        this.random = requireNonNull(random, "random");
    }

    /**
     * Generates a new key pair.
     *
     * @return the PEM-encoded key pair.
     * @throws KeyGenerationException if the key pair cannot be generated or encoded.
     */
    RsaKeyPair generate() {
        try {
            var generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(new RSAKeyGenParameterSpec(MODULUS_SIZE_BITS, RSAKeyGenParameterSpec.F4), random);
            var keyPair = generator.generateKeyPair();
            var publicPem = PemKeys.writePublicKey(keyPair.getPublic());
            var privatePem = PemKeys.writePrivateKey(keyPair.getPrivate());
            logger.debug("Generated {}-bit RSA key pair", MODULUS_SIZE_BITS);
            return new RsaKeyPair(publicPem, privatePem);
        } catch (GeneralSecurityException | IOException | ProviderException e) {
            logger.debug("RSA key generation failed", e);
            throw new KeyGenerationException("Unable to generate RSA key pair", e);
        }
    }
}
