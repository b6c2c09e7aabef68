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
import java.io.StringReader;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * Reads and writes RSA keys in PEM form. Public keys are written as SubjectPublicKeyInfo ({@code PUBLIC KEY}) and
 * private keys as PKCS#1 ({@code RSA PRIVATE KEY}), which is what OpenSSL produces. When reading, PKCS#8
 * ({@code PRIVATE KEY}) private keys and PKCS#1 ({@code RSA PUBLIC KEY}) public keys are accepted too.
 */
final class PemKeys {
    static final String PUBLIC_KEY = "PUBLIC KEY";
    static final String RSA_PUBLIC_KEY = "RSA PUBLIC KEY";
    static final String PRIVATE_KEY = "PRIVATE KEY";
    static final String RSA_PRIVATE_KEY = "RSA PRIVATE KEY";

    /**
     * Parses a PEM-encoded RSA public key.
     *
     * @param pem the PEM text.
     * @return the public key.
     * @throws IOException if the text is not a PEM-encoded RSA public key.
     */
    static RSAPublicKey readPublicKey(String pem) throws IOException {
        var spec = publicKeySpec(readPemObject(pem));
        var key = generate(kf -> kf.generatePublic(spec));
        if (!(key instanceof RSAPublicKey)) {
            throw new IOException("Not an RSA public key");
        }
        return (RSAPublicKey) key;
    }

    /**
     * Parses a PEM-encoded RSA private key. The decoded DER bytes are wiped before this method returns.
     *
     * @param pem the PEM text.
     * @return the private key.
     * @throws IOException if the text is not a PEM-encoded RSA private key.
     */
    static RSAPrivateKey readPrivateKey(String pem) throws IOException {
        var pemObject = readPemObject(pem);
        byte[] der = pemObject.getContent();
        try {
            var spec = privateKeySpec(pemObject.getType(), der);
            var key = generate(kf -> kf.generatePrivate(spec));
            if (!(key instanceof RSAPrivateKey)) {
                throw new IOException("Not an RSA private key");
            }
            return (RSAPrivateKey) key;
        } finally {
            Utils.wipe(der);
        }
    }

    static String writePublicKey(PublicKey publicKey) throws IOException {
        return writePemObject(new PemObject(PUBLIC_KEY, publicKey.getEncoded()));
    }

    /**
     * Writes a private key in PKCS#1 form. The key must be encodable as PKCS#8, which is true of all keys produced
     * by the JDK's RSA key pair generator.
     */
    static String writePrivateKey(PrivateKey privateKey) throws IOException {
        byte[] pkcs8 = privateKey.getEncoded();
        byte[] pkcs1 = null;
        try {
            if (pkcs8 == null) {
                throw new IOException("Private key cannot be encoded");
            }
            pkcs1 = PrivateKeyInfo.getInstance(pkcs8).parsePrivateKey().toASN1Primitive().getEncoded();
            return writePemObject(new PemObject(RSA_PRIVATE_KEY, pkcs1));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid PKCS#8 private key", e);
        } finally {
            Utils.wipe(pkcs8, pkcs1);
        }
    }

    private static PemObject readPemObject(String pem) throws IOException {
        requireNonNull(pem, "pem");
        try (var reader = new PemReader(new StringReader(pem))) {
            var pemObject = reader.readPemObject();
            if (pemObject == null) {
                throw new IOException("No PEM object found");
            }
            return pemObject;
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Raised by the Base64 decoder for a corrupted body
            throw new IOException("Malformed PEM data", e);
        }
    }

    private static String writePemObject(PemObject pemObject) throws IOException {
        var out = new StringWriter();
        try (var writer = new PemWriter(out)) {
            writer.writeObject(pemObject);
        }
        return out.toString();
    }

    private static KeySpec publicKeySpec(PemObject pemObject) throws IOException {
        switch (pemObject.getType()) {
            case PUBLIC_KEY:
                return new X509EncodedKeySpec(pemObject.getContent());
            case RSA_PUBLIC_KEY:
                return parsePkcs1PublicKey(pemObject.getContent());
            default:
                throw new IOException("Unexpected PEM type for public key: " + pemObject.getType());
        }
    }

    private static KeySpec privateKeySpec(String type, byte[] der) throws IOException {
        switch (type) {
            case RSA_PRIVATE_KEY:
                return parsePkcs1PrivateKey(der);
            case PRIVATE_KEY:
                return new PKCS8EncodedKeySpec(der);
            default:
                throw new IOException("Unexpected PEM type for private key: " + type);
        }
    }

    private static RSAPublicKeySpec parsePkcs1PublicKey(byte[] der) throws IOException {
        try {
            var key = org.bouncycastle.asn1.pkcs.RSAPublicKey.getInstance(der);
            return new RSAPublicKeySpec(key.getModulus(), key.getPublicExponent());
        } catch (RuntimeException e) {
            // BouncyCastle reports malformed ASN.1 through several unchecked exception types
            throw new IOException("Malformed PKCS#1 public key", e);
        }
    }

    private static RSAPrivateCrtKeySpec parsePkcs1PrivateKey(byte[] der) throws IOException {
        try {
            var key = org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(der);
            return new RSAPrivateCrtKeySpec(key.getModulus(), key.getPublicExponent(), key.getPrivateExponent(),
                    key.getPrime1(), key.getPrime2(), key.getExponent1(), key.getExponent2(), key.getCoefficient());
        } catch (RuntimeException e) {
            // BouncyCastle reports malformed ASN.1 through several unchecked exception types
            throw new IOException("Malformed PKCS#1 private key", e);
        }
    }

    private static <T> T generate(KeyFactoryFunction<T> function) throws IOException {
        try {
            return function.apply(KeyFactory.getInstance("RSA"));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM does not support RSA", e);
        } catch (GeneralSecurityException e) {
            throw new IOException("Invalid RSA key", e);
        }
    }

    @FunctionalInterface
    private interface KeyFactoryFunction<T> {
        T apply(KeyFactory keyFactory) throws GeneralSecurityException;
    }

    private PemKeys() {}
}
