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

import java.security.MessageDigest;
import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * Raw symmetric key bytes owned by a single operation. Closing the key zeroes its private copy of the bytes, after
 * which {@link #getEncoded()} fails, so a session key cannot be used once the seal or open call that created it has
 * finished with it.
 */
final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed = false;

    DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyMaterial.clone();
    }

    int length() {
        return keyMaterial.length;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(keyMaterial);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        checkDestroyed();
        if (this == other) { return true; }
        if (!(other instanceof DestroyableSecretKey)) { return false; }
        DestroyableSecretKey that = (DestroyableSecretKey) other;
        return algorithm.equals(that.algorithm)
                && MessageDigest.isEqual(keyMaterial, that.keyMaterial);
    }

    @Override
    public int hashCode() {
        return algorithm.hashCode();
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", destroyed=" + destroyed +
                '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }
}
