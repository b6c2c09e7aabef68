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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class MessageCryptoTest {
    private final MessageCrypto crypto = MessageCrypto.create();

    private RsaKeyPair keys;

    @BeforeClass
    public void generateKeys() {
        keys = crypto.generateKeyPair();
    }

    @Test
    public void shouldSealAndOpenHello() {
        var envelope = crypto.seal("hello", keys.getPublicKey());

        assertThat(envelope).hasSize(8 + 256 + 16 + 16);
        assertThat(MessageCrypto.isEnvelope(envelope)).isTrue();
        assertThat(crypto.open(envelope, keys.getPrivateKey())).asString(UTF_8).isEqualTo("hello");
    }

    @Test
    public void shouldSignAndVerify() {
        var message = "hello".getBytes(UTF_8);
        var signature = crypto.sign(keys.getPrivateKey(), message);

        assertThat(crypto.verify(keys.getPublicKey(), message, signature)).isTrue();
        assertThat(crypto.verify(keys.getPublicKey(), "hellO".getBytes(UTF_8), signature)).isFalse();
    }

    @Test
    public void shouldVerifyMessageNotEnvelope() {
        var message = "hello".getBytes(UTF_8);
        var signature = crypto.sign(keys.getPrivateKey(), message);
        var envelope = crypto.seal(message, keys.getPublicKey());

        assertThat(crypto.verify(keys.getPublicKey(), envelope, signature)).isFalse();
    }

    @Test
    public void shouldMatchGeneratedKeys() {
        assertThat(crypto.matches(keys.getPublicKey(), keys.getPrivateKey())).isTrue();
        assertThat(crypto.matches(keys.getPublicKey(), "nonsense")).isFalse();
    }

    @Test
    public void shouldUseSuppliedRandomGenerator() {
        var custom = MessageCrypto.builder().secureRandom(new SecureRandom()).build();

        var envelope = custom.seal("via builder", keys.getPublicKey());

        assertThat(crypto.open(envelope, keys.getPrivateKey())).asString(UTF_8).isEqualTo("via builder");
    }

    @Test
    public void shouldRejectNullArguments() {
        assertThatThrownBy(() -> crypto.seal((byte[]) null, keys.getPublicKey()))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> crypto.open(null, keys.getPrivateKey()))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> MessageCrypto.builder().secureRandom(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    public void shouldReportAllFailuresAsMessageCryptoExceptions() {
        assertThatThrownBy(() -> crypto.open("plain text".getBytes(UTF_8), keys.getPrivateKey()))
                .isInstanceOf(MessageCryptoException.class);
        assertThatThrownBy(() -> crypto.seal("x", "bad key"))
                .isInstanceOf(MessageCryptoException.class);
        assertThatThrownBy(() -> crypto.sign("bad key", new byte[0]))
                .isInstanceOf(MessageCryptoException.class);
        assertThatThrownBy(() -> crypto.verify("bad key", new byte[0], new byte[256]))
                .isInstanceOf(MessageCryptoException.class);
    }

    @Test
    public void shouldBeSafeToShareBetweenThreads() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        try {
            var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 32; ++i) {
                var message = "message " + i;
                tasks.add(() -> {
                    var envelope = crypto.seal(message, keys.getPublicKey());
                    var signature = crypto.sign(keys.getPrivateKey(), envelope);
                    assertThat(crypto.verify(keys.getPublicKey(), envelope, signature)).isTrue();
                    return new String(crypto.open(envelope, keys.getPrivateKey()), UTF_8);
                });
            }

            var results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); ++i) {
                assertThat(results.get(i).get()).isEqualTo("message " + i);
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }
}
