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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.Test;

public class DestroyableSecretKeyTest {

    @Test
    public void shouldCopyKeyMaterial() {
        var material = new byte[] { 1, 2, 3, 4 };
        var key = new DestroyableSecretKey("AES", material);
        material[0] = 42;

        assertThat(key.getEncoded()).containsExactly(1, 2, 3, 4);
        assertThat(key.getFormat()).isEqualTo("RAW");
        assertThat(key.getAlgorithm()).isEqualTo("AES");
    }

    @Test
    public void shouldNotLeakKeyMaterialThroughToString() {
        var key = new DestroyableSecretKey("AES", new byte[] { 0x7f, 0x7f, 0x7f });

        assertThat(key.toString()).doesNotContain("7f").contains("AES");
    }

    @Test
    public void shouldRefuseAccessAfterClose() {
        DestroyableSecretKey escaped;
        try (var key = new DestroyableSecretKey("AES", new byte[32])) {
            escaped = key;
        }

        assertThat(escaped.isDestroyed()).isTrue();
        assertThatThrownBy(escaped::getEncoded).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldCompareInConstantTimeByContent() {
        var a = new DestroyableSecretKey("AES", new byte[] { 1, 2, 3 });
        var b = new DestroyableSecretKey("AES", new byte[] { 1, 2, 3 });
        var c = new DestroyableSecretKey("HmacSHA256", new byte[] { 1, 2, 3 });

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b).isNotEqualTo(c);
    }
}
