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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.Test;

public class EnvelopeReaderTest {

    @Test
    public void shouldConsumeFieldsInOrder() {
        var reader = new EnvelopeReader("MESSAGE:abcdefgh".getBytes(US_ASCII));

        reader.expect("MESSAGE:".getBytes(US_ASCII), "marker");
        assertThat(reader.position()).isEqualTo(8);
        assertThat(reader.readFixedLengthBytes(3, "field")).asString(US_ASCII).isEqualTo("abc");
        assertThat(reader.readRemaining()).asString(US_ASCII).isEqualTo("defgh");
        assertThat(reader.remaining()).isZero();
        assertThat(reader.readRemaining()).isEmpty();
    }

    @Test
    public void shouldNotMoveWhenLiteralDoesNotMatch() {
        var reader = new EnvelopeReader("MESSAGX:".getBytes(US_ASCII));

        assertThatThrownBy(() -> reader.expect("MESSAGE:".getBytes(US_ASCII), "marker"))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("marker");
        assertThat(reader.position()).isZero();
    }

    @Test
    public void shouldRejectLiteralLongerThanData() {
        var reader = new EnvelopeReader("MESS".getBytes(US_ASCII));

        assertThatThrownBy(() -> reader.expect("MESSAGE:".getBytes(US_ASCII), "marker"))
                .isInstanceOf(FormatException.class);
    }

    @Test
    public void shouldRejectTruncatedFixedLengthField() {
        var reader = new EnvelopeReader(new byte[10]);
        reader.readFixedLengthBytes(4, "first");

        assertThatThrownBy(() -> reader.readFixedLengthBytes(7, "IV"))
                .isInstanceOf(FormatException.class)
                .hasMessage("Truncated IV");
        assertThat(reader.remaining()).isEqualTo(6);
    }

    @Test
    public void shouldReadAtMostWhatRemains() {
        var reader = new EnvelopeReader(new byte[10]);

        assertThat(reader.readAtMost(4)).hasSize(4);
        assertThat(reader.readAtMost(100)).hasSize(6);
        assertThat(reader.readAtMost(1)).isEmpty();
    }

    @Test
    public void shouldNotModifyUnderlyingData() {
        var data = "MESSAGE:xyz".getBytes(US_ASCII);
        var reader = new EnvelopeReader(data);
        reader.readFixedLengthBytes(8, "marker")[0] = 0;

        assertThat(data).asString(US_ASCII).isEqualTo("MESSAGE:xyz");
    }
}
