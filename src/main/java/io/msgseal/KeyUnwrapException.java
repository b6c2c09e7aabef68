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
 * Thrown when the wrapped session key of an envelope cannot be recovered: the private key is malformed, the wrapped
 * key is truncated, or the decrypted key has the wrong length.
 */
public final class KeyUnwrapException extends MessageCryptoException {
    KeyUnwrapException(String message) {
        super(message);
    }

    KeyUnwrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
