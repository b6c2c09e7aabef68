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
 * Thrown when a session key cannot be encrypted for a recipient, usually because the recipient's public key is
 * malformed.
 */
public final class KeyWrapException extends MessageCryptoException {
    KeyWrapException(String message) {
        super(message);
    }

    KeyWrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
