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
 * Base class of every exception thrown by this library. Low-level JCA and BouncyCastle failures are always wrapped
 * in one of the subclasses, so callers never have to deal with provider-specific exception types.
 */
public abstract class MessageCryptoException extends RuntimeException {
    MessageCryptoException(String message) {
        super(message);
    }

    MessageCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
