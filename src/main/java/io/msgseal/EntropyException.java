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
 * Thrown when the secure random number generator cannot produce key material. This indicates a problem with the
 * environment and is not worth retrying.
 */
public final class EntropyException extends MessageCryptoException {
    EntropyException(String message, Throwable cause) {
        super(message, cause);
    }
}
