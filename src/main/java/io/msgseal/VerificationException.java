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
 * Thrown when a signature could not be checked at all, for example because the public key does not parse. A
 * signature that is checked and found to be invalid is never reported with this exception; the verifier returns
 * {@code false} instead.
 */
public final class VerificationException extends MessageCryptoException {
    VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
