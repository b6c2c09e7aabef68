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
 * Thrown when the decrypted payload of an envelope does not start with the recognition tag. This happens either
 * because the envelope was sealed for a different key or because the ciphertext was corrupted. The two cases cannot
 * be told apart.
 */
public final class AuthenticityException extends MessageRejectedException {
    AuthenticityException(String message) {
        super(message);
    }

    AuthenticityException(String message, Throwable cause) {
        super(message, cause);
    }
}
