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
 * Common parent of the two ways an envelope can be rejected while opening it. In security-sensitive contexts
 * callers should catch this type rather than its subclasses and report a single generic failure, so that the
 * failing stage is not revealed to whoever supplied the envelope.
 */
public abstract class MessageRejectedException extends MessageCryptoException {
    MessageRejectedException(String message) {
        super(message);
    }

    MessageRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
