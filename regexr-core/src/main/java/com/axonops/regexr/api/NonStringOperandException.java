/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.regexr.api;

/**
 * Thrown when raw (unescaped) pattern text is given a structured node instead of text.
 *
 * @since 1.0.0
 */
public final class NonStringOperandException extends RegexrException {

    public NonStringOperandException(String message) {
        super("Regexr: Raw text accepts only literal strings: " + message);
    }
}
