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
 * Thrown when a flag code string contains a character outside {@code aiLmsux}.
 *
 * @since 1.0.0
 */
public final class UnknownFlagCodeException extends RegexrException {

    private final String codes;

    public UnknownFlagCodeException(String codes, char unknown) {
        super("Regexr: Invalid flag '" + unknown + "' in \"" + codes + "\", must be a subset of 'aiLmsux'");
        this.codes = codes;
    }

    public String getCodes() {
        return codes;
    }
}
