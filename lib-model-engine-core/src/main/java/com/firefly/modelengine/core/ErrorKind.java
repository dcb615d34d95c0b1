/*
 * Copyright 2025 Firefly Software Solutions Inc
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


package com.firefly.modelengine.core;

/**
 * Machine-readable classification of a failed {@link OperationResult}.
 */
public enum ErrorKind {
    /** Success: no error. */
    NONE,
    /** Malformed or missing parameters. Never opens a scope. */
    VALIDATION,
    /** Unresolved operation name or a missing referenced entity. */
    NOT_FOUND,
    /** Illegal transition, e.g. committing without an active group. */
    STATE,
    /** The resource refused or failed a mutation after failure classification. */
    RESOURCE,
    /** Unexpected fault raised by a handler, caught at the executor boundary. */
    EXCEPTION,
    /** The handler reported a domain failure not covered by another kind. */
    OPERATION
}
