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
 * How a committed continue-on-error batch with some failed operations is reported to the caller.
 * The batch commits in both modes; only the top-level {@code success} flag differs.
 */
public enum PartialSuccessMode {
    /** {@code success} is true only when no operation failed. */
    REPORT_FAILURE,
    /** {@code success} is true whenever the batch committed. */
    REPORT_SUCCESS
}
