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

import java.util.Optional;

/**
 * Outcome of the two-phase execute-then-verify protocol.
 */
public final class VerifyResult {
    private final VerifyPhase phase;
    private final OperationResult mainResult;
    private final OperationResult verifyResult; // null when verification never ran
    private final OperationResult commitFailure; // resource refused the final commit
    private final boolean wasRolledBack;

    private VerifyResult(VerifyPhase phase,
                         OperationResult mainResult,
                         OperationResult verifyResult,
                         OperationResult commitFailure,
                         boolean wasRolledBack) {
        this.phase = phase;
        this.mainResult = mainResult;
        this.verifyResult = verifyResult;
        this.commitFailure = commitFailure;
        this.wasRolledBack = wasRolledBack;
    }

    public static VerifyResult executionFailed(OperationResult main) {
        return new VerifyResult(VerifyPhase.EXECUTION, main, null, null, true);
    }

    /**
     * Nothing ran because an operation could not be resolved. For {@link VerifyPhase#VERIFICATION} the main
     * operation is reported as not executed.
     */
    public static VerifyResult rejected(VerifyPhase phase, OperationResult failure) {
        if (phase == VerifyPhase.EXECUTION) {
            return new VerifyResult(phase, failure, null, null, false);
        }
        OperationResult notRun = OperationResult.failure(ErrorKind.STATE, "Main operation not executed");
        return new VerifyResult(VerifyPhase.VERIFICATION, notRun, failure, null, false);
    }

    public static VerifyResult verificationFailed(OperationResult main, OperationResult verify) {
        return new VerifyResult(VerifyPhase.VERIFICATION, main, verify, null, true);
    }

    public static VerifyResult complete(OperationResult main, OperationResult verify) {
        return new VerifyResult(VerifyPhase.COMPLETE, main, verify, null, false);
    }

    /** Both phases passed but the resource rolled the scope back while committing. */
    public static VerifyResult commitFailed(OperationResult main, OperationResult verify, OperationResult failure) {
        return new VerifyResult(VerifyPhase.COMPLETE, main, verify, failure, true);
    }

    public VerifyPhase phase() { return phase; }
    public OperationResult mainResult() { return mainResult; }
    public Optional<OperationResult> verifyResult() { return Optional.ofNullable(verifyResult); }
    public Optional<OperationResult> commitFailure() { return Optional.ofNullable(commitFailure); }
    public boolean wasRolledBack() { return wasRolledBack; }

    public boolean isSuccess() {
        return phase == VerifyPhase.COMPLETE && commitFailure == null;
    }

    public String message() {
        return switch (phase) {
            case EXECUTION -> wasRolledBack ? "Main operation failed, rolled back" : "Main operation could not run";
            case VERIFICATION -> wasRolledBack ? "Verification failed, changes rolled back" : "Verification could not run";
            case COMPLETE -> commitFailure == null
                    ? "Operation and verification both succeeded"
                    : "Commit refused by the model, changes rolled back: " + commitFailure.errorMessage().orElse("");
        };
    }
}
