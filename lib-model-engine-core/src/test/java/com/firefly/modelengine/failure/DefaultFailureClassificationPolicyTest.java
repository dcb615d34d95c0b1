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


package com.firefly.modelengine.failure;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultFailureClassificationPolicyTest {

    private final ModelFailure warning = ModelFailure.warning("W1", "Walls overlap");
    private final ModelFailure resolvable = ModelFailure.error("E1", "Missing host", true);
    private final ModelFailure hard = ModelFailure.error("E2", "Element is pinned", false);

    @Test
    void suppressesWarningsAndResolvesWhatCanBeResolved() {
        FailureProcessingOutcome outcome = new DefaultFailureClassificationPolicy().process(List.of(warning, resolvable));

        assertEquals(List.of(warning), outcome.suppressed());
        assertEquals(List.of(resolvable), outcome.resolved());
        assertTrue(outcome.proceed());
    }

    @Test
    void nonResolvableErrorsAreFatal() {
        FailureProcessingOutcome outcome = new DefaultFailureClassificationPolicy().process(List.of(warning, hard));

        assertEquals(List.of(hard), outcome.fatal());
        assertFalse(outcome.proceed());
        assertEquals(2, outcome.total());
    }

    @Test
    void strictPolicyFailsOnWarningsAndResolvableErrors() {
        DefaultFailureClassificationPolicy strict = new DefaultFailureClassificationPolicy(false, false);

        assertEquals(FailureAction.FAIL, strict.classify(warning));
        assertEquals(FailureAction.FAIL, strict.classify(resolvable));
    }

    @Test
    void noFailuresLetTheScopeProceed() {
        assertSame(FailureProcessingOutcome.EMPTY, new DefaultFailureClassificationPolicy().process(List.of()));
        assertTrue(FailureProcessingOutcome.EMPTY.proceed());
    }

    @Test
    void customPoliciesOnlyNeedToClassify() {
        FailureClassificationPolicy failEverything = f -> FailureAction.FAIL;

        assertFalse(failEverything.process(List.of(warning)).proceed());
    }
}
