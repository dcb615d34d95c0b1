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


package com.firefly.modelengine.engine;

import com.firefly.modelengine.core.BatchPolicy;
import com.firefly.modelengine.core.BatchResult;
import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.PartialSuccessMode;
import com.firefly.modelengine.failure.DefaultFailureClassificationPolicy;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.support.TestModel;
import com.firefly.modelengine.support.TestOperations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

    private TestModel model;
    private ModelTransactionEngine engine;

    @BeforeEach
    void setUp() {
        model = new TestModel();
        engine = new ModelTransactionEngine(model, TestOperations.registry(), new DefaultFailureClassificationPolicy(), EngineEvents.NO_OP);
    }

    private static List<Operation> abc() {
        return List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("putThenFail", Map.of("key", "b")),
                Operation.of("put", Map.of("key", "c"))
        );
    }

    @Test
    void stopOnErrorRollsBackEverythingAndSkipsRemainingOperations() {
        BatchResult result = engine.runBatch(abc(), BatchPolicy.stopOnError("Batch"));

        assertEquals(1, result.succeededCount());
        assertEquals(1, result.failedCount());
        assertTrue(result.rolledBack());
        assertFalse(result.committed());
        assertEquals(2, result.perOperation().size());
        assertEquals(ErrorKind.NOT_FOUND, result.perOperation().get(1).result().errorKind());
        assertEquals("Operation 1 (putThenFail) failed: X not found. Transaction rolled back.", result.message());
        assertTrue(model.values().isEmpty());
        assertEquals(0, model.openScopeDepth());
        assertEquals(List.of("begin:Batch", "begin:put", "commit:put", "begin:putThenFail", "rollback:putThenFail", "rollback:Batch"),
                model.journal);
    }

    @Test
    void continueOnErrorCommitsOnlySucceededOperations() {
        BatchResult result = engine.runBatch(abc(), BatchPolicy.continueOnError("Batch"));

        assertEquals(2, result.succeededCount());
        assertEquals(1, result.failedCount());
        assertFalse(result.rolledBack());
        assertTrue(result.committed());
        assertEquals(3, result.perOperation().size());
        assertEquals(Map.of("a", "v", "c", "v"), model.values());
        assertEquals(List.of("a", "c"), result.createdIds());
        assertEquals("Batch had 1 failures", result.message());
    }

    @Test
    void partialSuccessIsReportedAccordingToMode() {
        BatchResult result = engine.runBatch(abc(), BatchPolicy.continueOnError("Batch"));

        assertFalse(result.isSuccess(PartialSuccessMode.REPORT_FAILURE));
        assertTrue(result.isSuccess(PartialSuccessMode.REPORT_SUCCESS));
    }

    @Test
    void unknownOperationIsRecordedWithoutOpeningASubScope() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("noSuchOperation")), BatchPolicy.continueOnError("Batch"));

        BatchResult.OperationOutcome missing = result.perOperation().get(1);
        assertEquals(ErrorKind.NOT_FOUND, missing.result().errorKind());
        assertEquals("Method 'noSuchOperation' not found", missing.result().errorMessage().orElseThrow());
        assertFalse(model.journal.contains("begin:noSuchOperation"));
        assertEquals(Map.of("a", "v"), model.values());
    }

    @Test
    void blankMethodNameIsRecordedAsNotFoundAndTheBatchContinues() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of(""),
                Operation.of("put", Map.of("key", "c"))), BatchPolicy.continueOnError("B"));

        assertEquals(3, result.perOperation().size());
        BatchResult.OperationOutcome blank = result.perOperation().get(1);
        assertEquals("(empty)", blank.name());
        assertEquals(ErrorKind.NOT_FOUND, blank.result().errorKind());
        assertEquals("Method '(empty)' not found", blank.result().errorMessage().orElseThrow());
        assertTrue(result.committed());
        assertEquals(2, result.succeededCount());
        assertEquals(Map.of("a", "v", "c", "v"), model.values());
    }

    @Test
    void missingEntryIsTreatedLikeABlankName() {
        List<Operation> operations = new ArrayList<>();
        operations.add(Operation.of("put", Map.of("key", "a")));
        operations.add(null);

        BatchResult result = engine.runBatch(operations, BatchPolicy.stopOnError("B"));

        assertEquals(ErrorKind.NOT_FOUND, result.perOperation().get(1).result().errorKind());
        assertTrue(result.rolledBack());
        assertTrue(model.values().isEmpty());
    }

    @Test
    void invalidParametersAreRecordedWithoutOpeningASubScope() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("put"),
                Operation.of("put", Map.of("key", "c"))), BatchPolicy.continueOnError("Batch"));

        BatchResult.OperationOutcome invalid = result.perOperation().get(1);
        assertEquals(ErrorKind.VALIDATION, invalid.result().errorKind());
        assertEquals("key", invalid.result().payload().get("parameter"));
        assertEquals(List.of("begin:Batch", "begin:put", "commit:put", "begin:put", "commit:put", "commit:Batch"),
                model.journal);
        assertEquals(Map.of("a", "v", "c", "v"), model.values());
    }

    @Test
    void warningsBecomeFatalWhenTheBatchDoesNotContinueOnWarning() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("warn")), BatchPolicy.continueOnError("Strict").withContinueOnWarning(false));

        assertEquals(ErrorKind.RESOURCE, result.perOperation().get(1).result().errorKind());
        assertTrue(result.committed());
        assertEquals(Map.of("a", "v"), model.values());
    }

    @Test
    void batchCanContinueOnWarningWhenTheEnginePolicyDoesNot() {
        ModelTransactionEngine strict = new ModelTransactionEngine(model, TestOperations.registry(),
                new DefaultFailureClassificationPolicy(false, true), EngineEvents.NO_OP);

        BatchResult result = strict.runBatch(List.of(Operation.of("warn")),
                BatchPolicy.stopOnError("Lenient").withContinueOnWarning(true));
        BatchResult refused = strict.runBatch(List.of(Operation.of("warn")), BatchPolicy.stopOnError("Default"));

        assertTrue(result.committed());
        assertTrue(refused.rolledBack());
    }

    @Test
    void unknownOperationStopsAStopOnErrorBatch() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("noSuchOperation"),
                Operation.of("put", Map.of("key", "c"))), BatchPolicy.stopOnError("Batch"));

        assertTrue(result.rolledBack());
        assertEquals(2, result.perOperation().size());
        assertTrue(model.values().isEmpty());
    }

    @Test
    void exceptionIsConvertedAndItsPartialEffectsAreUndone() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("putThenThrow", Map.of("key", "x")),
                Operation.of("put", Map.of("key", "a"))), BatchPolicy.continueOnError("Batch"));

        assertEquals(ErrorKind.EXCEPTION, result.perOperation().get(0).result().errorKind());
        assertEquals("boom", result.perOperation().get(0).result().errorMessage().orElseThrow());
        assertEquals(Map.of("a", "v"), model.values());
    }

    @Test
    void exceptionWithoutIsolationRollsBackEvenWhenContinuingOnError() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("putThenThrow", Map.of("key", "b")),
                Operation.of("put", Map.of("key", "c"))), new BatchPolicy("Shared", false, false));

        assertTrue(result.rolledBack());
        assertEquals(2, result.perOperation().size());
        assertEquals("Operation 1 (putThenThrow) threw exception: boom. Transaction rolled back.", result.message());
        assertTrue(model.values().isEmpty());
    }

    @Test
    void fatalFailureInsideAnOperationFailsOnlyThatOperation() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("fatal"),
                Operation.of("warn"),
                Operation.of("put", Map.of("key", "c"))), BatchPolicy.continueOnError("Batch"));

        assertEquals(ErrorKind.RESOURCE, result.perOperation().get(1).result().errorKind());
        assertTrue(result.perOperation().get(2).result().isSuccess(), "warnings are suppressed");
        assertTrue(result.committed());
        assertEquals(Map.of("a", "v", "c", "v"), model.values());
    }

    @Test
    void batchScopeRefusedByTheModelIsReportedAsRolledBack() {
        BatchResult result = engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "a")),
                Operation.of("fatal")), new BatchPolicy("Shared", false, false));

        assertTrue(result.rolledBack());
        assertFalse(result.committed());
        assertEquals(ErrorKind.RESOURCE, result.scopeFailure().orElseThrow().errorKind());
        assertEquals(2, result.succeededCount());
        assertTrue(model.values().isEmpty());
    }

    @Test
    void emptyBatchIsRejectedWithoutTouchingTheModel() {
        BatchResult result = engine.runBatch(List.of(), BatchPolicy.stopOnError("Empty"));

        assertFalse(result.committed());
        assertFalse(result.rolledBack());
        assertEquals(ErrorKind.VALIDATION, result.scopeFailure().orElseThrow().errorKind());
        assertTrue(model.journal.isEmpty());
    }

    @Test
    void operationsRunInListOrder() {
        engine.runBatch(List.of(
                Operation.of("put", Map.of("key", "k", "value", "1")),
                Operation.of("put", Map.of("key", "k", "value", "2")),
                Operation.of("expect", Map.of("key", "k", "value", "2"))), BatchPolicy.stopOnError("Ordered"));

        assertEquals("2", model.values().get("k"));
    }

    @Test
    void defaultPolicyStopsOnError() {
        BatchResult result = engine.runBatch(abc());

        assertEquals(BatchPolicy.DEFAULT_NAME, result.batchName());
        assertTrue(result.rolledBack());
    }
}
