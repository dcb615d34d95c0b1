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


package com.firefly.modelengine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.modelengine.failure.DefaultFailureClassificationPolicy;
import com.firefly.modelengine.engine.ModelTransactionEngine;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.support.TestModel;
import com.firefly.modelengine.support.TestOperations;
import com.firefly.modelengine.tasks.TaskBatchManager;
import com.firefly.modelengine.util.JsonUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommandDispatcherTest {

    private TestModel model;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        model = new TestModel();
        ModelTransactionEngine engine = new ModelTransactionEngine(
                model, TestOperations.registry(), new DefaultFailureClassificationPolicy(), EngineEvents.NO_OP);
        dispatcher = new CommandDispatcher(engine, new TaskBatchManager(engine), "model-test", 200);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void dispatchRunsOnTheModelThread() {
        StepVerifier.create(dispatcher.dispatch(CommandRequest.of("put", Map.of("key", "a"))))
                .assertNext(r -> {
                    assertThat(r.success()).isTrue();
                    assertThat(r.get("elementId")).isEqualTo("a");
                })
                .verifyComplete();

        assertThat(model.values()).containsEntry("a", "v");
        assertThat(model.journal).containsExactly("begin:put", "commit:put");
    }

    @Test
    void secondGroupStartIsRefusedWithTheActiveName() {
        dispatcher.dispatchNow(CommandRequest.of("startTransactionGroup", Map.of("name", "G1")));

        CommandResponse second = dispatcher.dispatchNow(CommandRequest.of("startTransactionGroup", Map.of("name", "G2")));

        assertThat(second.success()).isFalse();
        assertThat(second.error()).contains("AlreadyActive");
        assertThat(second.get("activeGroup")).isEqualTo("G1");
    }

    @Test
    void groupCommandsAreMatchedCaseInsensitively() {
        dispatcher.dispatchNow(CommandRequest.of("STARTTRANSACTIONGROUP", Map.of("name", "Walls")));
        dispatcher.dispatchNow(CommandRequest.of("put", Map.of("key", "a")));
        dispatcher.dispatchNow(CommandRequest.of("addCheckpoint", Map.of("name", "after a")));

        CommandResponse status = dispatcher.dispatchNow(CommandRequest.of("getTransactionStatus", Map.of()));
        assertThat(status.get("hasActiveGroup")).isEqualTo(true);
        assertThat(status.get("groupName")).isEqualTo("Walls");
        assertThat(status.get("checkpointCount")).isEqualTo(2);

        CommandResponse rollback = dispatcher.dispatchNow(CommandRequest.of("rollbackTransactionGroup", Map.of()));
        assertThat(rollback.success()).isTrue();
        assertThat(model.values()).isEmpty();
    }

    @Test
    void commitWithoutGroupReportsNoActiveGroup() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("commitTransactionGroup", Map.of()));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).contains("NoActiveGroup");
    }

    @Test
    void batchExecuteReportsPerOperationResultsAndCreatedIds() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("batchExecute", Map.of(
                "batchName", "Three",
                "stopOnError", false,
                "operations", List.of(
                        Map.of("method", "put", "params", Map.of("key", "A")),
                        Map.of("method", "putThenFail", "params", Map.of("key", "B")),
                        Map.of("method", "put", "params", Map.of("key", "C"))))));

        assertThat(r.success()).isFalse();
        assertThat(r.get("batchName")).isEqualTo("Three");
        assertThat(r.get("committed")).isEqualTo(true);
        assertThat(r.get("createdElementIds")).isEqualTo(List.of("A", "C"));
        assertThat(r.get("summary")).isEqualTo(Map.of("total", 3, "succeeded", 2, "failed", 1, "rolledBack", false));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) r.get("results");
        assertThat(results).hasSize(3);
        assertThat(results.get(1)).containsEntry("index", 1)
                .containsEntry("method", "putThenFail")
                .containsEntry("success", false)
                .containsEntry("error", "X not found");
        assertThat(model.values()).containsOnlyKeys("A", "C");
    }

    @Test
    void batchExecuteRejectsAnEmptyOperationList() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("batchExecute", Map.of("operations", List.of())));

        assertThat(r.success()).isFalse();
        assertThat(r.get("committed")).isEqualTo(false);
        assertThat(r.get("errorKind")).isEqualTo("VALIDATION");
        assertThat(model.journal).isEmpty();
    }

    @Test
    void malformedBatchEntryIsAValidationError() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("batchExecute", Map.of("operations", List.of("put"))));

        assertThat(r.success()).isFalse();
        assertThat(r.get("errorKind")).isEqualTo("VALIDATION");
        assertThat(r.get("parameter")).isEqualTo("operations");
    }

    @Test
    void batchEntryWithoutMethodIsRecordedAsNotFound() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("batchExecute", Map.of(
                "stopOnError", false,
                "operations", List.of(
                        Map.of("method", "put", "params", Map.of("key", "A")),
                        Map.of("params", Map.of("key", "B")),
                        Map.of("method", "put", "params", Map.of("key", "C"))))));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) r.get("results");
        assertThat(results).hasSize(3);
        assertThat(results.get(1)).containsEntry("method", "(empty)")
                .containsEntry("errorKind", "NOT_FOUND");
        assertThat(r.get("committed")).isEqualTo(true);
        assertThat(model.values()).containsOnlyKeys("A", "C");
    }

    @Test
    void batchExecuteCanTreatWarningsAsFailures() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("batchExecute", Map.of(
                "stopOnError", false,
                "continueOnWarning", false,
                "operations", List.of(
                        Map.of("method", "put", "params", Map.of("key", "A")),
                        Map.of("method", "warn")))));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) r.get("results");
        assertThat(results.get(1)).containsEntry("success", false)
                .containsEntry("errorKind", "RESOURCE");
        assertThat(r.get("committed")).isEqualTo(true);
        assertThat(model.values()).containsOnlyKeys("A");
    }

    @Test
    void taskBatchIsDrivenThroughBuiltInCommands() {
        CommandResponse created = dispatcher.dispatchNow(CommandRequest.of("createBatch", Map.of(
                "batchId", "b1",
                "name", "Walls",
                "onError", "skipAndContinue",
                "tasks", List.of(
                        Map.of("name", "first", "method", "put", "params", Map.of("key", "a")),
                        Map.of("method", "putThenFail", "params", Map.of("key", "b")),
                        Map.of("method", "put", "params", Map.of("key", "c"))))));
        assertThat(created.success()).isTrue();
        assertThat(created.get("totalTasks")).isEqualTo(3);
        assertThat(created.get("onError")).isEqualTo("SKIP_AND_CONTINUE");

        CommandResponse first = dispatcher.dispatchNow(CommandRequest.of("executeNextTask", Map.of()));
        assertThat(first.success()).isTrue();
        assertThat(first.get("name")).isEqualTo("first");
        assertThat(first.get("status")).isEqualTo("COMPLETED");

        CommandResponse all = dispatcher.dispatchNow(CommandRequest.of("executeAllTasks", Map.of()));
        assertThat(all.get("tasksExecuted")).isEqualTo(2);
        assertThat(all.get("completedTasks")).isEqualTo(2);
        assertThat(all.get("skippedTasks")).isEqualTo(1);
        assertThat(all.get("batchComplete")).isEqualTo(true);

        CommandResponse status = dispatcher.dispatchNow(CommandRequest.of("getBatchStatus", Map.of()));
        assertThat(status.get("hasBatch")).isEqualTo(true);
        assertThat(status.get("batchId")).isEqualTo("b1");
        @SuppressWarnings("unchecked")
        Map<String, Object> progress = (Map<String, Object>) status.get("progress");
        assertThat(progress).containsEntry("total", 3)
                .containsEntry("completed", 2)
                .containsEntry("skipped", 1)
                .containsEntry("percent", 100.0);
        assertThat(model.values()).containsOnlyKeys("a", "c");
    }

    @Test
    void pausedTaskBatchRefusesTheNextTask() {
        dispatcher.dispatchNow(CommandRequest.of("createBatch", Map.of(
                "tasks", List.of(Map.of("method", "put", "params", Map.of("key", "a"))))));
        dispatcher.dispatchNow(CommandRequest.of("pauseBatch", Map.of()));

        CommandResponse refused = dispatcher.dispatchNow(CommandRequest.of("executeNextTask", Map.of()));
        assertThat(refused.success()).isFalse();
        assertThat(refused.error()).hasValueSatisfying(e -> assertThat(e).contains("paused"));

        dispatcher.dispatchNow(CommandRequest.of("resumeBatch", Map.of()));
        assertThat(dispatcher.dispatchNow(CommandRequest.of("executeNextTask", Map.of())).success()).isTrue();
        assertThat(model.values()).containsOnlyKeys("a");
    }

    @Test
    void unknownErrorStrategyIsAValidationError() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("createBatch", Map.of(
                "onError", "panic",
                "tasks", List.of(Map.of("method", "put", "params", Map.of("key", "a"))))));

        assertThat(r.success()).isFalse();
        assertThat(r.get("errorKind")).isEqualTo("VALIDATION");
        assertThat(r.get("parameter")).isEqualTo("onError");
        assertThat(dispatcher.tasks().currentBatch()).isEmpty();
    }

    @Test
    void safeExecuteWrapsTheOperationResult() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("safeExecute", Map.of(
                "method", "putThenThrow", "params", Map.of("key", "a"), "operationName", "Risky")));

        assertThat(r.success()).isFalse();
        assertThat(r.get("operationName")).isEqualTo("Risky");
        assertThat(r.get("wasRolledBack")).isEqualTo(true);
        assertThat(r.error()).contains("boom");
        assertThat(model.values()).isEmpty();
    }

    @Test
    void verifyAndRollbackReportsThePhase() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("verifyAndRollback", Map.of(
                "method", "put", "params", Map.of("key", "a", "value", "1"),
                "verifyMethod", "expect", "verifyParams", Map.of("key", "a", "value", "2"))));

        assertThat(r.success()).isFalse();
        assertThat(r.get("phase")).isEqualTo("verification");
        assertThat(r.get("wasRolledBack")).isEqualTo(true);
        assertThat(model.values()).isEmpty();
    }

    @Test
    void missingMethodParameterIsAValidationError() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("safeExecute", Map.of()));

        assertThat(r.success()).isFalse();
        assertThat(r.get("errorKind")).isEqualTo("VALIDATION");
        assertThat(r.get("parameter")).isEqualTo("method");
    }

    @Test
    void unknownMethodIsNotFound() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("createSpaceship", Map.of()));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).contains("Method 'createSpaceship' not found");
        assertThat(model.journal).isEmpty();
    }

    @Test
    void listOperationsDescribesTheRegistry() {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("listOperations", Map.of()));

        assertThat(r.get("count")).isEqualTo(6);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> ops = (List<Map<String, Object>>) r.get("operations");
        assertThat(ops).anySatisfy(op -> {
            assertThat(op.get("name")).isEqualTo("put");
            assertThat(op.get("category")).isEqualTo("Test");
            assertThat(op.get("aliases")).isEqualTo(List.of("set"));
        });
    }

    @Test
    void responsesSerializeAsFlatJson() throws Exception {
        CommandResponse r = dispatcher.dispatchNow(CommandRequest.of("commitTransactionGroup", Map.of()));

        JsonNode json = JsonUtils.mapper().readTree(r.toJson());
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("error").asText()).isEqualTo("NoActiveGroup");
        assertThat(json.has("fields")).isFalse();
    }
}
