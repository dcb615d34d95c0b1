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


package com.firefly.modelengine.config;

import com.firefly.modelengine.annotations.EnableModelTransactionEngine;
import com.firefly.modelengine.annotations.ModelOperation;
import com.firefly.modelengine.annotations.OperationProvider;
import com.firefly.modelengine.aop.OperationLoggingAspect;
import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.PartialSuccessMode;
import com.firefly.modelengine.dispatch.CommandDispatcher;
import com.firefly.modelengine.dispatch.CommandRequest;
import com.firefly.modelengine.dispatch.CommandResponse;
import com.firefly.modelengine.engine.ModelTransactionEngine;
import com.firefly.modelengine.failure.DefaultFailureClassificationPolicy;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.observability.CompositeEngineEvents;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.observability.EngineLoggerEvents;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.support.TestModel;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModelEngineConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(HostConfig.class);

    @Configuration
    @EnableModelTransactionEngine
    static class HostConfig {
        @Bean
        public ResourceHandle resourceHandle() {
            return new TestModel();
        }

        @Bean
        public WallOperations wallOperations() {
            return new WallOperations();
        }

        @Bean
        public RecordingEvents recordingEvents() {
            return new RecordingEvents();
        }
    }

    @OperationProvider
    public static class WallOperations {
        @ModelOperation(name = "createWall", description = "Create a wall")
        public OperationResult createWall(ResourceHandle resource, OperationParams params) {
            ((TestModel) resource).put("wall", params.getString("level").orElse("L1"));
            return OperationResult.success(Map.of("wallId", "wall"));
        }
    }

    static class RecordingEvents implements EngineEvents {
        final List<String> committed = new ArrayList<>();

        @Override
        public void onScopeCommitted(String scope, String scopeId) {
            committed.add(scope);
        }
    }

    @Test
    void wiresTheEngineAroundTheHostResource() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ModelTransactionEngine.class);
            assertThat(context).hasSingleBean(CommandDispatcher.class);
            assertThat(context).hasSingleBean(OperationLoggingAspect.class);
            assertThat(context).hasSingleBean(EngineLoggerEvents.class);

            ModelTransactionEngine engine = context.getBean(ModelTransactionEngine.class);
            assertThat(engine.resource()).isSameAs(context.getBean(ResourceHandle.class));
            assertThat(engine.partialSuccessMode()).isEqualTo(PartialSuccessMode.REPORT_FAILURE);
            assertThat(engine.defaultBatchPolicy().stopOnError()).isTrue();
        });
    }

    @Test
    void compositeEventsIncludeEveryContributedSink() {
        contextRunner.run(context -> {
            EngineEvents primary = context.getBean(EngineEvents.class);
            assertThat(primary).isInstanceOf(CompositeEngineEvents.class);
            assertThat(((CompositeEngineEvents) primary).sinks())
                    .hasAtLeastOneElementOfType(EngineLoggerEvents.class)
                    .hasAtLeastOneElementOfType(RecordingEvents.class);
        });
    }

    @Test
    void dispatchesToAnnotatedProvidersThroughTheLoggingAspect() {
        contextRunner.run(context -> {
            assertThat(AopUtils.isAopProxy(context.getBean(WallOperations.class))).isTrue();

            CommandResponse response = context.getBean(CommandDispatcher.class)
                    .dispatchNow(CommandRequest.of("createwall", Map.of("level", "L2")));

            assertThat(response.success()).isTrue();
            assertThat(response.get("wallId")).isEqualTo("wall");
            assertThat(((TestModel) context.getBean(ResourceHandle.class)).values()).containsEntry("wall", "L2");
            assertThat(context.getBean(RecordingEvents.class).committed).containsExactly("createWall");
        });
    }

    @Test
    void bindsEngineProperties() {
        contextRunner
                .withPropertyValues(
                        "firefly.model.engine.batch.default-name=Import",
                        "firefly.model.engine.batch.stop-on-error=false",
                        "firefly.model.engine.batch.partial-success=report-success",
                        "firefly.model.engine.failure.suppress-warnings=false",
                        "firefly.model.engine.dispatcher.thread-name=revit-main")
                .run(context -> {
                    ModelTransactionEngine engine = context.getBean(ModelTransactionEngine.class);
                    assertThat(engine.defaultBatchPolicy().name()).isEqualTo("Import");
                    assertThat(engine.defaultBatchPolicy().stopOnError()).isFalse();
                    assertThat(engine.partialSuccessMode()).isEqualTo(PartialSuccessMode.REPORT_SUCCESS);

                    FailureClassificationPolicy policy = context.getBean(FailureClassificationPolicy.class);
                    assertThat(((DefaultFailureClassificationPolicy) policy).suppressesWarnings()).isFalse();
                    assertThat(((DefaultFailureClassificationPolicy) policy).resolvesErrors()).isTrue();
                });
    }

    @Test
    void operationLoggingAspectCanBeDisabled() {
        contextRunner
                .withPropertyValues("firefly.model.engine.operation-logging.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(OperationLoggingAspect.class));
    }
}
