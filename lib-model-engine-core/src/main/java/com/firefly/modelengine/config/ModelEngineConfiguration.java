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

import com.firefly.modelengine.aop.OperationLoggingAspect;
import com.firefly.modelengine.dispatch.CommandDispatcher;
import com.firefly.modelengine.engine.ModelTransactionEngine;
import com.firefly.modelengine.failure.DefaultFailureClassificationPolicy;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.group.TransactionGroupManager;
import com.firefly.modelengine.observability.CompositeEngineEvents;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.observability.EngineLoggerEvents;
import com.firefly.modelengine.observability.EngineMicrometerEvents;
import com.firefly.modelengine.observability.EngineTracingEvents;
import com.firefly.modelengine.registry.OperationRegistry;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.tasks.TaskBatchManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring configuration that wires the model transaction engine components.
 * Users typically activate it via {@link com.firefly.modelengine.annotations.EnableModelTransactionEngine}.
 * A {@link ResourceHandle} bean must be provided by the host.
 */
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(ModelEngineProperties.class)
public class ModelEngineConfiguration {

    @Bean
    public OperationRegistry operationRegistry(ApplicationContext applicationContext) {
        return new OperationRegistry(applicationContext);
    }

    @Bean
    @ConditionalOnMissingBean(FailureClassificationPolicy.class)
    public FailureClassificationPolicy failureClassificationPolicy(ModelEngineProperties properties) {
        return new DefaultFailureClassificationPolicy(
                properties.getFailure().isSuppressWarnings(),
                properties.getFailure().isResolveErrors());
    }

    @Bean
    public TransactionGroupManager transactionGroupManager(ResourceHandle resource,
                                                           FailureClassificationPolicy policy,
                                                           EngineEvents events,
                                                           ModelEngineProperties properties) {
        return new TransactionGroupManager(resource, policy, events, Clock.systemDefaultZone(),
                properties.getGroup().getDefaultNamePattern());
    }

    @Bean
    public ModelTransactionEngine modelTransactionEngine(ResourceHandle resource,
                                                         OperationRegistry registry,
                                                         TransactionGroupManager groups,
                                                         FailureClassificationPolicy policy,
                                                         EngineEvents events,
                                                         ModelEngineProperties properties) {
        return new ModelTransactionEngine(resource, registry, groups, policy, events,
                properties.getBatch().toPolicy(), properties.getBatch().getPartialSuccess());
    }

    @Bean
    public TaskBatchManager taskBatchManager(ModelTransactionEngine engine, ModelEngineProperties properties) {
        return new TaskBatchManager(engine, Clock.systemUTC(),
                properties.getTasks().getDefaultErrorStrategy(),
                properties.getTasks().getMaxBatches());
    }

    @Bean
    public CommandDispatcher commandDispatcher(ModelTransactionEngine engine,
                                               TaskBatchManager taskBatchManager,
                                               ModelEngineProperties properties) {
        return new CommandDispatcher(engine, taskBatchManager,
                properties.getDispatcher().getThreadName(),
                properties.getLogging().getPreviewLength());
    }

    @Bean
    public EngineLoggerEvents engineLoggerEvents() {
        return new EngineLoggerEvents();
    }

    /**
     * Fans out to every other {@link EngineEvents} bean: the logger sink, the Micrometer/Tracing sinks when
     * their infrastructure is present, and any sink contributed by the application or a starter.
     */
    @Bean
    @Primary
    public EngineEvents engineEventsComposite(ObjectProvider<EngineEvents> sinks) {
        List<EngineEvents> all = new ArrayList<>();
        sinks.orderedStream().forEach(all::add);
        return new CompositeEngineEvents(all);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerAutoConfig {
        @Bean
        public EngineMicrometerEvents engineMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new EngineMicrometerEvents(registry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.tracing.Tracer")
    @ConditionalOnBean(type = "io.micrometer.tracing.Tracer")
    static class TracingAutoConfig {
        @Bean
        public EngineTracingEvents engineTracingEvents(io.micrometer.tracing.Tracer tracer) {
            return new EngineTracingEvents(tracer);
        }
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.model.engine.operation-logging.enabled", havingValue = "true", matchIfMissing = true)
    public OperationLoggingAspect operationLoggingAspect(ModelEngineProperties properties) {
        return new OperationLoggingAspect(properties.getLogging().getPreviewLength());
    }
}
