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

import com.firefly.modelengine.core.BatchPolicy;
import com.firefly.modelengine.core.PartialSuccessMode;
import com.firefly.modelengine.group.TransactionGroupManager;
import com.firefly.modelengine.tasks.ErrorStrategy;
import com.firefly.modelengine.tasks.TaskBatchManager;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties for the model transaction engine.
 *
 * Example configuration:
 * <pre>
 * firefly.model.engine.batch.default-name=Batch Operation
 * firefly.model.engine.batch.stop-on-error=true
 * firefly.model.engine.batch.partial-success=REPORT_FAILURE
 * firefly.model.engine.failure.suppress-warnings=true
 * firefly.model.engine.group.default-name-pattern=AI Operation %s
 * firefly.model.engine.dispatcher.thread-name=model-dispatch
 * firefly.model.engine.logging.preview-length=200
 * firefly.model.engine.tasks.default-error-strategy=LOG_AND_CONTINUE
 * firefly.model.engine.tasks.max-batches=20
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.model.engine")
public class ModelEngineProperties {

    @NestedConfigurationProperty
    private BatchProperties batch = new BatchProperties();

    @NestedConfigurationProperty
    private FailureProperties failure = new FailureProperties();

    @NestedConfigurationProperty
    private GroupProperties group = new GroupProperties();

    @NestedConfigurationProperty
    private DispatcherProperties dispatcher = new DispatcherProperties();

    @NestedConfigurationProperty
    private LoggingProperties logging = new LoggingProperties();

    @NestedConfigurationProperty
    private TaskProperties tasks = new TaskProperties();

    public TaskProperties getTasks() {
        return tasks;
    }

    public void setTasks(TaskProperties tasks) {
        this.tasks = tasks;
    }

    public BatchProperties getBatch() {
        return batch;
    }

    public void setBatch(BatchProperties batch) {
        this.batch = batch;
    }

    public FailureProperties getFailure() {
        return failure;
    }

    public void setFailure(FailureProperties failure) {
        this.failure = failure;
    }

    public GroupProperties getGroup() {
        return group;
    }

    public void setGroup(GroupProperties group) {
        this.group = group;
    }

    public DispatcherProperties getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(DispatcherProperties dispatcher) {
        this.dispatcher = dispatcher;
    }

    public LoggingProperties getLogging() {
        return logging;
    }

    public void setLogging(LoggingProperties logging) {
        this.logging = logging;
    }

    /**
     * Batch defaults, used when a request does not say otherwise.
     */
    public static class BatchProperties {
        private String defaultName = BatchPolicy.DEFAULT_NAME;
        private boolean stopOnError = true;
        /**
         * How a committed continue-on-error batch with failures is reported.
         */
        private PartialSuccessMode partialSuccess = PartialSuccessMode.REPORT_FAILURE;
        /**
         * Run each batch operation in its own nested scope.
         */
        private boolean isolateOperations = true;

        public String getDefaultName() {
            return defaultName;
        }

        public void setDefaultName(String defaultName) {
            this.defaultName = defaultName;
        }

        public boolean isStopOnError() {
            return stopOnError;
        }

        public void setStopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
        }

        public PartialSuccessMode getPartialSuccess() {
            return partialSuccess;
        }

        public void setPartialSuccess(PartialSuccessMode partialSuccess) {
            this.partialSuccess = partialSuccess;
        }

        public boolean isIsolateOperations() {
            return isolateOperations;
        }

        public void setIsolateOperations(boolean isolateOperations) {
            this.isolateOperations = isolateOperations;
        }

        public BatchPolicy toPolicy() {
            return new BatchPolicy(defaultName, stopOnError, isolateOperations);
        }
    }

    public static class FailureProperties {
        /**
         * Suppress warnings raised by the model; when false a warning makes the scope fail.
         */
        private boolean suppressWarnings = true;
        /**
         * Apply the model's automatic resolution to resolvable errors.
         */
        private boolean resolveErrors = true;

        public boolean isSuppressWarnings() {
            return suppressWarnings;
        }

        public void setSuppressWarnings(boolean suppressWarnings) {
            this.suppressWarnings = suppressWarnings;
        }

        public boolean isResolveErrors() {
            return resolveErrors;
        }

        public void setResolveErrors(boolean resolveErrors) {
            this.resolveErrors = resolveErrors;
        }
    }

    public static class GroupProperties {
        /**
         * Name used when a group is started without one; {@code %s} receives the time as HH:mm:ss.
         */
        private String defaultNamePattern = TransactionGroupManager.DEFAULT_NAME_PATTERN;

        public String getDefaultNamePattern() {
            return defaultNamePattern;
        }

        public void setDefaultNamePattern(String defaultNamePattern) {
            this.defaultNamePattern = defaultNamePattern;
        }
    }

    public static class DispatcherProperties {
        private String threadName = "model-dispatch";

        public String getThreadName() {
            return threadName;
        }

        public void setThreadName(String threadName) {
            this.threadName = threadName;
        }
    }

    public static class LoggingProperties {
        /**
         * Maximum length of result previews in log lines.
         */
        private int previewLength = 200;

        public int getPreviewLength() {
            return previewLength;
        }

        public void setPreviewLength(int previewLength) {
            this.previewLength = previewLength;
        }
    }

    public static class TaskProperties {
        /**
         * Error strategy of task batches created without one.
         */
        private ErrorStrategy defaultErrorStrategy = ErrorStrategy.LOG_AND_CONTINUE;
        /**
         * Task batches kept in memory; the oldest idle batch is dropped beyond this.
         */
        private int maxBatches = TaskBatchManager.DEFAULT_MAX_BATCHES;

        public ErrorStrategy getDefaultErrorStrategy() {
            return defaultErrorStrategy;
        }

        public void setDefaultErrorStrategy(ErrorStrategy defaultErrorStrategy) {
            this.defaultErrorStrategy = defaultErrorStrategy;
        }

        public int getMaxBatches() {
            return maxBatches;
        }

        public void setMaxBatches(int maxBatches) {
            this.maxBatches = maxBatches;
        }
    }
}
