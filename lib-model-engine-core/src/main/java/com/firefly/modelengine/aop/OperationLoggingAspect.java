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


package com.firefly.modelengine.aop;

import com.firefly.modelengine.annotations.ModelOperation;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.engine.LogPreview;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.util.JsonUtils;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AOP aspect that logs operation method invocation context, latency and outcome.
 * Note: scopes, failure classification and exception conversion are handled by the engine; this only wraps
 * the original method to provide additional debug-level visibility with structured key=value logs.
 */
@Aspect
public class OperationLoggingAspect {
    private static final Logger log = LoggerFactory.getLogger(OperationLoggingAspect.class);

    private final int previewLength;

    public OperationLoggingAspect() {
        this(200);
    }

    public OperationLoggingAspect(int previewLength) {
        this.previewLength = previewLength;
    }

    @Around("@annotation(com.firefly.modelengine.annotations.ModelOperation)")
    public Object aroundModelOperation(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature ms = (MethodSignature) pjp.getSignature();
        ModelOperation ann = ms.getMethod().getAnnotation(ModelOperation.class);
        String operation = ann != null && !ann.name().isBlank() ? ann.name() : ms.getMethod().getName();
        String model = "n/a";
        for (Object arg : pjp.getArgs()) {
            if (arg instanceof ResourceHandle rh) { model = rh.title(); break; }
        }
        String className = ms.getDeclaringTypeName();
        String thread = Thread.currentThread().getName();

        long start = System.currentTimeMillis();
        if (log.isDebugEnabled()) {
            log.debug(JsonUtils.json(
                    "model_aspect", "operation_invocation_start",
                    "model", model,
                    "operation", operation,
                    "class", className,
                    "thread", thread
            ));
        }
        try {
            Object result = pjp.proceed();
            long elapsed = System.currentTimeMillis() - start;
            if (log.isDebugEnabled()) {
                String outcome = result instanceof OperationResult r
                        ? (r.isSuccess() ? "success" : r.errorKind().name())
                        : "n/a";
                log.debug(JsonUtils.json(
                        "model_aspect", "operation_invocation_success",
                        "model", model,
                        "operation", operation,
                        "class", className,
                        "latencyMs", Long.toString(elapsed),
                        "outcome", outcome,
                        "result_preview", LogPreview.preview(result, previewLength)
                ));
            }
            return result;
        } catch (Throwable t) {
            long elapsed = System.currentTimeMillis() - start;
            log.debug(JsonUtils.json(
                    "model_aspect", "operation_invocation_error",
                    "model", model,
                    "operation", operation,
                    "class", className,
                    "latencyMs", Long.toString(elapsed),
                    "error_class", t.getClass().getName(),
                    "error_msg", LogPreview.truncate(t.getMessage(), 300)
            ));
            throw t;
        }
    }
}
