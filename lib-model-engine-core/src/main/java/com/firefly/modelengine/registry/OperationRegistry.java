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


package com.firefly.modelengine.registry;

import com.firefly.modelengine.annotations.ModelOperation;
import com.firefly.modelengine.annotations.OperationProvider;
import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.resource.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.ApplicationContext;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;

/**
 * Name-to-handler lookup table for model operations.
 * <p>
 * Responsibilities:
 * - Scan for beans annotated with {@link OperationProvider} and index their {@link ModelOperation} methods,
 *   resolving proxy-safe invocation methods.
 * - Pick up {@link OperationDefinition} beans contributed programmatically.
 * - Resolve names and aliases case-insensitively. A name registered twice keeps the last registration;
 *   the conflict is logged and reported by {@link #conflicts()}.
 *
 * Thread-safety: scanning runs once (idempotent) guarded by a volatile flag plus synchronized gate;
 * once the flag is set, lookups do not lock. After that the registry is read-only.
 */
public class OperationRegistry {
    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final ApplicationContext applicationContext;
    private final Map<String, OperationDefinition> index = new HashMap<>(); // key: lower-cased name or alias
    private final Map<String, OperationDefinition> primaries = new TreeMap<>(); // key: lower-cased primary name
    private final List<String> conflicts = new ArrayList<>();
    private volatile boolean scanned = false;

    public OperationRegistry(ApplicationContext applicationContext) {
        this.applicationContext = Objects.requireNonNull(applicationContext, "applicationContext");
    }

    public OperationRegistry(Collection<OperationDefinition> definitions) {
        this.applicationContext = null;
        for (OperationDefinition def : definitions) {
            register(def);
        }
        this.scanned = true;
    }

    public static OperationRegistryBuilder builder() {
        return new OperationRegistryBuilder();
    }

    /** Look up an operation by name or alias; empty when nothing is registered under it. */
    public Optional<OperationDefinition> resolve(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        ensureScanned();
        return Optional.ofNullable(index.get(key(name)));
    }

    public boolean contains(String name) {
        return resolve(name).isPresent();
    }

    /** Registered operations by primary name, sorted by name. */
    public Collection<OperationDefinition> definitions() {
        ensureScanned();
        return Collections.unmodifiableCollection(primaries.values());
    }

    public List<String> conflicts() {
        ensureScanned();
        return Collections.unmodifiableList(conflicts);
    }

    private void ensureScanned() {
        if (scanned) return;
        synchronized (this) {
            if (scanned) return;
            scan();
            scanned = true;
        }
    }

    private void scan() {
        Map<String, Object> beans = applicationContext.getBeansWithAnnotation(OperationProvider.class);
        for (Object bean : beans.values()) {
            Class<?> targetClass = AopUtils.getTargetClass(bean);
            OperationProvider provider = targetClass.getAnnotation(OperationProvider.class);
            if (provider == null) continue; // safety
            String providerCategory = StringUtils.hasText(provider.category())
                    ? provider.category()
                    : defaultCategory(targetClass.getSimpleName());

            for (Method m : targetClass.getMethods()) {
                ModelOperation ann = m.getAnnotation(ModelOperation.class);
                if (ann == null) continue;
                if (!hasHandlerSignature(m)) {
                    log.warn("Skipping @ModelOperation {}.{}: expected OperationResult {}(ResourceHandle, OperationParams)",
                            targetClass.getSimpleName(), m.getName(), m.getName());
                    continue;
                }
                String name = StringUtils.hasText(ann.name()) ? ann.name() : m.getName();
                String category = StringUtils.hasText(ann.category()) ? ann.category() : providerCategory;
                Method invocation = resolveInvocationMethod(bean.getClass(), m);
                ReflectionUtils.makeAccessible(invocation);
                register(new OperationDefinition(
                        name,
                        List.of(ann.aliases()),
                        category,
                        ann.description(),
                        reflectiveHandler(bean, invocation),
                        targetClass.getSimpleName(),
                        Void.class.equals(ann.parameters()) ? ParameterValidator.NONE : ParameterValidator.forType(ann.parameters())
                ));
            }
        }
        for (OperationDefinition def : applicationContext.getBeansOfType(OperationDefinition.class).values()) {
            register(def);
        }
        log.info("Operation registry ready: {} operations, {} conflicts", primaries.size(), conflicts.size());
    }

    private void register(OperationDefinition def) {
        OperationDefinition previousPrimary = primaries.put(key(def.name()), def);
        if (previousPrimary != null) {
            recordConflict(def.name(), previousPrimary, def);
            // the replaced definition must not stay reachable through its aliases
            index.values().removeIf(d -> d == previousPrimary);
        }
        putIndex(def.name(), def);
        for (String alias : def.aliases()) {
            putIndex(alias, def);
        }
    }

    private void putIndex(String name, OperationDefinition def) {
        OperationDefinition previous = index.put(key(name), def);
        if (previous != null && previous != def) {
            recordConflict(name, previous, def);
        }
    }

    private void recordConflict(String name, OperationDefinition previous, OperationDefinition replacement) {
        String conflict = name + ": " + previous.source() + " replaced by " + replacement.source();
        conflicts.add(conflict);
        log.warn("Operation name conflict {}", conflict);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    static String defaultCategory(String simpleName) {
        for (String suffix : List.of("Operations", "Methods")) {
            if (simpleName.endsWith(suffix) && simpleName.length() > suffix.length()) {
                return simpleName.substring(0, simpleName.length() - suffix.length());
            }
        }
        return simpleName;
    }

    private static boolean hasHandlerSignature(Method m) {
        Class<?>[] types = m.getParameterTypes();
        return OperationResult.class.equals(m.getReturnType())
                && types.length == 2
                && ResourceHandle.class.equals(types[0])
                && OperationParams.class.equals(types[1]);
    }

    private static OperationHandler reflectiveHandler(Object bean, Method method) {
        return (resource, params) -> {
            try {
                return (OperationResult) method.invoke(bean, resource, params);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getTargetException();
                if (cause instanceof RuntimeException re) throw re;
                if (cause instanceof Error err) throw err;
                throw new IllegalStateException(cause.getMessage(), cause);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot invoke operation method " + method, e);
            }
        };
    }

    private Method resolveInvocationMethod(Class<?> beanClass, Method targetMethod) {
        try {
            return beanClass.getMethod(targetMethod.getName(), targetMethod.getParameterTypes());
        } catch (NoSuchMethodException e) {
            return targetMethod; // JDK proxy without the method on its interfaces
        }
    }
}
