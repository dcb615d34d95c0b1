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


package com.firefly.modelengine.inmemory;

import com.firefly.modelengine.annotations.ModelOperation;
import com.firefly.modelengine.annotations.OperationProvider;
import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.ParameterValidationException;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference element operations against an {@link InMemoryModelDocument}.
 * Each operation declares a parameter record that checks its own required fields, so malformed calls are
 * rejected before the engine opens a scope.
 */
@OperationProvider(category = "Elements")
public class InMemoryElementOperations {

    public record CreateElementParams(String category, String name, Long hostId, Map<String, Object> parameters) {
        public CreateElementParams {
            if (category == null || category.isBlank()) {
                throw new ParameterValidationException("category", "category is required");
            }
        }
    }

    public record SetParameterParams(Long elementId, String parameter, Object value) {
        public SetParameterParams {
            requireId(elementId);
            if (parameter == null || parameter.isBlank()) {
                throw new ParameterValidationException("parameter", "parameter is required");
            }
        }
    }

    public record DeleteElementsParams(List<Long> elementIds) {
        public DeleteElementsParams {
            if (elementIds == null || elementIds.isEmpty()) {
                throw new ParameterValidationException("elementIds", "elementIds must contain at least one id");
            }
        }
    }

    public record ElementRef(Long elementId) {
        public ElementRef {
            requireId(elementId);
        }
    }

    public record ElementCountParams(String category, Integer expected, Integer min) {
        public ElementCountParams {
            if (expected == null && min == null) {
                throw new ParameterValidationException("expected", "expected or min is required");
            }
        }
    }

    @ModelOperation(name = "createElement", aliases = {"addElement"}, description = "Create an element in a category",
            parameters = CreateElementParams.class)
    public OperationResult createElement(ResourceHandle resource, OperationParams params) {
        CreateElementParams p = params.as(CreateElementParams.class);
        Map<String, Object> values = new LinkedHashMap<>();
        if (p.parameters() != null) values.putAll(p.parameters());
        if (p.name() != null) values.put("name", p.name());
        if (p.hostId() != null) values.put("hostId", p.hostId());
        long id = document(resource).createElement(p.category(), values);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("elementId", id);
        payload.put("category", p.category());
        if (p.name() != null) payload.put("name", p.name());
        return OperationResult.success(payload);
    }

    @ModelOperation(name = "setParameter", description = "Set one parameter of an element",
            parameters = SetParameterParams.class)
    public OperationResult setParameter(ResourceHandle resource, OperationParams params) {
        SetParameterParams p = params.as(SetParameterParams.class);
        long id = p.elementId();
        InMemoryModelDocument doc = document(resource);
        if (doc.element(id).isEmpty()) {
            return OperationResult.notFound("Element " + id + " not found");
        }
        doc.setParameter(id, p.parameter(), p.value());
        return OperationResult.success(Map.of("elementId", id, "parameter", p.parameter()));
    }

    @ModelOperation(name = "deleteElements", aliases = {"deleteElement"}, description = "Delete elements by id",
            parameters = DeleteElementsParams.class)
    public OperationResult deleteElements(ResourceHandle resource, OperationParams params) {
        DeleteElementsParams p = params.as(DeleteElementsParams.class);
        InMemoryModelDocument doc = document(resource);
        List<Long> deleted = new ArrayList<>();
        List<Long> missing = new ArrayList<>();
        for (Long id : p.elementIds()) {
            if (id != null && doc.deleteElement(id)) {
                deleted.add(id);
            } else {
                missing.add(id);
            }
        }
        if (deleted.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "None of the elements exist", Map.of("missing", missing));
        }
        return OperationResult.success(Map.of("deleted", deleted, "deletedCount", deleted.size(), "missing", missing));
    }

    @ModelOperation(name = "getElement", description = "Read an element and its parameters",
            parameters = ElementRef.class)
    public OperationResult getElement(ResourceHandle resource, OperationParams params) {
        long id = params.as(ElementRef.class).elementId();
        Optional<InMemoryModelDocument.Element> element = document(resource).element(id);
        if (element.isEmpty()) {
            return OperationResult.notFound("Element " + id + " not found");
        }
        return OperationResult.success(Map.of(
                "elementId", id,
                "category", element.get().category(),
                "parameters", element.get().parameters()
        ));
    }

    @ModelOperation(name = "verifyElementCount", category = "Verification",
            description = "Check the number of elements, optionally within one category",
            parameters = ElementCountParams.class)
    public OperationResult verifyElementCount(ResourceHandle resource, OperationParams params) {
        ElementCountParams p = params.as(ElementCountParams.class);
        InMemoryModelDocument doc = document(resource);
        long count = p.category() == null ? doc.elementCount() : doc.countByCategory(p.category());
        String subject = p.category() == null ? "elements" : p.category() + " elements";
        if (p.expected() != null && count != p.expected()) {
            return OperationResult.failure(ErrorKind.OPERATION,
                    "Expected " + p.expected() + " " + subject + " but found " + count, Map.of("count", count));
        }
        if (p.min() != null && count < p.min()) {
            return OperationResult.failure(ErrorKind.OPERATION,
                    "Expected at least " + p.min() + " " + subject + " but found " + count, Map.of("count", count));
        }
        return OperationResult.success(Map.of("count", count));
    }

    private static void requireId(Long id) {
        if (id == null) {
            throw new ParameterValidationException("elementId", "elementId is required");
        }
    }

    private static InMemoryModelDocument document(ResourceHandle resource) {
        if (resource instanceof InMemoryModelDocument doc) {
            return doc;
        }
        throw new ResourceException("Element operations need an in-memory model, got " + resource.getClass().getName());
    }
}
