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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationParamsTest {

    record WallParams(String levelId, double height, List<Double> start) {}

    record LevelRef(String levelId) {
        LevelRef {
            if (levelId == null || levelId.isBlank()) {
                throw new ParameterValidationException("levelId", "levelId is required");
            }
        }
    }

    @Test
    void typedAccessorsConvertLooseValues() {
        OperationParams params = new OperationParams(Map.of(
                "flip", "TRUE",
                "count", "12",
                "height", 3,
                "name", "Wall"));

        assertTrue(params.getBoolean("flip", false));
        assertFalse(params.getBoolean("missing", false));
        assertEquals(12L, params.requireLong("count"));
        assertEquals(3.0, params.getDouble("height", 0));
        assertEquals("Wall", params.requireString("name"));
        assertTrue(params.getMap("absent").isEmpty());
        assertTrue(params.getList("absent").isEmpty());
    }

    @Test
    void missingOrMalformedValuesNameTheParameter() {
        OperationParams params = new OperationParams(Map.of("count", "twelve", "blank", " ", "items", "x"));

        ParameterValidationException missing = assertThrows(ParameterValidationException.class, () -> params.requireString("name"));
        assertEquals("name", missing.parameter());
        assertEquals("blank", assertThrows(ParameterValidationException.class, () -> params.requireString("blank")).parameter());
        assertEquals("count", assertThrows(ParameterValidationException.class, () -> params.requireLong("count")).parameter());
        assertEquals("items", assertThrows(ParameterValidationException.class, () -> params.getList("items")).parameter());
    }

    @Test
    void convertsTheWholeMapIntoARecord() {
        OperationParams params = new OperationParams(Map.of(
                "levelId", "L1", "height", "2.5", "start", List.of(0, 1.5), "ignored", true));

        WallParams wall = params.as(WallParams.class);

        assertEquals("L1", wall.levelId());
        assertEquals(2.5, wall.height());
        assertEquals(List.of(0.0, 1.5), wall.start());
    }

    @Test
    void recordConversionFailuresBecomeValidationErrors() {
        OperationParams params = new OperationParams(Map.of("height", "tall"));

        ParameterValidationException e = assertThrows(ParameterValidationException.class, () -> params.as(WallParams.class));
        assertNull(e.parameter());
        assertTrue(e.getMessage().startsWith("Invalid parameters for WallParams"), e.getMessage());
    }

    @Test
    void validationRaisedByTheRecordItselfKeepsTheParameterName() {
        ParameterValidationException e = assertThrows(ParameterValidationException.class,
                () -> OperationParams.empty().as(LevelRef.class));

        assertEquals("levelId", e.parameter());
        assertEquals("levelId is required", e.getMessage());
        assertEquals("L2", new OperationParams(Map.of("levelId", "L2")).as(LevelRef.class).levelId());
    }
}
