/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.qrtx.backend;

import dev.mars.qrtx.core.exceptions.ClassicalEvaluationException;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class InProcessClassicalEvaluatorTest {

    private InProcessClassicalEvaluator evaluator;

    @BeforeEach
    void setUp(Vertx vertx) {
        evaluator = new InProcessClassicalEvaluator(vertx)
                .register("scale", (inputs, params) -> new JsonObject()
                        .put("value", inputs.getInteger("x") * ((Number) params.get("factor")).intValue()))
                .register("broken", (inputs, params) -> {
                    throw new IllegalArgumentException("x must be positive");
                });
    }

    @Test
    void testEvaluatesRegisteredFunction(VertxTestContext testContext) {
        evaluator.evaluate("scale", new JsonObject().put("x", 7), Map.of("factor", 3))
                .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                    assertEquals(21, result.getInteger("value"));
                    testContext.completeNow();
                })));
    }

    @Test
    void testUnknownFunctionFails(VertxTestContext testContext) {
        evaluator.evaluate("missing", new JsonObject(), Map.of())
                .onComplete(testContext.failing(error -> testContext.verify(() -> {
                    assertInstanceOf(ClassicalEvaluationException.class, error);
                    testContext.completeNow();
                })));
    }

    @Test
    void testFunctionErrorsAreWrapped(VertxTestContext testContext) {
        evaluator.evaluate("broken", new JsonObject(), Map.of())
                .onComplete(testContext.failing(error -> testContext.verify(() -> {
                    assertInstanceOf(ClassicalEvaluationException.class, error);
                    assertInstanceOf(IllegalArgumentException.class, error.getCause());
                    testContext.completeNow();
                })));
    }

    @Test
    void testDuplicateRegistrationRejected() {
        assertThrows(IllegalStateException.class,
                () -> evaluator.register("scale", (inputs, params) -> new JsonObject()));
        assertTrue(evaluator.isRegistered("broken"));
    }
}
