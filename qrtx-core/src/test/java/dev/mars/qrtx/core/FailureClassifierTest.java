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

package dev.mars.qrtx.core;

import dev.mars.qrtx.core.exceptions.BackendExecutionException;
import dev.mars.qrtx.core.exceptions.ClassicalEvaluationException;
import dev.mars.qrtx.core.exceptions.CollaboratorUnavailableException;
import dev.mars.qrtx.core.exceptions.CompilationException;
import dev.mars.qrtx.core.exceptions.ExecutionFailureCause;
import dev.mars.qrtx.core.exceptions.NoCandidateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FailureClassifier")
class FailureClassifierTest {

    @ParameterizedTest(name = "{0} is transient")
    @EnumSource(value = ExecutionFailureCause.class, names = {"RESOURCE_UNAVAILABLE", "RESOURCE_BUSY", "DEADLINE_EXCEEDED"})
    void transientBackendCauses(ExecutionFailureCause cause) {
        var result = FailureClassifier.classify(new BackendExecutionException(cause, "dev-1", "boom"));

        assertEquals(FailureClass.TRANSIENT, result.failureClass());
        assertEquals(CauseCode.RETRIES_EXHAUSTED, result.causeCode());
        assertTrue(result.isRetryable());
    }

    @Test
    void unsupportedFormatIsPermanent() {
        var result = FailureClassifier.classify(
                new BackendExecutionException(ExecutionFailureCause.UNSUPPORTED_FORMAT, "dev-1", "qasm2 only"));

        assertEquals(FailureClass.PERMANENT, result.failureClass());
        assertEquals(CauseCode.UNSUPPORTED_FORMAT, result.causeCode());
        assertFalse(result.isRetryable());
    }

    @Test
    void unsatisfiableCandidateIsFatal() {
        var result = FailureClassifier.classify(
                new NoCandidateException("execute", NoCandidateException.Reason.UNSATISFIABLE, "needs 500 qubits"));

        assertEquals(FailureClass.UNSATISFIABLE, result.failureClass());
        assertEquals(CauseCode.NO_CANDIDATE, result.causeCode());
    }

    @Test
    void noneFreeIsRetryable() {
        var result = FailureClassifier.classify(
                new NoCandidateException("execute", NoCandidateException.Reason.NONE_FREE, "all busy"));

        assertTrue(result.isRetryable());
    }

    @Test
    void compilerAndEvaluatorRejectionsArePermanent() {
        assertEquals(CauseCode.COMPILATION_FAILED,
                FailureClassifier.classify(new CompilationException("ibm", "syntax error")).causeCode());
        assertEquals(CauseCode.PERMANENT_DISPATCH_FAILURE,
                FailureClassifier.classify(new ClassicalEvaluationException("fn", "bad input")).causeCode());
    }

    @Test
    void unavailableCollaboratorIsTransient() {
        var result = FailureClassifier.classify(new CollaboratorUnavailableException("compiler", "connection refused"));

        assertEquals(FailureClass.TRANSIENT, result.failureClass());
    }

    @Test
    void unexpectedExceptionsAreInternalAndDoNotLeakMessages() {
        var result = FailureClassifier.classify(new NullPointerException("secret internals"));

        assertEquals(FailureClass.INTERNAL, result.failureClass());
        assertEquals(CauseCode.INTERNAL_ERROR, result.causeCode());
        assertFalse(result.summary().contains("secret"));
    }

    @Test
    void completionExceptionIsUnwrapped() {
        var wrapped = new CompletionException(new CompilationException("ibm", "bad"));

        assertEquals(FailureClass.PERMANENT, FailureClassifier.classify(wrapped).failureClass());
    }
}
