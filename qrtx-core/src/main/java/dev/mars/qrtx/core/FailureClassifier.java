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

import dev.mars.qrtx.core.exceptions.ArtifactStoreException;
import dev.mars.qrtx.core.exceptions.BackendExecutionException;
import dev.mars.qrtx.core.exceptions.ClassicalEvaluationException;
import dev.mars.qrtx.core.exceptions.CollaboratorUnavailableException;
import dev.mars.qrtx.core.exceptions.CompilationException;
import dev.mars.qrtx.core.exceptions.NoCandidateException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a stage dispatch failure onto a {@link FailureClass} and the {@link CauseCode}
 * the job reports if that failure ends up failing it.
 *
 * <p>Transient failures carry {@link CauseCode#RETRIES_EXHAUSTED}: that code is only
 * used once the stage's retry budget is spent. Anything that is not one of the
 * collaborator exceptions is treated as an orchestrator defect.</p>
 */
public final class FailureClassifier {

    /**
     * Outcome of classifying one failure.
     *
     * @param failureClass how the driver should react
     * @param causeCode    code reported if the job fails because of it
     * @param summary      single-line description safe to show to callers
     */
    public record Classification(FailureClass failureClass, CauseCode causeCode, String summary) {

        public boolean isRetryable() {
            return failureClass == FailureClass.TRANSIENT;
        }
    }

    private FailureClassifier() {
    }

    public static Classification classify(Throwable failure) {
        Throwable t = unwrap(failure);
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();

        if (t instanceof NoCandidateException) {
            NoCandidateException nce = (NoCandidateException) t;
            return nce.isRetryable()
                    ? new Classification(FailureClass.TRANSIENT, CauseCode.RETRIES_EXHAUSTED, message)
                    : new Classification(FailureClass.UNSATISFIABLE, CauseCode.NO_CANDIDATE, message);
        }
        if (t instanceof BackendExecutionException) {
            BackendExecutionException bee = (BackendExecutionException) t;
            if (bee.getFailureCause().isTransient()) {
                return new Classification(FailureClass.TRANSIENT, CauseCode.RETRIES_EXHAUSTED,
                        bee.getFailureCause() + ": " + message);
            }
            return new Classification(FailureClass.PERMANENT, CauseCode.UNSUPPORTED_FORMAT, message);
        }
        if (t instanceof CompilationException) {
            return new Classification(FailureClass.PERMANENT, CauseCode.COMPILATION_FAILED, message);
        }
        if (t instanceof ClassicalEvaluationException) {
            return new Classification(FailureClass.PERMANENT, CauseCode.PERMANENT_DISPATCH_FAILURE, message);
        }
        if (t instanceof CollaboratorUnavailableException
                || t instanceof ArtifactStoreException
                || t instanceof TimeoutException) {
            return new Classification(FailureClass.TRANSIENT, CauseCode.RETRIES_EXHAUSTED, message);
        }
        return new Classification(FailureClass.INTERNAL, CauseCode.INTERNAL_ERROR,
                "Internal error: " + t.getClass().getSimpleName());
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
