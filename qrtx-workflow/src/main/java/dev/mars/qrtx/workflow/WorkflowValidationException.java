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

package dev.mars.qrtx.workflow;

import dev.mars.qrtx.core.exceptions.QrtxException;

/**
 * A workflow was rejected before admission. Carries every issue found, not just the first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class WorkflowValidationException extends QrtxException {

    private final ValidationResult validationResult;

    public WorkflowValidationException(String workflowName, ValidationResult validationResult) {
        super(formatMessage(workflowName, validationResult));
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String formatMessage(String workflowName, ValidationResult result) {
        StringBuilder sb = new StringBuilder("Workflow '").append(workflowName).append("' failed validation:");
        for (ValidationResult.ValidationIssue error : result.getErrors()) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
