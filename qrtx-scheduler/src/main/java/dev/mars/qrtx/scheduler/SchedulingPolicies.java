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

package dev.mars.qrtx.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Resolves a policy by its configured name.
 */
public final class SchedulingPolicies {
    private static final Logger logger = LoggerFactory.getLogger(SchedulingPolicies.class);

    private SchedulingPolicies() {
    }

    public static SchedulingPolicy fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case QualityAwarePolicy.NAME:
                return new QualityAwarePolicy();
            case FirstFitPolicy.NAME:
                return new FirstFitPolicy();
            default:
                logger.warn("Unknown scheduling policy '{}', using {}", name, FirstFitPolicy.NAME);
                return new FirstFitPolicy();
        }
    }
}
