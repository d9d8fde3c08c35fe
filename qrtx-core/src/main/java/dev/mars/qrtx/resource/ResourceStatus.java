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

package dev.mars.qrtx.resource;

/**
 * Operational status of a quantum resource.
 *
 * <ul>
 * <li>{@code ONLINE}: accepting allocations.</li>
 * <li>{@code MAINTENANCE}, {@code OFFLINE}: temporarily unavailable; stages that match
 * only these resources queue rather than fail.</li>
 * <li>{@code RETIRED}: permanently gone; never counted as a candidate.</li>
 * </ul>
 */
public enum ResourceStatus {

    ONLINE,
    MAINTENANCE,
    OFFLINE,
    RETIRED;

    public boolean isAvailable() {
        return this == ONLINE;
    }

    /**
     * Whether the resource may become available again.
     */
    public boolean canRecover() {
        return this != RETIRED;
    }
}
