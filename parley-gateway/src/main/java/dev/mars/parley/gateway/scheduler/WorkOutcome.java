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

package dev.mars.parley.gateway.scheduler;

import dev.mars.parley.core.WorkItem;

import java.util.Objects;

/**
 * Final result of a work item: completed, failed, or rejected before dispatch.
 *
 * @param agentId agent the item was addressed to
 * @param item    the work item
 * @param kind    how the item ended
 * @param detail  result content on success, otherwise a human-readable reason
 */
public record WorkOutcome(String agentId, WorkItem item, Kind kind, String detail) {

    public enum Kind {
        COMPLETED,
        FAILED,
        REJECTED
    }

    public WorkOutcome {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(item, "Work item cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(detail, "Detail cannot be null");
    }

    public boolean isError() {
        return kind != Kind.COMPLETED;
    }
}
