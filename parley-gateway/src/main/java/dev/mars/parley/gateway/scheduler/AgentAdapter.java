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

/**
 * Executes work for one agent.
 *
 * <p>The scheduler calls {@link #dispatch} for at most one item at a time per
 * agent. The adapter must settle every dispatched item exactly once through
 * the supplied {@link WorkCompletion}, normally from another thread or a later
 * event-loop turn. Throwing from {@code dispatch} counts as a failure of that
 * item.</p>
 */
public interface AgentAdapter {

    /**
     * Adapter kind reported when the agent registers, e.g. {@code "echo"}.
     */
    String type();

    void dispatch(WorkItem item, WorkCompletion completion);

    /**
     * Requests cancellation of the item in flight. The adapter still settles
     * that item's completion.
     */
    default void abort() {
    }

    /**
     * Releases adapter resources. Called once when the agent is removed.
     */
    default void dispose() {
    }
}
