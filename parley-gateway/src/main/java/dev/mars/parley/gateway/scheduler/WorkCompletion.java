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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Terminal callback for one dispatched {@link WorkItem}. Only the first call
 * to {@link #complete} or {@link #fail} takes effect.
 */
public final class WorkCompletion {

    private static final Logger logger = LoggerFactory.getLogger(WorkCompletion.class);

    @FunctionalInterface
    interface Settlement {
        void settled(WorkCompletion completion, boolean success, String detail);
    }

    private final String agentId;
    private final WorkItem item;
    private final Settlement settlement;
    private final AtomicBoolean done = new AtomicBoolean(false);

    // set by the scheduler before dispatch, -1 when no timeout is armed
    volatile long timeoutTimerId = -1;

    WorkCompletion(String agentId, WorkItem item, Settlement settlement) {
        this.agentId = agentId;
        this.item = item;
        this.settlement = settlement;
    }

    /**
     * @return {@code true} if this call settled the item
     */
    public boolean complete(String result) {
        return settle(true, result == null ? "" : result);
    }

    /**
     * @return {@code true} if this call settled the item
     */
    public boolean fail(String reason) {
        return settle(false, reason == null ? "Unknown error" : reason);
    }

    public boolean isDone() {
        return done.get();
    }

    public String getAgentId() {
        return agentId;
    }

    public WorkItem getItem() {
        return item;
    }

    /**
     * Fails the item, running {@code beforeSettle} once the item is marked done
     * but before the scheduler sees the failure and moves to the next item.
     * Settlement attempts made by {@code beforeSettle} are ignored.
     */
    boolean failAfter(String reason, Runnable beforeSettle) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }
        beforeSettle.run();
        settlement.settled(this, false, reason);
        return true;
    }

    private boolean settle(boolean success, String detail) {
        if (!done.compareAndSet(false, true)) {
            logger.debug("Ignoring repeated {} for item {} of agent {}",
                    success ? "completion" : "failure", item.correlationId(), agentId);
            return false;
        }
        settlement.settled(this, success, detail);
        return true;
    }
}
