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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter whose work items are settled by the test. Every dispatched item is
 * held until the test calls {@link #completeNext} or {@link #failNext}.
 */
class ManualAgentAdapter implements AgentAdapter {

    private final List<WorkCompletion> pending = new CopyOnWriteArrayList<>();
    private final List<WorkItem> dispatched = new CopyOnWriteArrayList<>();
    private final AtomicInteger aborts = new AtomicInteger();
    private final AtomicInteger disposals = new AtomicInteger();
    private volatile RuntimeException dispatchFailure;

    @Override
    public String type() {
        return "manual";
    }

    @Override
    public void dispatch(WorkItem item, WorkCompletion completion) {
        dispatched.add(item);
        RuntimeException failure = dispatchFailure;
        if (failure != null) {
            throw failure;
        }
        pending.add(completion);
    }

    @Override
    public void abort() {
        aborts.incrementAndGet();
    }

    @Override
    public void dispose() {
        disposals.incrementAndGet();
    }

    void failDispatchWith(RuntimeException failure) {
        this.dispatchFailure = failure;
    }

    boolean completeNext(String result) {
        return pending.remove(0).complete(result);
    }

    boolean failNext(String reason) {
        return pending.remove(0).fail(reason);
    }

    WorkCompletion inFlight() {
        return pending.isEmpty() ? null : pending.get(0);
    }

    List<WorkItem> dispatched() {
        return dispatched;
    }

    int aborts() {
        return aborts.get();
    }

    int disposals() {
        return disposals.get();
    }
}
