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

package dev.mars.parley.gateway.session;

import dev.mars.parley.core.WorkItem;
import dev.mars.parley.gateway.scheduler.AgentAdapter;
import dev.mars.parley.gateway.scheduler.WorkCompletion;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Adapter that answers every item with its own content after a fixed delay.
 * Useful for smoke-testing a deployment end to end.
 */
public class EchoAgentAdapter implements AgentAdapter {

    private static final Logger logger = LoggerFactory.getLogger(EchoAgentAdapter.class);

    public static final String TYPE = "echo";

    private final Vertx vertx;
    private final long delayMs;

    private WorkCompletion current;
    private long timerId = -1;
    private boolean disposed;

    public EchoAgentAdapter(Vertx vertx, long delayMs) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        if (delayMs < 0) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delayMs);
        }
        this.delayMs = delayMs;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public synchronized void dispatch(WorkItem item, WorkCompletion completion) {
        if (disposed) {
            throw new IllegalStateException("Echo adapter has been disposed");
        }
        current = completion;
        if (delayMs == 0) {
            vertx.runOnContext(v -> finish(completion, item));
        } else {
            timerId = vertx.setTimer(delayMs, id -> finish(completion, item));
        }
    }

    @Override
    public void abort() {
        WorkCompletion aborted;
        synchronized (this) {
            aborted = current;
            current = null;
            cancelTimer();
        }
        if (aborted != null && aborted.fail("Aborted")) {
            logger.debug("Aborted item {}", aborted.getItem().correlationId());
        }
    }

    @Override
    public void dispose() {
        synchronized (this) {
            disposed = true;
        }
        abort();
    }

    private void finish(WorkCompletion completion, WorkItem item) {
        synchronized (this) {
            if (current != completion) {
                return;
            }
            current = null;
            timerId = -1;
        }
        completion.complete(item.content());
    }

    private void cancelTimer() {
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }
}
