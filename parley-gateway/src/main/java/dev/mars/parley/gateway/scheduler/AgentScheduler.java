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

import dev.mars.parley.core.AgentPresence;
import dev.mars.parley.core.AgentState;
import dev.mars.parley.core.WorkItem;
import dev.mars.parley.core.exceptions.AgentQueueFullException;
import dev.mars.parley.core.exceptions.DuplicateAgentException;
import dev.mars.parley.core.exceptions.UnknownAgentException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-agent FIFO scheduler.
 *
 * <p>Each registered agent has at most one work item in flight. Further items
 * wait in a bounded queue and are dispatched strictly in arrival order as the
 * adapter settles the previous one. A failed item never blocks the items
 * behind it. Agents are independent: each entry is locked on its own, and no
 * operation on one agent waits for another.</p>
 *
 * <p>State listeners are notified while the entry lock is held so that status
 * transitions for an agent are observed in order. Adapter calls and outcome
 * notifications happen outside the lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class AgentScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AgentScheduler.class);

    private final Vertx vertx;
    private final SchedulerOptions options;
    private final AgentStateListener stateListener;
    private final WorkOutcomeListener outcomeListener;
    private final ConcurrentMap<String, AgentQueueEntry> agents = new ConcurrentHashMap<>();

    public AgentScheduler(Vertx vertx, SchedulerOptions options,
                          AgentStateListener stateListener, WorkOutcomeListener outcomeListener) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.stateListener = stateListener != null ? stateListener : AgentStateListener.NONE;
        this.outcomeListener = outcomeListener != null ? outcomeListener : WorkOutcomeListener.NONE;
        logger.debug("AgentScheduler initialized with {}", options);
    }

    /**
     * Registers an idle agent with an empty queue.
     *
     * @throws DuplicateAgentException if the id is already registered
     */
    public void registerAgent(String agentId, AgentAdapter adapter) throws DuplicateAgentException {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(adapter, "Adapter cannot be null");
        if (agents.putIfAbsent(agentId, new AgentQueueEntry(agentId, adapter)) != null) {
            throw new DuplicateAgentException(agentId);
        }
        logger.info("Registered agent {} ({})", agentId, adapter.type());
    }

    /**
     * Hands a work item to an agent. An idle agent receives it immediately,
     * a busy agent queues it.
     *
     * @throws UnknownAgentException   if the agent is not registered
     * @throws AgentQueueFullException if the agent is busy and its queue is full;
     *                                 the item is also reported as a
     *                                 {@link WorkOutcome.Kind#REJECTED} outcome
     */
    public EnqueueOutcome enqueue(String agentId, WorkItem item)
            throws UnknownAgentException, AgentQueueFullException {
        Objects.requireNonNull(item, "Work item cannot be null");
        AgentQueueEntry entry = requireEntry(agentId);
        WorkCompletion completion;
        synchronized (entry) {
            if (entry.removed) {
                throw new UnknownAgentException(agentId);
            }
            if (entry.state == AgentState.BUSY) {
                if (entry.queue.size() >= options.getQueueCapacity()) {
                    logger.warn("Rejecting item {} for agent {}: queue full ({})",
                            item.correlationId(), agentId, entry.queue.size());
                    completion = null;
                } else {
                    entry.queue.addLast(item);
                    logger.debug("Queued item {} for agent {} (depth {})",
                            item.correlationId(), agentId, entry.queue.size());
                    notifyState(agentId, AgentPresence.BUSY, entry.queue.size());
                    return EnqueueOutcome.QUEUED;
                }
            } else {
                entry.state = AgentState.BUSY;
                completion = beginLocked(entry, item);
                notifyState(agentId, AgentPresence.BUSY, 0);
            }
        }
        if (completion == null) {
            AgentQueueFullException rejection = new AgentQueueFullException(agentId, options.getQueueCapacity());
            notifyOutcome(new WorkOutcome(agentId, item, WorkOutcome.Kind.REJECTED, rejection.getMessage()));
            throw rejection;
        }
        dispatch(entry, completion);
        return EnqueueOutcome.DISPATCHED;
    }

    /**
     * Discards the agent's queued items and asks the adapter to abort the item
     * in flight. The in-flight item still settles normally, after which the
     * agent reports online.
     *
     * @return the number of queued items discarded
     * @throws UnknownAgentException if the agent is not registered
     */
    public int stop(String agentId) throws UnknownAgentException {
        AgentQueueEntry entry = requireEntry(agentId);
        int discarded;
        boolean abort;
        synchronized (entry) {
            discarded = entry.queue.size();
            entry.queue.clear();
            abort = entry.inFlight != null && !entry.removed;
            if (discarded > 0 && entry.state == AgentState.BUSY) {
                notifyState(agentId, AgentPresence.BUSY, 0);
            }
        }
        logger.info("Stopping agent {}: discarded {} queued item(s){}", agentId, discarded,
                abort ? ", aborting in-flight item" : "");
        if (abort) {
            abortAdapter(entry);
        }
        return discarded;
    }

    /**
     * Disposes the agent's adapter and forgets the agent. Removing an unknown
     * agent does nothing.
     *
     * @return {@code true} if the agent was registered
     */
    public boolean removeAgent(String agentId) {
        AgentQueueEntry entry = agentId == null ? null : agents.remove(agentId);
        if (entry == null) {
            logger.debug("removeAgent ignored, {} not registered", agentId);
            return false;
        }
        synchronized (entry) {
            entry.removed = true;
            entry.queue.clear();
            if (entry.inFlight != null) {
                cancelTimeout(entry.inFlight);
                entry.inFlight = null;
            }
            entry.state = AgentState.IDLE;
        }
        try {
            entry.adapter.dispose();
        } catch (RuntimeException e) {
            logger.warn("Adapter for agent {} failed to dispose: {}", agentId, e.getMessage(), e);
        }
        stateListener.onAgentRemoved(agentId);
        logger.info("Removed agent {}", agentId);
        return true;
    }

    public Optional<AgentSnapshot> snapshot(String agentId) {
        AgentQueueEntry entry = agents.get(agentId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.of(entry.snapshot());
        }
    }

    public Set<String> registeredAgents() {
        return new TreeSet<>(agents.keySet());
    }

    public boolean isRegistered(String agentId) {
        return agents.containsKey(agentId);
    }

    /**
     * Removes every agent, disposing their adapters.
     */
    public void shutdown() {
        logger.info("Shutting down scheduler ({} agent(s))", agents.size());
        for (String agentId : registeredAgents()) {
            removeAgent(agentId);
        }
    }

    private AgentQueueEntry requireEntry(String agentId) throws UnknownAgentException {
        AgentQueueEntry entry = agentId == null ? null : agents.get(agentId);
        if (entry == null) {
            throw new UnknownAgentException(agentId);
        }
        return entry;
    }

    private WorkCompletion beginLocked(AgentQueueEntry entry, WorkItem item) {
        WorkCompletion completion = new WorkCompletion(entry.agentId, item,
                (settled, success, detail) -> onSettled(entry, settled, success, detail));
        entry.inFlight = completion;
        return completion;
    }

    private void dispatch(AgentQueueEntry entry, WorkCompletion completion) {
        WorkItem item = completion.getItem();
        Optional<Duration> timeout = options.getWorkTimeout();
        if (timeout.isPresent()) {
            long timeoutMs = timeout.get().toMillis();
            // the abort must reach the adapter while the timed-out item is still its current one
            completion.timeoutTimerId = vertx.setTimer(timeoutMs, id ->
                    completion.failAfter("Work item timed out after " + timeoutMs + "ms", () -> {
                        logger.warn("Item {} for agent {} timed out after {}ms", item.correlationId(),
                                entry.agentId, timeoutMs);
                        abortAdapter(entry);
                    }));
        }
        logger.debug("Dispatching item {} to agent {}", item.correlationId(), entry.agentId);
        try {
            entry.adapter.dispatch(item, completion);
        } catch (RuntimeException e) {
            logger.warn("Adapter for agent {} threw on dispatch of {}: {}", entry.agentId,
                    item.correlationId(), e.getMessage());
            completion.fail("Adapter dispatch failed: " + e.getMessage());
        }
    }

    private void onSettled(AgentQueueEntry entry, WorkCompletion settled, boolean success, String detail) {
        cancelTimeout(settled);
        synchronized (entry) {
            if (entry.inFlight != settled) {
                logger.debug("Ignoring settlement of {} for agent {}, no longer in flight",
                        settled.getItem().correlationId(), entry.agentId);
                return;
            }
        }
        if (!success) {
            logger.warn("Item {} for agent {} failed: {}", settled.getItem().correlationId(),
                    entry.agentId, detail);
        }
        notifyOutcome(new WorkOutcome(entry.agentId, settled.getItem(),
                success ? WorkOutcome.Kind.COMPLETED : WorkOutcome.Kind.FAILED, detail));

        WorkCompletion next = null;
        synchronized (entry) {
            if (entry.inFlight != settled) {
                return;
            }
            entry.inFlight = null;
            WorkItem head = entry.queue.pollFirst();
            if (head == null) {
                entry.state = AgentState.IDLE;
                notifyState(entry.agentId, AgentPresence.ONLINE, 0);
            } else {
                next = beginLocked(entry, head);
                notifyState(entry.agentId, AgentPresence.BUSY, entry.queue.size());
            }
        }
        if (next != null) {
            dispatch(entry, next);
        }
    }

    private void abortAdapter(AgentQueueEntry entry) {
        try {
            entry.adapter.abort();
        } catch (RuntimeException e) {
            logger.warn("Adapter for agent {} failed to abort: {}", entry.agentId, e.getMessage(), e);
        }
    }

    private void cancelTimeout(WorkCompletion completion) {
        long timerId = completion.timeoutTimerId;
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            completion.timeoutTimerId = -1;
        }
    }

    private void notifyState(String agentId, AgentPresence status, int queueDepth) {
        try {
            stateListener.onStateChange(agentId, status, queueDepth);
        } catch (RuntimeException e) {
            logger.error("State listener failed for agent {} ({}, depth {})", agentId, status, queueDepth, e);
        }
    }

    private void notifyOutcome(WorkOutcome outcome) {
        try {
            outcomeListener.onOutcome(outcome);
        } catch (RuntimeException e) {
            logger.error("Outcome listener failed for item {} of agent {}",
                    outcome.item().correlationId(), outcome.agentId(), e);
        }
    }
}
