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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tunables for an {@link AgentScheduler}.
 *
 * <p>The work timeout is disabled by default: an adapter that never calls back
 * keeps its agent busy. When a timeout is set, the scheduler fails the item
 * itself and asks the adapter to abort.</p>
 */
public final class SchedulerOptions {

    public static final int DEFAULT_QUEUE_CAPACITY = 50;

    private final int queueCapacity;
    private final Duration workTimeout;

    private SchedulerOptions(Builder builder) {
        this.queueCapacity = builder.queueCapacity;
        this.workTimeout = builder.workTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SchedulerOptions defaults() {
        return builder().build();
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public Optional<Duration> getWorkTimeout() {
        return Optional.ofNullable(workTimeout);
    }

    @Override
    public String toString() {
        return "SchedulerOptions{queueCapacity=" + queueCapacity + ", workTimeout=" + workTimeout + '}';
    }

    public static class Builder {

        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private Duration workTimeout;

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * @param workTimeout maximum time an item may stay in flight; {@code null}
         *                    or zero disables the timeout
         */
        public Builder workTimeout(Duration workTimeout) {
            this.workTimeout = workTimeout == null || workTimeout.isZero() ? null : workTimeout;
            return this;
        }

        public SchedulerOptions build() {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
            }
            if (workTimeout != null && workTimeout.isNegative()) {
                throw new IllegalArgumentException("Work timeout cannot be negative: " + workTimeout);
            }
            return new SchedulerOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchedulerOptions)) {
            return false;
        }
        SchedulerOptions that = (SchedulerOptions) o;
        return queueCapacity == that.queueCapacity && Objects.equals(workTimeout, that.workTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queueCapacity, workTimeout);
    }
}
