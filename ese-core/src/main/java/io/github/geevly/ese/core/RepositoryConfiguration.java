package io.github.geevly.ese.core;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Strategies of an {@link AggregateRepository}, as alternative to overriding its methods. Retries of conflicting
 * commands and snapshotting are represented by functional interfaces.
 */
public class RepositoryConfiguration {
    private final RetryStrategy retryStrategy;
    private final SnapshotPolicy snapshotPolicy;

    /**
     * Create repository configuration.
     * @param retryStrategy strategy for retrying commands failed due to version conflict
     * @param snapshotPolicy policy when to store snapshots
     */
    public RepositoryConfiguration(RetryStrategy retryStrategy, SnapshotPolicy snapshotPolicy) {
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy, "Snapshot policy must be specified");
    }

    /**
     * Three immediate attempts, snapshot every 10 events.
     * @return default configuration
     */
    public static RepositoryConfiguration defaults() {
        return new RepositoryConfiguration(fixedRetries(3), SnapshotPolicy.every(10));
    }

    public RetryStrategy retryStrategy() {
        return retryStrategy;
    }

    public SnapshotPolicy snapshotPolicy() {
        return snapshotPolicy;
    }

    /**
     * Strategy for retrying a command that failed on version conflict.
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;

        /**
         * Decide whether and when the command should be retried.
         * @param aggregateId identity of the aggregate
         * @param t the conflict the command failed with
         * @param completedAttempts number of attempts so far, at least 1
         * @return negative in order to fail, zero to retry immediately, positive for delay in ms until next attempt
         */
        long retryDelay(String aggregateId, Throwable t, int completedAttempts);
    }

    /**
     * Decides when to store a snapshot of an aggregate.
     */
    @FunctionalInterface
    public interface SnapshotPolicy {
        boolean shouldStoreSnapshot(AggregateRoot<?, ?> aggregate, int eventsSinceSnapshot);

        static SnapshotPolicy every(int events) {
            if (events < 1) {
                throw new IllegalArgumentException("Snapshot interval must be positive, was " + events);
            }
            return (aggregate, eventsSinceSnapshot) -> eventsSinceSnapshot >= events;
        }

        static SnapshotPolicy never() {
            return (aggregate, eventsSinceSnapshot) -> false;
        }
    }

    static final RetryStrategy NO_RETRIES = (id, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failed command.
     * @return a retry strategy
     */
    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fix number of immediate attempts before failing.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedRepeat(attempts, RetryStrategy.RETRY_NOW);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay.
     * @param attempts number of attempt to allow
     * @param delay delay before retrying the command
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    static class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(String aggregateId, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
