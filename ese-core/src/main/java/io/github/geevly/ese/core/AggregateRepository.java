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

import io.github.geevly.ese.core.store.EventLog;
import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.EventStoreException;
import io.github.geevly.ese.core.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Facade for working with aggregates of single type. It instantiates the aggregates, recovers their state, manages
 * their snapshots and hands committed events over to listeners. In order for recovery to work, the repository needs
 * {@link EventLog} to see the past events, and {@link SnapshotStore} for the snapshots. Aggregates will then need to
 * be created with an {@link EventStore} that is consistent with the EventLog.
 *
 * <h2>Lifecycles</h2>
 * {@link #load(String)} describes the process of obtaining an up-to-date aggregate,
 * {@link #execute(String, Command)} describes the lifecycle of single command execution.
 *
 * @param <A> the type of aggregate this repository handles
 */
public abstract class AggregateRepository<A extends AggregateRoot<?, ?>> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final RepositoryConfiguration configuration;
    private final List<CommittedEventListener> listeners = new CopyOnWriteArrayList<>();

    protected AggregateRepository(RepositoryConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration must be specified");
    }

    /**
     * Create a new empty instance for given id, with reference to the EventStore and correct identity. Repository
     * will restore the state from snapshot and event log afterwards.
     * @param aggregateId the identity of the aggregate
     * @return freshly instantiated aggregate
     */
    protected abstract A instantiate(String aggregateId);

    /**
     * Event log of this repository. EventLog must be consistent with EventStore the aggregates append to.
     * @return event log of this repository
     */
    protected abstract EventLog getEventLog();

    /**
     * The SnapshotStore of this repository.
     * @return SnapshotStore of this repository
     */
    protected abstract SnapshotStore getSnapshotStore();

    /**
     * Register a listener for events committed by commands of this repository.
     * @param listener the listener
     */
    public void addListener(CommittedEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    /**
     * Obtain an aggregate in its latest known state:
     * <ol>
     *     <li>Instantiate new aggregate</li>
     *     <li>Import latest snapshot, if there is one. When it cannot be read, it is ignored and the entire
     *     history is replayed</li>
     *     <li>Replay all events past the version of the snapshot</li>
     * </ol>
     * An aggregate, that has no events is returned in uncreated state.
     *
     * @param aggregateId identity of the aggregate
     * @return recovered aggregate
     * @throws ApplyException when stored history cannot be replayed
     */
    public A load(String aggregateId) throws ApplyException {
        A aggregate = instantiate(aggregateId);
        restoreSnapshot(aggregate);
        catchUp(aggregate);
        return aggregate;
    }

    /**
     * Bring an aggregate up to date, by applying events stored after its version.
     * @param aggregate the aggregate
     * @throws ApplyException when stored history cannot be replayed
     */
    public void catchUp(A aggregate) throws ApplyException {
        try (EventLog.StoredEvents events = getEventLog().readEvents(aggregate.getIdentity(),
            aggregate.getStateVersion())) {
            events.foreach(aggregate::apply);
        }
    }

    private void restoreSnapshot(A aggregate) {
        String aggregateId = aggregate.getIdentity();
        Optional<SnapshotStore.Snapshot> snapshot = getSnapshotStore().readSnapshot(aggregateId);
        if (snapshot.isPresent()) {
            try {
                aggregate.importState(snapshot.get().getState());
                aggregate.restoreVersion(snapshot.get().getVersion());
            } catch (SnapshotDecodeException e) {
                logger.warn("Snapshot of {} at version {} taken at {} cannot be decoded, replaying entire history",
                    aggregateId, snapshot.get().getVersion(), snapshot.get().getTimestamp(), e);
            }
        }
    }

    /**
     * Execute a command against up-to-date aggregate.
     * <ol>
     *     <li>Obtain an up-to-date instance, as described by {@link #load(String)}</li>
     *     <li>Pass it to the command</li>
     *     <li>When the command fails due to version conflict, the instance catches up with the event log and the
     *     command is retried as long as {@link RepositoryConfiguration.RetryStrategy} allows</li>
     *     <li>If {@link RepositoryConfiguration.SnapshotPolicy} decides so, snapshot is stored</li>
     *     <li>Events committed by the command are handed over to the listeners, also when command failed later on.
     *     Failures of the listeners are logged and do not affect the result</li>
     * </ol>
     * Invariant violations, as well as any other failures are never retried.
     *
     * @param aggregateId identity of the aggregate
     * @param command the command to perform
     * @param <R> type of result
     * @return result of the command
     * @throws ApplyException when history cannot be replayed or the command issued an event not applicable to state
     * @throws EventStoreException when storing failed or version conflicts persisted after all retries
     */
    public <R> R execute(String aggregateId, Command<? super A, R> command)
            throws ApplyException, EventStoreException {
        A aggregate = load(aggregateId);
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                R result = command.execute(aggregate);
                storeSnapshotIfNeeded(aggregate);
                publish(aggregate);
                return result;
            } catch (EventStoreException e) {
                publish(aggregate);
                long delay = e.isVersionConflict()
                        ? configuration.retryStrategy().retryDelay(aggregateId, e, attempts)
                        : RepositoryConfiguration.RetryStrategy.DO_NOT_RETRY;
                if (delay < 0) {
                    throw e;
                }
                logger.info("Command on {} conflicted at version {} (attempt {}), retrying", aggregateId,
                    aggregate.getStateVersion(), attempts);
                pause(delay, e);
                catchUp(aggregate);
            } catch (ApplyException | RuntimeException e) {
                publish(aggregate);
                throw e;
            }
        }
    }

    private void pause(long delay, EventStoreException conflict) throws EventStoreException {
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw conflict;
            }
        }
    }

    private void publish(A aggregate) {
        for (EventEnvelope envelope : aggregate.drainCommittedEvents()) {
            for (CommittedEventListener listener : listeners) {
                try {
                    listener.committed(envelope);
                } catch (RuntimeException e) {
                    logger.error("Listener {} failed on event {} of aggregate {} version {}", listener,
                        envelope.type(), envelope.aggregateId(), envelope.version(), e);
                }
            }
        }
    }

    private void storeSnapshotIfNeeded(A aggregate) {
        if (aggregate.isCreated()
                && configuration.snapshotPolicy().shouldStoreSnapshot(aggregate, aggregate.getEventsSinceSnapshot())) {
            try {
                if (getSnapshotStore().store(aggregate.getIdentity(), aggregate.getStateVersion(),
                    aggregate.exportState())) {
                    aggregate.snapshotStored();
                }
            } catch (IOException e) {
                logger.error("Creating snapshot of aggregate {} failed", aggregate.getIdentity(), e);
            }
        }
    }
}
