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

import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.EventStoreException;
import io.github.geevly.ese.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single event sourced aggregate. Its state is derived solely by applying its own events, one at a time, in order
 * of their versions.
 *
 * <p>An aggregate is identified with unique String id. Its state can <strong>only</strong> change as result of
 * {@link #apply(EventEnvelope)} (with exception of importing a snapshot). New events are created by
 * {@link #issue(Enum, Object, long)}, which validates them against current state, appends them to the
 * {@link EventStore} and only then changes the state.</p>
 *
 * <p>State is held as an immutable value of type {@code S}, and it is {@code null} until the creation event is
 * applied. The events are handled by pure functions registered in the {@link EventRegistry} of the aggregate type,
 * therefore applying an event is all-or-nothing: when it fails, both state and version stay as they were.</p>
 *
 * <p>Instances are not thread safe. Single instance must only be used by one caller at a time, concurrent writers
 * to the same aggregate are serialized by the event store.</p>
 *
 * @param <K> the enumeration of event kinds
 * @param <S> the type of state
 */
public abstract class AggregateRoot<K extends Enum<K> & EventKind, S> {
    /**
     * Version of aggregate with no events.
     */
    public static final long NO_VERSION = -1;

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String identity;
    private final EventRegistry<K, S> registry;
    private final Serialization<S> stateSerialization;
    private final EventStore store;
    private final List<EventEnvelope> committedEvents = new ArrayList<>();
    private S state;
    private long stateVersion = NO_VERSION;
    private int eventsSinceSnapshot;

    /**
     * Constructor for subclasses.
     * @param identity the identity of the aggregate
     * @param registry event table of this aggregate type
     * @param stateSerialization serialization of the state for snapshots
     * @param store where to append issued events
     */
    protected AggregateRoot(String identity, EventRegistry<K, S> registry, Serialization<S> stateSerialization,
            EventStore store) {
        this.identity = Objects.requireNonNull(identity, "Identity must be specified");
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        this.stateSerialization = Objects.requireNonNull(stateSerialization, "State serialization must be specified");
        this.store = Objects.requireNonNull(store, "Event store must be specified");
    }

    public final String getIdentity() {
        return identity;
    }

    /**
     * Version of the last applied event. This is also the expected version for the next event to be issued.
     * @return current version, {@link #NO_VERSION} when no event was applied
     */
    public final long getStateVersion() {
        return stateVersion;
    }

    /**
     * Current state.
     * @return the state, empty until creation event is applied
     */
    public final Optional<S> getState() {
        return Optional.ofNullable(state);
    }

    public final boolean isCreated() {
        return state != null;
    }

    /**
     * Apply an event. This is the only method changing the state of the aggregate, it is used for replaying the
     * history as well as for new events.
     *
     * <p>Event must belong to this aggregate and directly follow current version. When the application fails, state
     * is left exactly as it was before the call.</p>
     * @param envelope the event to apply
     * @throws ApplyException when event is not applicable
     */
    public final void apply(EventEnvelope envelope) throws ApplyException {
        S newState = evaluate(envelope);
        commit(envelope, newState);
    }

    /**
     * Issue new event. The event is stamped with current time and next version, validated by applying it to current
     * state, and appended to the event store. The state changes only after the event is durably stored.
     *
     * @param kind kind of event
     * @param payload the payload, of type registered for the kind
     * @param expectedVersion the version caller has observed
     * @return the stored event
     * @throws ApplyException when event cannot be applied to current state, or its payload cannot be serialized
     * @throws EventStoreException with fault {@link EventStoreException.Fault#OPTIMISTIC_LOCK} when expected version
     *         is not current, or other writer has stored an event in between. Other faults when storing failed.
     */
    public final EventEnvelope issue(K kind, Object payload, long expectedVersion)
            throws ApplyException, EventStoreException {
        if (expectedVersion != stateVersion) {
            throw EventStoreException.optimisticLock(identity, stateVersion, expectedVersion);
        }
        byte[] data;
        try {
            data = registry.encode(identity, kind, payload);
        } catch (ApplyException encodeFailure) {
            // report rejection by the handler as well
            try {
                registry.evaluate(state, identity, kind, payload);
            } catch (ApplyException applyFailure) {
                encodeFailure.addSuppressed(applyFailure);
            }
            throw encodeFailure;
        }
        EventEnvelope envelope = EventEnvelope.builder()
                .type(kind.tag())
                .aggregateId(identity)
                .version(stateVersion + 1)
                .timestamp(Instant.now())
                .payload(data)
                .build();
        S newState = evaluate(envelope);
        try {
            store.appendIfVersion(identity, expectedVersion, envelope);
        } catch (EventStoreException e) {
            logger.debug("Appending {} to aggregate {} failed", kind, identity, e);
            throw e;
        }
        commit(envelope, newState);
        committedEvents.add(envelope);
        return envelope;
    }

    private S evaluate(EventEnvelope envelope) throws ApplyException {
        if (!identity.equals(envelope.aggregateId())) {
            throw ApplyException.invariantViolation(envelope,
                InvariantViolationException.foreignEvent(identity, envelope.aggregateId()));
        }
        if (envelope.version() != stateVersion + 1) {
            throw ApplyException.invariantViolation(envelope,
                InvariantViolationException.outOfOrder(stateVersion + 1, envelope.version()));
        }
        return registry.evaluate(state, envelope);
    }

    private void commit(EventEnvelope envelope, S newState) {
        state = newState;
        stateVersion = envelope.version();
        eventsSinceSnapshot++;
    }

    /**
     * Serialize current state, without version or history. Used for snapshots.
     * @return serialized state
     * @throws IOException when state cannot be serialized
     * @throws IllegalStateException when the aggregate has not been created yet
     */
    public final byte[] exportState() throws IOException {
        if (state == null) {
            throw new IllegalStateException("Aggregate " + identity + " has no state to export");
        }
        return stateSerialization.serialize(state);
    }

    /**
     * Replace the state with previously exported one. Version is not changed, the caller is responsible for pairing
     * the state with the version it was exported at.
     * @param data exported state
     * @throws SnapshotDecodeException when data cannot be read. State is not changed then.
     * @see AggregateRepository#load(String)
     */
    public final void importState(byte[] data) throws SnapshotDecodeException {
        S restored;
        try {
            restored = stateSerialization.deserialize(data);
        } catch (IOException | RuntimeException e) {
            throw new SnapshotDecodeException(identity, e);
        }
        if (restored == null) {
            throw new SnapshotDecodeException(identity, null);
        }
        state = restored;
    }

    /**
     * Called by the repository after snapshot has been imported.
     * @param recoveredVersion the version of the snapshot
     */
    final void restoreVersion(long recoveredVersion) {
        this.stateVersion = recoveredVersion;
        this.eventsSinceSnapshot = 0;
    }

    /**
     * Called by the repository after snapshot is saved to reset eventSinceSnapshot counter
     */
    final void snapshotStored() {
        this.eventsSinceSnapshot = 0;
    }

    /**
     * Events applied since snapshot recovery. Serves the repository to decide on storing new snapshot.
     * @return events since last snapshot was stored or restored
     */
    public final int getEventsSinceSnapshot() {
        return eventsSinceSnapshot;
    }

    /**
     * Events issued since last call. The repository hands them over to listeners after command completes.
     * @return issued events in order
     */
    final List<EventEnvelope> drainCommittedEvents() {
        if (committedEvents.isEmpty()) {
            return Collections.emptyList();
        }
        List<EventEnvelope> result = new ArrayList<>(committedEvents);
        committedEvents.clear();
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + identity + ", version=" + stateVersion + ", state=" + state + '}';
    }
}
