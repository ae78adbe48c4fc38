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

import io.github.geevly.ese.core.store.JacksonSerialization;
import io.github.geevly.ese.core.store.Serialization;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Table of all events of single aggregate type. For every constant of the closed set of event kinds, it holds the
 * payload type with its serialization and the handler computing new state.
 *
 * <p>The table is meant to be built once, usually in static initializer of the aggregate, and is read-only
 * afterwards.</p>
 *
 * <pre>
 * static final EventRegistry&lt;OrderEventType, OrderState&gt; REGISTRY = EventRegistry
 *         .builder(OrderEventType.class, OrderState.class)
 *         .on(OrderEventType.CREATED, OrderCreated.class, OrderState::created)
 *         .on(OrderEventType.SHIPPED, OrderShipped.class, OrderState::shipped)
 *         .build();
 * </pre>
 *
 * @param <K> the enumeration of event kinds
 * @param <S> the type of aggregate state
 */
public final class EventRegistry<K extends Enum<K> & EventKind, S> {
    private final Class<K> kindType;
    private final Map<String, K> kindsByTag;
    private final Map<K, Registration<S, ?>> registrations;

    private EventRegistry(Builder<K, S> builder) {
        this.kindType = builder.kindType;
        this.registrations = Collections.unmodifiableMap(new EnumMap<>(builder.registrations));
        Map<String, K> tags = new HashMap<>();
        for (K kind : kindType.getEnumConstants()) {
            if (tags.put(kind.tag(), kind) != null) {
                throw new IllegalStateException("Duplicate event tag " + kind.tag() + " in " + kindType.getName());
            }
        }
        this.kindsByTag = Collections.unmodifiableMap(tags);
    }

    /**
     * Start building a registry.
     * @param kindType the enumeration of event kinds
     * @param stateType the type of aggregate state
     * @param <K> the enumeration of event kinds
     * @param <S> the type of aggregate state
     * @return new builder
     */
    public static <K extends Enum<K> & EventKind, S> Builder<K, S> builder(Class<K> kindType, Class<S> stateType) {
        Objects.requireNonNull(stateType, "State type must be specified");
        return new Builder<>(kindType);
    }

    /**
     * Look up the kind of event by its tag.
     * @param tag the tag stored in event
     * @return the kind, or empty for unknown tag
     */
    public Optional<K> kindOf(String tag) {
        return Optional.ofNullable(kindsByTag.get(tag));
    }

    public Set<K> kinds() {
        return registrations.keySet();
    }

    public Class<K> getKindType() {
        return kindType;
    }

    /**
     * Compute the state after the event. Does not change passed state.
     * @param state current state, null for uncreated aggregate
     * @param envelope the event
     * @return new state
     * @throws ApplyException when event type is unknown, payload cannot be decoded or handler rejects or fails
     */
    public S evaluate(S state, EventEnvelope envelope) throws ApplyException {
        K kind = kindOf(envelope.type()).orElseThrow(() -> ApplyException.eventTypeNotFound(envelope));
        return registrations.get(kind).evaluate(state, envelope);
    }

    /**
     * Compute the state after an event with payload that was not serialized.
     * @param state current state
     * @param aggregateId identity of the aggregate
     * @param kind kind of the event
     * @param payload the payload
     * @return new state
     * @throws ApplyException when payload is of wrong type or handler rejects or fails
     */
    public S evaluate(S state, String aggregateId, K kind, Object payload) throws ApplyException {
        return registrations.get(kind).evaluate(state, aggregateId, kind.tag(), payload);
    }

    /**
     * Serialize event payload.
     * @param aggregateId the identity of the aggregate, for error reporting
     * @param kind kind of event
     * @param payload the payload
     * @return serialized payload
     * @throws ApplyException with fault {@link ApplyException.Fault#PAYLOAD_ENCODE} when payload is not of registered
     *         type or cannot be serialized
     */
    public byte[] encode(String aggregateId, K kind, Object payload) throws ApplyException {
        return registrations.get(kind).encode(aggregateId, kind.tag(), payload);
    }

    public static final class Builder<K extends Enum<K> & EventKind, S> {
        private final Class<K> kindType;
        private final Map<K, Registration<S, ?>> registrations;

        private Builder(Class<K> kindType) {
            this.kindType = Objects.requireNonNull(kindType, "Event kind type must be specified");
            this.registrations = new EnumMap<>(kindType);
        }

        /**
         * Register event kind with JSON payload.
         * @param kind the kind of event
         * @param payloadType type of payload
         * @param handler handler for the event
         * @param <P> type of payload
         * @return this builder
         */
        public <P> Builder<K, S> on(K kind, Class<P> payloadType, EventHandler<S, P> handler) {
            return on(kind, payloadType, JacksonSerialization.forType(payloadType), handler);
        }

        public <P> Builder<K, S> on(K kind, Class<P> payloadType, Serialization<P> serialization,
                EventHandler<S, P> handler) {
            Registration<S, P> registration = new Registration<>(payloadType, serialization, handler);
            if (registrations.putIfAbsent(Objects.requireNonNull(kind, "Kind cannot be null"), registration) != null) {
                throw new IllegalStateException("Event kind " + kind + " is already registered");
            }
            return this;
        }

        /**
         * Build the registry.
         * @return the registry
         * @throws IllegalStateException when some of the kinds have no registration
         */
        public EventRegistry<K, S> build() {
            Set<K> missing = EnumSet.allOf(kindType);
            missing.removeAll(registrations.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Event kinds " + missing + " of " + kindType.getName()
                        + " have no registration");
            }
            return new EventRegistry<>(this);
        }
    }

    private static final class Registration<S, P> {
        private final Class<P> payloadType;
        private final Serialization<P> serialization;
        private final EventHandler<S, P> handler;

        Registration(Class<P> payloadType, Serialization<P> serialization, EventHandler<S, P> handler) {
            this.payloadType = Objects.requireNonNull(payloadType, "Payload type must be specified");
            this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
            this.handler = Objects.requireNonNull(handler, "Handler must be specified");
        }

        S evaluate(S state, EventEnvelope envelope) throws ApplyException {
            P payload;
            try {
                payload = serialization.deserialize(envelope.payload());
            } catch (IOException | RuntimeException e) {
                throw ApplyException.payloadDecode(envelope, e);
            }
            if (payload == null) {
                throw ApplyException.payloadDecode(envelope, null);
            }
            return handle(state, envelope.aggregateId(), envelope.type(), payload);
        }

        S evaluate(S state, String aggregateId, String tag, Object payload) throws ApplyException {
            return handle(state, aggregateId, tag, cast(aggregateId, tag, payload));
        }

        byte[] encode(String aggregateId, String tag, Object payload) throws ApplyException {
            P typed = cast(aggregateId, tag, payload);
            try {
                return serialization.serialize(typed);
            } catch (IOException | RuntimeException e) {
                throw ApplyException.payloadEncode(aggregateId, tag, e);
            }
        }

        private P cast(String aggregateId, String tag, Object payload) throws ApplyException {
            if (!payloadType.isInstance(payload)) {
                throw ApplyException.payloadEncode(aggregateId, tag, new IllegalArgumentException(
                    "Expected payload of type " + payloadType.getName() + ", got " + payload));
            }
            return payloadType.cast(payload);
        }

        private S handle(S state, String aggregateId, String tag, P payload) throws ApplyException {
            S newState;
            try {
                newState = handler.apply(state, payload);
            } catch (InvariantViolationException e) {
                throw ApplyException.invariantViolation(aggregateId, tag, e);
            } catch (RuntimeException e) {
                throw ApplyException.handlerFailure(aggregateId, tag, e);
            }
            if (newState == null) {
                throw ApplyException.handlerFailure(aggregateId, tag,
                    new IllegalStateException("Handler returned no state"));
            }
            return newState;
        }
    }
}
