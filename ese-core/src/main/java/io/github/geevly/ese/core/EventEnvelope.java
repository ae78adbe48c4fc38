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

import org.immutables.value.Value;

import java.time.Instant;

/**
 * Immutable record of a single state change of an aggregate.
 *
 * <p>The payload is opaque to the runtime. Its schema is determined by {@link #type()}, and it is decoded by the
 * {@link EventRegistry} of the aggregate the event belongs to.</p>
 *
 * <p>For any aggregate, no two stored envelopes share the same version, and versions are contiguous starting with
 * the creation event at version {@code 0}.</p>
 */
@Value.Immutable
public abstract class EventEnvelope {

    /**
     * The tag of the event. Identifies payload schema and handler.
     * @return event type tag
     * @see EventKind#tag()
     */
    public abstract String type();

    /**
     * Serialized payload.
     * @return payload bytes
     */
    public abstract byte[] payload();

    /**
     * The version of the aggregate after this event is applied.
     * @return aggregate version
     */
    public abstract long version();

    /**
     * Identity of the aggregate this event belongs to.
     * @return aggregate id
     */
    public abstract String aggregateId();

    /**
     * The time event was issued at.
     * @return creation time of the event
     */
    public abstract Instant timestamp();

    @Value.Check
    protected void check() {
        if (version() < 0) {
            throw new IllegalStateException("Event version cannot be negative, was " + version());
        }
    }

    public static ImmutableEventEnvelope.Builder builder() {
        return ImmutableEventEnvelope.builder();
    }
}
