package io.github.geevly.ese.core.store.inmemory;

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

import io.github.geevly.ese.core.EventEnvelope;
import io.github.geevly.ese.core.store.EventLog;
import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.EventStoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping the streams in memory. Appends to single stream are serialized on the stream.
 */
public class InMemoryEventStore implements EventStore, EventLog {
    private final ConcurrentMap<String, List<EventEnvelope>> storage = new ConcurrentHashMap<>();

    private static long lastVersionOf(List<EventEnvelope> stream) {
        return stream.isEmpty() ? -1 : stream.get(stream.size() - 1).version();
    }

    private List<EventEnvelope> stream(String aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> new ArrayList<>());
    }

    boolean hasStream(String aggregateId) {
        return storage.containsKey(aggregateId);
    }

    @Override
    public void appendIfVersion(String aggregateId, long expectedVersion, EventEnvelope envelope)
            throws EventStoreException {
        EventStore.checkAppendable(aggregateId, expectedVersion, envelope);
        List<EventEnvelope> stream = stream(aggregateId);
        synchronized (stream) {
            long lastVersion = lastVersionOf(stream);
            if (lastVersion != expectedVersion) {
                throw EventStoreException.optimisticLock(aggregateId, lastVersion, expectedVersion);
            }
            stream.add(envelope);
        }
    }

    @Override
    public long currentVersion(String aggregateId) {
        List<EventEnvelope> stream = storage.get(aggregateId);
        if (stream == null) {
            return -1;
        }
        synchronized (stream) {
            return lastVersionOf(stream);
        }
    }

    @Override
    public StoredEvents readEvents(String aggregateId, long afterVersion) {
        List<EventEnvelope> stream = storage.get(aggregateId);
        if (stream == null) {
            return new ListStoredEvents(Collections.emptyList());
        }
        List<EventEnvelope> filteredEvents;
        synchronized (stream) {
            filteredEvents = stream.stream().filter(e -> e.version() > afterVersion).collect(toList());
        }
        return new ListStoredEvents(Collections.unmodifiableList(filteredEvents));
    }

    static class ListStoredEvents implements StoredEvents {
        private final List<EventEnvelope> events;
        private boolean stop;

        ListStoredEvents(List<EventEnvelope> events) {
            this.events = events;
        }

        @Override
        public <X extends Exception> void foreach(EventConsumer<X> consumer) throws X {
            for (EventEnvelope event : events) {
                if (stop) {
                    break;
                }
                consumer.accept(event);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
        }
    }
}
