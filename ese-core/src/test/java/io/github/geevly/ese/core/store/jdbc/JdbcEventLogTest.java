package io.github.geevly.ese.core.store.jdbc;

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
import io.github.geevly.ese.core.store.EventStoreException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventLogTest extends JdbcTest {

    List<EventEnvelope> generate(int size) throws EventStoreException {
        List<EventEnvelope> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            EventEnvelope e = event(i, "payload " + i);
            eventStore.appendIfVersion(name(), i - 1, e);
            result.add(e);
        }
        return result;
    }

    @Test
    public void foreach_delivers_results() throws EventStoreException {
        List<EventEnvelope> events = generate(3);
        List<EventEnvelope> delivered = new ArrayList<>();
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), -1)) {
            ev.foreach(delivered::add);
        }
        assertEquals(events, delivered);
    }

    @Test
    public void stop_stops_foreach() throws EventStoreException {
        List<EventEnvelope> events = generate(3);
        AtomicInteger counter = new AtomicInteger();
        List<EventEnvelope> delivered = new ArrayList<>();
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), -1)) {
            ev.foreach((e) -> {
                if (counter.incrementAndGet() == 2) {
                    ev.stop();
                }
                delivered.add(e);
            });
        }
        assertEquals(events.subList(0, 2), delivered);
    }

    @Test
    public void read_events_delivers_events_after_specified_version() throws EventStoreException {
        List<EventEnvelope> events = generate(30);
        List<EventEnvelope> delivered = new ArrayList<>();
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), 10)) {
            ev.foreach(delivered::add);
        }
        assertEquals(events.subList(11, events.size()), delivered);
        assertTrue("Returned version should be strictly greater than afterVersion argument",
                delivered.stream().allMatch(e -> e.version() > 10));
    }

    @Test
    public void no_events_returned_for_nonexisting_aggregate() {
        List<EventEnvelope> delivered = new ArrayList<>();
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), -1)) {
            ev.foreach(delivered::add);
        }
        assertThat(delivered, empty());
        assertEquals(-1, eventLog.currentVersion(name()));
    }

    @Test
    public void iteration_can_be_done_only_once() throws EventStoreException {
        generate(2);
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), -1)) {
            ev.foreach(e -> { });
            try {
                ev.foreach(e -> { });
                fail("should have failed");
            } catch (IllegalStateException e) {
                // expected
            }
        }
    }

    @Test
    public void consumer_exception_stops_iteration() throws EventStoreException {
        generate(3);
        List<EventEnvelope> delivered = new ArrayList<>();
        try (EventLog.StoredEvents ev = eventLog.readEvents(name(), -1)) {
            ev.foreach(e -> {
                delivered.add(e);
                throw new Exception("consumer failed");
            });
            fail("should have failed");
        } catch (Exception e) {
            assertEquals("consumer failed", e.getMessage());
        }
        assertEquals(1, delivered.size());
    }
}
