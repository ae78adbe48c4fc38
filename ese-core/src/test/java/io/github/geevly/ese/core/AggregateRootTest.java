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
import io.github.geevly.ese.core.store.inmemory.InMemoryEventStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.arrayWithSize;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRootTest {
    @Rule
    public TestName testName = new TestName();
    private InMemoryEventStore store;

    @Before
    public void setUp() {
        store = new InMemoryEventStore();
    }

    private String name() {
        return testName.getMethodName();
    }

    private List<EventEnvelope> history(String id) {
        List<EventEnvelope> result = new ArrayList<>();
        try (EventLog.StoredEvents events = store.readEvents(id, AggregateRoot.NO_VERSION)) {
            events.foreach(result::add);
        }
        return result;
    }

    private EventEnvelope event(String type, long version, String json) {
        return EventEnvelope.builder()
                .type(type)
                .aggregateId(name())
                .version(version)
                .timestamp(Instant.now())
                .payload(json.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    public void new_aggregate_is_empty() {
        Counter counter = new Counter(name(), store);
        assertFalse(counter.isCreated());
        assertFalse(counter.getState().isPresent());
        assertEquals(AggregateRoot.NO_VERSION, counter.getStateVersion());
    }

    @Test
    public void creation_event_has_version_zero() throws Exception {
        Counter counter = new Counter(name(), store);
        EventEnvelope created = counter.open("visits");
        assertEquals(0, created.version());
        assertEquals("Opened", created.type());
        assertEquals(name(), created.aggregateId());
        assertEquals(0, counter.getStateVersion());
        assertEquals("visits", counter.getState().get().getName());
    }

    @Test
    public void issued_events_are_stored_in_order() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("visits");
        counter.add(1);
        counter.add(2);
        assertEquals(3, counter.value());
        assertEquals(2, counter.getStateVersion());
        List<EventEnvelope> history = history(name());
        assertEquals(3, history.size());
        for (int i = 0; i < history.size(); i++) {
            assertEquals(i, history.get(i).version());
        }
    }

    @Test
    public void replay_yields_the_same_state() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("visits");
        counter.add(1);
        counter.add(41);
        Counter replayed = new Counter(name(), store);
        for (EventEnvelope envelope : history(name())) {
            replayed.apply(envelope);
        }
        assertEquals(counter.getState().get(), replayed.getState().get());
        assertEquals(counter.getStateVersion(), replayed.getStateVersion());
    }

    @Test
    public void out_of_order_event_is_rejected() throws Exception {
        Counter counter = new Counter(name(), store);
        try {
            counter.apply(event("Added", 1, "{\"amount\":1}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertTrue(e.isInvariantViolation());
            assertEquals(InvariantViolationException.Reason.OUT_OF_ORDER,
                ((InvariantViolationException) e.getCause()).getReason());
        }
        counter.apply(event("Opened", 0, "{\"name\":\"c\"}"));
        try {
            counter.apply(event("Added", 0, "{\"amount\":1}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertTrue(e.isInvariantViolation());
        }
        assertEquals(0, counter.getStateVersion());
    }

    @Test
    public void event_of_other_aggregate_is_rejected() {
        Counter counter = new Counter("other", store);
        try {
            counter.apply(event("Opened", 0, "{\"name\":\"c\"}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(InvariantViolationException.Reason.FOREIGN_EVENT,
                ((InvariantViolationException) e.getCause()).getReason());
        }
        assertFalse(counter.isCreated());
    }

    @Test
    public void failed_apply_leaves_state_untouched() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.apply(event("Opened", 0, "{\"name\":\"c\"}"));
        counter.apply(event("Added", 1, "{\"amount\":3}"));
        Counter.State before = counter.getState().get();
        for (EventEnvelope bad : new EventEnvelope[] {
                event("Added", 2, "{\"amount\":-4}"),
                event("Added", 2, "not json"),
                event("Broken", 2, "{}"),
                event("Removed", 2, "{}")}) {
            try {
                counter.apply(bad);
                fail("should have failed on " + bad.type());
            } catch (ApplyException e) {
                assertEquals(before, counter.getState().get());
                assertEquals(1, counter.getStateVersion());
            }
        }
    }

    @Test
    public void stale_expected_version_is_version_conflict() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("c");
        try {
            counter.issue(Counter.EventType.ADDED, new Counter.Added(1), AggregateRoot.NO_VERSION);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertEquals(1, history(name()).size());
    }

    @Test
    public void concurrent_writer_causes_version_conflict() throws Exception {
        Counter first = new Counter(name(), store);
        first.open("c");
        Counter second = new Counter(name(), store);
        second.apply(history(name()).get(0));

        first.add(1);
        try {
            second.add(2);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertTrue(e.isVersionConflict());
        }
        assertEquals(0, second.value());
        assertEquals(0, second.getStateVersion());
        assertEquals(1, store.currentVersion(name()));
    }

    @Test
    public void rejected_event_is_not_stored() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("c");
        try {
            counter.add(-1);
            fail("should have failed");
        } catch (ApplyException e) {
            assertTrue(e.isInvariantViolation());
        }
        assertEquals(1, history(name()).size());
        assertThat(counter.drainCommittedEvents().toArray(), arrayWithSize(1));
    }

    @Test
    public void failed_append_leaves_state_at_last_durable_version() throws Exception {
        EventStore failing = (id, expected, envelope) -> {
            throw EventStoreException.storeFailed(id, new IOException("disk full"));
        };
        Counter counter = new Counter(name(), failing);
        try {
            counter.open("c");
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.TX_ERROR, e.getFault());
        }
        assertFalse(counter.isCreated());
        assertEquals(AggregateRoot.NO_VERSION, counter.getStateVersion());
        assertThat(counter.drainCommittedEvents(), empty());
    }

    @Test
    public void encode_failure_carries_apply_failure() throws Exception {
        Counter counter = new Counter(name(), store);
        try {
            counter.issue(Counter.EventType.ADDED, "not a payload", AggregateRoot.NO_VERSION);
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.PAYLOAD_ENCODE, e.getFault());
            assertEquals(1, e.getSuppressed().length);
            assertEquals(ApplyException.Fault.PAYLOAD_ENCODE, ((ApplyException) e.getSuppressed()[0]).getFault());
        }
    }

    @Test
    public void committed_events_are_drained_once() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("c");
        counter.add(1);
        assertEquals(2, counter.drainCommittedEvents().size());
        assertThat(counter.drainCommittedEvents(), empty());
    }

    @Test
    public void exported_state_is_imported() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("c");
        counter.add(7);
        byte[] exported = counter.exportState();

        Counter restored = new Counter(name(), store);
        restored.importState(exported);
        assertEquals(counter.getState().get(), restored.getState().get());
    }

    @Test(expected = IllegalStateException.class)
    public void empty_aggregate_cannot_be_exported() throws Exception {
        new Counter(name(), store).exportState();
    }

    @Test
    public void malformed_snapshot_is_rejected() throws Exception {
        Counter counter = new Counter(name(), store);
        counter.open("c");
        try {
            counter.importState("{\"name\":".getBytes(StandardCharsets.UTF_8));
            fail("should have failed");
        } catch (SnapshotDecodeException e) {
            assertEquals(name(), e.getAggregateId());
        }
        assertEquals("c", counter.getState().get().getName());
    }
}
