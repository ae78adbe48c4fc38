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

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class EventRegistryTest {

    static EventEnvelope envelope(String type, String json) {
        return EventEnvelope.builder()
                .type(type)
                .aggregateId("c1")
                .version(0)
                .timestamp(Instant.now())
                .payload(json.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    public void kinds_are_resolved_by_tag() {
        assertEquals(Counter.EventType.ADDED, Counter.REGISTRY.kindOf("Added").get());
        assertFalse(Counter.REGISTRY.kindOf("Removed").isPresent());
        assertEquals(3, Counter.REGISTRY.kinds().size());
    }

    @Test
    public void build_fails_when_kind_is_not_registered() {
        try {
            EventRegistry.builder(Counter.EventType.class, Counter.State.class)
                    .on(Counter.EventType.OPENED, Counter.Opened.class, Counter::opened)
                    .build();
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("ADDED"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void kind_cannot_be_registered_twice() {
        EventRegistry.builder(Counter.EventType.class, Counter.State.class)
                .on(Counter.EventType.OPENED, Counter.Opened.class, Counter::opened)
                .on(Counter.EventType.OPENED, Counter.Opened.class, Counter::opened);
    }

    @Test
    public void evaluate_decodes_payload_and_invokes_handler() throws ApplyException {
        Counter.State state = Counter.REGISTRY.evaluate(null, envelope("Opened", "{\"name\":\"visits\"}"));
        assertEquals(new Counter.State("visits", 0), state);
        state = Counter.REGISTRY.evaluate(state, envelope("Added", "{\"amount\":5}"));
        assertEquals(new Counter.State("visits", 5), state);
    }

    @Test
    public void unknown_payload_fields_are_ignored() throws ApplyException {
        Counter.State state = Counter.REGISTRY.evaluate(null,
            envelope("Opened", "{\"name\":\"visits\",\"color\":\"red\"}"));
        assertEquals("visits", state.getName());
    }

    @Test
    public void unknown_type_is_reported() {
        try {
            Counter.REGISTRY.evaluate(null, envelope("Removed", "{}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.EVENT_TYPE_NOT_FOUND, e.getFault());
            assertEquals("Removed", e.getEventType());
            assertEquals("c1", e.getAggregateId());
        }
    }

    @Test
    public void malformed_payload_is_reported() {
        try {
            Counter.REGISTRY.evaluate(null, envelope("Opened", "{\"name\":"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.PAYLOAD_DECODE, e.getFault());
        }
    }

    @Test
    public void invariant_violation_carries_reason() {
        try {
            Counter.REGISTRY.evaluate(null, envelope("Added", "{\"amount\":1}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.INVARIANT_VIOLATION, e.getFault());
            assertThat(e.getCause(), instanceOf(InvariantViolationException.class));
            assertEquals(InvariantViolationException.Reason.NOT_FOUND,
                ((InvariantViolationException) e.getCause()).getReason());
        }
    }

    @Test
    public void runtime_failure_of_handler_is_converted() {
        try {
            Counter.REGISTRY.evaluate(new Counter.State("c", 0), envelope("Broken", "{\"reason\":\"test\"}"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.HANDLER_FAILURE, e.getFault());
            assertThat(e.getCause(), instanceOf(IllegalStateException.class));
            assertThat(e.getMessage(), containsString("Broken"));
        }
    }

    @Test
    public void evaluate_does_not_change_passed_state() throws ApplyException {
        Counter.State initial = new Counter.State("c", 1);
        Counter.State result = Counter.REGISTRY.evaluate(initial, envelope("Added", "{\"amount\":2}"));
        assertEquals(1, initial.getValue());
        assertEquals(3, result.getValue());
    }

    @Test
    public void payload_of_wrong_type_is_not_encoded() {
        try {
            Counter.REGISTRY.encode("c1", Counter.EventType.ADDED, new Counter.Opened("wrong"));
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(ApplyException.Fault.PAYLOAD_ENCODE, e.getFault());
        }
    }

    @Test
    public void encoded_payload_is_decoded_by_same_registration() throws ApplyException {
        Counter.State initial = new Counter.State("c", 1);
        byte[] payload = Counter.REGISTRY.encode("c1", Counter.EventType.ADDED, new Counter.Added(4));
        EventEnvelope envelope = envelope("Added", new String(payload, StandardCharsets.UTF_8));
        assertEquals(5, Counter.REGISTRY.evaluate(initial, envelope).getValue());
        assertSame(Counter.EventType.class, Counter.REGISTRY.getKindType());
    }
}
