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

/**
 * Failure to apply an event to an aggregate. The aggregate is left in the state it had before the failed event.
 *
 * <p>Carries the identity of the aggregate and the type of the failing event, as well as the {@link Fault}, so that
 * callers can tell an invalid command from a corrupt history.</p>
 */
public class ApplyException extends Exception {
    private final Fault fault;
    private final String aggregateId;
    private final String eventType;

    public enum Fault {
        EVENT_TYPE_NOT_FOUND, PAYLOAD_DECODE, PAYLOAD_ENCODE, INVARIANT_VIOLATION, HANDLER_FAILURE
    }

    protected ApplyException(Fault fault, String aggregateId, String eventType, String message, Throwable cause) {
        super("When processing event \"" + eventType + "\" of aggregate \"" + aggregateId + "\": " + message, cause);
        this.fault = fault;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
    }

    public Fault getFault() {
        return fault;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getEventType() {
        return eventType;
    }

    public boolean isInvariantViolation() {
        return fault == Fault.INVARIANT_VIOLATION;
    }

    public static ApplyException eventTypeNotFound(EventEnvelope envelope) {
        return new ApplyException(Fault.EVENT_TYPE_NOT_FOUND, envelope.aggregateId(), envelope.type(),
            "event type not found", null);
    }

    public static ApplyException payloadDecode(EventEnvelope envelope, Throwable cause) {
        return new ApplyException(Fault.PAYLOAD_DECODE, envelope.aggregateId(), envelope.type(),
            "error decoding payload" + (cause == null ? "" : ": " + cause.getMessage()), cause);
    }

    public static ApplyException payloadEncode(String aggregateId, String eventType, Throwable cause) {
        return new ApplyException(Fault.PAYLOAD_ENCODE, aggregateId, eventType,
            "error encoding payload: " + cause.getMessage(), cause);
    }

    public static ApplyException invariantViolation(EventEnvelope envelope, InvariantViolationException cause) {
        return invariantViolation(envelope.aggregateId(), envelope.type(), cause);
    }

    public static ApplyException invariantViolation(String aggregateId, String eventType,
            InvariantViolationException cause) {
        return new ApplyException(Fault.INVARIANT_VIOLATION, aggregateId, eventType, cause.getMessage(), cause);
    }

    public static ApplyException handlerFailure(String aggregateId, String eventType, Throwable cause) {
        return new ApplyException(Fault.HANDLER_FAILURE, aggregateId, eventType, "handler failed: " + cause, cause);
    }
}
