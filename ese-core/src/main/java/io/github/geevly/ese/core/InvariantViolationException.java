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
 * Raised by event handlers when an event cannot be applied to current state of an aggregate.
 */
public class InvariantViolationException extends Exception {
    private final Reason reason;

    public enum Reason {
        NOT_FOUND, ALREADY_EXISTS, OUT_OF_ORDER, FOREIGN_EVENT, INVALID_VALUE
    }

    protected InvariantViolationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static InvariantViolationException notFound(String what) {
        return new InvariantViolationException(Reason.NOT_FOUND, what + " not found");
    }

    public static InvariantViolationException alreadyExists(String what) {
        return new InvariantViolationException(Reason.ALREADY_EXISTS, what + " already exists");
    }

    public static InvariantViolationException outOfOrder(long expectedVersion, long actualVersion) {
        return new InvariantViolationException(Reason.OUT_OF_ORDER, "Event does not follow sequence. Expected: "
                + expectedVersion + " actual: " + actualVersion);
    }

    public static InvariantViolationException foreignEvent(String aggregateId, String eventAggregateId) {
        return new InvariantViolationException(Reason.FOREIGN_EVENT, "Event of aggregate " + eventAggregateId
                + " cannot be applied to " + aggregateId);
    }

    public static InvariantViolationException invalidValue(String message) {
        return new InvariantViolationException(Reason.INVALID_VALUE, message);
    }
}
