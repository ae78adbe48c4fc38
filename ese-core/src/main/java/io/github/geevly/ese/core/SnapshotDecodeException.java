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
 * Stored snapshot could not be turned into aggregate state. Recoverable by replaying entire history.
 */
public class SnapshotDecodeException extends Exception {
    private final String aggregateId;

    public SnapshotDecodeException(String aggregateId, Throwable cause) {
        super("Error decoding snapshot data of aggregate " + aggregateId
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.aggregateId = aggregateId;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
