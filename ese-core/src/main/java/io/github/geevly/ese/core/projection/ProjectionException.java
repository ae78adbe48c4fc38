package io.github.geevly.ese.core.projection;

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
 * Failure to update a read model. It does not affect the already committed event.
 */
public class ProjectionException extends Exception {
    private final String aggregateId;

    public ProjectionException(String aggregateId, String message) {
        this(aggregateId, message, null);
    }

    public ProjectionException(String aggregateId, String message, Throwable cause) {
        super("Projection of " + aggregateId + " failed: " + message, cause);
        this.aggregateId = aggregateId;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
