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

import io.github.geevly.ese.core.EventKind;

/**
 * Updates a read model after an event was committed. Handlers receive only the identity of the aggregate and the kind
 * of the event, and are expected to pull current state of the aggregate themselves. Therefore they need to be
 * idempotent, as the same event may be delivered more than once.
 *
 * @param <K> the enumeration of event kinds
 */
@FunctionalInterface
public interface ProjectionHandler<K extends Enum<K> & EventKind> {
    void project(String aggregateId, K kind) throws ProjectionException;
}
