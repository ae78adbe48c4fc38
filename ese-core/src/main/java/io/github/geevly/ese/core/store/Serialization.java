package io.github.geevly.ese.core.store;

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

import java.io.IOException;

/**
 * Conversion of event payloads and aggregate state into bytes and back. Both event registry and aggregate snapshots
 * utilize this to define type-specific conversions.
 * <p>During lifetime of the project the serialized objects might change. Serialization needs to be able to read all
 * past forms of the payloads it ever wrote.</p>
 *
 * @param <T> type of serialized objects
 */
public interface Serialization<T> {
    /**
     * Serialize the object.
     * @param object object to serialize
     * @return serialized form
     * @throws IOException when object cannot be serialized
     */
    byte[] serialize(T object) throws IOException;

    /**
     * Deserialize a payload.
     * @param payload payload to deserialize
     * @return deserialized object, or null when payload represents no value
     * @throws IOException when payload is malformed or incompatible
     */
    T deserialize(byte[] payload) throws IOException;
}
