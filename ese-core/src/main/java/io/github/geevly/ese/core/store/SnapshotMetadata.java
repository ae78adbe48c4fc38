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

import java.time.Instant;

/**
 * Header of stored snapshot.
 */
public interface SnapshotMetadata {
    /**
     * Identity of the aggregate.
     * @return identity
     */
    String aggregateId();

    /**
     * Timestamp of the snapshot
     * @return the time when snapshot was created
     */
    Instant getTimestamp();

    /**
     * Aggregate version
     * @return the version aggregate was in when this snapshot was generated
     */
    long version();

    class Default implements SnapshotMetadata {

        private final String aggregateId;
        private final Instant timestamp;
        private final long version;

        public Default(String aggregateId, Instant timestamp, long version) {
            this.aggregateId = aggregateId;
            this.timestamp = timestamp;
            this.version = version;
        }

        @Override
        public String aggregateId() {
            return aggregateId;
        }

        @Override
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public long version() {
            return version;
        }
    }
}
