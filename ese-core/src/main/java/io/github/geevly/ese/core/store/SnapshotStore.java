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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Common logic for storing snapshots. Snapshots are only an optimization of recovery, therefore failures of the
 * underlying storage are logged and reported as absent snapshot, never propagated.
 */
public abstract class SnapshotStore {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Exported state of an aggregate, paired with the version it reflects.
     */
    public static class Snapshot {
        private final long version;
        private final Instant timestamp;
        private final byte[] state;

        Snapshot(long version, Instant timestamp, byte[] state) {
            this.version = version;
            this.timestamp = timestamp;
            this.state = state;
        }

        public long getVersion() {
            return version;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public byte[] getState() {
            return state;
        }
    }

    /**
     * Read latest snapshot of an aggregate.
     * @param aggregateId identity of the aggregate
     * @return the snapshot, empty if there is none or it could not be read
     */
    public Optional<Snapshot> readSnapshot(String aggregateId) {
        try {
            SnapshotRecord snapshotRecord = retrieveSnapshotRecord(aggregateId);
            if (snapshotRecord != null) {
                return Optional.of(new Snapshot(snapshotRecord.header.version(),
                    snapshotRecord.header.getTimestamp(), snapshotRecord.payload));
            }
        } catch (RuntimeException e) {
            logger.error("Failure during retrieval of snapshot of {}", aggregateId, e);
        }
        return Optional.empty();
    }

    /**
     * Store exported state of an aggregate, replacing previous snapshot.
     *
     * @param aggregateId identity of the aggregate
     * @param version the version exported state reflects
     * @param state exported state
     * @return true if snapshot was stored
     */
    public boolean store(String aggregateId, long version, byte[] state) {
        try {
            storeSnapshotRecord(new SnapshotRecord(new SnapshotMetadata.Default(aggregateId, Instant.now(), version),
                Objects.requireNonNull(state, "Snapshot state must not be null")));
            return true;
        } catch (RuntimeException e) {
            logger.error("Storing snapshot of aggregate {} failed", aggregateId, e);
        }
        return false;
    }

    /**
     * Retrieve most recent snapshot for an aggregate from store.
     *
     * @param aggregateId the identity of an aggregate
     * @return header and payload of the snapshot, null if none exists
     */
    protected abstract SnapshotRecord retrieveSnapshotRecord(String aggregateId);

    /**
     * Actually commit the snapshot record into underlying storage.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * The record about a snapshot.
     */
    protected static class SnapshotRecord {
        protected final SnapshotMetadata header;
        protected final byte[] payload;

        /**
         * Create new record
         *
         * @param header  header
         * @param payload payload
         */
        public SnapshotRecord(SnapshotMetadata header, byte[] payload) {
            this.header = header;
            this.payload = payload;
        }

        public SnapshotMetadata getHeader() {
            return header;
        }

        public byte[] getPayload() {
            return payload;
        }
    }

}
