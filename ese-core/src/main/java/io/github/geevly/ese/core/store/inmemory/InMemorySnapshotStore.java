package io.github.geevly.ese.core.store.inmemory;

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

import io.github.geevly.ese.core.store.SnapshotStore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySnapshotStore extends SnapshotStore {
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String aggregateId) {
        return snapshotRecords.get(aggregateId);
    }

    public long getSnapshottedVersion(String aggregateId) {
        SnapshotRecord record = retrieveSnapshotRecord(aggregateId);
        return record == null ? -1 : record.getHeader().version();
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.put(snapshotRecord.getHeader().aggregateId(), snapshotRecord);
    }
}
