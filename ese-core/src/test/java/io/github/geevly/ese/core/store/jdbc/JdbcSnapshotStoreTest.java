package io.github.geevly.ese.core.store.jdbc;

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
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JdbcSnapshotStoreTest extends JdbcTest {

    private boolean store(long version, String state) {
        return snapshotStore.store(name(), version, state.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void first_snapshot_inserted() {
        assertTrue(store(1, "one"));
        assertDb(1, "select count(*) from snapshot where aggregate_id = ? and version = ?", name(), 1);
    }

    @Test
    public void next_snapshot_updated() {
        store(1, "one");
        store(2, "two");
        assertDb(0, "select count(*) from snapshot where aggregate_id = ? and version = ?", name(), 1);
        assertDb(1, "select count(*) from snapshot where aggregate_id = ? and version = ?", name(), 2);
    }

    @Test
    public void snapshot_is_read_with_its_version() {
        Instant before = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store(8, "eight");
        Optional<SnapshotStore.Snapshot> snapshot = snapshotStore.readSnapshot(name());
        assertTrue(snapshot.isPresent());
        assertEquals(8L, snapshot.get().getVersion());
        assertFalse(snapshot.get().getTimestamp().isBefore(before));
        assertFalse(snapshot.get().getTimestamp().isAfter(Instant.now()));
        assertEquals("eight", new String(snapshot.get().getState(), StandardCharsets.UTF_8));
    }

    @Test
    public void missing_snapshot_is_empty() {
        assertFalse(snapshotStore.readSnapshot(name()).isPresent());
    }

    @Test
    public void storage_failures_are_not_propagated() {
        JdbcSnapshotStore broken = new JdbcSnapshotStore(ds, new DefaultJdbcSchema("event", "no_such_table"));
        assertFalse(broken.store(name(), 1, new byte[] {1}));
        assertFalse(broken.readSnapshot(name()).isPresent());
    }
}
