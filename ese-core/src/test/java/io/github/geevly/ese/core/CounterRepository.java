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

import io.github.geevly.ese.core.store.EventLog;
import io.github.geevly.ese.core.store.SnapshotStore;
import io.github.geevly.ese.core.store.inmemory.InMemoryEventStore;
import io.github.geevly.ese.core.store.inmemory.InMemorySnapshotStore;

class CounterRepository extends AggregateRepository<Counter> {
    final InMemoryEventStore store;
    final InMemorySnapshotStore snapshotStore;

    CounterRepository(InMemoryEventStore store, InMemorySnapshotStore snapshotStore,
            RepositoryConfiguration configuration) {
        super(configuration);
        this.store = store;
        this.snapshotStore = snapshotStore;
    }

    @Override
    protected Counter instantiate(String aggregateId) {
        return new Counter(aggregateId, store);
    }

    @Override
    protected EventLog getEventLog() {
        return store;
    }

    @Override
    protected SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }
}
