package io.github.geevly.ese.student;

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

import io.github.geevly.ese.core.AggregateRepository;
import io.github.geevly.ese.core.RepositoryConfiguration;
import io.github.geevly.ese.core.store.EventLog;
import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.SnapshotStore;
import io.github.geevly.ese.core.store.inmemory.InMemoryEventStore;
import io.github.geevly.ese.core.store.inmemory.InMemorySnapshotStore;

import java.util.Objects;

public class StudentRepository extends AggregateRepository<Student> {
    private final EventStore eventStore;
    private final EventLog eventLog;
    private final SnapshotStore snapshotStore;

    public StudentRepository(EventStore eventStore, EventLog eventLog, SnapshotStore snapshotStore,
            RepositoryConfiguration configuration) {
        super(configuration);
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
    }

    /**
     * Repository keeping students in memory, with default configuration.
     * @return new repository
     */
    public static StudentRepository inMemory() {
        InMemoryEventStore store = new InMemoryEventStore();
        return new StudentRepository(store, store, new InMemorySnapshotStore(), RepositoryConfiguration.defaults());
    }

    @Override
    protected Student instantiate(String aggregateId) {
        return new Student(aggregateId, eventStore);
    }

    @Override
    protected EventLog getEventLog() {
        return eventLog;
    }

    @Override
    protected SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }
}
