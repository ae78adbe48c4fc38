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

import io.github.geevly.ese.core.CommittedEventListener;
import io.github.geevly.ese.core.EventEnvelope;
import io.github.geevly.ese.core.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes committed events to projection handlers registered for their kind.
 *
 * <p>Routing never fails. Events of unknown type are logged and skipped, failure of a handler is logged and the
 * remaining handlers are still invoked.</p>
 *
 * <pre>
 * ProjectionRouter&lt;StudentEventType&gt; router = ProjectionRouter.builder(StudentEventType.class)
 *         .on(StudentEventType.ADD_STUDENT, projector::refresh)
 *         .on(StudentEventType.SET_LOOKUP_CODE, projector::indexLookupCode)
 *         .build();
 * </pre>
 *
 * @param <K> the enumeration of event kinds
 */
public class ProjectionRouter<K extends Enum<K> & EventKind> implements CommittedEventListener {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionRouter.class);

    private final Map<String, K> kindsByTag;
    private final Map<K, List<ProjectionHandler<K>>> handlers;

    private ProjectionRouter(Builder<K> builder) {
        Map<String, K> tags = new HashMap<>();
        for (K kind : builder.kindType.getEnumConstants()) {
            tags.put(kind.tag(), kind);
        }
        this.kindsByTag = Collections.unmodifiableMap(tags);
        Map<K, List<ProjectionHandler<K>>> copy = new EnumMap<>(builder.kindType);
        builder.handlers.forEach((k, v) -> copy.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        this.handlers = Collections.unmodifiableMap(copy);
    }

    public static <K extends Enum<K> & EventKind> Builder<K> builder(Class<K> kindType) {
        return new Builder<>(kindType);
    }

    @Override
    public void committed(EventEnvelope envelope) {
        route(envelope);
    }

    /**
     * Invoke all handlers registered for kind of the event.
     * @param envelope the committed event
     * @return true if event type is known and all of its handlers succeeded
     */
    public boolean route(EventEnvelope envelope) {
        K kind = kindsByTag.get(envelope.type());
        if (kind == null) {
            logger.warn("No projection for event type {} of aggregate {} version {}", envelope.type(),
                envelope.aggregateId(), envelope.version());
            return false;
        }
        boolean success = true;
        for (ProjectionHandler<K> handler : handlers.getOrDefault(kind, Collections.emptyList())) {
            try {
                handler.project(envelope.aggregateId(), kind);
            } catch (ProjectionException | RuntimeException e) {
                logger.error("Projection of event {} of aggregate {} version {} failed", envelope.type(),
                    envelope.aggregateId(), envelope.version(), e);
                success = false;
            }
        }
        return success;
    }

    public static class Builder<K extends Enum<K> & EventKind> {
        private final Class<K> kindType;
        private final Map<K, List<ProjectionHandler<K>>> handlers;

        private Builder(Class<K> kindType) {
            this.kindType = Objects.requireNonNull(kindType, "Event kind type must be specified");
            this.handlers = new EnumMap<>(kindType);
        }

        /**
         * Register a handler for event kind. Handlers of the same kind are invoked in order of registration.
         * @param kind kind of event
         * @param handler the handler
         * @return this builder
         */
        public Builder<K> on(K kind, ProjectionHandler<K> handler) {
            handlers.computeIfAbsent(Objects.requireNonNull(kind, "Kind cannot be null"), k -> new ArrayList<>())
                    .add(Objects.requireNonNull(handler, "Handler cannot be null"));
            return this;
        }

        public ProjectionRouter<K> build() {
            return new ProjectionRouter<>(this);
        }
    }
}
