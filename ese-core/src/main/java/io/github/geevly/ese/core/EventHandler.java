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

/**
 * Pure function computing the state of an aggregate after an event.
 *
 * <p>Handler may not mutate passed state, nor have any side effects. It either returns the new state, or throws
 * {@link InvariantViolationException} when the event cannot be applied to the state.</p>
 *
 * @param <S> the type of aggregate state
 * @param <P> the type of event payload
 */
@FunctionalInterface
public interface EventHandler<S, P> {
    /**
     * Compute new state.
     * @param state current state, {@code null} when aggregate was not created yet
     * @param payload decoded payload of the event
     * @return the new state, never null
     * @throws InvariantViolationException when event is not applicable to current state
     */
    S apply(S state, P payload) throws InvariantViolationException;
}
