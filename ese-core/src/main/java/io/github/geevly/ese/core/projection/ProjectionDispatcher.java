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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers committed events to a listener asynchronously. Every aggregate has its own mailbox, so that events of
 * single aggregate are delivered one at a time, in order of submission, while events of different aggregates are
 * delivered concurrently.
 */
public class ProjectionDispatcher implements CommittedEventListener {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionDispatcher.class);

    private final CommittedEventListener target;
    private final ExecutorService executorService;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    public ProjectionDispatcher(CommittedEventListener target, ExecutorService executorService) {
        this.target = Objects.requireNonNull(target, "Target must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
    }

    @Override
    public void committed(EventEnvelope envelope) {
        submit(envelope);
    }

    /**
     * Schedule delivery of an event.
     * @param envelope the event
     * @return future completing after the target processed the event
     */
    public CompletableFuture<Void> submit(EventEnvelope envelope) {
        Mailbox mailbox = mailboxes.computeIfAbsent(envelope.aggregateId(), Mailbox::new);
        return mailbox.enqueue(envelope);
    }

    /**
     * Queue of events of single aggregate. Here we handle the concurrency between adding new event and delivering
     * only one event at a time.
     */
    class Mailbox implements Runnable {
        private final String aggregateId;
        private final Deque<Delivery> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();

        Mailbox(String aggregateId) {
            this.aggregateId = aggregateId;
        }

        CompletableFuture<Void> enqueue(EventEnvelope envelope) {
            Delivery delivery = new Delivery(envelope);
            queue.add(delivery);
            if (canStartProcessing()) {
                schedule();
            }
            return delivery.result;
        }

        private void schedule() {
            try {
                executorService.submit(this);
            } catch (RejectedExecutionException e) {
                abandon(e);
            }
        }

        /**
         * Fail all queued deliveries when the executor does not accept the mailbox any more. The counter is reset, so
         * that next event starts processing again.
         */
        private void abandon(RejectedExecutionException cause) {
            logger.error("Executor rejected delivery of events for {}, failing queued events", aggregateId, cause);
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Delivery delivery;
                while ((delivery = queue.poll()) != null) {
                    delivery.result.completeExceptionally(cause);
                }
                if (canStopProcessing(enqueues)) {
                    return;
                }
            }
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", aggregateId);
                return true;
            } else {
                logger.debug("Will not start processing the queue for {}, {} events enqueued during current delivery",
                    aggregateId, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Deliver single event and resubmit, so that events enqueued in the meantime get delivered as well.
         */
        @Override
        public void run() {
            Delivery delivery = nextDelivery();
            if (delivery != null) {
                delivery.run();
                schedule();
            }
        }

        private Delivery nextDelivery() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Delivery delivery = queue.poll();
                if (delivery == null) {
                    // an event might have been enqueued after the poll, then the counter has changed and we poll again
                    if (canStopProcessing(enqueues)) {
                        logger.debug("Stopping processing of event queue for {}", aggregateId);
                        return null;
                    }
                } else {
                    return delivery;
                }
            }
        }
    }

    class Delivery implements Runnable {
        private final EventEnvelope envelope;
        private final CompletableFuture<Void> result = new CompletableFuture<>();

        Delivery(EventEnvelope envelope) {
            this.envelope = envelope;
        }

        @Override
        public void run() {
            try {
                target.committed(envelope);
                result.complete(null);
            } catch (RuntimeException e) {
                logger.error("Delivery of event {} of aggregate {} version {} failed", envelope.type(),
                    envelope.aggregateId(), envelope.version(), e);
                result.completeExceptionally(e);
            }
        }
    }
}
