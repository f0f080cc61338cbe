package io.github.goodees.eventsourced.dispatch;

/*-
 * #%L
 * eventsourced-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
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
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous task dispatcher. Guarantees to run at most one task at time per entity. Internally, the dispatcher
 * maintains a queue of invocations for every entity id. Whenever a new task should be invoked, the dispatcher checks
 * if it is not invoking a task for that entity already. Tasks of different entities run in parallel on the
 * configured executor service.
 *
 * <p>Failed tasks are not retried, their exception is passed to the caller.</p>
 */
public class Dispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Schedule a task.
     * The task is added to entity's mailbox, and that mailbox is scheduled for dequeue. The response is returned
     * immediately, as it is just a holder for future result that completes when the task completes.
     *
     * @param id   entity id
     * @param task task to run
     * @param <RS> type of response
     * @return the promise for the response
     */
    public <RS> CompletableFuture<RS> execute(String id, EntityTask<RS> task) {
        Mailbox mailbox = mailboxes.computeIfAbsent(id, Mailbox::new);
        return mailbox.enqueue(task);
    }

    /**
     * Schedule a task with timeout. If the task doesn't start until timeout, the result completes exceptionally
     * with {@code CancellationException}. Task that already started is never interrupted, it runs to completion.
     * @param id entity id
     * @param task the task
     * @param timeout timeout for completion
     * @param unit timeout unit
     * @param <RS> response type
     * @return the promise for the result
     */
    public <RS> CompletableFuture<RS> executeWithTimeout(String id, EntityTask<RS> task, long timeout, TimeUnit unit) {
        Mailbox mailbox = mailboxes.computeIfAbsent(id, Mailbox::new);
        return mailbox.enqueueWithTimeout(task, timeout, unit);
    }

    /**
     * Get rid of wrapping exceptions of CompletableFuture.
     * @param ex the exception to unwrap
     * @return first cause that is not a CompletionException or ExecutionException
     */
    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Whether the throwable represents timed out or cancelled invocation.
     * @param ex the exception the future completed with
     * @return true if the cause was timeout
     */
    public static boolean isTimeout(Throwable ex) {
        Throwable cause = unwrapCompletionException(ex);
        return cause instanceof TimeoutException || cause instanceof CancellationException;
    }

    /**
     * Queue of tasks for single entity. At this level we're handling the concurrency between adding new task,
     * and executing only single task.
     */
    class Mailbox implements Runnable {
        private final String id;
        private final Deque<Invocation<?>> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation<?>> currentInvocation = new AtomicReference<>();

        Mailbox(String id) {
            this.id = id;
        }

        <RS> CompletableFuture<RS> enqueue(EntityTask<RS> task) {
            return enqueueInvocation(new Invocation<>(id, task));
        }

        <RS> CompletableFuture<RS> enqueueWithTimeout(EntityTask<RS> task, long timeout, TimeUnit unit) {
            return enqueueInvocation(new Invocation<>(id, task, timeout, unit));
        }

        /**
         * Add an invocation to queue, and process it if it is the first one.
         */
        private <RS> CompletableFuture<RS> enqueueInvocation(Invocation<RS> inv) {
            queue.add(inv);
            if (canStartProcessing()) {
                conf.executorService().submit(this);
            }
            return inv.result;
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", id);
                return true;
            } else {
                logger.debug("Will not start processing the queue for {}, {} tasks enqueued during current execution",
                    id, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Process single task.
         * Called when Mailbox is submitted for execution and not processing, but also at end
         * of processing. This way even tasks that arrive during processing will be processed.
         */
        @Override
        public void run() {
            Invocation<?> inv = nextInvocation();
            if (inv != null) {
                if (currentInvocation.compareAndSet(null, inv)) {
                    inv.run();
                } else {
                    logger.error("Submit has run while invocation is is progress. Current invocation: {}, "
                            + "dequeued invocation: {}", currentInvocation, inv);
                    queue.addFirst(inv);
                }
            }
        }

        private Invocation<?> nextInvocation() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Invocation<?> inv = queue.poll();
                if (inv == null) {
                    // An invocation might have been queued between previous line, and this decision point.
                    // Therefore we check, if canStartProcessing was called in between, and try polling the
                    // queue again, or we guarantee, that canStartProcessing will return true past the next statement.
                    if (canStopProcessing(enqueues)) {
                        logger.debug("Stopping processing of task queue for {}", id);
                        return null;
                    }
                } else {
                    return inv;
                }
            }
        }

        /**
         * Encapsulation of task processing. Represents the task as well as actual response given to client.
         * On this level we are handling the concurrency between invocation of the task, and cancellation of it.
         * @param <RS> type of response
         */
        class Invocation<RS> implements Runnable {

            private final EntityTask<RS> task;
            private final String entityId;
            private final FutureResponse<RS> result = new FutureResponse<>(this::cancelled);
            private final ScheduledFuture<?> timeout;
            private final Instant submission = Instant.now();
            private volatile Instant executionStart;

            Invocation(String entityId, EntityTask<RS> task) {
                this.entityId = entityId;
                this.task = task;
                this.timeout = null;
            }

            Invocation(String entityId, EntityTask<RS> task, long timeout, TimeUnit unit) {
                this.entityId = entityId;
                this.task = task;
                this.timeout = conf.schedulerService().schedule(this::timeout, timeout, unit);
            }

            @Override
            public void run() {
                if (result.couldStart()) {
                    executionStart = Instant.now();
                    RS response = null;
                    Throwable failure = null;
                    try {
                        response = task.run();
                    } catch (Throwable e) {
                        failure = e;
                    }
                    handleCompletion(response, failure);
                } else {
                    logger.info("Invocation attempted to run after it was cancelled: {}", this);
                    finish();
                }
            }

            void finish() {
                if (currentInvocation.compareAndSet(this, null)) {
                    executionStart = null;
                    conf.executorService().submit(Mailbox.this);
                } else {
                    logger.error("Invocation finished, but wasn't current invocation: {}", this);
                }
            }

            void cancelled() {
                queue.remove(this);
            }

            void timeout() {
                if (result.cancel(true)) {
                    logger.info("Invocation timed out: {}. Current invocation is {}", this, currentInvocation.get());
                } else if (!result.isDone()) {
                    // The task is running, it is not interrupted. It runs to completion and its result is delivered.
                    logger.warn("ACTIVE invocation timed out: {}", this);
                }
            }

            private void handleCompletion(RS response, Throwable throwable) {
                cancelTimeout();
                if (throwable == null) {
                    result.doComplete(response);
                } else {
                    logger.debug("Invocation {} failed", this, throwable);
                    result.doCompleteExceptionally(unwrapCompletionException(throwable));
                }
                finish();
            }

            private void cancelTimeout() {
                if (timeout != null && !timeout.isDone()) {
                    timeout.cancel(false);
                }
            }

            @Override
            public String toString() {
                return "Invocation[entity=" + entityId + ", task=" + task
                        + ", submissionTime=" + submission + ", executionStart=" + executionStart + "]";
            }
        }
    }

}
