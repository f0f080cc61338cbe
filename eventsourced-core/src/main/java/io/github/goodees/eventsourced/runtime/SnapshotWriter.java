package io.github.goodees.eventsourced.runtime;

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

import io.github.goodees.eventsourced.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Writes snapshots in background. Writes of single persistence id are chained, so they reach the store in the order
 * they were requested, which is revision order.
 */
public class SnapshotWriter {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotWriter.class);

    private final SnapshotStore<?> snapshotStore;
    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();

    public SnapshotWriter(SnapshotStore<?> snapshotStore, Executor executor) {
        this.snapshotStore = snapshotStore;
        this.executor = executor;
    }

    /**
     * Schedule write of a snapshot after all previously requested snapshots of the same entity.
     * @param persistenceId persistence id of the entity
     * @param revision revision of the state
     * @param state the state to store
     * @return future completing with true if the snapshot was stored
     */
    public CompletableFuture<Boolean> request(String persistenceId, long revision, Object state) {
        CompletableFuture<Boolean> write = pending.compute(persistenceId, (id, previous) -> {
            CompletableFuture<Boolean> predecessor = previous == null
                    ? CompletableFuture.completedFuture(true)
                    : previous.exceptionally(t -> false);
            return predecessor.thenApplyAsync(ignored -> write(persistenceId, revision, state), executor);
        });
        write.whenComplete((r, t) -> pending.remove(persistenceId, write));
        return write;
    }

    private boolean write(String persistenceId, long revision, Object state) {
        logger.debug("Storing snapshot of {} at revision {}", persistenceId, revision);
        boolean stored = snapshotStore.store(persistenceId, revision, state);
        if (!stored) {
            logger.info("Snapshot of {} at revision {} was not stored", persistenceId, revision);
        }
        return stored;
    }

    /**
     * Future that completes when all snapshot writes requested so far are done.
     * @return future of pending writes
     */
    public CompletableFuture<Void> whenIdle() {
        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
                .exceptionally(t -> null);
    }
}
