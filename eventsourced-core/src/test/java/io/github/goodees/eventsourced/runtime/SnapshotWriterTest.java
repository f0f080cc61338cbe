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

import io.github.goodees.eventsourced.store.inmemory.InMemorySnapshotStore;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class SnapshotWriterTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final InMemorySnapshotStore snapshotStore = new InMemorySnapshotStore();
    private final SnapshotWriter writer = new SnapshotWriter(snapshotStore, executor);

    @After
    public void tearDown() {
        executor.shutdown();
    }

    @Test
    public void writes_of_one_entity_keep_revision_order() throws Exception {
        for (int revision = 1; revision <= 50; revision++) {
            writer.request("counter/a", revision, "state " + revision);
        }
        writer.whenIdle().get(2, TimeUnit.SECONDS);
        assertEquals(50, snapshotStore.getSnapshotRevision("counter/a"));
        assertEquals("state 50", snapshotStore.readSnapshot("counter/a").get().getState());
    }

    @Test
    public void older_snapshot_is_not_stored() throws Exception {
        assertTrue(writer.request("counter/b", 10, "new").get(1, TimeUnit.SECONDS));
        assertFalse(writer.request("counter/b", 5, "old").get(1, TimeUnit.SECONDS));
        assertEquals("new", snapshotStore.readSnapshot("counter/b").get().getState());
    }

    @Test
    public void idle_writer_completes_immediately() {
        CompletableFuture<Void> idle = writer.whenIdle();
        assertTrue(idle.isDone());
    }
}
