package io.github.goodees.eventsourced.store.inmemory;

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

import io.github.goodees.eventsourced.store.JacksonSerialization;
import io.github.goodees.eventsourced.store.SnapshotStore;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.*;

public class InMemorySnapshotStoreTest {

    @Test
    public void snapshot_is_never_downgraded() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        assertTrue(store.store("counter/a", 6, "six"));
        assertFalse(store.store("counter/a", 3, "three"));
        assertFalse(store.store("counter/a", 6, "other six"));

        SnapshotStore.Snapshot snapshot = store.readSnapshot("counter/a").get();
        assertEquals(6, snapshot.getRevision());
        assertEquals("six", snapshot.getState());
    }

    @Test
    public void missing_snapshot_is_empty() {
        assertFalse(new InMemorySnapshotStore().readSnapshot("counter/none").isPresent());
        assertEquals(0, new InMemorySnapshotStore().getSnapshotRevision("counter/none"));
    }

    @Test
    public void serialized_snapshot_is_stored_as_json() {
        InMemorySnapshotStoreWithSerialization<Integer> store =
                new InMemorySnapshotStoreWithSerialization<>(new JacksonSerialization<>(Integer.class));
        assertTrue(store.store("counter/b", 3, 42));
        assertEquals(Optional.of("42"), store.getSerializedSnapshot("counter/b"));
        assertEquals(JacksonSerialization.PAYLOAD_VERSION, store.getSerializedSnapshotVersion("counter/b").getAsInt());
        assertEquals(42, store.readSnapshot("counter/b").get().getState());
    }

    @Test
    public void unsupported_state_is_not_stored() {
        InMemorySnapshotStoreWithSerialization<Integer> store =
                new InMemorySnapshotStoreWithSerialization<>(new JacksonSerialization<>(Integer.class));
        assertFalse(store.store("counter/c", 3, "not a number"));
        assertFalse(store.getSerializedSnapshot("counter/c").isPresent());
    }

    @Test
    public void undeserializable_snapshot_is_skipped() {
        InMemorySnapshotStoreWithSerialization<Integer> store =
                new InMemorySnapshotStoreWithSerialization<>(new JacksonSerialization<>(Integer.class));
        store.storeSnapshot("counter/d", 3, 99, "42");
        assertFalse(store.readSnapshot("counter/d").isPresent());
        store.storeSnapshot("counter/e", 3, JacksonSerialization.PAYLOAD_VERSION, "{broken");
        assertFalse(store.readSnapshot("counter/e").isPresent());
    }
}
