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

import org.junit.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.Assert.*;

public class SimpleDispatcherConfigurationTest {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @Test
    public void snapshots_are_written_on_executor_service_by_default() {
        SimpleDispatcherConfiguration conf = new SimpleDispatcherConfiguration("test", executorService, scheduler);
        assertEquals("test", conf.dispatcherName());
        assertSame(executorService, conf.snapshotExecutor());
        conf.shutdown();
    }

    @Test
    public void snapshot_executor_can_be_separate() {
        ExecutorService snapshots = Executors.newSingleThreadExecutor();
        SimpleDispatcherConfiguration conf = new SimpleDispatcherConfiguration("test", executorService, scheduler,
                snapshots);
        assertSame(snapshots, conf.snapshotExecutor());
        conf.shutdown();
        assertTrue(snapshots.isShutdown());
        assertTrue(scheduler.isShutdown());
    }

    @Test
    public void thread_pools_are_created_on_request() {
        SimpleDispatcherConfiguration conf = SimpleDispatcherConfiguration.withThreads("pool", 2);
        assertNotNull(conf.executorService());
        assertNotNull(conf.schedulerService());
        conf.shutdown();
        assertTrue(conf.executorService().isShutdown());
    }

    @Test(expected = NullPointerException.class)
    public void name_is_required() {
        new SimpleDispatcherConfiguration(null, executorService, scheduler);
    }
}
