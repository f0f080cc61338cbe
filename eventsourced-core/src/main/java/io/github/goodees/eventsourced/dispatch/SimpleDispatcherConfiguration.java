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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dispatcher configuration holding explicitly passed thread pools.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final ExecutorService snapshotExecutor;

    /**
     * Create dispatcher configuration.
     * @param name The name of the dispatcher
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param snapshotExecutor executor for background snapshot writes
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, ExecutorService snapshotExecutor) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.snapshotExecutor = Objects.requireNonNull(snapshotExecutor, "Snapshot executor must be specified");
    }

    /**
     * Create dispatcher configuration writing snapshots on the executor service.
     * @param name the name of the dispatcher
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService) {
        this(name, executorService, schedulerService, executorService);
    }

    /**
     * Configuration with fresh thread pools of given size. The caller is responsible for shutting them down.
     * @param name the name of the dispatcher
     * @param threads number of threads executing entity tasks
     * @return new configuration
     */
    public static SimpleDispatcherConfiguration withThreads(String name, int threads) {
        return new SimpleDispatcherConfiguration(name, Executors.newFixedThreadPool(threads),
                Executors.newSingleThreadScheduledExecutor());
    }

    @Override
    public String dispatcherName() {
        return this.name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public ExecutorService snapshotExecutor() {
        return snapshotExecutor;
    }

    /**
     * Shut down all thread pools of this configuration.
     */
    public void shutdown() {
        executorService.shutdown();
        schedulerService.shutdown();
        snapshotExecutor.shutdown();
    }
}
