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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools and naming of a {@link Dispatcher}.
 */
public interface DispatcherConfiguration {
    String dispatcherName();

    /**
     * The thread pool entity tasks run on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Thread pool for handling timeouts. <strong>Should be different from executorService!</strong> When same thread
     * pools would be used and the execution would block, the unsatisfied requests would not be cancelled as there
     * would be no free threads to perform the cancellation.
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    /**
     * Thread pool background snapshot writes run on. Defaults to {@link #executorService()}.
     * @return executor service for snapshot writes
     */
    default ExecutorService snapshotExecutor() {
        return executorService();
    }
}
