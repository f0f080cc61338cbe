package io.github.goodees.eventsourced.store;

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

/**
 * Failure of the event or snapshot store. The fault tells whether the failure is transient.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Another writer appended events in the meantime. Entity needs to be recovered before it can proceed.
         */
        OPTIMISTIC_LOCK,
        /**
         * Underlying storage failed.
         */
        TX_ERROR,
        /**
         * The store was used in a wrong way.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String persistenceId, long expectedRevision,
            long actualRevision) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Entity " + persistenceId + " appending after revision "
                + expectedRevision + " attempted while last known revision is " + actualRevision, null);
    }

    public static EventStoreException storeFailed(String persistenceId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of entity " + persistenceId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String persistenceId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Reading events of entity " + persistenceId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException nonMonotonic(String persistenceId, long expectedRevision, long actualRevision) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for entity " + persistenceId
                + " does not follow sequence. Expected: " + expectedRevision + " actual: " + actualRevision, null);
    }
}
