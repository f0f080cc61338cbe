package io.github.goodees.eventsourced.gateway;

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

/**
 * Outcome of a command as seen by the caller of {@link EntityGateway}.
 */
public final class Reply {
    public enum Status {
        /**
         * Command succeeded, response holds the value returned by the command handler.
         */
        OK,
        /**
         * Command handler signalled domain failure.
         */
        FAILED,
        /**
         * Command could not be executed.
         */
        ERROR
    }

    private final Status status;
    private final Object response;
    private final String message;

    private Reply(Status status, Object response, String message) {
        this.status = status;
        this.response = response;
        this.message = message;
    }

    public static Reply ok(Object response) {
        return new Reply(Status.OK, response, null);
    }

    public static Reply failed(String message) {
        return new Reply(Status.FAILED, null, Objects.requireNonNull(message, "Message must be specified"));
    }

    public static Reply error(String message) {
        return new Reply(Status.ERROR, null, Objects.requireNonNull(message, "Message must be specified"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Object getResponse() {
        return response;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Reply reply = (Reply) o;
        return status == reply.status && Objects.equals(response, reply.response)
                && Objects.equals(message, reply.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, response, message);
    }

    @Override
    public String toString() {
        return status == Status.OK ? "Reply{OK, " + response + '}' : "Reply{" + status + ", " + message + '}';
    }
}
