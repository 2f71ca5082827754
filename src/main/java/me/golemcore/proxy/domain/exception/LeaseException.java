package me.golemcore.proxy.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Failure to read or write the leader election lease. A
 * {@link LeaseException} with {@link #isConflict()} set means another replica
 * updated the lease first.
 */
public class LeaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean conflict;

    public LeaseException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public LeaseException(String message, Throwable cause, boolean conflict) {
        super(message, cause);
        this.conflict = conflict;
    }

    public static LeaseException conflict(String leaseName) {
        return new LeaseException("Lease " + leaseName + " was updated concurrently", null, true);
    }

    public boolean isConflict() {
        return conflict;
    }
}
