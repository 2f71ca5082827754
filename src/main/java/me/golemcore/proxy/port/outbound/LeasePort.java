package me.golemcore.proxy.port.outbound;


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

import me.golemcore.proxy.domain.model.LeaseRecord;

import java.util.Optional;

/**
 * Distributed lease primitive used for leader election. Implementations must
 * provide compare-and-set semantics on {@link LeaseRecord#getVersion()}.
 *
 * <p>
 * All methods throw {@link me.golemcore.proxy.domain.exception.LeaseException}
 * on failure; a lost compare-and-set is reported with
 * {@link me.golemcore.proxy.domain.exception.LeaseException#isConflict()}.
 */
public interface LeasePort {

    Optional<LeaseRecord> get(String namespace, String name);

    /**
     * Create the lease. Fails with a conflict if it already exists.
     */
    LeaseRecord create(String namespace, LeaseRecord lease);

    /**
     * Replace the lease if its version still matches.
     */
    LeaseRecord update(String namespace, LeaseRecord lease);
}
