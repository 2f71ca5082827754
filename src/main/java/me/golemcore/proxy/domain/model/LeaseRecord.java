package me.golemcore.proxy.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a distributed lease: who holds it and when it was last renewed.
 * An empty {@code holderIdentity} means the lease is free.
 */
@Value
@Builder(toBuilder = true)
public class LeaseRecord {
    String name;
    String holderIdentity;
    Duration leaseDuration;
    Instant acquireTime;
    Instant renewTime;
    int leaseTransitions;

    /**
     * Store revision, compared on update.
     */
    String version;

    public boolean isHeld() {
        return holderIdentity != null && !holderIdentity.isEmpty();
    }

    public boolean isHeldBy(String identity) {
        return isHeld() && holderIdentity.equals(identity);
    }
}
