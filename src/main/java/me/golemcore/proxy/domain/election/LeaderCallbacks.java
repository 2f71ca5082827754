package me.golemcore.proxy.domain.election;


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
 * Receives leadership transitions from a {@link LeaderElector}. All callbacks
 * are invoked on the elector's thread and must return promptly.
 */
public interface LeaderCallbacks {

    /**
     * This replica became leader. {@code context} is cancelled when the term
     * ends, before {@link #onStoppedLeading()} is called.
     */
    void onStartedLeading(LeadershipContext context);

    /**
     * This replica is no longer leader.
     */
    void onStoppedLeading();

    /**
     * A different replica was observed holding the lease.
     */
    default void onNewLeader(String identity) {
    }
}
