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

import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of {@link Schedule} records in the namespace shared by all
 * replicas.
 *
 * <p>
 * All writes after creation go through {@link #update(Schedule)}, which
 * compares the record's {@link Schedule#getVersion() version} with the stored
 * one. Implementations throw
 * {@link me.golemcore.proxy.domain.exception.ScheduleStoreException} on
 * transient backend failures.
 */
public interface ScheduleStorePort {

    /**
     * Persist a new schedule.
     *
     * @return the stored copy with its version set
     * @throws me.golemcore.proxy.domain.exception.ScheduleConflictException
     *             if a schedule with the same id already exists
     */
    Schedule create(Schedule schedule);

    Optional<Schedule> get(String id);

    /**
     * Replace a schedule if it has not changed since it was read.
     *
     * @return the stored copy with its new version
     * @throws me.golemcore.proxy.domain.exception.ScheduleConflictException
     *             if the stored version differs from {@code schedule.getVersion()}
     * @throws me.golemcore.proxy.domain.exception.ScheduleNotFoundException
     *             if the schedule was deleted
     */
    Schedule update(Schedule schedule);

    /**
     * @return {@code true} if a schedule was deleted
     */
    boolean delete(String id);

    /**
     * Active schedules whose next execution is at or before {@code now}.
     * Paused, completed and errored schedules are never returned.
     */
    List<Schedule> listDue(Instant now);

    List<Schedule> list(ScheduleFilter filter);
}
