package me.golemcore.proxy.testsupport;

import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleFilter;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule store keeping copies in memory, with the same version checks as the
 * real adapters.
 */
public class InMemoryScheduleStore implements ScheduleStorePort {

    private final Map<String, Schedule> schedules = new LinkedHashMap<>();
    private long revision;
    private int updateCount;

    @Override
    public synchronized Schedule create(Schedule schedule) {
        if (schedules.containsKey(schedule.getId())) {
            throw new ScheduleConflictException("Schedule " + schedule.getId() + " already exists");
        }
        Schedule stored = schedule.toBuilder().version(String.valueOf(++revision)).build();
        schedules.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<Schedule> get(String id) {
        Schedule schedule = schedules.get(id);
        return schedule == null ? Optional.empty() : Optional.of(schedule.toBuilder().build());
    }

    @Override
    public synchronized Schedule update(Schedule schedule) {
        Schedule current = schedules.get(schedule.getId());
        if (current == null) {
            throw new ScheduleNotFoundException(schedule.getId());
        }
        if (!current.getVersion().equals(schedule.getVersion())) {
            throw new ScheduleConflictException("Schedule " + schedule.getId() + " was modified concurrently");
        }
        Schedule stored = schedule.toBuilder().version(String.valueOf(++revision)).build();
        schedules.put(stored.getId(), stored);
        updateCount++;
        return stored.toBuilder().build();
    }

    @Override
    public synchronized boolean delete(String id) {
        return schedules.remove(id) != null;
    }

    @Override
    public synchronized List<Schedule> listDue(Instant now) {
        List<Schedule> due = new ArrayList<>();
        for (Schedule schedule : schedules.values()) {
            if (schedule.isDue(now)) {
                due.add(schedule.toBuilder().build());
            }
        }
        return due;
    }

    @Override
    public synchronized List<Schedule> list(ScheduleFilter filter) {
        List<Schedule> result = new ArrayList<>();
        for (Schedule schedule : schedules.values()) {
            if (filter.matches(schedule)) {
                result.add(schedule.toBuilder().build());
            }
        }
        return result;
    }

    /**
     * Store a schedule as-is, bypassing the version check.
     */
    public synchronized Schedule put(Schedule schedule) {
        Schedule stored = schedule.toBuilder().version(String.valueOf(++revision)).build();
        schedules.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    public synchronized int getUpdateCount() {
        return updateCount;
    }
}
