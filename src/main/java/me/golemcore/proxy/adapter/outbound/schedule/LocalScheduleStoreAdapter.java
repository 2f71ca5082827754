
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

package me.golemcore.proxy.adapter.outbound.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.exception.ScheduleStoreException;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleFilter;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import me.golemcore.proxy.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * File-backed schedule store for single-replica and development setups. Each
 * schedule is one JSON file under {@code schedules/}, written atomically.
 *
 * <p>
 * Versions are a counter kept in the document and compared under an
 * in-process lock, so only replicas sharing this process get conflict
 * detection. Multi-replica deployments use the Kubernetes store.
 */
@Component
@ConditionalOnProperty(prefix = "proxy.storage", name = "backend", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalScheduleStoreAdapter implements ScheduleStorePort {

    private static final String SCHEDULES_DIR = "schedules";
    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public LocalScheduleStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public Schedule create(Schedule schedule) {
        return locked(() -> {
            if (read(schedule.getId()).isPresent()) {
                throw new ScheduleConflictException("Schedule already exists: " + schedule.getId());
            }
            Schedule stored = schedule.toBuilder().version("1").build();
            write(stored);
            return stored;
        });
    }

    @Override
    public Optional<Schedule> get(String id) {
        return locked(() -> read(id));
    }

    @Override
    public Schedule update(Schedule schedule) {
        return locked(() -> {
            Schedule current = read(schedule.getId())
                    .orElseThrow(() -> new ScheduleNotFoundException(schedule.getId()));
            if (!Objects.equals(current.getVersion(), schedule.getVersion())) {
                throw new ScheduleConflictException("Schedule " + schedule.getId() + " was modified (version "
                        + current.getVersion() + ", expected " + schedule.getVersion() + ")");
            }
            Schedule stored = schedule.toBuilder().version(nextVersion(current.getVersion())).build();
            write(stored);
            return stored;
        });
    }

    @Override
    public boolean delete(String id) {
        return locked(() -> join(() -> storagePort.deleteObject(SCHEDULES_DIR, fileName(id)).join()));
    }

    @Override
    public List<Schedule> listDue(Instant now) {
        return readAll().stream()
                .filter(schedule -> schedule.isDue(now))
                .toList();
    }

    @Override
    public List<Schedule> list(ScheduleFilter filter) {
        return readAll().stream()
                .filter(filter::matches)
                .toList();
    }

    private List<Schedule> readAll() {
        return locked(() -> {
            List<String> files = join(() -> storagePort.listObjects(SCHEDULES_DIR, FILE_SUFFIX).join());
            List<Schedule> schedules = new ArrayList<>(files.size());
            for (String file : files) {
                read(file.substring(0, file.length() - FILE_SUFFIX.length())).ifPresent(schedules::add);
            }
            return schedules;
        });
    }

    private Optional<Schedule> read(String id) {
        String json = join(() -> storagePort.getText(SCHEDULES_DIR, fileName(id)).join());
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Schedule.class));
        } catch (JsonProcessingException e) {
            log.warn("[ScheduleStore] Skipping unreadable schedule file {}: {}", fileName(id), e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Schedule schedule) {
        String json;
        try {
            json = objectMapper.writeValueAsString(schedule);
        } catch (JsonProcessingException e) {
            throw new ScheduleStoreException("Failed to serialize schedule " + schedule.getId(), e);
        }
        join(() -> storagePort.putTextAtomic(SCHEDULES_DIR, fileName(schedule.getId()), json).join());
    }

    private static String fileName(String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.startsWith(".")) {
            throw new ScheduleNotFoundException(id);
        }
        return id + FILE_SUFFIX;
    }

    private static String nextVersion(String version) {
        try {
            return Long.toString(Long.parseLong(version) + 1);
        } catch (NumberFormatException e) {
            return "1";
        }
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static <T> T join(Supplier<T> storageCall) {
        try {
            return storageCall.get();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ScheduleStoreException("Schedule storage failed: " + cause.getMessage(), cause);
        }
    }
}
