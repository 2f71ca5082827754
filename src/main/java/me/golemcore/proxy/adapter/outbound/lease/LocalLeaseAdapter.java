
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

package me.golemcore.proxy.adapter.outbound.lease;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.proxy.domain.exception.LeaseException;
import me.golemcore.proxy.domain.model.LeaseRecord;
import me.golemcore.proxy.port.outbound.LeasePort;
import me.golemcore.proxy.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * File-backed lease for running the worker without a cluster. Leases are
 * stored under {@code leases/<namespace>.<name>.json}; compare-and-set is
 * enforced with an in-process lock, which is enough for a single replica.
 */
@Component
@ConditionalOnProperty(prefix = "proxy.storage", name = "backend", havingValue = "local", matchIfMissing = true)
public class LocalLeaseAdapter implements LeasePort {

    private static final String LEASES_DIR = "leases";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public LocalLeaseAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<LeaseRecord> get(String namespace, String name) {
        return locked(() -> read(namespace, name).map(LeaseDocument::toRecord));
    }

    @Override
    public LeaseRecord create(String namespace, LeaseRecord lease) {
        return locked(() -> {
            if (read(namespace, lease.getName()).isPresent()) {
                throw LeaseException.conflict(lease.getName());
            }
            LeaseDocument document = LeaseDocument.from(lease, 1);
            write(namespace, document);
            return document.toRecord();
        });
    }

    @Override
    public LeaseRecord update(String namespace, LeaseRecord lease) {
        return locked(() -> {
            LeaseDocument current = read(namespace, lease.getName())
                    .orElseThrow(() -> LeaseException.conflict(lease.getName()));
            if (!Objects.equals(Long.toString(current.getVersion()), lease.getVersion())) {
                throw LeaseException.conflict(lease.getName());
            }
            LeaseDocument document = LeaseDocument.from(lease, current.getVersion() + 1);
            write(namespace, document);
            return document.toRecord();
        });
    }

    private Optional<LeaseDocument> read(String namespace, String name) {
        String json = join(() -> storagePort.getText(LEASES_DIR, fileName(namespace, name)).join());
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, LeaseDocument.class));
        } catch (JsonProcessingException e) {
            throw new LeaseException("Lease file " + fileName(namespace, name) + " is unreadable", e);
        }
    }

    private void write(String namespace, LeaseDocument document) {
        try {
            String json = objectMapper.writeValueAsString(document);
            join(() -> storagePort.putTextAtomic(LEASES_DIR, fileName(namespace, document.getName()), json).join());
        } catch (JsonProcessingException e) {
            throw new LeaseException("Failed to serialize lease " + document.getName(), e);
        }
    }

    private static String fileName(String namespace, String name) {
        return namespace + "." + name + ".json";
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
            throw new LeaseException("Lease storage failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * On-disk form of a lease.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class LeaseDocument {
        private String name;
        private String holderIdentity;
        private Duration leaseDuration;
        private Instant acquireTime;
        private Instant renewTime;
        private int leaseTransitions;
        private long version;

        static LeaseDocument from(LeaseRecord lease, long version) {
            return new LeaseDocument(lease.getName(), lease.getHolderIdentity(), lease.getLeaseDuration(),
                    lease.getAcquireTime(), lease.getRenewTime(), lease.getLeaseTransitions(), version);
        }

        LeaseRecord toRecord() {
            return LeaseRecord.builder()
                    .name(name)
                    .holderIdentity(holderIdentity != null ? holderIdentity : "")
                    .leaseDuration(leaseDuration)
                    .acquireTime(acquireTime)
                    .renewTime(renewTime)
                    .leaseTransitions(leaseTransitions)
                    .version(Long.toString(version))
                    .build();
        }
    }
}
