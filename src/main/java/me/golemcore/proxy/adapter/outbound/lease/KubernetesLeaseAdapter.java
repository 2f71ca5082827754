
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

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpec;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.domain.exception.LeaseException;
import me.golemcore.proxy.domain.model.LeaseRecord;
import me.golemcore.proxy.port.outbound.LeasePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * {@link LeasePort} on {@code coordination.k8s.io/v1} Lease objects. The
 * object's {@code resourceVersion} provides compare-and-set.
 */
@Component
@ConditionalOnProperty(prefix = "proxy.storage", name = "backend", havingValue = "kubernetes")
@RequiredArgsConstructor
public class KubernetesLeaseAdapter implements LeasePort {

    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_CONFLICT = 409;

    private final KubernetesClient client;

    @Override
    public Optional<LeaseRecord> get(String namespace, String name) {
        try {
            Lease lease = client.resources(Lease.class).inNamespace(namespace).withName(name).get();
            return Optional.ofNullable(lease).map(KubernetesLeaseAdapter::toRecord);
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                return Optional.empty();
            }
            throw new LeaseException("Failed to read lease " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public LeaseRecord create(String namespace, LeaseRecord record) {
        try {
            Lease created = client.resources(Lease.class).inNamespace(namespace)
                    .resource(toLease(namespace, record, null)).create();
            return toRecord(created);
        } catch (KubernetesClientException e) {
            throw translate("create", namespace, record.getName(), e);
        }
    }

    @Override
    public LeaseRecord update(String namespace, LeaseRecord record) {
        try {
            Lease updated = client.resources(Lease.class).inNamespace(namespace)
                    .resource(toLease(namespace, record, record.getVersion())).update();
            return toRecord(updated);
        } catch (KubernetesClientException e) {
            throw translate("update", namespace, record.getName(), e);
        }
    }

    private static LeaseException translate(String action, String namespace, String name,
            KubernetesClientException e) {
        if (e.getCode() == HTTP_CONFLICT) {
            return new LeaseException("Lease " + namespace + "/" + name + " changed concurrently", e, true);
        }
        return new LeaseException("Failed to " + action + " lease " + namespace + "/" + name + ": "
                + e.getMessage(), e);
    }

    static Lease toLease(String namespace, LeaseRecord record, String resourceVersion) {
        ObjectMeta metadata = new ObjectMeta();
        metadata.setName(record.getName());
        metadata.setNamespace(namespace);
        metadata.setResourceVersion(resourceVersion);

        return new LeaseBuilder()
                .withMetadata(metadata)
                .withNewSpec()
                .withHolderIdentity(record.getHolderIdentity())
                .withLeaseDurationSeconds(toSeconds(record.getLeaseDuration()))
                .withAcquireTime(toZoned(record.getAcquireTime()))
                .withRenewTime(toZoned(record.getRenewTime()))
                .withLeaseTransitions(record.getLeaseTransitions())
                .endSpec()
                .build();
    }

    static LeaseRecord toRecord(Lease lease) {
        LeaseSpec spec = lease.getSpec() != null ? lease.getSpec() : new LeaseSpec();
        return LeaseRecord.builder()
                .name(lease.getMetadata().getName())
                .holderIdentity(spec.getHolderIdentity() != null ? spec.getHolderIdentity() : "")
                .leaseDuration(spec.getLeaseDurationSeconds() != null
                        ? Duration.ofSeconds(spec.getLeaseDurationSeconds())
                        : null)
                .acquireTime(toInstant(spec.getAcquireTime()))
                .renewTime(toInstant(spec.getRenewTime()))
                .leaseTransitions(spec.getLeaseTransitions() != null ? spec.getLeaseTransitions() : 0)
                .version(lease.getMetadata().getResourceVersion())
                .build();
    }

    private static Integer toSeconds(Duration duration) {
        if (duration == null) {
            return null;
        }
        long seconds = duration.getSeconds() + (duration.getNano() > 0 ? 1 : 0);
        return (int) Math.max(1, seconds);
    }

    private static ZonedDateTime toZoned(Instant instant) {
        return instant != null ? ZonedDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(ZonedDateTime time) {
        return time != null ? time.toInstant() : null;
    }
}
