
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
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.exception.ScheduleStoreException;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleFilter;
import me.golemcore.proxy.infrastructure.config.ScheduleWorkerSettings;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule store backed by Kubernetes Secrets, one per schedule, in the
 * worker namespace.
 *
 * <p>
 * Secrets are named {@code agentapi-schedule-<id>}, labelled for listing, and
 * hold the schedule as JSON under {@value #DATA_KEY}. The Secret's
 * {@code resourceVersion} is the schedule version: updates send it back and
 * the API server rejects stale writes with 409.
 */
@Component
@ConditionalOnProperty(prefix = "proxy.storage", name = "backend", havingValue = "kubernetes")
@Slf4j
public class KubernetesScheduleStoreAdapter implements ScheduleStorePort {

    static final String SECRET_PREFIX = "agentapi-schedule-";
    static final String DATA_KEY = "schedule.json";
    static final String LABEL_SCHEDULE = "agentapi.proxy/schedule";
    static final String LABEL_SCHEDULE_ID = "agentapi.proxy/schedule-id";
    static final String LABEL_SCHEDULE_USER_ID = "agentapi.proxy/schedule-user-id";

    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_CONFLICT = 409;
    private static final int MAX_LABEL_VALUE_LENGTH = 63;

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;
    private final String namespace;

    @Autowired
    public KubernetesScheduleStoreAdapter(KubernetesClient client, ObjectMapper objectMapper,
            ScheduleWorkerSettings settings) {
        this(client, objectMapper, settings.resolveNamespace());
    }

    KubernetesScheduleStoreAdapter(KubernetesClient client, ObjectMapper objectMapper, String namespace) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        log.info("[ScheduleStore] Using Kubernetes Secrets in namespace {}", namespace);
    }

    @Override
    public Schedule create(Schedule schedule) {
        Secret secret = toSecret(schedule, null);
        try {
            Secret created = client.secrets().inNamespace(namespace).resource(secret).create();
            return fromSecret(created);
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_CONFLICT) {
                throw new ScheduleConflictException("Schedule already exists: " + schedule.getId(), e);
            }
            throw storeFailure("create schedule " + schedule.getId(), e);
        }
    }

    @Override
    public Optional<Schedule> get(String id) {
        try {
            Secret secret = client.secrets().inNamespace(namespace).withName(secretName(id)).get();
            return Optional.ofNullable(secret).map(this::fromSecret);
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                return Optional.empty();
            }
            throw storeFailure("read schedule " + id, e);
        }
    }

    @Override
    public Schedule update(Schedule schedule) {
        if (schedule.getVersion() == null) {
            throw new ScheduleConflictException("Schedule " + schedule.getId() + " has no version to update");
        }
        Secret secret = toSecret(schedule, schedule.getVersion());
        try {
            Secret updated = client.secrets().inNamespace(namespace).resource(secret).update();
            return fromSecret(updated);
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_CONFLICT) {
                throw new ScheduleConflictException("Schedule " + schedule.getId() + " was modified concurrently",
                        e);
            }
            if (e.getCode() == HTTP_NOT_FOUND) {
                throw new ScheduleNotFoundException(schedule.getId());
            }
            throw storeFailure("update schedule " + schedule.getId(), e);
        }
    }

    @Override
    public boolean delete(String id) {
        try {
            List<StatusDetails> deleted = client.secrets().inNamespace(namespace).withName(secretName(id)).delete();
            return deleted != null && !deleted.isEmpty();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                return false;
            }
            throw storeFailure("delete schedule " + id, e);
        }
    }

    @Override
    public List<Schedule> listDue(Instant now) {
        return listAll(null).stream()
                .filter(schedule -> schedule.isDue(now))
                .toList();
    }

    @Override
    public List<Schedule> list(ScheduleFilter filter) {
        String ownerLabel = filter.getOwnerId() != null ? labelValue(filter.getOwnerId()) : null;
        return listAll(ownerLabel).stream()
                .filter(filter::matches)
                .toList();
    }

    private List<Schedule> listAll(String ownerLabel) {
        Map<String, String> selector = new LinkedHashMap<>();
        selector.put(LABEL_SCHEDULE, "true");
        if (ownerLabel != null) {
            selector.put(LABEL_SCHEDULE_USER_ID, ownerLabel);
        }
        List<Secret> secrets;
        try {
            secrets = client.secrets().inNamespace(namespace).withLabels(selector).list().getItems();
        } catch (KubernetesClientException e) {
            throw storeFailure("list schedules", e);
        }
        List<Schedule> schedules = new ArrayList<>(secrets.size());
        for (Secret secret : secrets) {
            try {
                schedules.add(fromSecret(secret));
            } catch (ScheduleStoreException e) {
                log.warn("[ScheduleStore] Skipping unreadable secret {}: {}",
                        secret.getMetadata().getName(), e.getMessage());
            }
        }
        return schedules;
    }

    private Secret toSecret(Schedule schedule, String resourceVersion) {
        String json;
        try {
            json = objectMapper.writeValueAsString(schedule.toBuilder().version(null).build());
        } catch (JsonProcessingException e) {
            throw new ScheduleStoreException("Failed to serialize schedule " + schedule.getId(), e);
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_SCHEDULE, "true");
        labels.put(LABEL_SCHEDULE_ID, labelValue(schedule.getId()));
        labels.put(LABEL_SCHEDULE_USER_ID, labelValue(schedule.getOwnerId()));

        ObjectMeta metadata = new ObjectMeta();
        metadata.setName(secretName(schedule.getId()));
        metadata.setNamespace(namespace);
        metadata.setLabels(labels);
        metadata.setResourceVersion(resourceVersion);

        return new SecretBuilder()
                .withMetadata(metadata)
                .withType("Opaque")
                .addToData(DATA_KEY, Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    private Schedule fromSecret(Secret secret) {
        String encoded = secret.getData() != null ? secret.getData().get(DATA_KEY) : null;
        if (encoded == null) {
            throw new ScheduleStoreException("Secret " + secret.getMetadata().getName() + " has no " + DATA_KEY);
        }
        try {
            String json = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
            Schedule schedule = objectMapper.readValue(json, Schedule.class);
            schedule.setVersion(secret.getMetadata().getResourceVersion());
            return schedule;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ScheduleStoreException("Secret " + secret.getMetadata().getName()
                    + " does not contain a valid schedule", e);
        }
    }

    static String secretName(String id) {
        return SECRET_PREFIX + id;
    }

    /**
     * Map an arbitrary id onto a valid label value: at most 63 characters of
     * {@code [A-Za-z0-9._-]}, starting and ending alphanumeric.
     */
    static String labelValue(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.replaceAll("[^A-Za-z0-9._-]", "-");
        if (value.length() > MAX_LABEL_VALUE_LENGTH) {
            value = value.substring(0, MAX_LABEL_VALUE_LENGTH);
        }
        return value.replaceAll("^[^A-Za-z0-9]+", "").replaceAll("[^A-Za-z0-9]+$", "");
    }

    private static ScheduleStoreException storeFailure(String action, KubernetesClientException e) {
        return new ScheduleStoreException("Failed to " + action + ": " + e.getMessage(), e);
    }
}
