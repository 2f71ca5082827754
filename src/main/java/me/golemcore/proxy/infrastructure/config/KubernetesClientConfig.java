package me.golemcore.proxy.infrastructure.config;


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

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes client used by the Secret-backed schedule store and the Lease
 * adapter. Connection details come from the in-cluster service account or
 * kubeconfig; {@code proxy.kubernetes.master-url} overrides the API server.
 * Every request is bounded by {@code proxy.schedule-worker.call-timeout}.
 */
@Configuration
@ConditionalOnProperty(prefix = "proxy.storage", name = "backend", havingValue = "kubernetes")
@Slf4j
public class KubernetesClientConfig {

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(ProxyProperties properties, ScheduleWorkerSettings settings) {
        ConfigBuilder builder = new ConfigBuilder(Config.autoConfigure(null));
        String masterUrl = properties.getKubernetes().getMasterUrl();
        if (masterUrl != null && !masterUrl.isBlank()) {
            builder.withMasterUrl(masterUrl);
        }
        int timeoutMillis = (int) settings.workerConfig().getTriggerTimeout().toMillis();
        Config config = builder
                .withNamespace(settings.resolveNamespace())
                .withRequestTimeout(timeoutMillis)
                .withConnectionTimeout(timeoutMillis)
                .build();
        log.info("[Kubernetes] Connecting to {} (namespace {})", config.getMasterUrl(), config.getNamespace());
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}
