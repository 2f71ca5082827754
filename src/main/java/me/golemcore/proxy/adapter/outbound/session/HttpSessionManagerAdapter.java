
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

package me.golemcore.proxy.adapter.outbound.session;

import feign.FeignException;
import feign.RetryableException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.exception.SessionStartException;
import me.golemcore.proxy.domain.model.SessionTemplate;
import me.golemcore.proxy.domain.model.StartSessionRequest;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.infrastructure.http.FeignClientFactory;
import me.golemcore.proxy.port.outbound.SessionManagerPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link SessionManagerPort} over HTTP: {@code POST {base-url}/start} with the
 * owner, environment, tags and params of the session, answered with the new
 * session id.
 */
@Component
@Slf4j
public class HttpSessionManagerAdapter implements SessionManagerPort {

    private final SessionManagerApi api;

    @Autowired
    public HttpSessionManagerAdapter(FeignClientFactory feignClientFactory, ProxyProperties properties) {
        this(feignClientFactory.create(SessionManagerApi.class, properties.getSessionManager().getBaseUrl()));
        log.info("[SessionManager] Using session manager at {}", properties.getSessionManager().getBaseUrl());
    }

    HttpSessionManagerAdapter(SessionManagerApi api) {
        this.api = api;
    }

    @Override
    public String startSession(StartSessionRequest request) {
        SessionManagerApi.StartResponse response;
        try {
            response = api.start(toBody(request));
        } catch (RetryableException e) {
            throw new SessionStartException("Session manager unreachable: " + e.getMessage(), e);
        } catch (FeignException e) {
            throw new SessionStartException("Session manager returned HTTP " + e.status() + ": "
                    + e.contentUTF8(), e);
        }
        if (response == null || response.getSessionId() == null || response.getSessionId().isBlank()) {
            throw new SessionStartException("Session manager returned no session id");
        }
        log.debug("[SessionManager] Started session {} for {}", response.getSessionId(), request.getOwnerId());
        return response.getSessionId();
    }

    static SessionManagerApi.StartBody toBody(StartSessionRequest request) {
        SessionTemplate.SessionParams params = request.getParams();
        return SessionManagerApi.StartBody.builder()
                .userId(request.getOwnerId())
                .environment(request.getEnvironment())
                .tags(request.getTags())
                .params(params == null ? null
                        : SessionManagerApi.Params.builder()
                                .message(params.getMessage())
                                .agentType(params.getAgentType())
                                .build())
                .build();
    }
}
