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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request handed to the session manager to start one session.
 */
@Value
@Builder
public class StartSessionRequest {
    String ownerId;
    Map<String, String> environment;
    Map<String, String> tags;
    SessionTemplate.SessionParams params;

    public static final String TAG_SCHEDULE_ID = "schedule_id";
    public static final String TAG_SCHEDULE_NAME = "schedule_name";

    /**
     * Build the request for one firing of {@code schedule}. The template is
     * forwarded as-is, with the schedule's id and name added as tags.
     */
    public static StartSessionRequest forSchedule(Schedule schedule) {
        SessionTemplate template = schedule.getSessionTemplate() != null
                ? schedule.getSessionTemplate()
                : new SessionTemplate();
        Map<String, String> environment = new LinkedHashMap<>();
        if (template.getEnvironment() != null) {
            environment.putAll(template.getEnvironment());
        }
        Map<String, String> tags = new LinkedHashMap<>();
        if (template.getTags() != null) {
            tags.putAll(template.getTags());
        }
        tags.put(TAG_SCHEDULE_ID, schedule.getId());
        if (schedule.getName() != null) {
            tags.put(TAG_SCHEDULE_NAME, schedule.getName());
        }
        return StartSessionRequest.builder()
                .ownerId(schedule.getOwnerId())
                .environment(environment)
                .tags(tags)
                .params(template.getParams())
                .build();
    }
}
