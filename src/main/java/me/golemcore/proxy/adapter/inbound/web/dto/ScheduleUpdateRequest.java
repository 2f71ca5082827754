package me.golemcore.proxy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.proxy.domain.model.SessionTemplate;

import java.time.Instant;

/**
 * Body of {@code PUT /api/schedules/{id}}. Omitted fields stay unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleUpdateRequest {
    private String name;
    private String cronExpression;
    private String timezone;
    private Instant scheduledAt;
    private SessionTemplate sessionTemplate;
}
