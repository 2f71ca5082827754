package me.golemcore.proxy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.proxy.domain.model.SessionTemplate;

import java.time.Instant;

/**
 * Body of {@code POST /api/schedules}. Set {@code cronExpression} for a
 * recurring schedule, {@code scheduledAt} alone for a one-time one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    private String name;
    private String cronExpression;
    private String timezone;
    private Instant scheduledAt;
    private SessionTemplate sessionTemplate;
}
