package me.golemcore.proxy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.proxy.domain.model.ExecutionRecord;
import me.golemcore.proxy.domain.model.SessionTemplate;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDto {
    private String id;
    private String name;
    private String ownerId;
    private String status;
    private String cronExpression;
    private String timezone;
    private Instant scheduledAt;
    private SessionTemplate sessionTemplate;
    private Instant nextExecutionAt;
    private Instant lastExecutionAt;
    private ExecutionRecord lastExecution;
    private int consecutiveFailureCount;
    private int executionCount;
    private Instant createdAt;
    private Instant updatedAt;
}
