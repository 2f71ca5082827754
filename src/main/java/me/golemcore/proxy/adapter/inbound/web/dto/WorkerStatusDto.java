package me.golemcore.proxy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Leader election state of the replica that served the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatusDto {
    private boolean enabled;
    private String identity;
    private boolean leader;
    private String currentLeader;
    private Instant leaderSince;
    private Instant lastRenewTime;
}
