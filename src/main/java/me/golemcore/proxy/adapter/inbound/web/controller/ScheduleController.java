package me.golemcore.proxy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.adapter.inbound.web.dto.ScheduleDto;
import me.golemcore.proxy.adapter.inbound.web.dto.ScheduleListResponse;
import me.golemcore.proxy.adapter.inbound.web.dto.ScheduleRequest;
import me.golemcore.proxy.adapter.inbound.web.dto.ScheduleUpdateRequest;
import me.golemcore.proxy.adapter.inbound.web.dto.TriggerResponse;
import me.golemcore.proxy.adapter.inbound.web.dto.WorkerStatusDto;
import me.golemcore.proxy.auto.ScheduleLeaderWorker;
import me.golemcore.proxy.domain.model.ExecutionRecord;
import me.golemcore.proxy.domain.model.LeaderStatus;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleStatus;
import me.golemcore.proxy.domain.model.ScheduleUpdate;
import me.golemcore.proxy.domain.service.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

/**
 * Schedule administration endpoints. Every operation is scoped to the caller:
 * the {@code X-Owner-Id} header, else the authenticated principal, else
 * {@code anonymous}.
 */
@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    static final String OWNER_HEADER = "X-Owner-Id";
    static final String ANONYMOUS = "anonymous";

    private final ScheduleService scheduleService;
    private final ScheduleLeaderWorker scheduleLeaderWorker;

    @PostMapping
    public Mono<ResponseEntity<ScheduleDto>> createSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @RequestBody ScheduleRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Schedule draft = Schedule.builder()
                .name(request.getName())
                .cronExpression(request.getCronExpression())
                .timezone(request.getTimezone())
                .scheduledAt(request.getScheduledAt())
                .sessionTemplate(request.getSessionTemplate())
                .build();
        Schedule created = scheduleService.createSchedule(resolveOwner(ownerHeader, principal), draft);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(created)));
    }

    @GetMapping
    public Mono<ResponseEntity<ScheduleListResponse>> listSchedules(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @RequestParam(value = "status", required = false) String status) {
        ScheduleStatus statusFilter = ScheduleStatus.fromValue(status);
        List<ScheduleDto> schedules = scheduleService
                .listSchedules(resolveOwner(ownerHeader, principal), statusFilter).stream()
                .map(ScheduleController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(new ScheduleListResponse(schedules)));
    }

    @GetMapping("/worker")
    public Mono<ResponseEntity<WorkerStatusDto>> getWorkerStatus() {
        LeaderStatus status = scheduleLeaderWorker.getStatus();
        WorkerStatusDto dto = WorkerStatusDto.builder()
                .enabled(status.isWorkerEnabled())
                .identity(status.getIdentity())
                .leader(status.isLeader())
                .currentLeader(status.isLeader() ? status.getIdentity() : status.getObservedLeader())
                .leaderSince(status.getLeaderSince())
                .lastRenewTime(status.getLastRenewTime())
                .build();
        return Mono.just(ResponseEntity.ok(dto));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ScheduleDto>> getSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        Schedule schedule = scheduleService.getSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.ok(toDto(schedule)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<ScheduleDto>> updateSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id,
            @RequestBody ScheduleUpdateRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        ScheduleUpdate update = ScheduleUpdate.builder()
                .name(request.getName())
                .cronExpression(request.getCronExpression())
                .timezone(request.getTimezone())
                .scheduledAt(request.getScheduledAt())
                .sessionTemplate(request.getSessionTemplate())
                .build();
        Schedule updated = scheduleService.updateSchedule(resolveOwner(ownerHeader, principal), id, update);
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        scheduleService.deleteSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/pause")
    public Mono<ResponseEntity<ScheduleDto>> pauseSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        Schedule schedule = scheduleService.pauseSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.ok(toDto(schedule)));
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<ScheduleDto>> resumeSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        Schedule schedule = scheduleService.resumeSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.ok(toDto(schedule)));
    }

    @PostMapping("/{id}/reset")
    public Mono<ResponseEntity<ScheduleDto>> resetSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        Schedule schedule = scheduleService.resetSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.ok(toDto(schedule)));
    }

    @PostMapping("/{id}/trigger")
    public Mono<ResponseEntity<TriggerResponse>> triggerSchedule(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader,
            Principal principal,
            @PathVariable String id) {
        ExecutionRecord record = scheduleService.triggerSchedule(resolveOwner(ownerHeader, principal), id);
        return Mono.just(ResponseEntity.ok(new TriggerResponse(record.getSessionId(), record.getExecutedAt())));
    }

    static String resolveOwner(String ownerHeader, Principal principal) {
        if (ownerHeader != null && !ownerHeader.isBlank()) {
            return ownerHeader.trim();
        }
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        return ANONYMOUS;
    }

    private static ScheduleDto toDto(Schedule schedule) {
        return ScheduleDto.builder()
                .id(schedule.getId())
                .name(schedule.getName())
                .ownerId(schedule.getOwnerId())
                .status(schedule.getStatus() != null ? schedule.getStatus().value() : null)
                .cronExpression(schedule.getCronExpression())
                .timezone(schedule.getTimezone())
                .scheduledAt(schedule.getScheduledAt())
                .sessionTemplate(schedule.getSessionTemplate())
                .nextExecutionAt(schedule.getNextExecutionAt())
                .lastExecutionAt(schedule.getLastExecutionAt())
                .lastExecution(schedule.getLastExecution())
                .consecutiveFailureCount(schedule.getConsecutiveFailureCount())
                .executionCount(schedule.getExecutionCount())
                .createdAt(schedule.getCreatedAt())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }
}
