package com.example.runbook.scheduler.web;

import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.example.runbook.scheduler.service.ScheduleService;
import com.example.runbook.scheduler.web.dto.ApiResponse;
import com.example.runbook.scheduler.web.dto.CreateScheduleRequest;
import com.example.runbook.scheduler.web.dto.ScheduleResponse;
import com.example.runbook.scheduler.web.dto.UpdateScheduleRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/runbooks")
@RequiredArgsConstructor
public class ScheduleController {
    static final String USER_HEADER = "X-User-Id";

    private final ScheduleService scheduleService;
    private final ObjectMapper mapper;

    @GetMapping("/{runbookId}/schedules")
    public ApiResponse<List<ScheduleResponse>> list(@PathVariable String runbookId) {
        List<ScheduleResponse> data = scheduleService.listForRunbook(runbookId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ApiResponse.ok(data);
    }

    @PostMapping("/{runbookId}/schedules")
    public ResponseEntity<ApiResponse<ScheduleResponse>> create(@PathVariable String runbookId,
                                                                @RequestBody @Validated CreateScheduleRequest req,
                                                                @RequestHeader(value = USER_HEADER, required = false) String userId) {
        RunbookSchedule s = scheduleService.create(runbookId, req, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(toResponse(s), "Schedule created successfully"));
    }

    @GetMapping("/schedules/{id}")
    public ApiResponse<ScheduleResponse> get(@PathVariable Long id) {
        return ApiResponse.ok(toResponse(scheduleService.get(id)));
    }

    @PutMapping("/schedules/{id}")
    public ApiResponse<ScheduleResponse> update(@PathVariable Long id, @RequestBody @Validated UpdateScheduleRequest req) {
        return ApiResponse.ok(toResponse(scheduleService.update(id, req)), "Schedule updated successfully");
    }

    @DeleteMapping("/schedules/{id}")
    public ApiResponse<Void> delete(@PathVariable Long id) {
        scheduleService.delete(id);
        return ApiResponse.ok(null, "Schedule deleted successfully");
    }

    @PostMapping("/schedules/{id}/pause")
    public ApiResponse<ScheduleResponse> pause(@PathVariable Long id) {
        return ApiResponse.ok(toResponse(scheduleService.pause(id)), "Schedule paused successfully");
    }

    @PostMapping("/schedules/{id}/resume")
    public ApiResponse<ScheduleResponse> resume(@PathVariable Long id) {
        return ApiResponse.ok(toResponse(scheduleService.resume(id)), "Schedule resumed successfully");
    }

    @GetMapping("/frequencies")
    public ApiResponse<Map<String, List<ScheduleFrequency>>> frequencies() {
        return ApiResponse.ok(Collections.singletonMap("frequencies", Arrays.asList(ScheduleFrequency.values())));
    }

    private ScheduleResponse toResponse(RunbookSchedule s) {
        return ScheduleResponse.of(s, mapper);
    }
}
