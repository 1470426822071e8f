package com.example.runbook.scheduler.service;

import com.example.runbook.scheduler.config.SchedulerProperties;
import com.example.runbook.scheduler.domain.RunbookEnvironment;
import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.example.runbook.scheduler.exception.InvalidScheduleException;
import com.example.runbook.scheduler.exception.ScheduleNotFoundException;
import com.example.runbook.scheduler.repo.ScheduleRepo;
import com.example.runbook.scheduler.support.MutableClock;
import com.example.runbook.scheduler.timing.CronMatcher;
import com.example.runbook.scheduler.timing.NextRunCalculator;
import com.example.runbook.scheduler.web.dto.CreateScheduleRequest;
import com.example.runbook.scheduler.web.dto.UpdateScheduleRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T10:17:00Z");

    @Mock private ScheduleRepo scheduleRepo;

    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper();
    private ScheduleService service;

    @BeforeEach
    void setUp() {
        CronMatcher matcher = new CronMatcher();
        service = new ScheduleService(scheduleRepo, new NextRunCalculator(matcher, new SchedulerProperties()), matcher, mapper, clock);
    }

    private void echoSaves() {
        when(scheduleRepo.save(any(RunbookSchedule.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static CreateScheduleRequest request(ScheduleFrequency frequency, String cron) {
        CreateScheduleRequest r = new CreateScheduleRequest();
        r.setName("nightly cleanup");
        r.setFrequency(frequency);
        r.setCronExpression(cron);
        return r;
    }

    private static RunbookSchedule stored(long id, ScheduleFrequency frequency) {
        RunbookSchedule s = new RunbookSchedule();
        s.setId(id);
        s.setRunbookId("rb-1");
        s.setName("existing");
        s.setFrequency(frequency);
        s.setCreatedBy("user_alice");
        s.setActive(true);
        s.setLastRunAt(Timestamp.from(NOW.minus(Duration.ofHours(2))));
        s.setNextRunAt(Timestamp.from(NOW.minus(Duration.ofHours(1))));
        return s;
    }

    @Test
    void createHourlyPlansFirstRunOneHourOut() {
        echoSaves();

        RunbookSchedule s = service.create("rb-1", request(ScheduleFrequency.HOURLY, null), "user_alice");

        assertThat(s.isActive()).isTrue();
        assertThat(s.getNextRunAt().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(s.getLastRunAt()).isNull();
        assertThat(s.getTimezone()).isEqualTo("UTC");
        assertThat(s.getEnvironment()).isEqualTo(RunbookEnvironment.DEVELOPMENT);
        assertThat(s.getCreatedBy()).isEqualTo("user_alice");
    }

    @Test
    void createCronProbesForFirstRun() {
        echoSaves();

        RunbookSchedule s = service.create("rb-1", request(ScheduleFrequency.CRON, " */15 * * * * "), null);

        assertThat(s.getCronExpression()).isEqualTo("*/15 * * * *");
        assertThat(s.getNextRunAt().toInstant()).isEqualTo(Instant.parse("2026-03-10T10:30:00Z"));
        assertThat(s.getCreatedBy()).isEqualTo("scheduler");
    }

    @Test
    void createDropsCronForFixedFrequency() {
        echoSaves();

        RunbookSchedule s = service.create("rb-1", request(ScheduleFrequency.DAILY, "0 9 * * *"), "user_alice");

        assertThat(s.getCronExpression()).isNull();
    }

    @Test
    void createKeepsInputParamsAsJson() throws Exception {
        echoSaves();
        CreateScheduleRequest r = request(ScheduleFrequency.DAILY, null);
        r.setInputParams(mapper.readTree("{\"dryRun\":true}"));
        r.setEnvironment(RunbookEnvironment.PRODUCTION);

        RunbookSchedule s = service.create("rb-1", r, "user_alice");

        assertThat(s.getInputParams()).isEqualTo("{\"dryRun\":true}");
        assertThat(s.getEnvironment()).isEqualTo(RunbookEnvironment.PRODUCTION);
    }

    @Test
    void createRejectsInvalidRequests() throws Exception {
        assertThatThrownBy(() -> service.create("rb-1", request(ScheduleFrequency.CRON, null), "u"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("Cron expression required");
        assertThatThrownBy(() -> service.create("rb-1", request(ScheduleFrequency.CRON, "0 9 * *"), "u"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("5 fields");
        assertThatThrownBy(() -> service.create("rb-1", request(null, null), "u"))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> service.create(" ", request(ScheduleFrequency.HOURLY, null), "u"))
                .isInstanceOf(InvalidScheduleException.class);

        CreateScheduleRequest arrayParams = request(ScheduleFrequency.HOURLY, null);
        arrayParams.setInputParams(mapper.readTree("[1,2]"));
        assertThatThrownBy(() -> service.create("rb-1", arrayParams, "u"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("JSON object");

        verify(scheduleRepo, never()).save(any());
    }

    @Test
    void pauseOnlyFlipsActive() {
        RunbookSchedule s = stored(3L, ScheduleFrequency.HOURLY);
        Timestamp last = s.getLastRunAt();
        Timestamp next = s.getNextRunAt();
        when(scheduleRepo.findById(3L)).thenReturn(Optional.of(s));
        echoSaves();

        RunbookSchedule paused = service.pause(3L);

        assertThat(paused.isActive()).isFalse();
        assertThat(paused.getLastRunAt()).isEqualTo(last);
        assertThat(paused.getNextRunAt()).isEqualTo(next);
    }

    @Test
    void resumeRecomputesNextRunFromNow() {
        RunbookSchedule s = stored(3L, ScheduleFrequency.DAILY);
        s.setActive(false);
        when(scheduleRepo.findById(3L)).thenReturn(Optional.of(s));
        echoSaves();

        RunbookSchedule resumed = service.resume(3L);

        assertThat(resumed.isActive()).isTrue();
        assertThat(resumed.getNextRunAt().toInstant()).isAfter(NOW);
        assertThat(resumed.getNextRunAt().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void resumeCronProbesAgain() {
        RunbookSchedule s = stored(3L, ScheduleFrequency.CRON);
        s.setCronExpression("0 9 * * 1-5");
        s.setActive(false);
        when(scheduleRepo.findById(3L)).thenReturn(Optional.of(s));
        echoSaves();

        RunbookSchedule resumed = service.resume(3L);

        assertThat(resumed.getNextRunAt().toInstant()).isEqualTo(Instant.parse("2026-03-11T09:00:00Z"));
    }

    @Test
    void updatePatchesOnlyGivenFields() {
        RunbookSchedule s = stored(4L, ScheduleFrequency.HOURLY);
        Timestamp next = s.getNextRunAt();
        when(scheduleRepo.findById(4L)).thenReturn(Optional.of(s));
        echoSaves();
        UpdateScheduleRequest patch = new UpdateScheduleRequest();
        patch.setName("renamed");
        patch.setEndsAt(Instant.parse("2026-12-31T00:00:00Z"));

        RunbookSchedule updated = service.update(4L, patch);

        assertThat(updated.getName()).isEqualTo("renamed");
        assertThat(updated.getFrequency()).isEqualTo(ScheduleFrequency.HOURLY);
        assertThat(updated.getEndsAt().toInstant()).isEqualTo(Instant.parse("2026-12-31T00:00:00Z"));
        assertThat(updated.getNextRunAt()).isEqualTo(next);
    }

    @Test
    void updateReactivatingPlansFromNow() {
        RunbookSchedule s = stored(4L, ScheduleFrequency.HOURLY);
        s.setActive(false);
        when(scheduleRepo.findById(4L)).thenReturn(Optional.of(s));
        echoSaves();
        UpdateScheduleRequest patch = new UpdateScheduleRequest();
        patch.setActive(Boolean.TRUE);

        RunbookSchedule updated = service.update(4L, patch);

        assertThat(updated.isActive()).isTrue();
        assertThat(updated.getNextRunAt().toInstant()).isAfter(NOW);
        assertThat(updated.getNextRunAt().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void updateDeactivatingKeepsNextRun() {
        RunbookSchedule s = stored(4L, ScheduleFrequency.HOURLY);
        Timestamp next = s.getNextRunAt();
        when(scheduleRepo.findById(4L)).thenReturn(Optional.of(s));
        echoSaves();
        UpdateScheduleRequest patch = new UpdateScheduleRequest();
        patch.setActive(Boolean.FALSE);

        RunbookSchedule updated = service.update(4L, patch);

        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getNextRunAt()).isEqualTo(next);
    }

    @Test
    void updateToCronRequiresExpressionAndReschedules() {
        RunbookSchedule s = stored(4L, ScheduleFrequency.HOURLY);
        when(scheduleRepo.findById(4L)).thenReturn(Optional.of(s));

        UpdateScheduleRequest noCron = new UpdateScheduleRequest();
        noCron.setFrequency(ScheduleFrequency.CRON);
        assertThatThrownBy(() -> service.update(4L, noCron)).isInstanceOf(InvalidScheduleException.class);

        s.setFrequency(ScheduleFrequency.HOURLY);
        echoSaves();
        UpdateScheduleRequest withCron = new UpdateScheduleRequest();
        withCron.setFrequency(ScheduleFrequency.CRON);
        withCron.setCronExpression("30 * * * *");

        RunbookSchedule updated = service.update(4L, withCron);

        assertThat(updated.getCronExpression()).isEqualTo("30 * * * *");
        assertThat(updated.getNextRunAt().toInstant()).isEqualTo(Instant.parse("2026-03-10T10:30:00Z"));
    }

    @Test
    void updateAwayFromCronClearsExpression() {
        RunbookSchedule s = stored(4L, ScheduleFrequency.CRON);
        s.setCronExpression("0 9 * * *");
        when(scheduleRepo.findById(4L)).thenReturn(Optional.of(s));
        echoSaves();
        UpdateScheduleRequest patch = new UpdateScheduleRequest();
        patch.setFrequency(ScheduleFrequency.WEEKLY);

        RunbookSchedule updated = service.update(4L, patch);

        assertThat(updated.getCronExpression()).isNull();
        assertThat(updated.getNextRunAt().toInstant()).isEqualTo(NOW.plus(Duration.ofDays(7)));
    }

    @Test
    void unknownScheduleIsNotFound() {
        when(scheduleRepo.findById(404L)).thenReturn(Optional.empty());
        when(scheduleRepo.existsById(404L)).thenReturn(false);

        assertThatThrownBy(() -> service.pause(404L)).isInstanceOf(ScheduleNotFoundException.class);
        assertThatThrownBy(() -> service.delete(404L)).isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    void deleteIsHard() {
        when(scheduleRepo.existsById(9L)).thenReturn(true);

        service.delete(9L);

        verify(scheduleRepo).deleteById(9L);
    }
}
