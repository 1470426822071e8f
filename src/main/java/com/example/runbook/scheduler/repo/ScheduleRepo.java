package com.example.runbook.scheduler.repo;

import com.example.runbook.scheduler.domain.RunbookSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public interface ScheduleRepo extends JpaRepository<RunbookSchedule, Long> {
    List<RunbookSchedule> findByActiveTrue();

    List<RunbookSchedule> findByRunbookIdOrderByCreatedAtDesc(String runbookId);

    /**
     * 记录一次触发：只有 schedule 仍为 active 时才更新成功（返回 1）。
     * 返回 0 表示已被暂停或删除，调用方应放弃本次触发。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RunbookSchedule s set s.lastRunAt = ?2, s.nextRunAt = ?3, s.updatedAt = ?2 " +
            "where s.id = ?1 and s.active = true")
    int advanceTimestamps(Long id, Timestamp lastRunAt, Timestamp nextRunAt);
}
