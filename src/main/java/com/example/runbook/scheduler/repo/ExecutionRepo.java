package com.example.runbook.scheduler.repo;

import com.example.runbook.scheduler.domain.RunbookExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExecutionRepo extends JpaRepository<RunbookExecution, Long> {
}
