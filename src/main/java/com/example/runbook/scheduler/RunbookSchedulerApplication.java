package com.example.runbook.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RunbookSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunbookSchedulerApplication.class, args);
    }
}
