package com.osint.leadtrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeadTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadTraceApplication.class, args);
    }
}
