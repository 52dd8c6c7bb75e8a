package com.osint.leadtrace.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

@Configuration
@EnableAsync
public class AsyncConfig {
    // Investigation runs started over HTTP execute on the async task executor;
    // the scheduler itself stays single-threaded inside that task
}
