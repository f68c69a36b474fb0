package com.colorcorrection.service.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the Spring context, then exits the JVM with the context's exit code.
 */
@Component
@Slf4j
public class SpringProcessTerminator implements ProcessTerminator {

    private final ApplicationContext context;

    public SpringProcessTerminator(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public void terminate(int exitCode) {
        log.info("Exiting with code {}", exitCode);
        int code = SpringApplication.exit(context, () -> exitCode);
        System.exit(code);
    }
}
