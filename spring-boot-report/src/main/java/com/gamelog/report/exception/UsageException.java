package com.gamelog.report.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Bad command line. Ends the run with exit code 2.
 */
public class UsageException extends RuntimeException implements ExitCodeGenerator {

    public static final String USAGE = "Usage: java -jar spring-boot-report.jar <log-file>";

    public UsageException(String message) {
        super(message + System.lineSeparator() + USAGE);
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
