package com.gamelog.report.exception;

import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The log file could not be read. Ends the run with exit code 1.
 */
@Getter
public class LogReadException extends RuntimeException implements ExitCodeGenerator {

    private final Path path;

    public LogReadException(Path path, IOException cause) {
        super("Cannot read log file " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
