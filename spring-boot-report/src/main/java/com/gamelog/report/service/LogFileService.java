package com.gamelog.report.service;

import com.gamelog.core.model.ParseResult;
import com.gamelog.core.parser.LogParser;
import com.gamelog.report.exception.LogReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Reads a log file from disk and hands its lines to the parser.
 */
@Service
@Slf4j
public class LogFileService {

    private final LogParser logParser;
    private final Charset charset;

    public LogFileService(
            LogParser logParser,
            @Value("${gamelog.input.charset:UTF-8}") Charset charset) {
        this.logParser = logParser;
        this.charset = charset;
    }

    public ParseResult parse(Path path) {
        log.debug("Reading {} as {}", path, charset);
        try {
            return logParser.parse(path, charset);
        } catch (IOException e) {
            log.error("Failed to read log file: path={}, error={}", path, e.toString());
            throw new LogReadException(path, e);
        }
    }
}
