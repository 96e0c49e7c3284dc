package com.gamelog.report.runner;

import com.gamelog.core.model.ParseResult;
import com.gamelog.report.exception.UsageException;
import com.gamelog.report.service.LogFileService;
import com.gamelog.report.service.ReportService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point:
 * 1. Takes the log path from the single positional argument
 * 2. Parses the whole file
 * 3. Prints the report to stdout
 * <p>
 * Failures propagate so Spring Boot exits with the exception's exit code.
 */
@Component
@Slf4j
public class ReportRunner implements ApplicationRunner {

    private final LogFileService logFileService;
    private final ReportService reportService;

    private final Counter linesRead;
    private final Counter linesSkipped;
    private final Counter gamesParsed;
    private final Counter gamesIncomplete;

    public ReportRunner(
            LogFileService logFileService,
            ReportService reportService,
            MeterRegistry meterRegistry) {
        this.logFileService = logFileService;
        this.reportService = reportService;

        this.linesRead = Counter.builder("gamelog.lines.read")
                .description("Lines read from the log file")
                .register(meterRegistry);
        this.linesSkipped = Counter.builder("gamelog.lines.skipped")
                .description("Lines that did not decode to an event")
                .register(meterRegistry);
        this.gamesParsed = Counter.builder("gamelog.games.parsed")
                .description("Games reconstructed from the log")
                .register(meterRegistry);
        this.gamesIncomplete = Counter.builder("gamelog.games.incomplete")
                .description("Games that ended without a shutdown line")
                .register(meterRegistry);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            throw new UsageException("Missing log file argument");
        }
        if (files.size() > 1) {
            throw new UsageException("Expected one log file, got " + files.size());
        }

        Path path = Path.of(files.get(0));
        ParseResult result = logFileService.parse(path);

        linesRead.increment(result.linesRead());
        linesSkipped.increment(result.linesSkipped());
        gamesParsed.increment(result.games().size());
        gamesIncomplete.increment(result.incompleteGames());

        System.out.print(reportService.render(result));
        System.out.flush();

        log.info("Report done: {} games ({} incomplete), {} lines read, {} skipped",
                (long) gamesParsed.count(), (long) gamesIncomplete.count(),
                (long) linesRead.count(), (long) linesSkipped.count());
    }
}
