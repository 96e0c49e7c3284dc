package com.gamelog.report;

import com.gamelog.report.exception.UsageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.ExitCodeEvent;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exit codes seen by {@code main} for each way a run can end.
 */
class SpringBootReportExitCodeTests {

    private static final String FIXTURE = "src/test/resources/logs/games.log";

    @Test
    void successfulRunExitsWithZero() {
        ConfigurableApplicationContext context = SpringApplication.run(SpringBootReportApplication.class, FIXTURE);

        assertThat(SpringApplication.exit(context)).isZero();
    }

    @Test
    void missingArgumentExitsWithTwo() {
        ExitCodeRecorder recorder = new ExitCodeRecorder();
        SpringApplication application = new SpringApplication(SpringBootReportApplication.class);
        application.addListeners(recorder);

        assertThatThrownBy(() -> application.run()).hasRootCauseInstanceOf(UsageException.class);
        assertThat(recorder.exitCode).isEqualTo(2);
    }

    @Test
    void unreadableFileExitsWithOne(@TempDir Path dir) {
        ExitCodeRecorder recorder = new ExitCodeRecorder();
        SpringApplication application = new SpringApplication(SpringBootReportApplication.class);
        application.addListeners(recorder);
        String missing = dir.resolve("missing.log").toString();

        assertThatThrownBy(() -> application.run(missing)).hasStackTraceContaining("Cannot read log file");
        assertThat(recorder.exitCode).isEqualTo(1);
    }

    static class ExitCodeRecorder implements ApplicationListener<ExitCodeEvent> {

        private int exitCode;

        @Override
        public void onApplicationEvent(ExitCodeEvent event) {
            exitCode = event.getExitCode();
        }
    }
}
