package com.gamelog.core.parser;

import com.gamelog.core.model.GameEvent;
import com.gamelog.core.model.ParseResult;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads a whole log into games: tokenize, decode, segment.
 * <p>
 * Holds no state between calls; each {@code parse} runs its own
 * {@link GameSegmenter}. Lines that do not decode are skipped silently.
 */
@Slf4j
public class LogParser {

    private final LineTokenizer tokenizer;
    private final ActionDecoder decoder;

    public LogParser() {
        this(new LineTokenizer(), new ActionDecoder());
    }

    public LogParser(LineTokenizer tokenizer, ActionDecoder decoder) {
        this.tokenizer = tokenizer;
        this.decoder = decoder;
    }

    public Optional<GameEvent> parseLine(String line) {
        return tokenizer.tokenize(line)
                .flatMap(tokens -> decoder.decode(tokens.content())
                        .map(action -> new GameEvent(tokens.timestamp(), action)));
    }

    public ParseResult parse(Iterable<String> lines) {
        GameSegmenter segmenter = new GameSegmenter();
        long linesRead = 0;
        long eventsDecoded = 0;
        for (String line : lines) {
            linesRead++;
            Optional<GameEvent> event = parseLine(line);
            if (event.isPresent()) {
                eventsDecoded++;
                segmenter.accept(event.get());
            } else if (log.isTraceEnabled()) {
                log.trace("Skipped line {}: {}", linesRead, line);
            }
        }
        segmenter.finish();

        if (segmenter.getDroppedEvents() > 0) {
            log.debug("{} events arrived outside any game", segmenter.getDroppedEvents());
        }
        return new ParseResult(segmenter.getGames(),
                segmenter.getOverallKillsByMeans(), segmenter.getOverallKillers(), linesRead, eventsDecoded);
    }

    /**
     * Parses the file at {@code path}. I/O failures are not handled here.
     */
    public ParseResult parse(Path path, Charset charset) throws IOException {
        log.info("Parsing {}", path.toAbsolutePath());
        try (BufferedReader reader = Files.newBufferedReader(path, charset)) {
            ParseResult result = parse(reader.lines()::iterator);
            log.info("Parsed {} games from {} lines ({} skipped)",
                    result.games().size(), result.linesRead(), result.linesSkipped());
            return result;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
