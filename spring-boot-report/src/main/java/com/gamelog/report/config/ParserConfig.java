package com.gamelog.report.config;

import com.gamelog.core.parser.ActionDecoder;
import com.gamelog.core.parser.KillDecoder;
import com.gamelog.core.parser.LineTokenizer;
import com.gamelog.core.parser.LogParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// The parser pieces are stateless; each parse builds its own GameSegmenter
@Configuration
public class ParserConfig {

    @Bean
    public LineTokenizer lineTokenizer() {
        return new LineTokenizer();
    }

    @Bean
    public ActionDecoder actionDecoder() {
        return new ActionDecoder(new KillDecoder());
    }

    @Bean
    public LogParser logParser(LineTokenizer lineTokenizer, ActionDecoder actionDecoder) {
        return new LogParser(lineTokenizer, actionDecoder);
    }
}
