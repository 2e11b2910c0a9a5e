package dev.jobharvest.ats;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Matches candidate URLs against the registered deterministic parsers.
 */
@Slf4j
@Component
public class AtsParserRegistry {

    private final List<AtsParser> parsers;

    public AtsParserRegistry(List<AtsParser> parsers) {
        this.parsers = List.copyOf(parsers);
        log.info("Registered ATS parsers: {}", parsers.stream().map(AtsParser::getName).toList());
    }

    /**
     * First parser whose URL shape matches, if any.
     */
    public Optional<AtsParser> find(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return parsers.stream()
                .filter(parser -> parser.canHandle(url))
                .findFirst();
    }

    public List<AtsParser> getParsers() {
        return parsers;
    }
}
