package io.github.yok.csvseeder.util;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link SeedReporter} that writes through SLF4J, prefixing every message with
 * {@code CsvSeeder: }.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Slf4jSeedReporter implements SeedReporter {

    static final String PREFIX = "CsvSeeder: ";

    @Override
    public void emit(String message, Level level) {
        switch (level) {
            case ERROR:
                log.error(PREFIX + "{}", message);
                break;
            case WARN:
                log.warn(PREFIX + "{}", message);
                break;
            default:
                log.info(PREFIX + "{}", message);
                break;
        }
    }
}
