package work.lcod.lexicon.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.lexicon.api.LogLevel;

final class LogLevels {
    private LogLevels() {}

    static void apply(LogLevel level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.WARN));
        }
    }
}
