package theory.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics to the {@code theory.diagnostics} logger at WARN.
 */
public class Slf4jDiagnosticSink implements DiagnosticSink {

    static final String LOGGER_NAME = "theory.diagnostics";

    private final Logger logger;

    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(String message) {
        logger.warn("{}", message);
    }
}
