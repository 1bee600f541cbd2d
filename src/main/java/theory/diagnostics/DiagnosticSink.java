package theory.diagnostics;

/**
 * Process-wide, append-only channel for discovery diagnostics. Implementations must accept
 * concurrent calls.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void emit(String message);
}
