package common;

import theory.diagnostics.DiagnosticSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class CapturingDiagnosticSink implements DiagnosticSink {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public void emit(String message) {
        messages.add(message);
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }
}
