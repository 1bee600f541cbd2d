package theory.model;

import java.util.Objects;

/**
 * Settings that shape discovery of every theory in a run.
 *
 * @param preEnumerateTheories when {@code false}, every theory becomes a single deferred case
 * @param methodDisplay        how case display names refer to the method
 */
public record DiscoveryOptions(boolean preEnumerateTheories, MethodDisplay methodDisplay) {
    public DiscoveryOptions {
        Objects.requireNonNull(methodDisplay, "methodDisplay is required");
    }

    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(true, MethodDisplay.CLASS_AND_METHOD);
    }

    public DiscoveryOptions withPreEnumerateTheories(boolean preEnumerate) {
        return new DiscoveryOptions(preEnumerate, methodDisplay);
    }

    public DiscoveryOptions withMethodDisplay(MethodDisplay display) {
        return new DiscoveryOptions(preEnumerateTheories, display);
    }
}
