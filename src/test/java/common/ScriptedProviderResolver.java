package common;

import theory.model.DataProviderDirective;
import theory.model.TestMethod;
import theory.provider.DataDiscoveryException;
import theory.provider.DataProvider;
import theory.provider.ProviderResolver;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Hands out providers by directive index.
 */
public class ScriptedProviderResolver implements ProviderResolver {

    private final Map<Integer, Supplier<DataProvider>> script = new HashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedProviderResolver provide(int index, DataProvider provider) {
        script.put(index, () -> provider);
        return this;
    }

    public ScriptedProviderResolver failOn(int index, RuntimeException failure) {
        script.put(index, () -> {
            throw failure;
        });
        return this;
    }

    @Override
    public DataProvider resolve(DataProviderDirective directive, TestMethod testMethod) {
        calls.incrementAndGet();
        Supplier<DataProvider> entry = script.get(directive.index());
        if (entry == null) {
            throw new DataDiscoveryException("No provider scripted for directive #" + directive.index());
        }
        return entry.get();
    }

    public int calls() {
        return calls.get();
    }
}
