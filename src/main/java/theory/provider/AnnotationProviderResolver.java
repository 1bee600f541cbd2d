package theory.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.annotation.DataDiscoverer;
import theory.model.DataProviderDirective;
import theory.model.TestMethod;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves directives through the {@link DataDiscoverer} meta-annotation of their annotation type.
 * Factories are created once per class and shared between threads.
 */
public class AnnotationProviderResolver implements ProviderResolver {

    private static final Logger log = LoggerFactory.getLogger(AnnotationProviderResolver.class);

    private final Map<Class<?>, DataProviderFactory<?>> factories = new ConcurrentHashMap<>();

    @Override
    public DataProvider resolve(DataProviderDirective directive, TestMethod testMethod) {
        Objects.requireNonNull(directive, "directive is required");
        Objects.requireNonNull(testMethod, "testMethod is required");

        Class<? extends Annotation> annotationType = directive.annotationType();
        DataDiscoverer discoverer = annotationType.getAnnotation(DataDiscoverer.class);
        if (discoverer == null) {
            throw new DataDiscoveryException("@" + annotationType.getSimpleName()
                    + " on " + testMethod.qualifiedName() + " is not annotated with @DataDiscoverer");
        }

        DataProviderFactory<Annotation> factory = factoryFor(discoverer.value());
        DataProvider provider = factory.create(directive.annotation(), testMethod);
        if (provider == null) {
            throw new DataDiscoveryException(discoverer.value().getName()
                    + " returned no provider for @" + annotationType.getSimpleName() + " on " + testMethod.qualifiedName());
        }
        log.debug("Resolved directive #{} (@{}) on {} to {}",
                directive.index(), annotationType.getSimpleName(), testMethod.qualifiedName(), provider.getClass().getSimpleName());
        return provider;
    }

    private DataProviderFactory<Annotation> factoryFor(Class<? extends DataProviderFactory<?>> factoryClass) {
        return (DataProviderFactory<Annotation>) factories.computeIfAbsent(factoryClass, this::instantiate);
    }

    private DataProviderFactory<?> instantiate(Class<?> factoryClass) {
        try {
            Object instance = factoryClass.getDeclaredConstructor().newInstance();
            log.debug("Created data provider factory {}", factoryClass.getName());
            return (DataProviderFactory<?>) instance;
        } catch (InvocationTargetException e) {
            throw new DataDiscoveryException("Constructor of " + factoryClass.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new DataDiscoveryException("Cannot instantiate " + factoryClass.getName()
                    + "; a public no-arg constructor is required", e);
        }
    }
}
