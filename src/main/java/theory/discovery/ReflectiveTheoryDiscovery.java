package theory.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.annotation.DataDiscoverer;
import theory.annotation.Theory;
import theory.model.DataProviderDirective;
import theory.model.DiscoveryOptions;
import theory.model.TestCase;
import theory.model.TestMethod;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@link Theory} and data annotations off test methods and hands them to a {@link TheoryDiscoverer}.
 */
public class ReflectiveTheoryDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveTheoryDiscovery.class);

    private final TheoryDiscoverer discoverer;

    public ReflectiveTheoryDiscovery(TheoryDiscoverer discoverer) {
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer is required");
    }

    public List<TestCase> discover(DiscoveryOptions options, Method method) {
        Theory theory = method.getAnnotation(Theory.class);
        if (theory == null) {
            throw new IllegalArgumentException(TestMethod.of(method).qualifiedName() + " is not annotated with @Theory");
        }
        String skipReason = theory.skip().isEmpty() ? null : theory.skip();
        return discoverer.discover(options, TestMethod.of(method), directivesOf(method), skipReason);
    }

    /**
     * Expands every {@link Theory} method declared by {@code testClass}, ordered by name and then
     * parameter count so repeated runs register cases in the same order.
     */
    public List<TestCase> discoverAll(DiscoveryOptions options, Class<?> testClass) {
        List<Method> theories = Arrays.stream(testClass.getDeclaredMethods())
                .filter(method -> method.isAnnotationPresent(Theory.class))
                .sorted(Comparator.comparing(Method::getName).thenComparingInt(Method::getParameterCount))
                .toList();
        log.debug("Found {} theory method(s) in {}", theories.size(), testClass.getName());

        List<TestCase> testCases = new ArrayList<>();
        for (Method method : theories) {
            testCases.addAll(discover(options, method));
        }
        return testCases;
    }

    /**
     * Data annotations of {@code method} in declaration order; containers of repeated annotations
     * are unwrapped in place.
     */
    public static List<DataProviderDirective> directivesOf(Method method) {
        List<Annotation> dataAnnotations = new ArrayList<>();
        for (Annotation annotation : method.getDeclaredAnnotations()) {
            if (isDataAnnotation(annotation.annotationType())) {
                dataAnnotations.add(annotation);
            } else {
                for (Annotation repeated : unwrapContainer(annotation)) {
                    dataAnnotations.add(repeated);
                }
            }
        }

        List<DataProviderDirective> directives = new ArrayList<>();
        for (int i = 0; i < dataAnnotations.size(); i++) {
            directives.add(new DataProviderDirective(dataAnnotations.get(i), i));
        }
        return directives;
    }

    private static boolean isDataAnnotation(Class<? extends Annotation> type) {
        return type.isAnnotationPresent(DataDiscoverer.class);
    }

    private static List<Annotation> unwrapContainer(Annotation annotation) {
        Method value = Arrays.stream(annotation.annotationType().getDeclaredMethods())
                .filter(candidate -> candidate.getName().equals("value"))
                .findFirst()
                .orElse(null);
        if (value == null) {
            return List.of();
        }
        Class<?> returnType = value.getReturnType();
        if (!returnType.isArray()
                || !returnType.getComponentType().isAnnotation()
                || !isDataAnnotation(returnType.getComponentType().asSubclass(Annotation.class))) {
            return List.of();
        }
        try {
            return Arrays.asList((Annotation[]) value.invoke(annotation));
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read repeated @" + returnType.getComponentType().getSimpleName()
                    + " from @" + annotation.annotationType().getSimpleName(), e);
        }
    }
}
