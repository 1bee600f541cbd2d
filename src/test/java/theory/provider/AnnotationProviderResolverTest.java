package theory.provider;

import common.FakeData;
import org.junit.jupiter.api.Test;
import theory.annotation.DataDiscoverer;
import theory.annotation.InlineData;
import theory.model.DataProviderDirective;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.lang.annotation.Annotation;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationProviderResolverTest {

    private static final TestMethod METHOD = new TestMethod(AnnotationProviderResolverTest.class, "annotated", List.of());

    private final AnnotationProviderResolver resolver = new AnnotationProviderResolver();

    @Test
    void resolvesThroughDataDiscovererMetaAnnotation() {
        DataProvider provider = resolver.resolve(directive(InlineData.class), METHOD);

        assertThat(provider.canEnumerateAhead()).isTrue();
        assertThat(provider.rows()).containsExactly(DataRow.of("a", "b"));
    }

    @Test
    void factoryIsCreatedOnce() {
        CountingFactory.INSTANCES.set(0);

        resolver.resolve(directive(Counted.class), METHOD);
        resolver.resolve(directive(Counted.class), METHOD);

        assertThat(CountingFactory.INSTANCES.get()).isEqualTo(1);
    }

    @Test
    void annotationWithoutDataDiscovererIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(directive(FakeData.class), METHOD))
                .isInstanceOf(DataDiscoveryException.class)
                .hasMessageContaining("@FakeData")
                .hasMessageContaining("is not annotated with @DataDiscoverer");
    }

    @Test
    void factoryWithoutNoArgConstructorIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(directive(NeedsArgument.class), METHOD))
                .isInstanceOf(DataDiscoveryException.class)
                .hasMessageContaining("public no-arg constructor is required");
    }

    @Test
    void factoryReturningNullIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(directive(ReturnsNothing.class), METHOD))
                .isInstanceOf(DataDiscoveryException.class)
                .hasMessageContaining("returned no provider");
    }

    /* ------------------------------------------------ adnotacje testowe */

    @Retention(RetentionPolicy.RUNTIME)
    @DataDiscoverer(CountingFactory.class)
    @interface Counted {
    }

    @Retention(RetentionPolicy.RUNTIME)
    @DataDiscoverer(ArgumentFactory.class)
    @interface NeedsArgument {
    }

    @Retention(RetentionPolicy.RUNTIME)
    @DataDiscoverer(NullFactory.class)
    @interface ReturnsNothing {
    }

    public static class CountingFactory implements DataProviderFactory<Counted> {
        static final AtomicInteger INSTANCES = new AtomicInteger();

        public CountingFactory() {
            INSTANCES.incrementAndGet();
        }

        @Override
        public DataProvider create(Counted annotation, TestMethod testMethod) {
            return new InlineDataProviderFactory().create(inline(), testMethod);
        }
    }

    public static class ArgumentFactory implements DataProviderFactory<NeedsArgument> {
        public ArgumentFactory(String unused) {
        }

        @Override
        public DataProvider create(NeedsArgument annotation, TestMethod testMethod) {
            throw new UnsupportedOperationException();
        }
    }

    public static class NullFactory implements DataProviderFactory<ReturnsNothing> {
        @Override
        public DataProvider create(ReturnsNothing annotation, TestMethod testMethod) {
            return null;
        }
    }

    @InlineData({"a", "b"})
    @FakeData
    @Counted
    @NeedsArgument
    @ReturnsNothing
    void annotated() {
    }

    private static InlineData inline() {
        return (InlineData) annotation(InlineData.class);
    }

    private static DataProviderDirective directive(Class<? extends Annotation> type) {
        return new DataProviderDirective(annotation(type), 0);
    }

    private static Annotation annotation(Class<? extends Annotation> type) {
        try {
            return AnnotationProviderResolverTest.class.getDeclaredMethod("annotated").getAnnotation(type);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(e);
        }
    }
}
