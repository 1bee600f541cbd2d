package theory.annotation;

import theory.provider.MemberDataProviderFactory;

import java.lang.annotation.*;

/**
 * Rows taken from a static method or field. The member may return an {@code Iterable}, a
 * {@code Stream} or an array; {@code Object[]} elements are spread into arguments.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(MemberData.List.class)
@DataDiscoverer(MemberDataProviderFactory.class)
public @interface MemberData {

    /** Name of the static no-arg method or static field. */
    String value();

    /** Class declaring the member; {@code void.class} means the test class itself. */
    Class<?> of() default void.class;

    /**
     * Set when rows can only be produced once the test runs (fresh objects, external state).
     * The theory is then discovered as a single deferred case.
     */
    boolean disableDiscoveryEnumeration() default false;

    @Target({ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Documented
    @interface List {
        MemberData[] value();
    }
}
