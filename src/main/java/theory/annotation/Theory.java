package theory.annotation;

import java.lang.annotation.*;

/**
 * Marks a method as a theory: a test run once per row supplied by its data annotations.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Theory {

    /** Skip reason; empty means the theory is not skipped. */
    String skip() default "";
}
