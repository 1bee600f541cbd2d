package theory.annotation;

import theory.provider.DataProviderFactory;

import java.lang.annotation.*;

/**
 * Meta-annotation for data annotations, naming the factory that turns the annotation into a
 * {@link theory.provider.DataProvider}. The factory needs a public no-arg constructor.
 */
@Target({ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DataDiscoverer {
    Class<? extends DataProviderFactory<?>> value();
}
