package theory.model;

import java.lang.annotation.Annotation;
import java.util.Objects;

/**
 * A data annotation found on a theory, with its position among the method's data annotations.
 */
public record DataProviderDirective(Annotation annotation, int index) {
    public DataProviderDirective {
        Objects.requireNonNull(annotation, "annotation is required");
        if (index < 0) {
            throw new IllegalArgumentException("Directive index cannot be negative: " + index);
        }
    }

    public Class<? extends Annotation> annotationType() {
        return annotation.annotationType();
    }

    public <A extends Annotation> A annotationAs(Class<A> type) {
        if (!type.isInstance(annotation)) {
            throw new IllegalArgumentException(
                    "Directive #" + index + " is @" + annotationType().getSimpleName() + ", not @" + type.getSimpleName());
        }
        return type.cast(annotation);
    }
}
