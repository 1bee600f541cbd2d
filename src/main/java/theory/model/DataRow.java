package theory.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One row of arguments for a theory. Values are not checked against the method's
 * parameter types and may be {@code null}.
 */
public record DataRow(List<Object> arguments) {
    public DataRow {
        // List.copyOf odrzuca nulle, a null jest poprawnym argumentem
        arguments = arguments == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static DataRow of(Object... arguments) {
        return new DataRow(arguments == null ? null : Arrays.asList(arguments));
    }

    public int size() {
        return arguments.size();
    }

    public Object[] toArray() {
        return arguments.toArray();
    }
}
