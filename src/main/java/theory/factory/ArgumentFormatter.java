package theory.factory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.model.DataRow;

import java.util.stream.Collectors;

/**
 * Renders row arguments for display names as JSON ({@code "PLN"}, {@code {"amount":10.0}}).
 */
public class ArgumentFormatter {

    private static final Logger log = LoggerFactory.getLogger(ArgumentFormatter.class);

    private final Gson gson;

    public ArgumentFormatter() {
        this(new GsonBuilder().serializeNulls().disableHtmlEscaping().create());
    }

    public ArgumentFormatter(Gson gson) {
        this.gson = gson;
    }

    public String format(DataRow dataRow) {
        return dataRow.arguments().stream()
                .map(this::formatArgument)
                .collect(Collectors.joining(", "));
    }

    String formatArgument(Object argument) {
        if (argument == null) {
            return "null";
        }
        try {
            return gson.toJson(argument);
        } catch (JsonIOException | IllegalArgumentException | UnsupportedOperationException e) {
            // np. typy JDK niedostępne dla refleksji
            log.debug("Cannot render {} as JSON, using toString(): {}", argument.getClass().getName(), e.toString());
            return String.valueOf(argument);
        }
    }
}
