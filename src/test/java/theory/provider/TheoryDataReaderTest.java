package theory.provider;

import common.Directives;
import common.FakeDataProvider;
import common.SampleTheories;
import common.ScriptedProviderResolver;
import org.junit.jupiter.api.Test;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TheoryDataReaderTest {

    private static final TestMethod METHOD = new TestMethod(SampleTheories.class, "runtimeOnly", List.of(Object.class));

    @Test
    void readsProvidersThatCannotEnumerateAhead() {
        ScriptedProviderResolver resolver = new ScriptedProviderResolver()
                .provide(0, FakeDataProvider.rows(DataRow.of("PLN")))
                .provide(1, FakeDataProvider.notEnumerable(DataRow.of("fresh"), DataRow.of("again")));

        List<DataRow> rows = new TheoryDataReader(resolver).readRows(METHOD, Directives.of(2));

        assertThat(rows).containsExactly(DataRow.of("PLN"), DataRow.of("fresh"), DataRow.of("again"));
    }

    @Test
    void failuresPropagateAtExecutionTime() {
        ScriptedProviderResolver resolver = new ScriptedProviderResolver()
                .provide(0, FakeDataProvider.failingOnRows(new IllegalStateException("generator exploded")));

        assertThatThrownBy(() -> new TheoryDataReader(resolver).readRows(METHOD, Directives.of(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("generator exploded");
    }

    @Test
    void nullRowsAreReported() {
        ScriptedProviderResolver resolver = new ScriptedProviderResolver().provide(0, FakeDataProvider.returningNull());

        assertThatThrownBy(() -> new TheoryDataReader(resolver).readRows(METHOD, Directives.of(1)))
                .isInstanceOf(DataDiscoveryException.class)
                .hasMessageContaining("returned no rows");
    }
}
