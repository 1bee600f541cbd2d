package theory.provider;

import theory.annotation.InlineData;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.util.List;

public class InlineDataProviderFactory implements DataProviderFactory<InlineData> {

    @Override
    public DataProvider create(InlineData annotation, TestMethod testMethod) {
        DataRow row = DataRow.of((Object[]) annotation.value());
        return new DataProvider() {
            @Override
            public boolean canEnumerateAhead() {
                return true;
            }

            @Override
            public Iterable<DataRow> rows() {
                return List.of(row);
            }
        };
    }
}
