package org.carball.widgetq.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnMeta {
    String name;
    String dataType;
    String displayName;
    boolean nullable;
    boolean primaryKey;

    public static ColumnMeta of(String name, String dataType) {
        return ColumnMeta.builder()
                .name(name)
                .dataType(dataType)
                .nullable(true)
                .build();
    }

    @JsonIgnore
    public DataTypeCategory getCategory() {
        return DataTypeCategory.of(dataType);
    }

    @JsonIgnore
    public boolean isNumeric() {
        return getCategory().isNumeric();
    }

    @JsonIgnore
    public boolean isDate() {
        return getCategory().isDate();
    }
}
