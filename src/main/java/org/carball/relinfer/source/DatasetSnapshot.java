package org.carball.relinfer.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of an imported dataset as exported by the source system.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetSnapshot {

    private String sourceId;
    private List<TableData> tables = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TableData {
        private String name;
        /** Source-system identifier of the table, referenced by declared links. */
        private String id;
        @Builder.Default
        private String keyColumn = "id";
        @Builder.Default
        private List<Map<String, Object>> rows = new ArrayList<>();

        public TableData row(Object... keyValues) {
            if (keyValues.length % 2 != 0) {
                throw new IllegalArgumentException("Expected key/value pairs");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < keyValues.length; i += 2) {
                row.put((String) keyValues[i], keyValues[i + 1]);
            }
            rows.add(row);
            return this;
        }
    }
}
