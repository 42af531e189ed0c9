package org.carball.relinfer.ddl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqlIdentifiersTest {

    @Test
    void shouldQuoteIdentifiers() {
        assertThat(SqlIdentifiers.quote("order")).isEqualTo("\"order\"");
        assertThat(SqlIdentifiers.quote("Mixed Case")).isEqualTo("\"Mixed Case\"");
        assertThat(SqlIdentifiers.quote("we\"ird")).isEqualTo("\"we\"\"ird\"");
    }

    @Test
    void shouldRejectEmptyIdentifiers() {
        assertThatThrownBy(() -> SqlIdentifiers.quote(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldQualifyWithSchema() {
        assertThat(SqlIdentifiers.qualified("public", "orders")).isEqualTo("\"public\".\"orders\"");
        assertThat(SqlIdentifiers.qualified(null, "orders")).isEqualTo("\"orders\"");
    }

    @Test
    void shouldTruncateByBytesWithoutSplittingCharacters() {
        // Given
        String name = "é".repeat(40);

        // When
        String truncated = SqlIdentifiers.truncate(name, 63);

        // Then
        assertThat(truncated).hasSize(31);
        assertThat(SqlIdentifiers.generated("Customer_ID", 63)).isEqualTo("customer_id");
    }
}
