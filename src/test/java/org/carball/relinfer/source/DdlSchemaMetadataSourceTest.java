package org.carball.relinfer.source;

import org.carball.relinfer.exception.ConfigurationException;
import org.carball.relinfer.model.candidate.LinkDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DdlSchemaMetadataSourceTest {

    @Test
    void shouldExtractTableLevelForeignKeys() {
        // Given
        String ddl = """
                CREATE TABLE customers (id TEXT PRIMARY KEY, name TEXT);
                CREATE TABLE orders (
                    id TEXT PRIMARY KEY,
                    customer_id TEXT NOT NULL,
                    coupon_id TEXT,
                    CONSTRAINT fk_orders_customer FOREIGN KEY (customer_id) REFERENCES customers (id),
                    FOREIGN KEY (coupon_id) REFERENCES coupons (id)
                );
                """;

        // When
        List<LinkDescriptor> links = new DdlSchemaMetadataSource(ddl).listDeclaredLinks();

        // Then
        assertThat(links).containsExactly(
                new LinkDescriptor("orders", "customer_id", "customers", false, false, true, true, null),
                new LinkDescriptor("orders", "coupon_id", "coupons", false, false, false, true, null));
    }

    @Test
    void shouldExtractInlineReferences() {
        // Given
        String ddl = """
                CREATE TABLE "profiles" (
                    "id" TEXT PRIMARY KEY,
                    "user_id" TEXT UNIQUE REFERENCES "users" ("id")
                );
                """;

        // When
        List<LinkDescriptor> links = new DdlSchemaMetadataSource(ddl).listDeclaredLinks();

        // Then
        assertThat(links).singleElement().satisfies(link -> {
            assertThat(link.sourceTable()).isEqualTo("profiles");
            assertThat(link.sourceField()).isEqualTo("user_id");
            assertThat(link.targetTableId()).isEqualTo("users");
            assertThat(link.prefersSingleRecordLink()).isTrue();
            assertThat(link.inversePrefersSingleRecordLink()).isTrue();
        });
    }

    @Test
    void shouldTreatUniqueConstraintAsSingleReferencePerTarget() {
        // Given
        String ddl = """
                CREATE TABLE passports (
                    id TEXT PRIMARY KEY,
                    person_id TEXT NOT NULL,
                    UNIQUE (person_id),
                    FOREIGN KEY (person_id) REFERENCES people (id)
                );
                """;

        // When
        List<LinkDescriptor> links = new DdlSchemaMetadataSource(ddl).listDeclaredLinks();

        // Then
        assertThat(links).containsExactly(
                new LinkDescriptor("passports", "person_id", "people", false, false, true, true, true));
    }

    @Test
    void shouldIgnoreTablesWithoutForeignKeys() {
        // When
        List<LinkDescriptor> links = new DdlSchemaMetadataSource("CREATE TABLE tags (id TEXT PRIMARY KEY, label TEXT);")
                .listDeclaredLinks();

        // Then
        assertThat(links).isEmpty();
    }

    @Test
    void shouldRejectInvalidDdl() {
        // When/Then
        assertThatThrownBy(() -> new DdlSchemaMetadataSource("CREATE TABLE (").listDeclaredLinks())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid SQL DDL");
    }
}
