package org.carball.relinfer.config;

import lombok.Builder;
import lombok.Value;
import org.carball.relinfer.ddl.SqlIdentifiers;

/**
 * Naming and typing conventions used when rendering DDL previews.
 */
@Value
@Builder(toBuilder = true)
public class DdlOptions {

    @Builder.Default
    String keyColumnType = "TEXT";

    @Builder.Default
    String foreignKeySuffix = "_id";

    @Builder.Default
    String collisionSuffix = "_fk";

    @Builder.Default
    String junctionCollisionSuffix = "_link";

    @Builder.Default
    String selfReferencePrefix = "related_";

    @Builder.Default
    int maxIdentifierLength = SqlIdentifiers.POSTGRES_MAX_IDENTIFIER_LENGTH;

    @Builder.Default
    boolean includeBackfill = true;

    public static DdlOptions defaults() {
        return DdlOptions.builder().build();
    }
}
