package com.ryuqq.registry.testkit.fixture;

import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.KeyType;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;

import java.util.UUID;

/**
 * Fixture element type whose attribute names exercise every pluralization rule.
 *
 * <ul>
 *   <li>{@code status} → {@code status} (already ends in "s")</li>
 *   <li>{@code category} → {@code categories}</li>
 *   <li>{@code box} → {@code boxes}</li>
 *   <li>{@code serial} → {@code serials}</li>
 * </ul>
 *
 * @param sku unique stock keeping unit
 * @param id identifier
 * @param serial unique serial number
 * @param category category name
 * @param box packaging
 * @param status stock status
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Item(String sku, UUID id, long serial, String category, String box, String status) {

    public static final RecordType<Item> TYPE = RecordType.ofRecord(Item.class);

    public static final KeySchema SCHEMA = KeySchema.of(
        KeyDeclaration.of("skus", "sku", KeyType.TEXT),
        KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER),
        KeyDeclaration.of("serials", "serial", KeyType.NUMBER)
    );

    public static Item of(String sku, long serial, String category) {
        return new Item(sku, UUID.randomUUID(), serial, category, "carton", "IN_STOCK");
    }
}
