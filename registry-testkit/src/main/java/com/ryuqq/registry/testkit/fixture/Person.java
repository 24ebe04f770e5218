package com.ryuqq.registry.testkit.fixture;

import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.KeyType;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;

import java.util.UUID;

/**
 * Fixture element type with one unique text key and one identifier key.
 *
 * @param name unique name
 * @param id identifier, exempt from uniqueness
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Person(String name, UUID id) {

    public static final RecordType<Person> TYPE = RecordType.ofRecord(Person.class);

    /**
     * names (TEXT) then ids (IDENTIFIER).
     */
    public static final KeySchema SCHEMA = KeySchema.of(
        KeyDeclaration.of("names", "name", KeyType.TEXT),
        KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER)
    );

    public static Person named(String name) {
        return new Person(name, UUID.randomUUID());
    }
}
