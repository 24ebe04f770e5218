package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeyDeclaration 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class KeyDeclarationTest {

    @Test
    void of_ValidValues_CreatesDeclaration() {
        // When
        KeyDeclaration declaration = KeyDeclaration.of("names", "name", KeyType.TEXT);

        // Then
        assertEquals("names", declaration.projectionName());
        assertEquals("name", declaration.sourceAttribute());
        assertEquals(KeyType.TEXT, declaration.matchType());
    }

    @Test
    void enforcesUniqueness_IdentifierType_ReturnsFalse() {
        assertFalse(KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER).enforcesUniqueness());
        assertTrue(KeyDeclaration.of("names", "name", KeyType.TEXT).enforcesUniqueness());
    }

    @Test
    void of_BlankSourceAttribute_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> KeyDeclaration.of("names", "  ", KeyType.TEXT)
        );
        assertTrue(exception.getMessage().contains("sourceAttribute"));
    }

    @Test
    void of_NullMatchType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> KeyDeclaration.of("names", "name", null));
    }

    @Test
    void of_NullProjectionName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> KeyDeclaration.of(null, "name", KeyType.TEXT));
    }
}
