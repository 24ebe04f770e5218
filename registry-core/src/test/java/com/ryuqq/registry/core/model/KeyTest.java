package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Key sealed interface 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class KeyTest {

    @Test
    void of_String_CreatesTextKey() {
        // When
        Key.ValueKey key = Key.of("Alice");

        // Then
        assertThat(key).isInstanceOf(Key.Text.class);
        assertThat(key.type()).isEqualTo(KeyType.TEXT);
        assertThat(key.value()).isEqualTo("Alice");
        assertThat(key.projection()).isEmpty();
    }

    @Test
    void of_Uuid_CreatesIdentifierKey() {
        // Given
        UUID id = UUID.randomUUID();

        // When
        Key.ValueKey key = Key.of(id);

        // Then
        assertThat(key.type()).isEqualTo(KeyType.IDENTIFIER);
        assertThat(key.value()).isEqualTo(id);
    }

    @Test
    void number_CreatesNumericKeyWithLongValue() {
        // When
        Key.Numeric key = Key.number(42);

        // Then
        assertThat(key).isEqualTo(new Key.Numeric(42L, null));
        assertThat(key.type()).isEqualTo(KeyType.NUMBER);
        assertThat(key.value()).isEqualTo(42L);
        assertThat(key.via("badges").projection()).contains("badges");
        assertThat(key.toString()).isEqualTo("Numeric{42}");
    }

    @Test
    void at_CreatesPositionKey() {
        assertThat(Key.at(3)).isEqualTo(new Key.Position(3));
        assertThat(Key.at(3).index()).isEqualTo(3);
    }

    @Test
    void via_SetsProjectionAndKeepsValue() {
        // Given
        UUID id = UUID.randomUUID();

        // When
        Key.ValueKey key = Key.of(id).via("teamIds");

        // Then
        assertThat(key.projection()).contains("teamIds");
        assertThat(key.value()).isEqualTo(id);
        assertThat(key).isNotEqualTo(Key.of(id));
    }

    @Test
    void via_BlankProjection_ThrowsException() {
        assertThatThrownBy(() -> Key.of("Alice").via(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("projectionName");
    }

    @Test
    void of_NullValue_ThrowsException() {
        assertThatThrownBy(() -> Key.of((String) null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Key.of((UUID) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertThat(Key.of("Bob")).isEqualTo(Key.of("Bob"));
        assertThat(Key.number(1)).isEqualTo(Key.number(1));
    }
}
