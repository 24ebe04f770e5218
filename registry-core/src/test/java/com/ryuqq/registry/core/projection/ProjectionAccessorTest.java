package com.ryuqq.registry.core.projection;

import com.ryuqq.registry.core.exception.AttributeNotFoundException;
import com.ryuqq.registry.core.fixture.Member;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.KeyType;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProjectionAccessor 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class ProjectionAccessorTest {

    private final ProjectionAccessor<Member> accessor = new ProjectionAccessor<>(Member.TYPE, Member.SCHEMA);

    @Test
    void projectionNames_KeyNamesThenPluralizedAttributes() {
        assertThat(accessor.projectionNames())
            .containsExactly("names", "ids", "teamIds", "badges", "cities");
    }

    @Test
    void project_ReturnsValuesInStoreOrder() {
        // Given
        Member alice = Member.of("Alice", 1);
        Member bob = Member.of("Bob", 2);

        // When
        List<Object> names = accessor.project("names", List.of(alice, bob));
        List<Object> cities = accessor.project("cities", List.of(bob, alice));

        // Then
        assertThat(names).containsExactly("Alice", "Bob");
        assertThat(cities).containsExactly("Seoul", "Seoul");
    }

    @Test
    void project_NoRecords_ReturnsEmptyList() {
        assertThat(accessor.project("badges", List.of())).isEmpty();
    }

    @Test
    void project_SingularAttributeName_ThrowsAttributeNotFound() {
        assertThatThrownBy(() -> accessor.project("city", List.of()))
            .isInstanceOf(AttributeNotFoundException.class)
            .hasMessageContaining("city");
    }

    @Test
    void attributeFor_KeyProjectionName_MapsToSourceAttribute() {
        // Given: projection 이름이 속성 복수형과 다른 키
        KeySchema schema = KeySchema.of(KeyDeclaration.of("people", "name", KeyType.TEXT));
        ProjectionAccessor<Member> custom = new ProjectionAccessor<>(Member.TYPE, schema);

        // When & Then
        assertThat(custom.attributeFor("people")).isEqualTo("name");
        assertThat(custom.attributeFor("names")).isEqualTo("name");
    }

    @Test
    void attributeFor_CollidingPlurals_LastDeclaredAttributeWins() {
        // Given: "status"와 "statu"는 모두 "status"로 복수화됨
        RecordType<Map<String, String>> type = RecordType.<Map<String, String>>builder("Row")
            .attribute("status", row -> row.get("status"))
            .attribute("statu", row -> row.get("statu"))
            .build();
        ProjectionAccessor<Map<String, String>> rows = new ProjectionAccessor<>(type, KeySchema.of());

        // When & Then
        assertThat(rows.attributeFor("status")).isEqualTo("statu");
        assertThat(rows.project("status", List.of(Map.of("status", "OPEN", "statu", "x"))))
            .containsExactly("x");
    }
}
