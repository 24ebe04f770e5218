package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.exception.AmbiguousKeyException;
import com.ryuqq.registry.core.exception.DuplicateKeyException;
import com.ryuqq.registry.core.model.Key;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.registry.KeyedRegistry;
import com.ryuqq.registry.core.spi.RegistryEventSink;
import com.ryuqq.registry.testkit.fixture.Item;
import com.ryuqq.registry.testkit.fixture.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for registry Contract Tests.
 *
 * <p>Every registry wired with a {@link RegistryEventSink} implementation must satisfy these
 * contracts. Adapter modules subclass this test and supply their sink through
 * {@link #createEventSink()}; the sink must never change the outcome of an operation.</p>
 *
 * <p><strong>Contracts:</strong></p>
 * <ul>
 *   <li>Uniqueness: no two records share a non-identifier key value after any successful write</li>
 *   <li>Identifier exemption: duplicate identifiers are stored, looking them up is ambiguous</li>
 *   <li>Delete stability: a batch delete removes exactly the resolved records, others keep their order</li>
 *   <li>Round-trip: an appended record is found through each of its unique keys</li>
 *   <li>Projection: the i-th projected value is the attribute of the i-th record</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MySinkContractTest extends AbstractRegistryContractTest {
 *     {@literal @}Override
 *     protected RegistryEventSink createEventSink() {
 *         return new MySink();
 *     }
 * }
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class AbstractRegistryContractTest {

    protected KeyedRegistry<Person> people;
    protected KeyedRegistry<Item> items;
    protected RegistryEventSink eventSink;

    /**
     * Creates the sink under test. Called once per test.
     *
     * @return a fresh sink
     */
    protected abstract RegistryEventSink createEventSink();

    @BeforeEach
    void setUpRegistries() {
        eventSink = createEventSink();
        people = KeyedRegistry.create(Person.TYPE, Person.SCHEMA, List.of(), eventSink);
        items = KeyedRegistry.create(Item.TYPE, Item.SCHEMA, List.of(), eventSink);
    }

    @AfterEach
    void tearDownRegistries() {
        if (people != null) {
            people.clear();
        }
        if (items != null) {
            items.clear();
        }
    }

    // ============================================================
    // Concrete scenario
    // ============================================================

    @Test
    void scenario_AppendLookupProjectDelete() {
        // Given
        UUID u1 = UUID.randomUUID();
        UUID u2 = UUID.randomUUID();
        Person alice = new Person("Alice", u1);
        Person bob = new Person("Bob", u2);

        // When
        people.append(alice);
        people.append(bob);

        // Then
        assertEquals(2, people.size());
        assertEquals(alice, people.get(Key.of("Alice")));
        assertThrows(DuplicateKeyException.class, () -> people.append(new Person("Alice", UUID.randomUUID())));
        assertEquals(List.of("Alice", "Bob"), people.project("names"));

        // When: delete by identifier
        people.delete(Key.of(u1));

        // Then
        assertEquals(1, people.size());
        assertEquals(List.of(bob), people.records());
    }

    // ============================================================
    // Uniqueness invariant
    // ============================================================

    @Test
    void uniqueness_HoldsAfterRandomWrites() {
        Random random = new Random(20240611L);

        for (int step = 0; step < 300; step++) {
            String sku = "SKU-" + random.nextInt(40);
            long serial = random.nextInt(40);
            Item candidate = Item.of(sku, serial, "tools");
            try {
                if (items.isEmpty() || random.nextBoolean()) {
                    items.append(candidate);
                } else {
                    items.replace(Key.at(random.nextInt(items.size())), candidate);
                }
            } catch (DuplicateKeyException expected) {
                // rejected writes leave the store unchanged
            }
            assertUniqueKeys(items);
        }
        assertThat(items.size()).isPositive();
    }

    // ============================================================
    // Identifier exemption
    // ============================================================

    @Test
    void identifier_DuplicatesStoredButLookupIsAmbiguous() {
        // Given
        UUID shared = UUID.randomUUID();

        // When
        people.append(new Person("Alice", shared));
        people.append(new Person("Bob", shared));

        // Then
        assertEquals(2, people.size());
        assertThrows(AmbiguousKeyException.class, () -> people.get(Key.of(shared)));
        assertEquals("Bob", people.get(Key.of("Bob")).name());
    }

    // ============================================================
    // Index stability under delete
    // ============================================================

    @Test
    void delete_BatchKeepsRelativeOrderOfSurvivors() {
        // Given
        List<Person> all = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            all.add(Person.named("P" + i));
        }
        people.append(all);

        // When: keys given out of order, mixing positions and values
        people.delete(List.of(Key.of("P6"), Key.at(1), Key.of(all.get(4).id()), Key.at(0)));

        // Then
        assertEquals(List.of(all.get(2), all.get(3), all.get(5), all.get(7)), people.records());
    }

    // ============================================================
    // Round-trip
    // ============================================================

    @Test
    void roundTrip_AppendedItemFoundThroughEveryUniqueKey() {
        // Given
        Item hammer = Item.of("SKU-1", 1001L, "tools");
        items.append(Item.of("SKU-0", 1000L, "tools"));

        // When
        items.append(hammer);

        // Then
        assertEquals(hammer, items.get(Key.of("SKU-1")));
        assertEquals(hammer, items.get(Key.number(1001L)));
        assertEquals(hammer, items.get(Key.of(hammer.id())));
        assertEquals(hammer, items.get(Key.at(1)));
    }

    // ============================================================
    // Projection
    // ============================================================

    @Test
    void projection_MatchesRecordAttributesInStoreOrder() {
        // Given
        items.append(Item.of("SKU-A", 1L, "tools"));
        items.append(Item.of("SKU-B", 2L, "garden"));
        items.append(Item.of("SKU-C", 3L, "kitchen"));
        items.delete(Key.of("SKU-B"));

        // When
        List<Object> categories = items.project("categories");
        List<Object> boxes = items.project("boxes");
        List<Object> status = items.project("status");

        // Then
        List<Item> records = items.records();
        for (int i = 0; i < records.size(); i++) {
            assertEquals(records.get(i).category(), categories.get(i));
            assertEquals(records.get(i).box(), boxes.get(i));
            assertEquals(records.get(i).status(), status.get(i));
        }
        assertEquals(List.of("tools", "kitchen"), categories);
    }

    @Test
    void summary_DescribesTypeCountAndKeys() {
        people.append(Person.named("Alice"));

        assertEquals("Registry<Person>: 1 records, keys: [names, ids]", people.toString());
    }

    /**
     * Asserts that no two records share a value for any non-identifier key.
     *
     * @param registry the registry to check
     * @param <T> element type
     */
    protected <T> void assertUniqueKeys(KeyedRegistry<T> registry) {
        for (KeyDeclaration declaration : registry.keySchema().uniqueDeclarations()) {
            List<Object> values = registry.project(declaration.projectionName());
            Set<Object> distinct = new HashSet<>();
            for (Object value : values) {
                assertTrue(distinct.add(value),
                        String.format("Duplicate value %s for key '%s' in %s",
                                value, declaration.projectionName(), registry));
            }
        }
    }
}
