package com.familygraph.repository;

import com.familygraph.model.GraphSnapshot;
import com.familygraph.model.Person;
import com.familygraph.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.familygraph.model.RelationshipType.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JdbcGraphSnapshotRepositoryTest {

    @Autowired
    private GraphSnapshotRepository repository;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void clearTables() {
        jdbc.update("DELETE FROM relationship");
        jdbc.update("DELETE FROM person");
        jdbc.update("DELETE FROM graph_snapshot");
    }

    @Test
    void usesJdbcStorageWhenPersistenceIsEnabled() {
        assertThat(repository).isInstanceOf(JdbcGraphSnapshotRepository.class);
    }

    @Test
    void loadIsEmptyBeforeFirstSave() {
        assertThat(repository.load()).isEmpty();
    }

    @Test
    void savedSnapshotLoadsBack() {
        Person anne = new Person(1L, "Anne", "Smith", "Nan", LocalDate.of(1920, 5, 1), LocalDate.of(1999, 2, 3),
            "F", "Emigrated 1948", Map.of("birthPlace", "Leeds", "children", 3));
        Person bob = new Person(2L, "Bob", "Smith", null, null, null, null, null, Map.of());
        Relationship rel = new Relationship(5L, 1L, 2L, PARENT, null, null, "baptism record");

        repository.save(new GraphSnapshot(4, List.of(anne, bob), List.of(rel)));

        GraphSnapshot loaded = repository.load().orElseThrow();
        assertThat(loaded.version()).isEqualTo(4);
        assertThat(loaded.people()).containsExactly(anne, bob);
        assertThat(loaded.relationships()).containsExactly(rel);
    }

    @Test
    void longNotesAndAttributesAreStoredWhole() {
        Person anne = new Person(1L, "Anne", "Smith", null, null, null, null, "n".repeat(50_000),
            Map.of("story", "s".repeat(30_000)));
        Relationship rel = new Relationship(1L, 1L, 1L, FRIEND, null, null, "r".repeat(40_000));

        repository.save(new GraphSnapshot(1, List.of(anne), List.of(rel)));

        GraphSnapshot loaded = repository.load().orElseThrow();
        assertThat(loaded.people()).containsExactly(anne);
        assertThat(loaded.relationships()).containsExactly(rel);
    }

    @Test
    void saveReplacesThePreviousSnapshot() {
        Person anne = new Person(1L, "Anne", "Smith", null, null, null, null, null, Map.of());
        Person bob = new Person(2L, "Bob", "Smith", null, null, null, null, null, Map.of());
        repository.save(new GraphSnapshot(1, List.of(anne, bob),
            List.of(new Relationship(1L, 1L, 2L, SPOUSE, LocalDate.of(1950, 6, 1), null, null))));

        repository.save(new GraphSnapshot(2, List.of(bob), List.of()));

        GraphSnapshot loaded = repository.load().orElseThrow();
        assertThat(loaded.version()).isEqualTo(2);
        assertThat(loaded.people()).containsExactly(bob);
        assertThat(loaded.relationships()).isEmpty();
    }

    @Test
    void unknownTypeLabelsLoadWithoutType() {
        repository.save(new GraphSnapshot(1, List.of(), List.of()));
        jdbc.update("INSERT INTO relationship (id, person1_id, person2_id, rel_type) VALUES (9, 1, 2, 'nemesis')");

        assertThat(repository.load().orElseThrow().relationships())
            .singleElement()
            .satisfies(r -> assertThat(r.type()).isNull());
    }
}
