package com.familygraph.repository;

import com.familygraph.model.GraphSnapshot;
import com.familygraph.model.Person;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the whole graph in three tables ({@code person}, {@code relationship} and
 * {@code graph_snapshot}), replacing everything in one transaction on each save.
 * Relationship rows are not constrained by foreign keys; the graph skips rows it
 * cannot accept when it loads them.
 */
public class JdbcGraphSnapshotRepository implements GraphSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcGraphSnapshotRepository.class);

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final ObjectMapper objectMapper;

    private final RowMapper<Person> personMapper = (rs, rowNum) -> new Person(
        rs.getLong("id"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("nickname"),
        rs.getObject("birth_date", LocalDate.class),
        rs.getObject("death_date", LocalDate.class),
        rs.getString("gender"),
        rs.getString("notes"),
        readAttributes(rs.getLong("id"), rs.getString("attributes"))
    );

    private static final RowMapper<Relationship> RELATIONSHIP_MAPPER = (rs, rowNum) -> new Relationship(
        rs.getLong("id"),
        rs.getObject("person1_id") != null ? rs.getLong("person1_id") : null,
        rs.getObject("person2_id") != null ? rs.getLong("person2_id") : null,
        RelationshipType.fromLabel(rs.getString("rel_type")).orElse(null),
        rs.getObject("start_date", LocalDate.class),
        rs.getObject("end_date", LocalDate.class),
        rs.getString("notes")
    );

    public JdbcGraphSnapshotRepository(JdbcTemplate jdbc, TransactionTemplate transactions, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.transactions = transactions;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<GraphSnapshot> load() {
        List<Long> versions = jdbc.queryForList("SELECT graph_version FROM graph_snapshot WHERE id = 1", Long.class);
        if (versions.isEmpty()) {
            log.info("No stored graph snapshot found");
            return Optional.empty();
        }
        List<Person> people = jdbc.query("SELECT * FROM person ORDER BY id", personMapper);
        List<Relationship> relationships = jdbc.query("SELECT * FROM relationship ORDER BY id", RELATIONSHIP_MAPPER);
        return Optional.of(new GraphSnapshot(versions.get(0), people, relationships));
    }

    @Override
    public void save(GraphSnapshot snapshot) {
        List<Object[]> personRows = new ArrayList<>(snapshot.people().size());
        for (Person p : snapshot.people()) {
            personRows.add(new Object[] {
                p.id(), p.firstName(), p.lastName(), p.nickname(), p.birthDate(), p.deathDate(),
                p.gender(), p.notes(), writeAttributes(p)
            });
        }
        List<Object[]> relationshipRows = new ArrayList<>(snapshot.relationships().size());
        for (Relationship r : snapshot.relationships()) {
            relationshipRows.add(new Object[] {
                r.id(), r.person1Id(), r.person2Id(), r.type().label(), r.startDate(), r.endDate(), r.notes()
            });
        }

        transactions.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM relationship");
            jdbc.update("DELETE FROM person");
            if (!personRows.isEmpty()) {
                jdbc.batchUpdate("""
                INSERT INTO person (id, first_name, last_name, nickname, birth_date, death_date,
                                    gender, notes, attributes)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, personRows);
            }
            if (!relationshipRows.isEmpty()) {
                jdbc.batchUpdate("""
                INSERT INTO relationship (id, person1_id, person2_id, rel_type, start_date, end_date, notes)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """, relationshipRows);
            }
            jdbc.update("DELETE FROM graph_snapshot");
            jdbc.update("INSERT INTO graph_snapshot (id, graph_version, saved_at) VALUES (1, ?, ?)",
                snapshot.version(), Timestamp.from(Instant.now()));
        });
        log.debug("Saved graph version {} ({} people, {} relationships)",
            snapshot.version(), personRows.size(), relationshipRows.size());
    }

    private String writeAttributes(Person person) {
        if (person.attributes().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(person.attributes());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Attributes of person " + person.id() + " cannot be stored as JSON", e);
        }
    }

    private Map<String, Object> readAttributes(long personId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable attributes of person {}: {}", personId, e.getMessage());
            return Map.of();
        }
    }
}
