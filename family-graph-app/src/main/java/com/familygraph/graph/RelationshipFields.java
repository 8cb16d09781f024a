package com.familygraph.graph;

import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Parsing and field-level validation for relationships. Checks that need the graph
 * (endpoints exist, duplicate triples) live in {@link FamilyGraph}.
 */
final class RelationshipFields {

    private static final Logger log = LoggerFactory.getLogger(RelationshipFields.class);

    private static final List<String> PERSON1 = List.of("person1Id", "person1_id");
    private static final List<String> PERSON2 = List.of("person2Id", "person2_id");
    private static final List<String> TYPE = List.of("type", "relationshipType", "relationship_type", "rel_type");
    private static final List<String> START_DATE = List.of("startDate", "start_date");
    private static final List<String> END_DATE = List.of("endDate", "end_date");
    private static final List<String> NOTES = List.of("notes", "description");

    private RelationshipFields() {
    }

    static RelationshipType type(Object value) {
        if (value instanceof RelationshipType type) {
            return type;
        }
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new ValidationException("Relationship type is required");
        }
        if (!(value instanceof String label)) {
            throw new ValidationException("Relationship type must be a string");
        }
        return RelationshipType.fromLabel(label)
            .orElseThrow(() -> new ValidationException("Unknown relationship type: " + label));
    }

    /** A relationship without id from request fields: both person ids, the type, and optional attributes. */
    static Relationship parse(Map<String, Object> fields) {
        Map<String, Object> input = fields == null ? Map.of() : fields;
        Long person1Id = Ids.parse(value(input, PERSON1), "person1Id");
        Long person2Id = Ids.parse(value(input, PERSON2), "person2Id");
        RelationshipType type = type(value(input, TYPE));
        return create(null, person1Id, person2Id, type, input);
    }

    static Relationship create(Long id, Long person1Id, Long person2Id, RelationshipType type,
                               Map<String, Object> attributes) {
        Map<String, Object> attrs = attributes == null ? Map.of() : attributes;
        LocalDate startDate = PersonFields.parseDate(value(attrs, START_DATE), "startDate");
        LocalDate endDate = PersonFields.parseDate(value(attrs, END_DATE), "endDate");
        String notes = PersonFields.text(value(attrs, NOTES), "notes");
        checkDates(startDate, endDate);
        return new Relationship(id, person1Id, person2Id, type, startDate, endDate, notes);
    }

    static Relationship edit(Relationship existing, Map<String, Object> updates) {
        Map<String, Object> input = updates == null ? Map.of() : updates;
        Long person1Id = existing.person1Id();
        Long person2Id = existing.person2Id();
        RelationshipType type = existing.type();
        LocalDate startDate = existing.startDate();
        LocalDate endDate = existing.endDate();
        String notes = existing.notes();

        for (String key : input.keySet()) {
            Object value = input.get(key);
            if (PERSON1.contains(key)) {
                person1Id = Ids.parse(value, "person1Id");
            } else if (PERSON2.contains(key)) {
                person2Id = Ids.parse(value, "person2Id");
            } else if (TYPE.contains(key)) {
                type = type(value);
            } else if (START_DATE.contains(key)) {
                startDate = PersonFields.parseDate(value, "startDate");
            } else if (END_DATE.contains(key)) {
                endDate = PersonFields.parseDate(value, "endDate");
            } else if (NOTES.contains(key)) {
                notes = PersonFields.text(value, "notes");
            } else if (!"id".equals(key)) {
                log.warn("Ignoring unknown relationship field '{}' for relationship {}", key, existing.id());
            }
        }
        checkDates(startDate, endDate);
        return new Relationship(existing.id(), person1Id, person2Id, type, startDate, endDate, notes);
    }

    private static void checkDates(LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("End date " + endDate + " is before start date " + startDate);
        }
    }

    private static Object value(Map<String, Object> map, List<String> aliases) {
        for (String alias : aliases) {
            if (map.containsKey(alias)) {
                return map.get(alias);
            }
        }
        return null;
    }
}
