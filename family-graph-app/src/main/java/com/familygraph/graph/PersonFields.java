package com.familygraph.graph;

import com.familygraph.model.Person;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns request field maps into validated Person records. Known fields accept the
 * camelCase name and a couple of aliases; any other key is kept as a free-form attribute.
 */
final class PersonFields {

    private static final List<String> FIRST_NAME = List.of("firstName", "first_name", "forename");
    private static final List<String> LAST_NAME = List.of("lastName", "last_name", "surname");
    private static final List<String> NICKNAME = List.of("nickname");
    private static final List<String> BIRTH_DATE = List.of("birthDate", "birth_date", "dob");
    private static final List<String> DEATH_DATE = List.of("deathDate", "death_date", "dod");
    private static final List<String> GENDER = List.of("gender");
    private static final List<String> NOTES = List.of("notes");
    private static final List<String> ATTRIBUTES = List.of("attributes");

    /** Column widths of the person table; notes and attributes are unbounded. */
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_GENDER_LENGTH = 50;

    private static final Set<String> IGNORED = Set.of("id", "personId", "person_id");

    private static final List<List<String>> KNOWN = List.of(
        FIRST_NAME, LAST_NAME, NICKNAME, BIRTH_DATE, DEATH_DATE, GENDER, NOTES, ATTRIBUTES
    );

    private PersonFields() {
    }

    static Person create(Long id, Map<String, Object> fields) {
        Person blank = new Person(id, null, "", null, null, null, null, null, Map.of());
        Person created = apply(blank, fields == null ? Map.of() : fields);
        if (created.firstName() == null) {
            throw new ValidationException("First name is required");
        }
        return created;
    }

    static Person edit(Person existing, Map<String, Object> updates) {
        return apply(existing, updates == null ? Map.of() : updates);
    }

    static LocalDate parseDate(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException(field + " must be a date string (yyyy-MM-dd)");
        }
        if (text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + " '" + text + "': expected yyyy-MM-dd");
        }
    }

    /** Trimmed text, or null when absent or blank. */
    static String text(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException(field + " must be a string");
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String text(Object value, String field, int maxLength) {
        String trimmed = text(value, field);
        if (trimmed != null && trimmed.length() > maxLength) {
            throw new ValidationException(field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }

    private static Person apply(Person base, Map<String, Object> updates) {
        String firstName = base.firstName();
        String lastName = base.lastName();
        String nickname = base.nickname();
        LocalDate birthDate = base.birthDate();
        LocalDate deathDate = base.deathDate();
        String gender = base.gender();
        String notes = base.notes();
        Map<String, Object> attributes = new LinkedHashMap<>(base.attributes());

        String key = presentKey(updates, FIRST_NAME);
        if (key != null) {
            firstName = text(updates.get(key), "firstName", MAX_NAME_LENGTH);
            if (firstName == null) {
                throw new ValidationException("First name cannot be empty");
            }
        }
        key = presentKey(updates, LAST_NAME);
        if (key != null) {
            String value = text(updates.get(key), "lastName", MAX_NAME_LENGTH);
            lastName = value == null ? "" : value;
        }
        key = presentKey(updates, NICKNAME);
        if (key != null) {
            nickname = text(updates.get(key), "nickname", MAX_NAME_LENGTH);
        }
        key = presentKey(updates, BIRTH_DATE);
        if (key != null) {
            birthDate = parseDate(updates.get(key), "birthDate");
        }
        key = presentKey(updates, DEATH_DATE);
        if (key != null) {
            deathDate = parseDate(updates.get(key), "deathDate");
        }
        key = presentKey(updates, GENDER);
        if (key != null) {
            gender = text(updates.get(key), "gender", MAX_GENDER_LENGTH);
        }
        key = presentKey(updates, NOTES);
        if (key != null) {
            notes = text(updates.get(key), "notes");
        }
        key = presentKey(updates, ATTRIBUTES);
        if (key != null) {
            Object value = updates.get(key);
            if (value == null) {
                attributes.clear();
            } else if (value instanceof Map<?, ?> map) {
                map.forEach((k, v) -> attributes.put(String.valueOf(k), v));
            } else {
                throw new ValidationException("attributes must be an object");
            }
        }

        for (Map.Entry<String, Object> entry : updates.entrySet()) {
            if (!isKnown(entry.getKey()) && !IGNORED.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }

        if (birthDate != null && deathDate != null && deathDate.isBefore(birthDate)) {
            throw new ValidationException("Death date " + deathDate + " is before birth date " + birthDate);
        }

        return new Person(base.id(), firstName, lastName, nickname, birthDate, deathDate, gender, notes, attributes);
    }

    private static String presentKey(Map<String, Object> updates, List<String> aliases) {
        for (String alias : aliases) {
            if (updates.containsKey(alias)) {
                return alias;
            }
        }
        return null;
    }

    private static boolean isKnown(String key) {
        for (List<String> aliases : KNOWN) {
            if (aliases.contains(key)) {
                return true;
            }
        }
        return false;
    }
}
