package com.familygraph.model;

import java.time.LocalDate;
import java.time.Period;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Person(
    Long id,
    String firstName,
    String lastName,
    String nickname,
    LocalDate birthDate,
    LocalDate deathDate,
    String gender,
    String notes,
    Map<String, Object> attributes
) {
    public Person {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName);
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(lastName);
        }
        return sb.length() == 0 ? "Unknown" : sb.toString();
    }

    public String displayName() {
        if (nickname != null && !nickname.isBlank()) {
            return fullName() + " (" + nickname + ")";
        }
        return fullName();
    }

    public String lifespan() {
        Integer birth = birthYear();
        Integer death = deathYear();
        if (birth == null && death == null) {
            return "";
        }
        String birthStr = birth != null ? String.valueOf(birth) : "?";
        String deathStr = death != null ? String.valueOf(death) : "";
        if (deathStr.isEmpty() && birth != null) {
            return "b. " + birthStr;
        }
        return birthStr + " - " + deathStr;
    }

    public Integer birthYear() {
        return birthDate != null ? birthDate.getYear() : null;
    }

    public Integer deathYear() {
        return deathDate != null ? deathDate.getYear() : null;
    }

    /**
     * Age in whole years on the given day, or at death if that came first.
     * Null when the birth date is unknown.
     */
    public Integer ageOn(LocalDate day) {
        if (birthDate == null) {
            return null;
        }
        LocalDate end = deathDate != null && deathDate.isBefore(day) ? deathDate : day;
        return Period.between(birthDate, end).getYears();
    }
}
