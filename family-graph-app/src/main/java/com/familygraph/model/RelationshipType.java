package com.familygraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed vocabulary of relationship types.
 * For asymmetric types person1 is the {@code type} of person2, e.g. a PARENT edge
 * reads "person1 is the parent of person2".
 */
public enum RelationshipType {

    PARENT("parent", false),
    CHILD("child", false),
    SPOUSE("spouse", true),
    PARTNER("partner", true),
    DIVORCED("divorced", true),
    SIBLING("sibling", true),
    HALF_SIBLING("half_sibling", true),
    STEP_SIBLING("step_sibling", true),
    COUSIN("cousin", true),
    GRANDPARENT("grandparent", false),
    GRANDCHILD("grandchild", false),
    AUNT("aunt", false),
    UNCLE("uncle", false),
    NEPHEW("nephew", false),
    NIECE("niece", false),
    AUNT_OR_UNCLE("aunt_or_uncle", false),
    NEPHEW_OR_NIECE("nephew_or_niece", false),
    STEP_PARENT("step_parent", false),
    STEP_CHILD("step_child", false),
    ADOPTIVE_PARENT("adoptive_parent", false),
    ADOPTED_CHILD("adopted_child", false),
    GODPARENT("godparent", false),
    GODCHILD("godchild", false),
    GUARDIAN("guardian", false),
    WARD("ward", false),
    FRIEND("friend", true),
    OTHER("other", false);

    private final String label;
    private final boolean symmetric;

    RelationshipType(String label, boolean symmetric) {
        this.label = label;
        this.symmetric = symmetric;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Direction-irrelevant types such as spouse or sibling. */
    public boolean isSymmetric() {
        return symmetric;
    }

    /**
     * Parse a label leniently: case, surrounding blanks, spaces and hyphens are ignored
     * and "a/b" is read as "a_or_b", so "Step-Parent" and "aunt/uncle" both resolve.
     */
    public static Optional<RelationshipType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT)
            .replace("/", "_or_")
            .replaceAll("[\\s\\-]+", "_");
        for (RelationshipType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static RelationshipType fromJson(String label) {
        return fromLabel(label)
            .orElseThrow(() -> new IllegalArgumentException("Unknown relationship type: " + label));
    }
}
