package com.familygraph.graph;

import com.familygraph.model.Reciprocal;
import com.familygraph.model.Reciprocal.Resolution;
import com.familygraph.model.RelationshipType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.familygraph.model.RelationshipType.*;

/**
 * Maps a relationship type to its semantic inverse. Used to read edges from the other
 * end; never writes a second edge.
 * <p>
 * Lookup order is the table key, then an explicit override for values shared by
 * several keys, then the single key that maps to the type, and finally "no
 * reciprocal" (the type itself, flagged {@link Resolution#UNDEFINED}). Every type is
 * resolved once at construction and a table that leaves a type ambiguous or
 * unaccounted for is rejected.
 */
public class ReciprocityResolver {

    static final Map<RelationshipType, RelationshipType> STANDARD_TABLE = standardTable();

    static final Map<RelationshipType, RelationshipType> STANDARD_OVERRIDES = Map.of(
        AUNT_OR_UNCLE, NEPHEW_OR_NIECE,
        NEPHEW_OR_NIECE, AUNT_OR_UNCLE
    );

    static final Set<RelationshipType> STANDARD_UNDEFINED = EnumSet.of(OTHER);

    private static final ReciprocityResolver STANDARD =
        new ReciprocityResolver(STANDARD_TABLE, STANDARD_OVERRIDES, STANDARD_UNDEFINED);

    private final Map<RelationshipType, Reciprocal> resolved;

    ReciprocityResolver(Map<RelationshipType, RelationshipType> table,
                        Map<RelationshipType, RelationshipType> overrides,
                        Set<RelationshipType> undefined) {
        Map<RelationshipType, Reciprocal> result = new EnumMap<>(RelationshipType.class);
        for (RelationshipType type : RelationshipType.values()) {
            result.put(type, resolve(type, table, overrides, undefined));
        }
        for (Map.Entry<RelationshipType, Reciprocal> entry : result.entrySet()) {
            RelationshipType type = entry.getKey();
            if (type.isSymmetric() && entry.getValue().type() != type) {
                throw new IllegalStateException("Symmetric type " + type.label() + " must map to itself");
            }
        }
        this.resolved = Collections.unmodifiableMap(result);
    }

    public static ReciprocityResolver standard() {
        return STANDARD;
    }

    public Reciprocal reciprocal(RelationshipType type) {
        return resolved.get(type);
    }

    /** Shorthand for the inverse type; the input itself when none is defined. */
    public RelationshipType inverse(RelationshipType type) {
        return resolved.get(type).type();
    }

    /** True when {@code candidate} is the defined inverse of {@code type}. */
    public boolean isReciprocalOf(RelationshipType candidate, RelationshipType type) {
        Reciprocal reciprocal = resolved.get(type);
        return reciprocal.defined() && reciprocal.type() == candidate;
    }

    private static Reciprocal resolve(RelationshipType type,
                                      Map<RelationshipType, RelationshipType> table,
                                      Map<RelationshipType, RelationshipType> overrides,
                                      Set<RelationshipType> undefined) {
        if (table.containsKey(type)) {
            return new Reciprocal(table.get(type), Resolution.DIRECT);
        }
        if (overrides.containsKey(type)) {
            return new Reciprocal(overrides.get(type), Resolution.OVERRIDE);
        }
        List<RelationshipType> keys = new ArrayList<>();
        for (RelationshipType key : RelationshipType.values()) {
            if (table.get(key) == type) {
                keys.add(key);
            }
        }
        if (keys.size() == 1) {
            return new Reciprocal(keys.get(0), Resolution.REVERSE);
        }
        if (keys.size() > 1) {
            throw new IllegalStateException("Reciprocal of " + type.label()
                + " is ambiguous between " + keys + "; add an override");
        }
        if (undefined.contains(type)) {
            return new Reciprocal(type, Resolution.UNDEFINED);
        }
        throw new IllegalStateException("No reciprocal declared for " + type.label());
    }

    private static Map<RelationshipType, RelationshipType> standardTable() {
        Map<RelationshipType, RelationshipType> table = new EnumMap<>(RelationshipType.class);
        table.put(PARENT, CHILD);
        table.put(CHILD, PARENT);
        table.put(SPOUSE, SPOUSE);
        table.put(PARTNER, PARTNER);
        table.put(DIVORCED, DIVORCED);
        table.put(SIBLING, SIBLING);
        table.put(HALF_SIBLING, HALF_SIBLING);
        table.put(STEP_SIBLING, STEP_SIBLING);
        table.put(COUSIN, COUSIN);
        table.put(FRIEND, FRIEND);
        table.put(GRANDPARENT, GRANDCHILD);
        table.put(GRANDCHILD, GRANDPARENT);
        table.put(AUNT, NEPHEW_OR_NIECE);
        table.put(UNCLE, NEPHEW_OR_NIECE);
        table.put(NEPHEW, AUNT_OR_UNCLE);
        table.put(NIECE, AUNT_OR_UNCLE);
        table.put(STEP_PARENT, STEP_CHILD);
        table.put(STEP_CHILD, STEP_PARENT);
        table.put(ADOPTIVE_PARENT, ADOPTED_CHILD);
        table.put(ADOPTED_CHILD, ADOPTIVE_PARENT);
        table.put(GODPARENT, GODCHILD);
        table.put(GODCHILD, GODPARENT);
        table.put(GUARDIAN, WARD);
        table.put(WARD, GUARDIAN);
        return Collections.unmodifiableMap(table);
    }
}
