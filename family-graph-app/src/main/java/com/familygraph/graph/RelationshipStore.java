package com.familygraph.graph;

import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the Relationship records of one graph plus two indexes kept in step on every
 * write: person id to edge ids (adjacency) and (person1, person2, type) to edge id.
 */
class RelationshipStore {

    private final Map<Long, Relationship> byId = new LinkedHashMap<>();
    private final Map<Long, Set<Long>> byPerson = new HashMap<>();
    private final Map<EdgeKey, Long> byTriple = new HashMap<>();
    private long lastId;

    Optional<Relationship> get(Long id) {
        return Optional.ofNullable(byId.get(id));
    }

    Collection<Relationship> all() {
        return Collections.unmodifiableCollection(byId.values());
    }

    int size() {
        return byId.size();
    }

    Long nextId() {
        return ++lastId;
    }

    List<Relationship> forPerson(Long personId) {
        Set<Long> ids = byPerson.get(personId);
        if (ids == null) {
            return List.of();
        }
        List<Relationship> result = new ArrayList<>(ids.size());
        for (Long id : ids) {
            result.add(byId.get(id));
        }
        return result;
    }

    Optional<Relationship> find(Long person1Id, Long person2Id, RelationshipType type) {
        Long id = byTriple.get(new EdgeKey(person1Id, person2Id, type));
        return id == null ? Optional.empty() : Optional.of(byId.get(id));
    }

    void put(Relationship relationship) {
        remove(relationship.id());
        byId.put(relationship.id(), relationship);
        byPerson.computeIfAbsent(relationship.person1Id(), k -> new LinkedHashSet<>()).add(relationship.id());
        byPerson.computeIfAbsent(relationship.person2Id(), k -> new LinkedHashSet<>()).add(relationship.id());
        byTriple.put(EdgeKey.of(relationship), relationship.id());
        lastId = Math.max(lastId, relationship.id());
    }

    Optional<Relationship> remove(Long id) {
        Relationship removed = byId.remove(id);
        if (removed == null) {
            return Optional.empty();
        }
        unindex(removed.person1Id(), id);
        unindex(removed.person2Id(), id);
        byTriple.remove(EdgeKey.of(removed));
        return Optional.of(removed);
    }

    private void unindex(Long personId, Long relationshipId) {
        Set<Long> ids = byPerson.get(personId);
        if (ids != null) {
            ids.remove(relationshipId);
            if (ids.isEmpty()) {
                byPerson.remove(personId);
            }
        }
    }

    private record EdgeKey(Long person1Id, Long person2Id, RelationshipType type) {
        static EdgeKey of(Relationship r) {
            return new EdgeKey(r.person1Id(), r.person2Id(), r.type());
        }
    }
}
