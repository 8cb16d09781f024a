package com.familygraph.graph;

import com.familygraph.model.GraphSnapshot;
import com.familygraph.model.Person;
import com.familygraph.model.PersonRelationship;
import com.familygraph.model.Reciprocal;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import com.familygraph.repository.GraphSnapshotRepository;
import com.familygraph.repository.InMemoryGraphSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * One family graph: its people, its relationships and the lock that guards them.
 * <p>
 * Writers are serialised. A mutation validates, writes the stores, bumps the version
 * and takes a snapshot under the write lock. The snapshot is persisted after the lock
 * is released, so neither readers nor the next writer wait on storage, and stored
 * versions only move forward. A storage failure leaves the in-memory commit in place
 * and is reported as {@link SnapshotPersistenceException}.
 */
public class FamilyGraph {

    private static final Logger log = LoggerFactory.getLogger(FamilyGraph.class);

    private static final Comparator<Person> BY_NAME = Comparator
        .comparing((Person p) -> p.lastName() == null ? "" : p.lastName().toLowerCase(Locale.ROOT))
        .thenComparing(p -> p.firstName() == null ? "" : p.firstName().toLowerCase(Locale.ROOT))
        .thenComparing(Person::id);

    private final PersonStore people = new PersonStore();
    private final RelationshipStore relationships = new RelationshipStore();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final State state = new State();
    private final ReciprocityResolver reciprocity;
    private final GraphSnapshotRepository snapshots;
    private final AuditTrail audit;
    private long version;
    private long savedVersion;

    public FamilyGraph(ReciprocityResolver reciprocity, GraphSnapshotRepository snapshots, AuditTrail audit) {
        this.reciprocity = reciprocity;
        this.snapshots = snapshots;
        this.audit = audit;
    }

    /** An empty graph with in-memory storage. */
    public static FamilyGraph inMemory() {
        return new FamilyGraph(ReciprocityResolver.standard(), new InMemoryGraphSnapshotRepository(), new AuditTrail(100));
    }

    /**
     * A graph loaded from a stored snapshot. Rows that break the graph invariants are
     * skipped with a warning rather than failing the load.
     */
    public static FamilyGraph restore(GraphSnapshot snapshot, ReciprocityResolver reciprocity,
                                      GraphSnapshotRepository snapshots, AuditTrail audit) {
        FamilyGraph graph = new FamilyGraph(reciprocity, snapshots, audit);
        graph.load(snapshot);
        return graph;
    }

    // ========== PEOPLE ==========

    public Person addPerson(Map<String, Object> fields, String actor) {
        return write(actor, "add_person", w -> {
            Person person = PersonFields.create(null, fields);
            Person created = new Person(w.nextPersonId(), person.firstName(), person.lastName(),
                person.nickname(), person.birthDate(), person.deathDate(), person.gender(),
                person.notes(), person.attributes());
            w.putPerson(created);
            log.info("Added person {} '{}'", created.id(), created.fullName());
            return created;
        });
    }

    public Person editPerson(Long id, Map<String, Object> updates, String actor) {
        return write(actor, "edit_person", w -> {
            Person existing = w.requirePerson(id);
            Person updated = PersonFields.edit(existing, updates);
            w.putPerson(updated);
            log.info("Updated person {}", id);
            return updated;
        });
    }

    /** Deletes the person together with every relationship that references them. */
    public Person deletePerson(Long id, String actor) {
        return write(actor, "delete_person", w -> {
            Person existing = w.requirePerson(id);
            List<Relationship> edges = w.relationshipsOf(id);
            for (Relationship edge : edges) {
                w.removeRelationship(edge.id());
            }
            w.removePerson(id);
            log.info("Deleted person {} '{}' and {} relationships", id, existing.fullName(), edges.size());
            return existing;
        });
    }

    // ========== RELATIONSHIPS ==========

    public Relationship addRelationship(Long person1Id, Long person2Id, RelationshipType type, String actor) {
        return addRelationship(person1Id, person2Id, type.label(), Map.of(), actor);
    }

    public Relationship addRelationship(Long person1Id, Long person2Id, String type,
                                        Map<String, Object> attributes, String actor) {
        return write(actor, "add_relationship", w -> insertRelationship(w,
            RelationshipFields.create(null, person1Id, person2Id, RelationshipFields.type(type), attributes)));
    }

    /** Creates a relationship from request fields: person1Id, person2Id, type, and optional dates and notes. */
    public Relationship addRelationship(Map<String, Object> fields, String actor) {
        return write(actor, "add_relationship", w -> insertRelationship(w, RelationshipFields.parse(fields)));
    }

    private static Relationship insertRelationship(GraphWriter w, Relationship draft) {
        checkEdge(w, draft);
        Relationship created = new Relationship(w.nextRelationshipId(), draft.person1Id(), draft.person2Id(),
            draft.type(), draft.startDate(), draft.endDate(), draft.notes());
        w.putRelationship(created);
        log.info("Added relationship {}: {} is {} of {}",
            created.id(), created.person1Id(), created.type().label(), created.person2Id());
        return created;
    }

    public Relationship editRelationship(Long id, Map<String, Object> updates, String actor) {
        return write(actor, "edit_relationship", w -> {
            Relationship existing = w.relationship(id).orElseThrow(() -> NotFoundException.relationship(id));
            Relationship updated = RelationshipFields.edit(existing, updates);
            checkEdge(w, updated);
            w.putRelationship(updated);
            log.info("Updated relationship {}", id);
            return updated;
        });
    }

    public Relationship deleteRelationship(Long id, String actor) {
        return write(actor, "delete_relationship", w -> {
            Relationship existing = w.relationship(id).orElseThrow(() -> NotFoundException.relationship(id));
            w.removeRelationship(id);
            log.info("Deleted relationship {}", id);
            return existing;
        });
    }

    /** Endpoint, self-edge and duplicate-triple checks shared by add and edit. */
    private static void checkEdge(GraphReader r, Relationship edge) {
        if (edge.person1Id() == null || edge.person2Id() == null) {
            throw new ValidationException("Both person1Id and person2Id are required");
        }
        if (edge.person1Id().equals(edge.person2Id())) {
            throw new ValidationException("A person cannot have a relationship with themselves");
        }
        r.requirePerson(edge.person1Id());
        r.requirePerson(edge.person2Id());
        Optional<Relationship> existing = r.findEdge(edge.person1Id(), edge.person2Id(), edge.type());
        if (existing.isPresent() && !existing.get().id().equals(edge.id())) {
            throw new DuplicateEdgeException(edge.person1Id(), edge.person2Id(), edge.type(), existing.get().id());
        }
    }

    // ========== QUERIES ==========

    public Optional<Person> findPerson(Long id) {
        return read(r -> r.person(id));
    }

    public Person getPerson(Long id) {
        return read(r -> r.requirePerson(id));
    }

    /** Everyone, ordered by last name then first name. */
    public List<Person> people() {
        return read(r -> r.people().stream().sorted(BY_NAME).toList());
    }

    /** Case-insensitive substring match on first name, last name or nickname. */
    public List<Person> search(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("A name to search for is required");
        }
        String needle = name.trim().toLowerCase(Locale.ROOT);
        return read(r -> r.people().stream()
            .filter(p -> contains(p.firstName(), needle) || contains(p.lastName(), needle)
                || contains(p.nickname(), needle))
            .sorted(BY_NAME)
            .toList());
    }

    public Relationship getRelationship(Long id) {
        return read(r -> r.relationship(id).orElseThrow(() -> NotFoundException.relationship(id)));
    }

    /** All relationships, or only those of one type when {@code type} is given. */
    public List<Relationship> relationships(RelationshipType type) {
        return read(r -> r.relationships().stream()
            .filter(rel -> type == null || rel.type() == type)
            .toList());
    }

    /** The person's relationships described from their side. */
    public List<PersonRelationship> relationshipsFrom(Long personId) {
        return read(r -> {
            r.requirePerson(personId);
            List<PersonRelationship> result = new ArrayList<>();
            for (Relationship rel : r.relationshipsOf(personId)) {
                if (rel.person1Id().equals(personId)) {
                    result.add(new PersonRelationship(rel, rel.person2Id(), rel.type(), true));
                } else {
                    Reciprocal reciprocal = reciprocity.reciprocal(rel.type());
                    result.add(new PersonRelationship(rel, rel.person1Id(), reciprocal.type(), reciprocal.defined()));
                }
            }
            return result;
        });
    }

    public long version() {
        return read(r -> version);
    }

    public ReciprocityResolver reciprocity() {
        return reciprocity;
    }

    public AuditTrail audit() {
        return audit;
    }

    // ========== LOCKING ==========

    /** Runs a query against a stable view; any number of readers may run at once. */
    public <T> T read(Function<GraphReader, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a mutation as the single writer, audits it and persists the resulting
     * snapshot. The mutation must validate everything before its first write.
     */
    public <T> T write(String actor, String action, Function<GraphWriter, T> mutation) {
        String who = actor == null || actor.isBlank() ? AuditTrail.SYSTEM : actor;
        T result;
        GraphSnapshot committed;
        lock.writeLock().lock();
        try {
            try {
                result = mutation.apply(state);
            } catch (FamilyGraphException e) {
                log.warn("{} by {} rejected: {}", action, who, e.getMessage());
                audit.record(who, action, false, e.getMessage());
                throw e;
            }
            version++;
            committed = state.snapshot(version);
        } finally {
            lock.writeLock().unlock();
        }
        audit.record(who, action, true, String.valueOf(result));
        persist(committed, result);
        return result;
    }

    /**
     * Saves outside the graph lock. Saves are serialised; a snapshot not newer than the
     * last stored one is skipped.
     */
    private void persist(GraphSnapshot snapshot, Object result) {
        saveLock.lock();
        try {
            if (snapshot.version() <= savedVersion) {
                log.debug("Graph version {} already covered by stored version {}", snapshot.version(), savedVersion);
                return;
            }
            snapshots.save(snapshot);
            savedVersion = snapshot.version();
        } catch (RuntimeException e) {
            log.error("Failed to persist graph version {}", snapshot.version(), e);
            throw new SnapshotPersistenceException(snapshot.version(), result, e);
        } finally {
            saveLock.unlock();
        }
    }

    private void load(GraphSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            int skipped = 0;
            for (Person person : snapshot.people()) {
                if (person.id() == null || people.contains(person.id())) {
                    log.warn("Skipping person with missing or repeated id: {}", person);
                    skipped++;
                    continue;
                }
                people.put(person);
            }
            for (Relationship rel : snapshot.relationships()) {
                if (rel.id() == null || relationships.get(rel.id()).isPresent()) {
                    log.warn("Skipping relationship with missing or repeated id: {}", rel);
                    skipped++;
                } else if (!people.contains(rel.person1Id()) || !people.contains(rel.person2Id())) {
                    log.warn("Skipping relationship {}: person {} or {} not loaded", rel.id(), rel.person1Id(), rel.person2Id());
                    skipped++;
                } else if (rel.person1Id().equals(rel.person2Id()) || rel.type() == null) {
                    log.warn("Skipping invalid relationship {}", rel);
                    skipped++;
                } else if (relationships.find(rel.person1Id(), rel.person2Id(), rel.type()).isPresent()) {
                    log.warn("Skipping duplicate relationship {}", rel);
                    skipped++;
                } else {
                    relationships.put(rel);
                }
            }
            version = snapshot.version();
            savedVersion = snapshot.version();
            log.info("Loaded {} people and {} relationships at version {} ({} entries skipped)",
                people.size(), relationships.size(), version, skipped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    /** Store-backed view shared by readers and the writer; only used under the lock. */
    private final class State implements GraphWriter {

        @Override
        public Optional<Person> person(Long id) {
            return people.get(id);
        }

        @Override
        public Collection<Person> people() {
            return people.all();
        }

        @Override
        public int personCount() {
            return people.size();
        }

        @Override
        public Optional<Relationship> relationship(Long id) {
            return relationships.get(id);
        }

        @Override
        public List<Relationship> relationshipsOf(Long personId) {
            return relationships.forPerson(personId);
        }

        @Override
        public Collection<Relationship> relationships() {
            return relationships.all();
        }

        @Override
        public int relationshipCount() {
            return relationships.size();
        }

        @Override
        public Optional<Relationship> findEdge(Long person1Id, Long person2Id, RelationshipType type) {
            return relationships.find(person1Id, person2Id, type);
        }

        @Override
        public List<Long> parentsOf(Long personId) {
            Set<Long> parents = new LinkedHashSet<>();
            for (Relationship rel : relationships.forPerson(personId)) {
                if (rel.type() == RelationshipType.PARENT && rel.person2Id().equals(personId)) {
                    parents.add(rel.person1Id());
                } else if (reciprocity.isReciprocalOf(RelationshipType.PARENT, rel.type())
                    && rel.person1Id().equals(personId)) {
                    parents.add(rel.person2Id());
                }
            }
            return List.copyOf(parents);
        }

        @Override
        public List<Long> childrenOf(Long personId) {
            Set<Long> children = new LinkedHashSet<>();
            for (Relationship rel : relationships.forPerson(personId)) {
                if (rel.type() == RelationshipType.PARENT && rel.person1Id().equals(personId)) {
                    children.add(rel.person2Id());
                } else if (reciprocity.isReciprocalOf(RelationshipType.PARENT, rel.type())
                    && rel.person2Id().equals(personId)) {
                    children.add(rel.person1Id());
                }
            }
            return List.copyOf(children);
        }

        @Override
        public ReciprocityResolver reciprocity() {
            return reciprocity;
        }

        @Override
        public Long nextPersonId() {
            return people.nextId();
        }

        @Override
        public Long nextRelationshipId() {
            return relationships.nextId();
        }

        @Override
        public void putPerson(Person person) {
            people.put(person);
        }

        @Override
        public void removePerson(Long id) {
            people.remove(id);
        }

        @Override
        public void putRelationship(Relationship relationship) {
            relationships.put(relationship);
        }

        @Override
        public void removeRelationship(Long id) {
            relationships.remove(id);
        }

        GraphSnapshot snapshot(long atVersion) {
            return new GraphSnapshot(atVersion, new ArrayList<>(people.all()), new ArrayList<>(relationships.all()));
        }
    }
}
