package com.familygraph.service;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.GraphReader;
import com.familygraph.graph.GraphWriter;
import com.familygraph.graph.ValidationException;
import com.familygraph.model.ConsistencyIssue;
import com.familygraph.model.ConsistencyIssue.Kind;
import com.familygraph.model.DuplicateCandidate;
import com.familygraph.model.MergeResult;
import com.familygraph.model.Person;
import com.familygraph.model.Reciprocal;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only checks over a person's edges, duplicate-person detection, and the one
 * mutation that repairs duplicates: merge.
 */
@Service
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final DuplicatePolicy duplicatePolicy;
    private final int maxVisited;

    public ConsistencyChecker(DuplicatePolicy duplicatePolicy, GraphTraversal traversal) {
        this.duplicatePolicy = duplicatePolicy;
        this.maxVisited = traversal.limits().maxVisited();
    }

    // ========== CHECKS ==========

    public List<ConsistencyIssue> check(FamilyGraph graph, Long personId) {
        return graph.read(r -> {
            r.requirePerson(personId);
            return checkPerson(r, personId);
        });
    }

    /** Every person's issues; an edge problem seen from both ends is reported once. */
    public List<ConsistencyIssue> checkAll(FamilyGraph graph) {
        return graph.read(r -> {
            List<ConsistencyIssue> issues = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Person person : r.people()) {
                for (ConsistencyIssue issue : checkPerson(r, person.id())) {
                    if (issue.kind() == Kind.PARENT_CYCLE || seen.add(issue.kind() + ":" + issue.relationshipIds())) {
                        issues.add(issue);
                    }
                }
            }
            return issues;
        });
    }

    private List<ConsistencyIssue> checkPerson(GraphReader r, Long personId) {
        List<ConsistencyIssue> issues = new ArrayList<>();
        for (Relationship rel : r.relationshipsOf(personId)) {
            if (rel.person1Id().equals(rel.person2Id())) {
                issues.add(new ConsistencyIssue(Kind.SELF_RELATIONSHIP, personId, List.of(rel.id()),
                    "Relationship " + rel.id() + " links person " + personId + " to themselves"));
                continue;
            }
            checkReciprocals(r, personId, rel, issues);
        }
        checkParentCycle(r, personId).ifPresent(issues::add);
        checkBirthOrder(r, personId, issues);
        return issues;
    }

    /**
     * Flags a type stored next to its own reciprocal on the same ordered pair, and an
     * edge stored a second time as its reciprocal in the other direction. Each pair is
     * reported from the edge with the lower id.
     */
    private static void checkReciprocals(GraphReader r, Long personId, Relationship rel,
                                         List<ConsistencyIssue> issues) {
        Reciprocal reciprocal = r.reciprocity().reciprocal(rel.type());
        if (!reciprocal.defined()) {
            return;
        }
        RelationshipType inverse = reciprocal.type();
        if (inverse != rel.type()) {
            r.findEdge(rel.person1Id(), rel.person2Id(), inverse)
                .filter(other -> rel.id() < other.id())
                .ifPresent(other -> issues.add(new ConsistencyIssue(Kind.CONFLICTING_DIRECTION, personId,
                    List.of(rel.id(), other.id()),
                    "Person " + rel.person1Id() + " is recorded as both " + rel.type().label()
                        + " and " + inverse.label() + " of person " + rel.person2Id())));
        }
        r.findEdge(rel.person2Id(), rel.person1Id(), inverse)
            .filter(other -> rel.id() < other.id())
            .ifPresent(other -> issues.add(new ConsistencyIssue(Kind.RECIPROCAL_DUPLICATE, personId,
                List.of(rel.id(), other.id()),
                "Relationship " + other.id() + " repeats " + rel.id() + " from the other side")));
    }

    /** Walks parent links upward; reaching the start again means the person is their own ancestor. */
    private Optional<ConsistencyIssue> checkParentCycle(GraphReader r, Long personId) {
        Map<Long, Relationship> reachedBy = new HashMap<>();
        Set<Long> visited = new HashSet<>();
        Deque<Long> queue = new ArrayDeque<>();
        visited.add(personId);
        queue.add(personId);

        while (!queue.isEmpty() && visited.size() <= maxVisited) {
            Long current = queue.poll();
            for (Relationship link : parentLinks(r, current)) {
                Long parent = parentOf(link, current);
                if (parent.equals(personId)) {
                    List<Long> path = new LinkedList<>();
                    path.add(link.id());
                    Long step = current;
                    while (!step.equals(personId)) {
                        Relationship via = reachedBy.get(step);
                        path.add(0, via.id());
                        step = childOf(via, step);
                    }
                    return Optional.of(new ConsistencyIssue(Kind.PARENT_CYCLE, personId, path,
                        "Person " + personId + " is their own ancestor"));
                }
                if (visited.add(parent)) {
                    reachedBy.put(parent, link);
                    queue.add(parent);
                }
            }
        }
        return Optional.empty();
    }

    private static void checkBirthOrder(GraphReader r, Long personId, List<ConsistencyIssue> issues) {
        for (Relationship link : parentLinks(r, personId)) {
            compareBirths(r, parentOf(link, personId), personId, link, issues);
        }
        for (Relationship rel : r.relationshipsOf(personId)) {
            Long other = rel.otherPerson(personId);
            if (other != null && parentLinks(r, other).contains(rel) && parentOf(rel, other).equals(personId)) {
                compareBirths(r, personId, other, rel, issues);
            }
        }
    }

    private static void compareBirths(GraphReader r, Long parentId, Long childId, Relationship link,
                                      List<ConsistencyIssue> issues) {
        Person parent = r.person(parentId).orElse(null);
        Person child = r.person(childId).orElse(null);
        if (parent == null || child == null || parent.birthDate() == null || child.birthDate() == null) {
            return;
        }
        if (parent.birthDate().isAfter(child.birthDate())) {
            issues.add(new ConsistencyIssue(Kind.PARENT_BORN_AFTER_CHILD, childId, List.of(link.id()),
                parent.fullName() + " (b. " + parent.birthDate() + ") is recorded as parent of "
                    + child.fullName() + " (b. " + child.birthDate() + ")"));
        }
    }

    /** Edges that make someone a parent of {@code childId}: PARENT edges into them and CHILD edges out of them. */
    private static List<Relationship> parentLinks(GraphReader r, Long childId) {
        List<Relationship> links = new ArrayList<>();
        for (Relationship rel : r.relationshipsOf(childId)) {
            if (rel.person1Id().equals(rel.person2Id())) {
                continue;
            }
            if (rel.type() == RelationshipType.PARENT && rel.person2Id().equals(childId)) {
                links.add(rel);
            } else if (r.reciprocity().isReciprocalOf(RelationshipType.PARENT, rel.type())
                && rel.person1Id().equals(childId)) {
                links.add(rel);
            }
        }
        return links;
    }

    private static Long parentOf(Relationship link, Long childId) {
        return link.otherPerson(childId);
    }

    private static Long childOf(Relationship link, Long parentId) {
        return link.otherPerson(parentId);
    }

    // ========== DUPLICATES ==========

    /** Candidate pairs for review, lower id first. Nothing is merged. */
    public List<DuplicateCandidate> findDuplicates(FamilyGraph graph) {
        return graph.read(r -> {
            Map<String, List<Person>> blocks = new LinkedHashMap<>();
            r.people().stream()
                .sorted(Comparator.comparing(Person::id))
                .forEach(p -> duplicatePolicy.blockingKey(p)
                    .ifPresent(key -> blocks.computeIfAbsent(key, k -> new ArrayList<>()).add(p)));

            List<DuplicateCandidate> candidates = new ArrayList<>();
            for (List<Person> block : blocks.values()) {
                for (int i = 0; i < block.size(); i++) {
                    for (int j = i + 1; j < block.size(); j++) {
                        Person first = block.get(i);
                        Person second = block.get(j);
                        duplicatePolicy.match(first, second)
                            .ifPresent(reason -> candidates.add(new DuplicateCandidate(first, second, reason)));
                    }
                }
            }
            log.debug("Found {} duplicate candidates in {} blocks", candidates.size(), blocks.size());
            return candidates;
        });
    }

    // ========== MERGE ==========

    /**
     * Moves every edge of {@code removeId} onto {@code keepId}, then deletes {@code removeId}.
     * An edge that would repeat a triple {@code keepId} already has, or that joined the two
     * people, is dropped; existing edges win.
     */
    public MergeResult merge(FamilyGraph graph, Long keepId, Long removeId, String actor) {
        return graph.write(actor, "merge_people", w -> {
            if (keepId == null || removeId == null) {
                throw new ValidationException("Both keepId and removeId are required");
            }
            if (keepId.equals(removeId)) {
                throw new ValidationException("Cannot merge person " + keepId + " into themselves");
            }
            w.requirePerson(keepId);
            Person removed = w.requirePerson(removeId);
            return fold(w, keepId, removed);
        });
    }

    private static MergeResult fold(GraphWriter w, Long keepId, Person removed) {
        Long removeId = removed.id();
        int rewritten = 0;
        int dropped = 0;
        for (Relationship rel : w.relationshipsOf(removeId)) {
            Long p1 = rel.person1Id().equals(removeId) ? keepId : rel.person1Id();
            Long p2 = rel.person2Id().equals(removeId) ? keepId : rel.person2Id();
            Optional<Relationship> clash = w.findEdge(p1, p2, rel.type());
            if (p1.equals(p2) || (clash.isPresent() && !clash.get().id().equals(rel.id()))) {
                w.removeRelationship(rel.id());
                dropped++;
            } else {
                w.putRelationship(rel.withPeople(p1, p2));
                rewritten++;
            }
        }
        w.removePerson(removeId);
        log.info("Merged person {} '{}' into {}: {} edges moved, {} dropped",
            removeId, removed.fullName(), keepId, rewritten, dropped);
        return new MergeResult(w.requirePerson(keepId), removeId, rewritten, dropped);
    }
}
