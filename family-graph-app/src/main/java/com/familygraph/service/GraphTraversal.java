package com.familygraph.service;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.GraphReader;
import com.familygraph.graph.TraversalLimits;
import com.familygraph.graph.ValidationException;
import com.familygraph.model.PartialTree;
import com.familygraph.model.Person;
import com.familygraph.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Depth-bounded breadth-first queries over a {@link FamilyGraph}.
 * <p>
 * Every query checks that the start person exists before looking at the depth, so an
 * unknown id is always {@link com.familygraph.graph.NotFoundException}. A depth of 0
 * returns an empty result without traversing; negative depths are rejected and depths
 * above the configured ceiling are clamped. Each walk keeps a visited set, so a cycle
 * among parent edges terminates.
 */
@Service
public class GraphTraversal {

    private static final Logger log = LoggerFactory.getLogger(GraphTraversal.class);

    private final TraversalLimits limits;

    public GraphTraversal(TraversalLimits limits) {
        this.limits = limits;
    }

    public TraversalLimits limits() {
        return limits;
    }

    // ========== ANCESTORS / DESCENDANTS ==========

    public List<Person> ancestors(FamilyGraph graph, Long id, Integer depth) {
        return graph.read(r -> {
            r.requirePerson(id);
            return toPeople(r, ancestorIds(r, id, limits.clampDepth(depth)));
        });
    }

    public List<Person> descendants(FamilyGraph graph, Long id, Integer depth) {
        return graph.read(r -> {
            r.requirePerson(id);
            return toPeople(r, descendantIds(r, id, limits.clampDepth(depth)));
        });
    }

    /** Ancestor ids in discovery order; {@code depth} must already be clamped. */
    public Set<Long> ancestorIds(GraphReader r, Long id, int depth) {
        return walk(r, id, depth, r::parentsOf);
    }

    public Set<Long> descendantIds(GraphReader r, Long id, int depth) {
        return walk(r, id, depth, r::childrenOf);
    }

    // ========== SIBLINGS ==========

    /**
     * Everyone who shares at least one parent with the person. Full and half siblings
     * are both included.
     */
    public List<Person> siblings(FamilyGraph graph, Long id) {
        return graph.read(r -> {
            r.requirePerson(id);
            return toPeople(r, siblingIds(r, id));
        });
    }

    public Set<Long> siblingIds(GraphReader r, Long id) {
        Set<Long> siblings = new LinkedHashSet<>();
        for (Long parentId : r.parentsOf(id)) {
            siblings.addAll(r.childrenOf(parentId));
        }
        siblings.remove(id);
        return siblings;
    }

    // ========== EXTENDED FAMILY / RELATED ==========

    /** Walks parent edges upward, like {@link #ancestors}. Collateral relatives are not included. */
    public List<Person> extendedFamily(FamilyGraph graph, Long id, Integer depth) {
        return graph.read(r -> {
            r.requirePerson(id);
            return toPeople(r, walk(r, id, limits.clampDepth(depth), r::parentsOf));
        });
    }

    /** Anyone connected within {@code depth} hops over relationships of any type, in either direction. */
    public List<Person> related(FamilyGraph graph, Long id, Integer depth) {
        return graph.read(r -> {
            r.requirePerson(id);
            return toPeople(r, relatedIds(r, id, limits.clampDepth(depth)));
        });
    }

    public Set<Long> relatedIds(GraphReader r, Long id, int depth) {
        return walk(r, id, depth, personId -> neighbours(r, personId));
    }

    // ========== BRANCH ==========

    /** The person followed by every descendant within {@code depth} levels, in breadth-first order. */
    public List<Person> branch(FamilyGraph graph, Long id, Integer depth) {
        return graph.read(r -> {
            r.requirePerson(id);
            int bounded = limits.clampDepth(depth);
            if (bounded == 0) {
                return List.<Person>of();
            }
            Set<Long> ids = new LinkedHashSet<>();
            ids.add(id);
            ids.addAll(descendantIds(r, id, bounded));
            return toPeople(r, ids);
        });
    }

    // ========== PARTIAL TREE ==========

    public PartialTree partialTree(FamilyGraph graph, Long id, Integer depth,
                                   boolean onlyAncestors, boolean onlyDescendants) {
        return graph.read(r -> {
            Person center = r.requirePerson(id);
            if (onlyAncestors && onlyDescendants) {
                throw new ValidationException("onlyAncestors and onlyDescendants cannot both be set");
            }
            int bounded = limits.clampDepth(depth);
            List<Person> ancestors = onlyDescendants ? List.of() : toPeople(r, ancestorIds(r, id, bounded));
            List<Person> descendants = onlyAncestors ? List.of() : toPeople(r, descendantIds(r, id, bounded));
            return new PartialTree(center, ancestors, descendants);
        });
    }

    // ========== BFS ==========

    /**
     * Breadth-first walk from {@code start}. Each newly found person is collected and,
     * while {@code level + 1 < depth}, expanded on the next level. The start person is
     * never collected.
     */
    private Set<Long> walk(GraphReader r, Long start, int depth, Function<Long, Collection<Long>> next) {
        Set<Long> collected = new LinkedHashSet<>();
        if (depth <= 0) {
            return collected;
        }
        Set<Long> visited = new LinkedHashSet<>();
        visited.add(start);
        Deque<Long> queue = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        queue.add(start);
        levels.add(0);

        while (!queue.isEmpty()) {
            Long current = queue.poll();
            int level = levels.poll();
            for (Long found : next.apply(current)) {
                if (!visited.add(found)) {
                    continue;
                }
                collected.add(found);
                if (collected.size() >= limits.maxVisited()) {
                    log.warn("Traversal from person {} stopped at {} people", start, limits.maxVisited());
                    return collected;
                }
                if (level + 1 < depth) {
                    queue.add(found);
                    levels.add(level + 1);
                }
            }
        }
        return collected;
    }

    private static List<Long> neighbours(GraphReader r, Long personId) {
        List<Long> result = new ArrayList<>();
        for (Relationship rel : r.relationshipsOf(personId)) {
            Long other = rel.otherPerson(personId);
            if (other != null && !other.equals(personId)) {
                result.add(other);
            }
        }
        return result;
    }

    static List<Person> toPeople(GraphReader r, Collection<Long> ids) {
        List<Person> people = new ArrayList<>(ids.size());
        for (Long id : ids) {
            r.person(id).ifPresent(people::add);
        }
        return people;
    }
}
