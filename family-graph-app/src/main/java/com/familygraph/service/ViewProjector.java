package com.familygraph.service;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.GraphReader;
import com.familygraph.model.GraphView;
import com.familygraph.model.GraphView.Link;
import com.familygraph.model.GraphView.Node;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects the graph, or the part of it reachable from one person, into nodes and links
 * for the visualisation client.
 * <p>
 * Parent and child edges become one {@code parent_child} link pointing from parent to
 * child. Symmetric types give one link per unordered pair, from the lower id to the higher.
 */
@Service
public class ViewProjector {

    private final GraphTraversal traversal;

    public ViewProjector(GraphTraversal traversal) {
        this.traversal = traversal;
    }

    /**
     * @param startId  optional; when given only people related to it within {@code maxDepth} hops are included
     * @param maxDepth ignored without {@code startId}; 0 yields the start person alone
     */
    public GraphView view(FamilyGraph graph, Long startId, Integer maxDepth) {
        return graph.read(r -> {
            Set<Long> included = new LinkedHashSet<>();
            if (startId == null) {
                r.people().forEach(p -> included.add(p.id()));
            } else {
                r.requirePerson(startId);
                int depth = traversal.limits().clampDepth(maxDepth);
                included.add(startId);
                included.addAll(traversal.relatedIds(r, startId, depth));
            }
            return project(r, included);
        });
    }

    private static GraphView project(GraphReader r, Set<Long> included) {
        List<Node> nodes = new ArrayList<>(included.size());
        for (Long id : included) {
            r.person(id).map(Node::of).ifPresent(nodes::add);
        }

        Map<String, LinkBuilder> links = new LinkedHashMap<>();
        for (Relationship rel : edgesWithin(r, included)) {
            Long source = rel.person1Id();
            Long target = rel.person2Id();
            String type = rel.type().label();
            if (rel.type() == RelationshipType.PARENT) {
                type = GraphView.PARENT_CHILD;
            } else if (r.reciprocity().isReciprocalOf(RelationshipType.PARENT, rel.type())) {
                type = GraphView.PARENT_CHILD;
                source = rel.person2Id();
                target = rel.person1Id();
            } else if (rel.type().isSymmetric() && source > target) {
                source = rel.person2Id();
                target = rel.person1Id();
            }
            String key = type + ":" + source + ":" + target;
            links.computeIfAbsent(key, k -> new LinkBuilder()).add(source, target, type, rel.id());
        }

        List<Link> result = new ArrayList<>(links.size());
        for (LinkBuilder builder : links.values()) {
            result.add(builder.build());
        }
        return new GraphView(nodes, result);
    }

    private static List<Relationship> edgesWithin(GraphReader r, Set<Long> included) {
        Set<Long> seen = new LinkedHashSet<>();
        List<Relationship> edges = new ArrayList<>();
        for (Long id : included) {
            for (Relationship rel : r.relationshipsOf(id)) {
                if (!rel.person1Id().equals(rel.person2Id())
                    && included.contains(rel.person1Id())
                    && included.contains(rel.person2Id())
                    && seen.add(rel.id())) {
                    edges.add(rel);
                }
            }
        }
        edges.sort((a, b) -> Long.compare(a.id(), b.id()));
        return edges;
    }

    private static final class LinkBuilder {
        private Long source;
        private Long target;
        private String type;
        private final List<Long> relationshipIds = new ArrayList<>();

        void add(Long source, Long target, String type, Long relationshipId) {
            this.source = source;
            this.target = target;
            this.type = type;
            relationshipIds.add(relationshipId);
        }

        Link build() {
            return new Link(source, target, type, List.copyOf(relationshipIds));
        }
    }
}
