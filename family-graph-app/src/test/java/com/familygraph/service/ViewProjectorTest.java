package com.familygraph.service;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.NotFoundException;
import com.familygraph.graph.TraversalLimits;
import com.familygraph.model.GraphView;
import com.familygraph.model.GraphView.Link;
import com.familygraph.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.familygraph.model.RelationshipType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewProjectorTest {

    private static final String ACTOR = "tester";

    private final ViewProjector projector = new ViewProjector(new GraphTraversal(TraversalLimits.defaults()));

    private FamilyGraph graph;
    private Long anne, bob, carl, dora;

    @BeforeEach
    void setUp() {
        graph = FamilyGraph.inMemory();
        anne = graph.addPerson(Map.of("firstName", "Anne", "lastName", "Smith", "nickname", "Nan",
            "birthDate", "1920-05-01", "deathDate", "1999-02-03"), ACTOR).id();
        bob = graph.addPerson(Map.of("firstName", "Bob", "lastName", "Smith"), ACTOR).id();
        carl = graph.addPerson(Map.of("firstName", "Carl", "lastName", "Smith"), ACTOR).id();
        dora = graph.addPerson(Map.of("firstName", "Dora", "lastName", "Jones"), ACTOR).id();
    }

    @Test
    void wholeGraphHasEveryNode() {
        GraphView view = projector.view(graph, null, null);

        assertThat(view.nodes()).extracting(GraphView.Node::id).containsExactly(anne, bob, carl, dora);
        assertThat(view.links()).isEmpty();
    }

    @Test
    void nodesCarryDisplayFields() {
        GraphView.Node node = projector.view(graph, anne, 0).nodes().get(0);

        assertThat(node.label()).isEqualTo("Anne Smith (Nan)");
        assertThat(node.fullName()).isEqualTo("Anne Smith");
        assertThat(node.lifespan()).isEqualTo("1920 - 1999");
    }

    @Test
    void parentAndChildRecordsCollapseIntoOneLink() {
        Relationship parent = graph.addRelationship(anne, bob, PARENT, ACTOR);
        Relationship child = graph.addRelationship(bob, anne, CHILD, ACTOR);

        GraphView view = projector.view(graph, null, null);

        assertThat(view.links()).singleElement().satisfies(link -> {
            assertThat(link.source()).isEqualTo(anne);
            assertThat(link.target()).isEqualTo(bob);
            assertThat(link.type()).isEqualTo(GraphView.PARENT_CHILD);
            assertThat(link.relationshipIds()).containsExactly(parent.id(), child.id());
        });
    }

    @Test
    void childRecordAloneIsOrientedParentToChild() {
        graph.addRelationship(carl, anne, CHILD, ACTOR);

        Link link = projector.view(graph, null, null).links().get(0);

        assertThat(link.source()).isEqualTo(anne);
        assertThat(link.target()).isEqualTo(carl);
        assertThat(link.type()).isEqualTo("parent_child");
    }

    @Test
    void symmetricTypeGivesOneLinkPerPair() {
        graph.addRelationship(dora, carl, SPOUSE, ACTOR);
        graph.addRelationship(carl, dora, SPOUSE, ACTOR);

        GraphView view = projector.view(graph, null, null);

        assertThat(view.links()).singleElement().satisfies(link -> {
            assertThat(link.source()).isEqualTo(carl);
            assertThat(link.target()).isEqualTo(dora);
            assertThat(link.type()).isEqualTo("spouse");
            assertThat(link.relationshipIds()).hasSize(2);
        });
    }

    @Test
    void differentTypesOnSamePairStaySeparate() {
        graph.addRelationship(anne, dora, GODPARENT, ACTOR);
        graph.addRelationship(anne, dora, FRIEND, ACTOR);

        assertThat(projector.view(graph, null, null).links())
            .extracting(Link::type)
            .containsExactly("godparent", "friend");
    }

    @Test
    void startNodeAtDepthZeroIsAlone() {
        graph.addRelationship(anne, bob, PARENT, ACTOR);

        GraphView view = projector.view(graph, anne, 0);

        assertThat(view.nodes()).extracting(GraphView.Node::id).containsExactly(anne);
        assertThat(view.links()).isEmpty();
    }

    @Test
    void startNodeLimitsViewToReachablePeople() {
        graph.addRelationship(anne, bob, PARENT, ACTOR);
        graph.addRelationship(bob, carl, PARENT, ACTOR);
        graph.addRelationship(carl, dora, SPOUSE, ACTOR);

        GraphView view = projector.view(graph, anne, 2);

        assertThat(view.nodes()).extracting(GraphView.Node::id).containsExactly(anne, bob, carl);
        assertThat(view.links()).extracting(Link::target).containsExactly(bob, carl);
    }

    @Test
    void unknownStartIsNotFound() {
        assertThatThrownBy(() -> projector.view(graph, 77L, 3)).isInstanceOf(NotFoundException.class);
    }
}
