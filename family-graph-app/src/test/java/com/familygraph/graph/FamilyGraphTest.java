package com.familygraph.graph;

import com.familygraph.model.AuditEntry;
import com.familygraph.model.GraphSnapshot;
import com.familygraph.model.Person;
import com.familygraph.model.PersonRelationship;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import com.familygraph.repository.GraphSnapshotRepository;
import com.familygraph.repository.InMemoryGraphSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.familygraph.model.RelationshipType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FamilyGraphTest {

    private static final String ACTOR = "tester";

    private InMemoryGraphSnapshotRepository snapshots;
    private FamilyGraph graph;

    @BeforeEach
    void setUp() {
        snapshots = new InMemoryGraphSnapshotRepository();
        graph = new FamilyGraph(ReciprocityResolver.standard(), snapshots, new AuditTrail(20));
    }

    private Person person(String firstName, String lastName) {
        return graph.addPerson(Map.of("firstName", firstName, "lastName", lastName), ACTOR);
    }

    // ========== PEOPLE ==========

    @Nested
    @DisplayName("addPerson")
    class AddPerson {

        @Test
        void assignsIncreasingIds() {
            Person ada = person("Ada", "Lovelace");
            Person byron = person("George", "Byron");

            assertThat(byron.id()).isGreaterThan(ada.id());
            assertThat(graph.people()).hasSize(2);
        }

        @Test
        void acceptsAliasesAndKeepsUnknownKeysAsAttributes() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("forename", "Ada");
            fields.put("surname", "Lovelace");
            fields.put("dob", "1815-12-10");
            fields.put("birthPlace", "London");

            Person ada = graph.addPerson(fields, ACTOR);

            assertThat(ada.firstName()).isEqualTo("Ada");
            assertThat(ada.lastName()).isEqualTo("Lovelace");
            assertThat(ada.birthDate()).isEqualTo(LocalDate.of(1815, 12, 10));
            assertThat(ada.attributes()).containsEntry("birthPlace", "London");
        }

        @Test
        void rejectsMissingFirstName() {
            assertThatThrownBy(() -> graph.addPerson(Map.of("lastName", "Nobody"), ACTOR))
                .isInstanceOf(ValidationException.class);
            assertThat(graph.people()).isEmpty();
        }

        @Test
        void rejectsInvalidDate() {
            assertThatThrownBy(() -> graph.addPerson(Map.of("firstName", "Ada", "birthDate", "10/12/1815"), ACTOR))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("birthDate");
        }

        @Test
        void rejectsDeathBeforeBirth() {
            Map<String, Object> fields = Map.of("firstName", "Ada", "birthDate", "1815-12-10", "deathDate", "1800-01-01");

            assertThatThrownBy(() -> graph.addPerson(fields, ACTOR)).isInstanceOf(ValidationException.class);
        }

        @Test
        void rejectsNamesWiderThanStoredColumn() {
            String tooLong = "x".repeat(PersonFields.MAX_NAME_LENGTH + 1);

            assertThatThrownBy(() -> graph.addPerson(Map.of("firstName", tooLong), ACTOR))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("firstName");
            assertThatThrownBy(() -> graph.addPerson(Map.of("firstName", "Ada", "nickname", tooLong), ACTOR))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> graph.addPerson(Map.of("firstName", "Ada", "gender", "x".repeat(51)), ACTOR))
                .isInstanceOf(ValidationException.class);
            assertThat(graph.people()).isEmpty();
            assertThat(graph.version()).isZero();
        }

        @Test
        void acceptsNameAtColumnWidthAndLongNotes() {
            String name = "x".repeat(PersonFields.MAX_NAME_LENGTH);
            String notes = "n".repeat(20_000);

            Person created = graph.addPerson(Map.of("firstName", name, "notes", notes), ACTOR);

            assertThat(created.firstName()).hasSize(PersonFields.MAX_NAME_LENGTH);
            assertThat(created.notes()).hasSize(20_000);
        }

        @Test
        void editRejectsOverlongLastNameAndKeepsPerson() {
            Person ada = graph.addPerson(Map.of("firstName", "Ada", "lastName", "Byron"), ACTOR);

            assertThatThrownBy(() -> graph.editPerson(ada.id(), Map.of("lastName", "y".repeat(300)), ACTOR))
                .isInstanceOf(ValidationException.class);
            assertThat(graph.getPerson(ada.id()).lastName()).isEqualTo("Byron");
        }
    }

    @Nested
    @DisplayName("editPerson")
    class EditPerson {

        @Test
        void updatesOnlyGivenFields() {
            Person ada = graph.addPerson(Map.of("firstName", "Ada", "lastName", "Byron", "gender", "F"), ACTOR);

            Person edited = graph.editPerson(ada.id(), Map.of("lastName", "Lovelace"), ACTOR);

            assertThat(edited.lastName()).isEqualTo("Lovelace");
            assertThat(edited.gender()).isEqualTo("F");
            assertThat(graph.getPerson(ada.id())).isEqualTo(edited);
        }

        @Test
        void mergesAttributes() {
            Person ada = graph.addPerson(Map.of("firstName", "Ada", "attributes", Map.of("title", "Countess")), ACTOR);

            Person edited = graph.editPerson(ada.id(), Map.of("attributes", Map.of("field", "Mathematics")), ACTOR);

            assertThat(edited.attributes()).containsEntry("title", "Countess").containsEntry("field", "Mathematics");
        }

        @Test
        void unknownIdIsNotFound() {
            assertThatThrownBy(() -> graph.editPerson(99L, Map.of("firstName", "X"), ACTOR))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        void rejectedEditChangesNothing() {
            Person ada = person("Ada", "Lovelace");
            long version = graph.version();

            assertThatThrownBy(() -> graph.editPerson(ada.id(), Map.of("firstName", "  "), ACTOR))
                .isInstanceOf(ValidationException.class);

            assertThat(graph.getPerson(ada.id())).isEqualTo(ada);
            assertThat(graph.version()).isEqualTo(version);
        }
    }

    @Nested
    @DisplayName("deletePerson")
    class DeletePerson {

        @Test
        void cascadesToEveryRelationship() {
            Person parent = person("Anne", "Smith");
            Person child = person("Bob", "Smith");
            Person spouse = person("Carl", "Smith");
            graph.addRelationship(parent.id(), child.id(), PARENT, ACTOR);
            graph.addRelationship(spouse.id(), parent.id(), SPOUSE, ACTOR);
            Relationship unrelated = graph.addRelationship(spouse.id(), child.id(), PARENT, ACTOR);

            graph.deletePerson(parent.id(), ACTOR);

            assertThat(graph.findPerson(parent.id())).isEmpty();
            assertThat(graph.relationships(null)).containsExactly(unrelated);
            List<Relationship> left = graph.read(r -> r.relationshipsOf(parent.id()));
            assertThat(left).isEmpty();
        }

        @Test
        void unknownIdIsNotFound() {
            assertThatThrownBy(() -> graph.deletePerson(42L, ACTOR))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("42");
        }
    }

    // ========== RELATIONSHIPS ==========

    @Nested
    @DisplayName("addRelationship")
    class AddRelationship {

        @Test
        void storesOneDirectedEdge() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Bob", "Smith");

            Relationship rel = graph.addRelationship(p1.id(), p2.id(), "Parent", Map.of("notes", "birth record"), ACTOR);

            assertThat(rel.type()).isEqualTo(PARENT);
            assertThat(rel.notes()).isEqualTo("birth record");
            assertThat(graph.relationships(null)).hasSize(1);
        }

        @Test
        void duplicateTripleIsRejectedAndCountUnchanged() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Bob", "Smith");
            Relationship first = graph.addRelationship(p1.id(), p2.id(), PARENT, ACTOR);

            assertThatThrownBy(() -> graph.addRelationship(p1.id(), p2.id(), PARENT, ACTOR))
                .isInstanceOf(DuplicateEdgeException.class)
                .satisfies(e -> assertThat(((DuplicateEdgeException) e).getExistingId()).isEqualTo(first.id()));

            assertThat(graph.relationships(null)).hasSize(1);
        }

        @Test
        void samePairMayCarryDistinctTypes() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Bob", "Jones");

            graph.addRelationship(p1.id(), p2.id(), GODPARENT, ACTOR);
            graph.addRelationship(p1.id(), p2.id(), GUARDIAN, ACTOR);
            graph.addRelationship(p2.id(), p1.id(), FRIEND, ACTOR);

            assertThat(graph.relationships(null)).hasSize(3);
        }

        @Test
        void selfRelationshipIsRejected() {
            Person p1 = person("Anne", "Smith");

            assertThatThrownBy(() -> graph.addRelationship(p1.id(), p1.id(), SPOUSE, ACTOR))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void unknownTypeIsRejected() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Bob", "Smith");

            assertThatThrownBy(() -> graph.addRelationship(p1.id(), p2.id(), "nemesis", Map.of(), ACTOR))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("nemesis");
        }

        @Test
        void missingPersonIsNotFound() {
            Person p1 = person("Anne", "Smith");

            assertThatThrownBy(() -> graph.addRelationship(p1.id(), 77L, PARENT, ACTOR))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        void parsesRequestFields() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Carl", "Smith");
            Map<String, Object> fields = Map.of(
                "person1Id", p1.id(), "person2Id", p2.id().toString(), "type", "spouse",
                "startDate", "1990-06-01", "endDate", "1980-01-01");

            assertThatThrownBy(() -> graph.addRelationship(fields, ACTOR))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("before start date");
            assertThat(graph.relationships(null)).isEmpty();
        }

        @Test
        void rejectionIsAuditedWithoutChangingVersion() {
            Person p1 = person("Anne", "Smith");
            long version = graph.version();

            assertThatThrownBy(() -> graph.addRelationship(p1.id(), p1.id(), SPOUSE, ACTOR))
                .isInstanceOf(ValidationException.class);

            assertThat(graph.version()).isEqualTo(version);
            AuditEntry latest = graph.audit().recent(1).get(0);
            assertThat(latest.action()).isEqualTo("add_relationship");
            assertThat(latest.success()).isFalse();
            assertThat(latest.actor()).isEqualTo(ACTOR);
        }
    }

    @Nested
    @DisplayName("editRelationship")
    class EditRelationship {

        @Test
        void changesTypeAndDates() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Carl", "Smith");
            Relationship rel = graph.addRelationship(p1.id(), p2.id(), SPOUSE, ACTOR);

            Relationship edited = graph.editRelationship(rel.id(), Map.of("type", "divorced", "endDate", "2001-03-04"), ACTOR);

            assertThat(edited.type()).isEqualTo(DIVORCED);
            assertThat(edited.endDate()).isEqualTo(LocalDate.of(2001, 3, 4));
            Optional<Relationship> spouse = graph.read(r -> r.findEdge(p1.id(), p2.id(), SPOUSE));
            assertThat(spouse).isEmpty();
        }

        @Test
        void cannotEditIntoExistingTriple() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Carl", "Smith");
            graph.addRelationship(p1.id(), p2.id(), SPOUSE, ACTOR);
            Relationship friend = graph.addRelationship(p1.id(), p2.id(), FRIEND, ACTOR);

            assertThatThrownBy(() -> graph.editRelationship(friend.id(), Map.of("type", "spouse"), ACTOR))
                .isInstanceOf(DuplicateEdgeException.class);
            assertThat(graph.getRelationship(friend.id()).type()).isEqualTo(FRIEND);
        }

        @Test
        void cannotEditIntoSelfEdge() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Carl", "Smith");
            Relationship rel = graph.addRelationship(p1.id(), p2.id(), SPOUSE, ACTOR);

            assertThatThrownBy(() -> graph.editRelationship(rel.id(), Map.of("person2Id", p1.id()), ACTOR))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void unknownRelationshipIsNotFound() {
            assertThatThrownBy(() -> graph.editRelationship(5L, Map.of("notes", "x"), ACTOR))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("Relationship 5");
        }
    }

    // ========== QUERIES ==========

    @Nested
    class Queries {

        @Test
        void relationshipsFromUsesReciprocalForPersonTwo() {
            Person parent = person("Anne", "Smith");
            Person child = person("Bob", "Smith");
            graph.addRelationship(parent.id(), child.id(), PARENT, ACTOR);

            List<PersonRelationship> fromChild = graph.relationshipsFrom(child.id());

            assertThat(fromChild).singleElement().satisfies(pr -> {
                assertThat(pr.role()).isEqualTo(CHILD);
                assertThat(pr.otherPersonId()).isEqualTo(parent.id());
                assertThat(pr.roleDefined()).isTrue();
            });
        }

        @Test
        void searchMatchesNamePartsIgnoringCase() {
            person("Ada", "Lovelace");
            graph.addPerson(Map.of("firstName", "Augusta", "lastName", "Byron", "nickname", "Ada"), ACTOR);
            person("Charles", "Babbage");

            assertThat(graph.search("ada")).extracting(Person::firstName).containsExactly("Augusta", "Ada");
            assertThat(graph.search("BAB")).extracting(Person::lastName).containsExactly("Babbage");
        }

        @Test
        void childEdgesCountAsParentLinks() {
            Person parent = person("Anne", "Smith");
            Person child = person("Bob", "Smith");
            graph.addRelationship(child.id(), parent.id(), CHILD, ACTOR);

            List<Long> parents = graph.read(r -> r.parentsOf(child.id()));
            List<Long> children = graph.read(r -> r.childrenOf(parent.id()));

            assertThat(parents).containsExactly(parent.id());
            assertThat(children).containsExactly(child.id());
        }
    }

    // ========== PERSISTENCE ==========

    @Nested
    class Persistence {

        @Test
        void everyCommitIsSavedWithItsVersion() {
            Person p1 = person("Anne", "Smith");
            Person p2 = person("Bob", "Smith");
            graph.addRelationship(p1.id(), p2.id(), PARENT, ACTOR);

            GraphSnapshot saved = snapshots.load().orElseThrow();
            assertThat(saved.version()).isEqualTo(3);
            assertThat(saved.people()).hasSize(2);
            assertThat(saved.relationships()).hasSize(1);
        }

        @Test
        void storageFailureIsSurfacedButCommitStands() {
            GraphSnapshotRepository broken = new GraphSnapshotRepository() {
                @Override
                public Optional<GraphSnapshot> load() {
                    return Optional.empty();
                }

                @Override
                public void save(GraphSnapshot snapshot) {
                    throw new IllegalStateException("disk full");
                }
            };
            FamilyGraph failing = new FamilyGraph(ReciprocityResolver.standard(), broken, new AuditTrail(5));

            assertThatThrownBy(() -> failing.addPerson(Map.of("firstName", "Ada"), ACTOR))
                .isInstanceOf(SnapshotPersistenceException.class)
                .hasMessageContaining("disk full")
                .satisfies(e -> {
                    SnapshotPersistenceException failure = (SnapshotPersistenceException) e;
                    assertThat(failure.getVersion()).isEqualTo(1);
                    assertThat(failure.getCommitted()).isInstanceOf(Person.class);
                });

            assertThat(failing.people()).extracting(Person::firstName).containsExactly("Ada");
        }

        @Test
        void readersProceedWhileSnapshotIsBeingSaved() throws Exception {
            CountDownLatch saving = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            GraphSnapshotRepository slow = new GraphSnapshotRepository() {
                @Override
                public Optional<GraphSnapshot> load() {
                    return Optional.empty();
                }

                @Override
                public void save(GraphSnapshot snapshot) {
                    saving.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            };
            FamilyGraph slowGraph = new FamilyGraph(ReciprocityResolver.standard(), slow, new AuditTrail(5));
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Person> pending = executor.submit(() -> slowGraph.addPerson(Map.of("firstName", "Ada"), ACTOR));
                assertThat(saving.await(5, TimeUnit.SECONDS)).isTrue();

                assertThat(slowGraph.people()).extracting(Person::firstName).containsExactly("Ada");

                release.countDown();
                assertThat(pending.get(5, TimeUnit.SECONDS).firstName()).isEqualTo("Ada");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void readersDoNotWaitBehindWriterQueuedDuringSave() throws Exception {
            CountDownLatch saving = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<Long> saved = new CopyOnWriteArrayList<>();
            GraphSnapshotRepository slow = new GraphSnapshotRepository() {
                @Override
                public Optional<GraphSnapshot> load() {
                    return Optional.empty();
                }

                @Override
                public void save(GraphSnapshot snapshot) {
                    if (snapshot.version() == 1) {
                        saving.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    saved.add(snapshot.version());
                }
            };
            FamilyGraph slowGraph = new FamilyGraph(ReciprocityResolver.standard(), slow, new AuditTrail(5));
            ExecutorService executor = Executors.newFixedThreadPool(3);
            try {
                Future<Person> first = executor.submit(() -> slowGraph.addPerson(Map.of("firstName", "Ada"), ACTOR));
                assertThat(saving.await(5, TimeUnit.SECONDS)).isTrue();
                Future<Person> second = executor.submit(() -> slowGraph.addPerson(Map.of("firstName", "Bob"), ACTOR));
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (slowGraph.version() < 2 && System.nanoTime() < deadline) {
                    Thread.sleep(10);
                }

                Future<List<Person>> read = executor.submit(slowGraph::people);

                assertThat(read.get(1, TimeUnit.SECONDS)).extracting(Person::firstName).containsExactly("Ada", "Bob");
                assertThat(second.isDone()).isFalse();

                release.countDown();
                first.get(5, TimeUnit.SECONDS);
                second.get(5, TimeUnit.SECONDS);
                assertThat(saved).containsExactly(1L, 2L);
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }

        @Test
        void restoreSkipsRowsThatBreakInvariants() {
            Person anne = new Person(1L, "Anne", "Smith", null, null, null, null, null, Map.of());
            Person bob = new Person(2L, "Bob", "Smith", null, null, null, null, null, Map.of());
            List<Relationship> rows = List.of(
                new Relationship(10L, 1L, 2L, PARENT, null, null, null),
                new Relationship(11L, 1L, 2L, PARENT, null, null, null),
                new Relationship(12L, 1L, 1L, SPOUSE, null, null, null),
                new Relationship(13L, 1L, 3L, SIBLING, null, null, null),
                new Relationship(14L, 2L, 1L, null, null, null, null)
            );

            FamilyGraph restored = FamilyGraph.restore(new GraphSnapshot(7, List.of(anne, bob), rows),
                ReciprocityResolver.standard(), new InMemoryGraphSnapshotRepository(), new AuditTrail(5));

            assertThat(restored.version()).isEqualTo(7);
            assertThat(restored.people()).hasSize(2);
            assertThat(restored.relationships(null)).extracting(Relationship::id).containsExactly(10L);
            Person carol = restored.addPerson(Map.of("firstName", "Carol"), ACTOR);
            assertThat(carol.id()).isEqualTo(3L);
            Relationship next = restored.addRelationship(1L, 3L, RelationshipType.SIBLING, ACTOR);
            assertThat(next.id()).isEqualTo(11L);
        }
    }
}
