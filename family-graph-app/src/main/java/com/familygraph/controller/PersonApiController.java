package com.familygraph.controller;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.model.ConsistencyIssue;
import com.familygraph.model.PartialTree;
import com.familygraph.model.Person;
import com.familygraph.model.PersonRelationship;
import com.familygraph.service.ConsistencyChecker;
import com.familygraph.service.GraphTraversal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/people")
public class PersonApiController {

    private final FamilyGraph graph;
    private final GraphTraversal traversal;
    private final ConsistencyChecker consistencyChecker;

    public PersonApiController(FamilyGraph graph, GraphTraversal traversal, ConsistencyChecker consistencyChecker) {
        this.graph = graph;
        this.traversal = traversal;
        this.consistencyChecker = consistencyChecker;
    }

    // ========== CRUD ==========

    @GetMapping
    public List<Person> listPeople() {
        return graph.people();
    }

    @GetMapping("/search")
    public List<Person> search(@RequestParam(required = false) String name) {
        return graph.search(name);
    }

    @GetMapping("/{id}")
    public Map<String, Object> getPerson(@PathVariable Long id) {
        Map<String, Object> result = new LinkedHashMap<>();
        Person person = graph.getPerson(id);
        result.put("person", person);
        result.put("age", person.ageOn(LocalDate.now()));
        result.put("relationships", graph.relationshipsFrom(id));
        return result;
    }

    @PostMapping
    public ResponseEntity<Person> createPerson(@RequestBody Map<String, Object> body,
                                               @AuthenticationPrincipal UserDetails user) {
        Person created = graph.addPerson(body, CurrentActor.of(user));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updatePerson(@PathVariable Long id,
                                                            @RequestBody Map<String, Object> body,
                                                            @AuthenticationPrincipal UserDetails user) {
        Person updated = graph.editPerson(id, body, CurrentActor.of(user));
        return ResponseEntity.ok(Map.of("id", id, "person", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePerson(@PathVariable Long id, @AuthenticationPrincipal UserDetails user) {
        graph.deletePerson(id, CurrentActor.of(user));
        return ResponseEntity.noContent().build();
    }

    // ========== TRAVERSALS ==========

    @GetMapping("/{id}/ancestors")
    public List<Person> ancestors(@PathVariable Long id, @RequestParam(required = false) Integer depth) {
        return traversal.ancestors(graph, id, depth);
    }

    @GetMapping("/{id}/descendants")
    public List<Person> descendants(@PathVariable Long id, @RequestParam(required = false) Integer depth) {
        return traversal.descendants(graph, id, depth);
    }

    @GetMapping("/{id}/siblings")
    public List<Person> siblings(@PathVariable Long id) {
        return traversal.siblings(graph, id);
    }

    @GetMapping("/{id}/extended-family")
    public List<Person> extendedFamily(@PathVariable Long id, @RequestParam(required = false) Integer depth) {
        return traversal.extendedFamily(graph, id, depth);
    }

    @GetMapping("/{id}/related")
    public List<Person> related(@PathVariable Long id, @RequestParam(required = false) Integer depth) {
        return traversal.related(graph, id, depth);
    }

    @GetMapping("/{id}/branch")
    public List<Person> branch(@PathVariable Long id, @RequestParam(required = false) Integer depth) {
        return traversal.branch(graph, id, depth);
    }

    @GetMapping("/{id}/partial-tree")
    public PartialTree partialTree(@PathVariable Long id,
                                   @RequestParam(required = false) Integer depth,
                                   @RequestParam(defaultValue = "false") boolean onlyAncestors,
                                   @RequestParam(defaultValue = "false") boolean onlyDescendants) {
        return traversal.partialTree(graph, id, depth, onlyAncestors, onlyDescendants);
    }

    // ========== RELATIONSHIPS / CHECKS ==========

    @GetMapping("/{id}/relationships")
    public List<PersonRelationship> relationships(@PathVariable Long id) {
        return graph.relationshipsFrom(id);
    }

    @GetMapping("/{id}/consistency")
    public List<ConsistencyIssue> consistency(@PathVariable Long id) {
        return consistencyChecker.check(graph, id);
    }
}
