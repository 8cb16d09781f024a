package com.familygraph.controller;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.ReciprocityResolver;
import com.familygraph.graph.ValidationException;
import com.familygraph.model.Reciprocal;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/relationships")
public class RelationshipApiController {

    private final FamilyGraph graph;

    public RelationshipApiController(FamilyGraph graph) {
        this.graph = graph;
    }

    @GetMapping
    public List<Relationship> listRelationships(@RequestParam(required = false) String type) {
        RelationshipType filter = null;
        if (type != null && !type.isBlank()) {
            filter = RelationshipType.fromLabel(type)
                .orElseThrow(() -> new ValidationException("Unknown relationship type: " + type));
        }
        return graph.relationships(filter);
    }

    @GetMapping("/{id}")
    public Relationship getRelationship(@PathVariable Long id) {
        return graph.getRelationship(id);
    }

    @PostMapping
    public ResponseEntity<Relationship> createRelationship(@RequestBody Map<String, Object> body,
                                                           @AuthenticationPrincipal UserDetails user) {
        Relationship created = graph.addRelationship(body, CurrentActor.of(user));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public Relationship updateRelationship(@PathVariable Long id, @RequestBody Map<String, Object> body,
                                           @AuthenticationPrincipal UserDetails user) {
        return graph.editRelationship(id, body, CurrentActor.of(user));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRelationship(@PathVariable Long id, @AuthenticationPrincipal UserDetails user) {
        graph.deleteRelationship(id, CurrentActor.of(user));
        return ResponseEntity.noContent().build();
    }

    /** The type vocabulary with each type's reciprocal. */
    @GetMapping("/types")
    public List<Map<String, Object>> types() {
        ReciprocityResolver reciprocity = graph.reciprocity();
        List<Map<String, Object>> types = new ArrayList<>();
        for (RelationshipType type : RelationshipType.values()) {
            Reciprocal reciprocal = reciprocity.reciprocal(type);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", type.label());
            entry.put("symmetric", type.isSymmetric());
            entry.put("reciprocal", reciprocal.defined() ? reciprocal.type().label() : null);
            types.add(entry);
        }
        return types;
    }
}
