package com.familygraph.controller;

import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.AuditTrail;
import com.familygraph.graph.Ids;
import com.familygraph.model.AuditEntry;
import com.familygraph.model.ConsistencyIssue;
import com.familygraph.model.DuplicateCandidate;
import com.familygraph.model.GraphView;
import com.familygraph.model.MergeResult;
import com.familygraph.model.Relationship;
import com.familygraph.service.ConsistencyChecker;
import com.familygraph.service.ViewProjector;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/graph")
public class GraphApiController {

    private final FamilyGraph graph;
    private final ViewProjector viewProjector;
    private final ConsistencyChecker consistencyChecker;

    public GraphApiController(FamilyGraph graph, ViewProjector viewProjector, ConsistencyChecker consistencyChecker) {
        this.graph = graph;
        this.viewProjector = viewProjector;
        this.consistencyChecker = consistencyChecker;
    }

    @GetMapping("/view")
    public GraphView view(@RequestParam(required = false) Long startId,
                          @RequestParam(required = false) Integer maxDepth) {
        return viewProjector.view(graph, startId, maxDepth);
    }

    @GetMapping("/duplicates")
    public List<DuplicateCandidate> duplicates() {
        return consistencyChecker.findDuplicates(graph);
    }

    @PostMapping("/merge")
    public MergeResult merge(@RequestBody Map<String, Object> body, @AuthenticationPrincipal UserDetails user) {
        return consistencyChecker.merge(graph, id(body, "keepId"), id(body, "removeId"), CurrentActor.of(user));
    }

    @GetMapping("/consistency")
    public List<ConsistencyIssue> consistency() {
        return consistencyChecker.checkAll(graph);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> stats = graph.read(r -> {
            Map<String, Integer> byType = new TreeMap<>();
            for (Relationship rel : r.relationships()) {
                byType.merge(rel.type().label(), 1, Integer::sum);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("people", r.personCount());
            result.put("relationships", r.relationshipCount());
            result.put("relationshipsByType", byType);
            return result;
        });
        stats.put("version", graph.version());
        return stats;
    }

    @GetMapping("/audit")
    public List<AuditEntry> audit(@RequestParam(defaultValue = "50") int limit) {
        AuditTrail trail = graph.audit();
        return trail.recent(Math.max(0, Math.min(limit, trail.retained())));
    }

    private static Long id(Map<String, Object> body, String field) {
        return Ids.parse(body.get(field), field);
    }
}
