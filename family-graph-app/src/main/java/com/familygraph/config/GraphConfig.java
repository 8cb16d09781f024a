package com.familygraph.config;

import com.familygraph.graph.AuditTrail;
import com.familygraph.graph.FamilyGraph;
import com.familygraph.graph.ReciprocityResolver;
import com.familygraph.graph.TraversalLimits;
import com.familygraph.model.GraphSnapshot;
import com.familygraph.repository.GraphSnapshotRepository;
import com.familygraph.repository.InMemoryGraphSnapshotRepository;
import com.familygraph.repository.JdbcGraphSnapshotRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the single {@link FamilyGraph} of this application, restored from the last
 * stored snapshot.
 */
@Configuration
public class GraphConfig {

    private static final Logger log = LoggerFactory.getLogger(GraphConfig.class);

    @Bean
    public TraversalLimits traversalLimits(FamilyGraphConfig config) {
        return config.getTraversal().toLimits();
    }

    @Bean
    public ReciprocityResolver reciprocityResolver() {
        return ReciprocityResolver.standard();
    }

    @Bean
    public AuditTrail auditTrail(FamilyGraphConfig config) {
        return new AuditTrail(config.getAudit().getRetained());
    }

    @Bean
    public GraphSnapshotRepository graphSnapshotRepository(FamilyGraphConfig config, JdbcTemplate jdbc,
                                                           TransactionTemplate transactions,
                                                           ObjectMapper objectMapper) {
        if (!config.getPersistence().isEnabled()) {
            log.info("Graph persistence disabled; changes are kept in memory only");
            return new InMemoryGraphSnapshotRepository();
        }
        return new JdbcGraphSnapshotRepository(jdbc, transactions, objectMapper);
    }

    @Bean
    public FamilyGraph familyGraph(ReciprocityResolver reciprocity, GraphSnapshotRepository snapshots,
                                   AuditTrail audit) {
        GraphSnapshot snapshot = snapshots.load().orElseGet(GraphSnapshot::empty);
        return FamilyGraph.restore(snapshot, reciprocity, snapshots, audit);
    }
}
