package com.familygraph.graph;

import com.familygraph.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Who changed what. Entries go to the {@code familygraph.audit} logger and the most
 * recent ones are kept in memory.
 */
public class AuditTrail {

    public static final String SYSTEM = "system";

    private static final Logger log = LoggerFactory.getLogger("familygraph.audit");

    private final int retained;
    private final Deque<AuditEntry> recent = new ArrayDeque<>();

    public AuditTrail(int retained) {
        if (retained < 0) {
            throw new IllegalArgumentException("retained must not be negative: " + retained);
        }
        this.retained = retained;
    }

    /** How many recent entries are kept in memory. */
    public int retained() {
        return retained;
    }

    public void record(String actor, String action, boolean success, String detail) {
        AuditEntry entry = new AuditEntry(Instant.now(), actor, action, success, detail);
        log.info("{} {} {} - {}", actor, action, success ? "success" : "failure", detail);
        synchronized (recent) {
            recent.addFirst(entry);
            while (recent.size() > retained) {
                recent.removeLast();
            }
        }
    }

    /** Newest first. */
    public List<AuditEntry> recent(int limit) {
        synchronized (recent) {
            List<AuditEntry> result = new ArrayList<>(Math.min(limit, recent.size()));
            Iterator<AuditEntry> it = recent.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        }
    }
}
