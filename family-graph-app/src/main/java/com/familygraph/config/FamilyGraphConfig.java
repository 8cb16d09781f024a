package com.familygraph.config;

import com.familygraph.graph.TraversalLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under 'familygraph' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "familygraph")
public class FamilyGraphConfig {

    private Traversal traversal = new Traversal();
    private Persistence persistence = new Persistence();
    private Audit audit = new Audit();
    private List<UserDefinition> users = new ArrayList<>();

    public Traversal getTraversal() { return traversal; }
    public void setTraversal(Traversal traversal) { this.traversal = traversal; }

    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    public List<UserDefinition> getUsers() { return users; }
    public void setUsers(List<UserDefinition> users) { this.users = users; }

    public static class Traversal {
        private int maxDepth = 20;
        private int maxVisited = 10_000;
        private int defaultDepth = 10;

        public TraversalLimits toLimits() {
            return new TraversalLimits(maxDepth, maxVisited, defaultDepth);
        }

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public int getMaxVisited() { return maxVisited; }
        public void setMaxVisited(int maxVisited) { this.maxVisited = maxVisited; }

        public int getDefaultDepth() { return defaultDepth; }
        public void setDefaultDepth(int defaultDepth) { this.defaultDepth = defaultDepth; }
    }

    public static class Persistence {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Audit {
        private int retained = 500;

        public int getRetained() { return retained; }
        public void setRetained(int retained) { this.retained = retained; }
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class UserDefinition {
        private String username;
        private String password;
        private List<String> roles = new ArrayList<>(List.of("USER"));

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public List<String> getRoles() { return roles; }
        public void setRoles(List<String> roles) { this.roles = roles; }
    }
}
