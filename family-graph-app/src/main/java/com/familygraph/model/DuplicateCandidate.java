package com.familygraph.model;

/**
 * Two people that look like the same individual. For human review only.
 */
public record DuplicateCandidate(Person first, Person second, String reason) {}
