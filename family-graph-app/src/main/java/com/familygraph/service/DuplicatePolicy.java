package com.familygraph.service;

import com.familygraph.model.Person;

import java.util.Optional;

/**
 * Decides which pairs of people look like the same individual.
 * <p>
 * Only people sharing a blocking key are compared, so {@link #match} never sees
 * the full cross product.
 */
public interface DuplicatePolicy {

    /**
     * Key used to group candidates before pairwise comparison.
     * Empty when the person should never be compared.
     */
    Optional<String> blockingKey(Person person);

    /**
     * The reason the two people look alike, or empty when they don't.
     */
    Optional<String> match(Person first, Person second);
}
