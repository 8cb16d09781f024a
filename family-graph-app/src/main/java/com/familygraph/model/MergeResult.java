package com.familygraph.model;

/**
 * Outcome of folding one person into another.
 *
 * @param rewritten edges moved onto the kept person
 * @param dropped   edges discarded because the kept person already had them,
 *                  or because they joined the two merged people
 */
public record MergeResult(
    Person kept,
    Long removedId,
    int rewritten,
    int dropped
) {}
