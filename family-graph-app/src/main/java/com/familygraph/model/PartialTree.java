package com.familygraph.model;

import java.util.List;

public record PartialTree(
    Person center,
    List<Person> ancestors,
    List<Person> descendants
) {}
