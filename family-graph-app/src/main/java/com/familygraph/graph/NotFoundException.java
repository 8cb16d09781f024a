package com.familygraph.graph;

public class NotFoundException extends FamilyGraphException {

    private final String kind;
    private final Long id;

    public NotFoundException(String kind, Long id) {
        super(kind + " " + id + " not found");
        this.kind = kind;
        this.id = id;
    }

    public static NotFoundException person(Long id) {
        return new NotFoundException("Person", id);
    }

    public static NotFoundException relationship(Long id) {
        return new NotFoundException("Relationship", id);
    }

    public String getKind() {
        return kind;
    }

    public Long getId() {
        return id;
    }
}
