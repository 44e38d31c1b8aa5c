package com.codeannotation.backend.domain;

/**
 * A named annotation study. Name and description are mutable, the id is assigned by the store.
 */
public class Experiment {
    private int id;
    private String name;
    private String description;

    public Experiment(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public Experiment(int id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
    }

    public Experiment copy() {
        return new Experiment(id, name, description);
    }

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
