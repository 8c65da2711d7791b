package com.matcast.server.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Competitor reference stored inline on the match row.
 */
@Embeddable
public class Participant {

    @Column(nullable = false, length = 64)
    private String id;

    @Column(length = 120)
    private String name;

    @Column(length = 120)
    private String team;

    public Participant() {
    }

    public Participant(String id, String name, String team) {
        this.id = id;
        this.name = name;
        this.team = team;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
}
