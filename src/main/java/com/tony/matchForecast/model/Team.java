package com.tony.matchForecast.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name", "league_id"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @ManyToOne
    @JoinColumn(name = "league_id")
    private League league;

    @Embedded
    private TeamStats currentStats;

    private String stadiumCity;
    private Double latitude;
    private Double longitude;

    public Team(String name, League league) {
        this.name = name;
        this.league = league;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
