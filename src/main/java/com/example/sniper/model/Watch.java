package com.example.sniper.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "watches")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Watch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "venue_id", nullable = false)
    private String venueId;

    @Builder.Default
    @Column(name = "venue_name")
    private String venueName = "";

    @Builder.Default
    @Column(name = "party_size", nullable = false)
    private Integer partySize = 2;

    @Column(name = "date_start", nullable = false)
    private LocalDate dateStart;

    /** null means a single-day watch */
    @Column(name = "date_end")
    private LocalDate dateEnd;

    /** HH:MM, inclusive */
    @Builder.Default
    @Column(name = "time_earliest", length = 5)
    private String timeEarliest = "17:00";

    /** HH:MM, inclusive */
    @Builder.Default
    @Column(name = "time_latest", length = 5)
    private String timeLatest = "22:00";

    @Builder.Default
    @Column(name = "snipe_mode", nullable = false)
    private boolean snipeMode = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "last_checked")
    private LocalDateTime lastChecked;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public LocalDate effectiveDateEnd() {
        return dateEnd != null ? dateEnd : dateStart;
    }

    public String displayName() {
        return venueName == null || venueName.isBlank() ? venueId : venueName;
    }
}
