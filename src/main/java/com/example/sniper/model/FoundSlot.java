package com.example.sniper.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One sighting of an open slot. At most one row exists per watch, date and start time;
 * the constraint is what keeps concurrent scans from recording the same slot twice.
 */
@Entity
@Table(
        name = "found_slots",
        uniqueConstraints = @UniqueConstraint(name = "uniq_watch_date_time",
                columnNames = {"watch_id", "slot_date", "slot_time"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FoundSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "watch_id", nullable = false)
    private Long watchId;

    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    /** raw start timestamp as the API returned it, e.g. "2024-06-01 19:00:00" */
    @Column(name = "slot_time", nullable = false)
    private String slotTime;

    @Column(name = "party_size")
    private Integer partySize;

    @Column(name = "config_token", length = 1024)
    private String configToken;

    @Column(name = "seen_at")
    private LocalDateTime seenAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean booked = false;

    @Builder.Default
    @Column(name = "snipe_attempts", nullable = false)
    private int snipeAttempts = 0;

    /** set while one scan owns the booking attempt for this slot */
    @Builder.Default
    @Column(name = "snipe_in_progress", nullable = false)
    private boolean snipeInProgress = false;
}
