package com.example.sniper.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "activity")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** null for system-wide events */
    @Column(name = "watch_id")
    private Long watchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ActivityType type;

    @Column(nullable = false, length = 1024)
    private String message;

    @Column(length = 4096)
    private String details;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
