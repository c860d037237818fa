package com.example.sniper.repository;

import com.example.sniper.model.FoundSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FoundSlotRepository extends JpaRepository<FoundSlot, Long> {

    Optional<FoundSlot> findByWatchIdAndSlotDateAndSlotTimeAndBookedFalse(Long watchId, LocalDate slotDate, String slotTime);

    List<FoundSlot> findAllByWatchId(Long watchId);

    List<FoundSlot> findTop50ByOrderBySeenAtDesc();

    @Transactional
    @Modifying
    @Query("update FoundSlot s set s.booked = true "
            + "where s.watchId = :watchId and s.slotDate = :slotDate and s.slotTime = :slotTime")
    int markBooked(@Param("watchId") Long watchId,
                   @Param("slotDate") LocalDate slotDate,
                   @Param("slotTime") String slotTime);

    @Transactional
    @Modifying
    @Query("update FoundSlot s set s.snipeAttempts = s.snipeAttempts + 1, s.snipeInProgress = true "
            + "where s.watchId = :watchId and s.slotDate = :slotDate and s.slotTime = :slotTime "
            + "and s.booked = false and s.snipeInProgress = false and s.snipeAttempts < :maxAttempts")
    int claimSnipe(@Param("watchId") Long watchId,
                   @Param("slotDate") LocalDate slotDate,
                   @Param("slotTime") String slotTime,
                   @Param("maxAttempts") int maxAttempts);

    @Transactional
    @Modifying
    @Query("update FoundSlot s set s.snipeInProgress = false "
            + "where s.watchId = :watchId and s.slotDate = :slotDate and s.slotTime = :slotTime")
    int releaseSnipe(@Param("watchId") Long watchId,
                     @Param("slotDate") LocalDate slotDate,
                     @Param("slotTime") String slotTime);

    @Transactional
    @Modifying
    @Query("update FoundSlot s set s.snipeInProgress = false where s.snipeInProgress = true")
    int releaseAllSnipes();
}
