package com.example.sniper.repository;

import com.example.sniper.model.Watch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface WatchRepository extends JpaRepository<Watch, Long> {

    List<Watch> findAllByActiveTrue();

    List<Watch> findAllByOrderByCreatedAtDesc();

    @Transactional
    @Modifying
    @Query("update Watch w set w.lastChecked = :checkedAt where w.id = :id")
    int updateLastChecked(@Param("id") Long id, @Param("checkedAt") LocalDateTime checkedAt);
}
