package com.example.sniper.repository;

import com.example.sniper.model.ActivityEvent;
import com.example.sniper.model.ActivityType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ActivityEventRepository extends JpaRepository<ActivityEvent, Long> {

    List<ActivityEvent> findTop100ByOrderByCreatedAtDescIdDesc();

    List<ActivityEvent> findAllByWatchIdOrderByIdAsc(Long watchId);

    List<ActivityEvent> findAllByTypeOrderByIdAsc(ActivityType type);
}
