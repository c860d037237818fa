package com.example.sniper.service;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.model.ActivityType;
import com.example.sniper.model.MonitorState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the RUNNING/STOPPED state and the periodic scan. Cycles run on a single-threaded
 * scheduler with a fixed delay between the end of one cycle and the start of the next.
 * Stopping cancels future cycles only; a cycle already in progress finishes.
 * State transitions and the schedule swap happen under the monitor's lock.
 */
@Slf4j
@Service
public class MonitorLoop {

    private final WatchScanner scanner;
    private final ActivityLog activity;
    private final SniperConfig config;
    private final TaskScheduler monitorTaskScheduler;
    private final TaskExecutor manualScanExecutor;

    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.STOPPED);
    private ScheduledFuture<?> schedule;

    public MonitorLoop(WatchScanner scanner,
                       ActivityLog activity,
                       SniperConfig config,
                       @Qualifier("monitorTaskScheduler") TaskScheduler monitorTaskScheduler,
                       @Qualifier("manualScanExecutor") TaskExecutor manualScanExecutor) {
        this.scanner = scanner;
        this.activity = activity;
        this.config = config;
        this.monitorTaskScheduler = monitorTaskScheduler;
        this.manualScanExecutor = manualScanExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (config.isAutoStart()) {
            log.info("sniper.monitor.auto-start=true, starting monitor");
            start();
        } else {
            log.info("Monitor ready (stopped). Scan interval: {}", config.getMonitorInterval());
        }
    }

    /**
     * @return false if the monitor was already running
     */
    public synchronized boolean start() {
        if (!state.compareAndSet(MonitorState.STOPPED, MonitorState.RUNNING)) {
            return false;
        }
        activity.append(null, ActivityType.SYSTEM, "Monitor started");
        cancelSchedule();
        schedule = monitorTaskScheduler.scheduleWithFixedDelay(
                this::runCycle, Instant.now(), config.getMonitorInterval());
        return true;
    }

    public synchronized void stop() {
        state.set(MonitorState.STOPPED);
        cancelSchedule();
        activity.append(null, ActivityType.SYSTEM, "Monitor stopped");
    }

    public MonitorState status() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == MonitorState.RUNNING;
    }

    /** Runs one scan outside the regular cadence. Returns immediately. */
    public void triggerImmediateScan() {
        manualScanExecutor.execute(this::runGuarded);
    }

    void runCycle() {
        if (!isRunning()) {
            return;
        }
        runGuarded();
    }

    private void runGuarded() {
        try {
            scanner.scanAllActive();
        } catch (Exception e) {
            log.error("Monitor cycle failed: {}", e.getMessage(), e);
            activity.append(null, ActivityType.ERROR, "Monitor error: " + e.getMessage());
        }
    }

    private void cancelSchedule() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        state.set(MonitorState.STOPPED);
        cancelSchedule();
    }
}
