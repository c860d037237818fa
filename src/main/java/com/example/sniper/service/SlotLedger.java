package com.example.sniper.service;

import com.example.sniper.model.FoundSlot;
import com.example.sniper.repository.FoundSlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Remembers which (watch, date, time) slots have been seen. Records are never evicted,
 * they double as the history shown under {@code /api/found}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotLedger {

    private final FoundSlotRepository repository;

    /** The unbooked record for this slot, if it was already seen. */
    public Optional<FoundSlot> findUnbooked(Long watchId, LocalDate date, String time) {
        return repository.findByWatchIdAndSlotDateAndSlotTimeAndBookedFalse(watchId, date, time);
    }

    /**
     * Inserts the slot unless a row for the same watch, date and time already exists.
     *
     * @return true if this call created the record
     */
    public boolean recordIfAbsent(FoundSlot slot) {
        if (slot.getSeenAt() == null) {
            slot.setSeenAt(LocalDateTime.now());
        }
        try {
            repository.saveAndFlush(slot);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Slot already recorded: watch={} date={} time={}",
                    slot.getWatchId(), slot.getSlotDate(), slot.getSlotTime());
            return false;
        }
    }

    /**
     * Takes the booking attempt for an unbooked slot. Fails while another scan holds it
     * or once {@code maxAttempts} attempts have been made.
     *
     * @return true if the caller now owns the attempt and must {@link #releaseSnipe release} it
     */
    public boolean claimSnipe(Long watchId, LocalDate date, String time, int maxAttempts) {
        return repository.claimSnipe(watchId, date, time, maxAttempts) == 1;
    }

    public void releaseSnipe(Long watchId, LocalDate date, String time) {
        repository.releaseSnipe(watchId, date, time);
    }

    /** Claims left behind by a process that died mid-attempt. */
    @EventListener(ApplicationReadyEvent.class)
    public void releaseStaleClaims() {
        int released = repository.releaseAllSnipes();
        if (released > 0) {
            log.warn("Released {} snipe claims left over from a previous run", released);
        }
    }

    public int markBooked(Long watchId, LocalDate date, String time) {
        return repository.markBooked(watchId, date, time);
    }

    public List<FoundSlot> recent() {
        return repository.findTop50ByOrderBySeenAtDesc();
    }
}
