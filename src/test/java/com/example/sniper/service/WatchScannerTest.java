package com.example.sniper.service;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.controllers.BookingApiClient;
import com.example.sniper.dto.SlotOffer;
import com.example.sniper.model.ActivityType;
import com.example.sniper.model.FoundSlot;
import com.example.sniper.model.SniperSettings;
import com.example.sniper.model.Watch;
import com.example.sniper.repository.WatchRepository;
import com.example.sniper.service.exception.RemoteCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class WatchScannerTest {

    private static final LocalDate JUNE_1 = LocalDate.of(2024, 6, 1);
    private static final LocalDate JUNE_2 = LocalDate.of(2024, 6, 2);
    private static final LocalDate JUNE_3 = LocalDate.of(2024, 6, 3);

    private static final SniperSettings WITH_KEY = new SniperSettings("key", null, null);
    private static final SniperSettings WITH_AUTH = new SniperSettings("key", "auth", 99L);

    @Mock
    private WatchRepository watchRepository;

    @Mock
    private BookingApiClient api;

    @Mock
    private SlotLedger ledger;

    @Mock
    private SnipeSequencer snipeSequencer;

    @Mock
    private SettingsService settingsService;

    @Mock
    private ActivityLog activity;

    private WatchScanner scanner;

    @BeforeEach
    void setUp() {
        SniperConfig config = new SniperConfig();
        config.setDayPause(Duration.ZERO);
        config.setMaxSnipeAttempts(3);
        scanner = new WatchScanner(watchRepository, api, ledger, snipeSequencer, settingsService, activity, config);
    }

    @Test
    void shouldDoNothingWithoutApiKey() {
        given(settingsService.current()).willReturn(SniperSettings.empty());

        scanner.scanAllActive();

        verifyNoInteractions(api, watchRepository, ledger, activity);
    }

    @Test
    void shouldKeepScanningOtherWatchesWhenOneFails() {
        Watch reversed = watch(1L);
        reversed.setDateStart(JUNE_3);
        reversed.setDateEnd(JUNE_1);
        Watch healthy = watch(2L);
        given(settingsService.current()).willReturn(WITH_KEY);
        given(watchRepository.findAllByActiveTrue()).willReturn(List.of(reversed, healthy));
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of());

        scanner.scanAllActive();

        verify(activity).append(eq(1L), eq(ActivityType.ERROR), startsWith("Error checking Carbone"));
        verify(watchRepository, never()).updateLastChecked(eq(1L), any());
        verify(watchRepository).updateLastChecked(eq(2L), any());
    }

    @Test
    void shouldQueryEveryDayInAscendingOrder() {
        Watch watch = watch(1L);
        watch.setDateEnd(JUNE_3);
        given(api.findSlots(anyString(), any(), anyInt())).willReturn(List.of());

        scanner.scanWatch(watch, WITH_KEY);

        InOrder order = inOrder(api, watchRepository);
        order.verify(api).findSlots("v1", JUNE_1, 2);
        order.verify(api).findSlots("v1", JUNE_2, 2);
        order.verify(api).findSlots("v1", JUNE_3, 2);
        order.verify(watchRepository).updateLastChecked(eq(1L), any());
    }

    @Test
    void shouldSkipFailedDaysWithoutLoggingActivity() {
        Watch watch = watch(1L);
        watch.setDateEnd(JUNE_2);
        given(api.findSlots("v1", JUNE_1, 2)).willThrow(new RemoteCallException("503"));
        given(api.findSlots("v1", JUNE_2, 2)).willReturn(List.of(new SlotOffer("2024-06-02 19:00:00", "tok", null)));
        given(ledger.findUnbooked(1L, JUNE_2, "2024-06-02 19:00:00")).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(true);

        scanner.scanWatch(watch, WITH_KEY);

        verify(activity, never()).append(any(), eq(ActivityType.ERROR), anyString());
        verify(activity).append(1L, ActivityType.FOUND, "Slot found! Carbone - 2024-06-02 at 2024-06-02 19:00:00 for 2");
        verify(watchRepository).updateLastChecked(eq(1L), any());
    }

    @Test
    void shouldDropSlotsOutsideTimeWindow() {
        Watch watch = watch(1L);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(
                new SlotOffer("2024-06-01 16:59:00", "a", null),
                new SlotOffer("2024-06-01 17:00:00", "b", null),
                new SlotOffer("2024-06-01 22:00:00", "c", null),
                new SlotOffer("2024-06-01 22:01:00", "d", null)));
        given(ledger.findUnbooked(eq(1L), eq(JUNE_1), anyString())).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(true);

        scanner.scanWatch(watch, WITH_KEY);

        ArgumentCaptor<FoundSlot> captor = ArgumentCaptor.forClass(FoundSlot.class);
        verify(ledger, times(2)).recordIfAbsent(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(FoundSlot::getSlotTime)
                .containsExactly("2024-06-01 17:00:00", "2024-06-01 22:00:00");
        assertThat(captor.getAllValues()).allSatisfy(slot -> {
            assertThat(slot.getWatchId()).isEqualTo(1L);
            assertThat(slot.getSlotDate()).isEqualTo(JUNE_1);
            assertThat(slot.isBooked()).isFalse();
        });
    }

    @Test
    void shouldNotAnnounceKnownSlotAgain() {
        Watch watch = watch(1L);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(new SlotOffer("2024-06-01 19:00:00", "tok1", null)));
        given(ledger.findUnbooked(1L, JUNE_1, "2024-06-01 19:00:00"))
                .willReturn(Optional.of(FoundSlot.builder().watchId(1L).build()));

        scanner.scanWatch(watch, WITH_AUTH);

        verify(ledger, never()).recordIfAbsent(any());
        verify(activity, never()).append(any(), eq(ActivityType.FOUND), anyString());
    }

    @Test
    void shouldSkipSlotWhenConcurrentScanRecordedItFirst() {
        Watch watch = watch(1L);
        watch.setSnipeMode(true);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(new SlotOffer("2024-06-01 19:00:00", "tok1", null)));
        given(ledger.findUnbooked(1L, JUNE_1, "2024-06-01 19:00:00")).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(false);

        scanner.scanWatch(watch, WITH_AUTH);

        verify(activity, never()).append(any(), eq(ActivityType.FOUND), anyString());
        verifyNoInteractions(snipeSequencer);
    }

    @Test
    void shouldSnipeNewSlotWhenEnabled() {
        Watch watch = watch(1L);
        watch.setSnipeMode(true);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(new SlotOffer("2024-06-01 19:00:00", "tok1", null)));
        given(ledger.findUnbooked(1L, JUNE_1, "2024-06-01 19:00:00")).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(true);
        given(ledger.claimSnipe(1L, JUNE_1, "2024-06-01 19:00:00", 3)).willReturn(true);

        scanner.scanWatch(watch, WITH_AUTH);

        InOrder order = inOrder(ledger, snipeSequencer);
        order.verify(ledger).claimSnipe(1L, JUNE_1, "2024-06-01 19:00:00", 3);
        order.verify(snipeSequencer).snipe(watch, "tok1", JUNE_1, "2024-06-01 19:00:00");
        order.verify(ledger).releaseSnipe(1L, JUNE_1, "2024-06-01 19:00:00");
    }

    @Test
    void shouldReleaseClaimWhenSnipeThrows() {
        Watch watch = watch(1L);
        watch.setSnipeMode(true);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(new SlotOffer("2024-06-01 19:00:00", "tok1", null)));
        given(ledger.findUnbooked(1L, JUNE_1, "2024-06-01 19:00:00")).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(true);
        given(ledger.claimSnipe(1L, JUNE_1, "2024-06-01 19:00:00", 3)).willReturn(true);
        given(snipeSequencer.snipe(watch, "tok1", JUNE_1, "2024-06-01 19:00:00"))
                .willThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> scanner.scanWatch(watch, WITH_AUTH)).hasMessage("db down");

        verify(ledger).releaseSnipe(1L, JUNE_1, "2024-06-01 19:00:00");
    }

    @Test
    void shouldNotSnipeWithoutAuthTokenOrConfigToken() {
        Watch watch = watch(1L);
        watch.setSnipeMode(true);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(
                new SlotOffer("2024-06-01 19:00:00", "tok1", null),
                new SlotOffer("2024-06-01 20:00:00", "", null)));
        given(ledger.findUnbooked(eq(1L), eq(JUNE_1), anyString())).willReturn(Optional.empty());
        given(ledger.recordIfAbsent(any())).willReturn(true);

        scanner.scanWatch(watch, WITH_KEY);

        verifyNoInteractions(snipeSequencer);
        verify(activity, times(2)).append(eq(1L), eq(ActivityType.FOUND), anyString());
    }

    @Test
    void shouldSnipeKnownSlotOnlyWhileClaimSucceeds() {
        Watch watch = watch(1L);
        watch.setSnipeMode(true);
        given(api.findSlots("v1", JUNE_1, 2)).willReturn(List.of(new SlotOffer("2024-06-01 19:00:00", "tok2", null)));
        given(ledger.findUnbooked(1L, JUNE_1, "2024-06-01 19:00:00"))
                .willReturn(Optional.of(FoundSlot.builder().watchId(1L).snipeAttempts(2).build()));
        given(ledger.claimSnipe(1L, JUNE_1, "2024-06-01 19:00:00", 3)).willReturn(true, false);

        scanner.scanWatch(watch, WITH_AUTH);
        scanner.scanWatch(watch, WITH_AUTH);

        verify(snipeSequencer, times(1)).snipe(watch, "tok2", JUNE_1, "2024-06-01 19:00:00");
        verify(ledger, times(1)).releaseSnipe(1L, JUNE_1, "2024-06-01 19:00:00");
        verify(ledger, never()).recordIfAbsent(any());
    }

    private Watch watch(Long id) {
        return Watch.builder()
                .id(id)
                .venueId("v1")
                .venueName("Carbone")
                .partySize(2)
                .dateStart(JUNE_1)
                .timeEarliest("17:00")
                .timeLatest("22:00")
                .build();
    }
}
