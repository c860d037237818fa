package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Min;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Body of watch create/update requests. On update only the non-null fields are applied,
 * except that an explicit {@code null} clears {@code date_end}, {@code time_earliest}
 * or {@code time_latest}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WatchRequest {

    private String venueId;

    private String venueName;

    @Min(1)
    private Integer partySize;

    private LocalDate dateStart;

    private LocalDate dateEnd;

    private String timeEarliest;

    private String timeLatest;

    private Boolean snipeMode;

    private Boolean active;

    /** fields the body set to an explicit null */
    @JsonIgnore
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Set<String> explicitNulls = new HashSet<>();

    public void setDateEnd(LocalDate dateEnd) {
        this.dateEnd = track("dateEnd", dateEnd);
    }

    public void setTimeEarliest(String timeEarliest) {
        this.timeEarliest = track("timeEarliest", timeEarliest);
    }

    public void setTimeLatest(String timeLatest) {
        this.timeLatest = track("timeLatest", timeLatest);
    }

    public boolean providesDateEnd() {
        return dateEnd != null || explicitNulls.contains("dateEnd");
    }

    public boolean providesTimeEarliest() {
        return timeEarliest != null || explicitNulls.contains("timeEarliest");
    }

    public boolean providesTimeLatest() {
        return timeLatest != null || explicitNulls.contains("timeLatest");
    }

    private <T> T track(String field, T value) {
        if (value == null) {
            explicitNulls.add(field);
        } else {
            explicitNulls.remove(field);
        }
        return value;
    }
}
