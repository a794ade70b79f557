package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Validated time-of-use schedule. Off-peak is the complement of the
 * peak and partial-peak hour sets.
 */
@Value
@Builder
public class TouSchedule {
    Set<Integer> summerMonths;
    Set<Integer> peakHours;
    Set<Integer> partialPeakHours;

    public Season seasonOf(int month) {
        return summerMonths.contains(month) ? Season.SUMMER : Season.WINTER;
    }

    public TouPeriod periodAt(int hourOfDay) {
        if (peakHours.contains(hourOfDay)) {
            return TouPeriod.PEAK;
        }
        if (partialPeakHours.contains(hourOfDay)) {
            return TouPeriod.PARTIAL_PEAK;
        }
        return TouPeriod.OFF_PEAK;
    }
}
