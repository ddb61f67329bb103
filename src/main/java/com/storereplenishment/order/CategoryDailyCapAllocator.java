package com.storereplenishment.order;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Caps how many distinct items of a short-life category are ordered per day, keeping
 * a share of the slots for items that are still building a sales history.
 */
@Slf4j
@Component
public class CategoryDailyCapAllocator {

    private static final Comparator<CapCandidate> PRIORITY = Comparator
        .comparingInt(CapCandidate::dataDays).reversed()
        .thenComparing(Comparator.comparingDouble(CapCandidate::forecast).reversed())
        .thenComparing(CapCandidate::itemId);

    public CapAllocation allocate(CategoryGroup group, List<CapCandidate> candidates, LocalDate targetDate,
                                  List<DailyOrderCount> history, RunContext context) {
        List<CapCandidate> ordering = candidates.stream().filter(c -> c.orderQty() > 0).toList();
        Set<String> all = new LinkedHashSet<>();
        ordering.forEach(c -> all.add(c.itemId()));

        if (!group.isDailyCapped()) {
            return new CapAllocation(ordering.size(), ordering.size(), "uncapped", all, List.of(), 0, 0, List.of());
        }

        RunContext.CapSettings settings = context.dailyCap();
        Average average = averageItemCount(history, targetDate, settings);
        int cap = (int) Math.round(average.value()) + settings.wasteBuffer();

        if (ordering.size() <= cap) {
            return new CapAllocation(cap, average.value(), average.basis(), all, List.of(), 0, 0, List.of());
        }

        List<CapCandidate> proven = new ArrayList<>();
        List<CapCandidate> exploratory = new ArrayList<>();
        List<String> exploreFailed = new ArrayList<>();
        for (CapCandidate c : ordering) {
            if (c.dataDays() >= settings.provenMinDataDays()) {
                proven.add(c);
            } else if (c.recentZeroSaleStreak() >= settings.exploreFailZeroDays()) {
                exploreFailed.add(c.itemId());
            } else {
                exploratory.add(c);
            }
        }
        proven.sort(PRIORITY);
        exploratory.sort(PRIORITY);

        int exploreSlots = (int) Math.round(cap * settings.exploreRatio());
        int exploitSlots = cap - exploreSlots;
        int takeProven = Math.min(exploitSlots, proven.size());
        int takeExplore = Math.min(exploreSlots, exploratory.size());

        int leftover = cap - takeProven - takeExplore;
        int extraProven = Math.min(leftover, proven.size() - takeProven);
        takeProven += extraProven;
        leftover -= extraProven;
        takeExplore += Math.min(leftover, exploratory.size() - takeExplore);

        Set<String> selected = new LinkedHashSet<>();
        proven.subList(0, takeProven).forEach(c -> selected.add(c.itemId()));
        exploratory.subList(0, takeExplore).forEach(c -> selected.add(c.itemId()));
        List<String> dropped = ordering.stream()
            .map(CapCandidate::itemId)
            .filter(id -> !selected.contains(id))
            .toList();

        log.info("Daily cap applied | group={} | date={} | cap={} ({} avg {}) | candidates={} | proven={} | exploratory={} | exploreFailed={}",
                 group, targetDate, cap, average.basis(), average.value(), ordering.size(),
                 takeProven, takeExplore, exploreFailed.size());
        return new CapAllocation(cap, average.value(), average.basis(), selected, dropped,
                                 takeProven, takeExplore, exploreFailed);
    }

    Average averageItemCount(List<DailyOrderCount> history, LocalDate targetDate, RunContext.CapSettings settings) {
        LocalDate from = targetDate.minusDays(settings.lookbackDays());
        List<DailyOrderCount> window = withZeroDays(history.stream()
            .filter(h -> !h.date().isBefore(from) && h.date().isBefore(targetDate))
            .toList());
        DayOfWeek weekday = targetDate.getDayOfWeek();
        List<DailyOrderCount> sameWeekday = window.stream()
            .filter(h -> h.date().getDayOfWeek() == weekday)
            .toList();

        if (sameWeekday.size() >= settings.minSameWeekdaySamples()) {
            return new Average(mean(sameWeekday), "weekday");
        }
        if (!window.isEmpty()) {
            return new Average(mean(window), "overall");
        }
        return new Average(settings.fallbackDailyAvg(), "fallback");
    }

    /**
     * Days without a row inside the recorded span had no orders in the category and
     * count as zero. Days before the first or after the last row are left out.
     */
    static List<DailyOrderCount> withZeroDays(List<DailyOrderCount> recorded) {
        if (recorded.isEmpty()) {
            return recorded;
        }
        TreeMap<LocalDate, Long> byDate = new TreeMap<>();
        for (DailyOrderCount count : recorded) {
            byDate.merge(count.date(), count.itemCount(), Long::sum);
        }
        LocalDate first = byDate.firstKey();
        LocalDate last = byDate.lastKey();
        List<DailyOrderCount> filled = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            filled.add(new DailyOrderCount(day, byDate.getOrDefault(day, 0L)));
        }
        return filled;
    }

    private static double mean(List<DailyOrderCount> counts) {
        return counts.stream().mapToLong(DailyOrderCount::itemCount).average().orElse(0.0);
    }

    record Average(double value, String basis) {}
}
