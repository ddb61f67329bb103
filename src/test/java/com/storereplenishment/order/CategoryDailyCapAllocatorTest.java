package com.storereplenishment.order;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.RunContext;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CategoryDailyCapAllocatorTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final CategoryDailyCapAllocator allocator = new CategoryDailyCapAllocator();
    private final RunContext context = TestFixtures.context(TARGET);

    private static List<DailyOrderCount> sameWeekday(long count) {
        return List.of(
            new DailyOrderCount(TARGET.minusDays(7), count),
            new DailyOrderCount(TARGET.minusDays(14), count),
            new DailyOrderCount(TARGET.minusDays(21), count),
            new DailyOrderCount(TARGET.minusDays(3), 40)
        );
    }

    private static List<CapCandidate> candidates(int proven, int exploratory) {
        List<CapCandidate> list = new ArrayList<>();
        for (int i = 0; i < proven; i++) {
            list.add(new CapCandidate(String.format("P-%02d", i), 2, 30 - i % 10, 5.0 + i, 0));
        }
        for (int i = 0; i < exploratory; i++) {
            list.add(new CapCandidate(String.format("E-%02d", i), 1, 2, 1.0 + i, 0));
        }
        return list;
    }

    @Test
    void allocate_splitsCapBetweenProvenAndExploratory() {
        CapAllocation allocation = allocator.allocate(CategoryGroup.FOOD, candidates(25, 12), TARGET,
            sameWeekday(17), context);

        assertThat(allocation.cap()).isEqualTo(20);
        assertThat(allocation.averageBasis()).isEqualTo("weekday");
        assertThat(allocation.selected()).hasSize(20);
        assertThat(allocation.provenSelected()).isEqualTo(15);
        assertThat(allocation.exploratorySelected()).isEqualTo(5);
        assertThat(allocation.dropped()).hasSize(17);
    }

    @Test
    void allocate_givesUnusedExploreSlotsToProvenItems() {
        CapAllocation allocation = allocator.allocate(CategoryGroup.FOOD, candidates(25, 2), TARGET,
            sameWeekday(17), context);

        assertThat(allocation.selected()).hasSize(20);
        assertThat(allocation.provenSelected()).isEqualTo(18);
        assertThat(allocation.exploratorySelected()).isEqualTo(2);
    }

    @Test
    void allocate_leavesExploratoryItemsWithZeroSaleStreakOut() {
        List<CapCandidate> list = new ArrayList<>(candidates(25, 0));
        list.add(new CapCandidate("E-FAIL", 1, 2, 9.0, 3));

        CapAllocation allocation = allocator.allocate(CategoryGroup.FOOD, list, TARGET, sameWeekday(17), context);

        assertThat(allocation.exploreFailed()).containsExactly("E-FAIL");
        assertThat(allocation.isSelected("E-FAIL")).isFalse();
    }

    @Test
    void allocate_underCapKeepsEveryone() {
        CapAllocation allocation = allocator.allocate(CategoryGroup.FOOD, candidates(5, 3), TARGET,
            sameWeekday(17), context);

        assertThat(allocation.selected()).hasSize(8);
        assertThat(allocation.dropped()).isEmpty();
    }

    @Test
    void allocate_uncappedGroupPassesThrough() {
        CapAllocation allocation = allocator.allocate(CategoryGroup.SNACK, candidates(40, 10), TARGET,
            List.of(), context);

        assertThat(allocation.selected()).hasSize(50);
        assertThat(allocation.averageBasis()).isEqualTo("uncapped");
    }

    @Test
    void averageItemCount_fallsBackWhenNoHistory() {
        var overall = allocator.averageItemCount(
            List.of(new DailyOrderCount(TARGET.minusDays(2), 10), new DailyOrderCount(TARGET.minusDays(3), 12)),
            TARGET, context.dailyCap());
        var fallback = allocator.averageItemCount(List.of(), TARGET, context.dailyCap());

        assertThat(overall.basis()).isEqualTo("overall");
        assertThat(overall.value()).isEqualTo(11.0);
        assertThat(fallback.basis()).isEqualTo("fallback");
        assertThat(fallback.value()).isEqualTo(15.0);
    }

    @Test
    void averageItemCount_daysWithoutOrdersCountAsZero() {
        var weekday = allocator.averageItemCount(
            List.of(new DailyOrderCount(TARGET.minusDays(21), 8), new DailyOrderCount(TARGET.minusDays(14), 8),
                    new DailyOrderCount(TARGET.minusDays(3), 5)),
            TARGET, context.dailyCap());
        var overall = allocator.averageItemCount(
            List.of(new DailyOrderCount(TARGET.minusDays(5), 10), new DailyOrderCount(TARGET.minusDays(2), 14)),
            TARGET, context.dailyCap());

        assertThat(weekday.basis()).isEqualTo("weekday");
        assertThat(weekday.value()).isCloseTo(16.0 / 3, within(1e-9));
        assertThat(overall.basis()).isEqualTo("overall");
        assertThat(overall.value()).isEqualTo(6.0);
    }
}
