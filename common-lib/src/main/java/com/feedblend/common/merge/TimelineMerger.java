package com.feedblend.common.merge;

import com.feedblend.common.exception.UnknownStrategyException;
import com.feedblend.common.model.InjectionStrategy;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.StrategyType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Merges a real chronological sequence with injectable items under an
 * {@link InjectionStrategy}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Sort both inputs newest first (ties by id). Shuffle the injectables when the
 *       strategy asks for it; the shuffle only affects which items survive the budget.</li>
 *   <li>Budget {@code k = min(maxInjections, |injectable|)}.</li>
 *   <li>Build the {@code m + 1} {@link Gap}s of the real sequence and let the strategy's
 *       {@link InjectionPlanner} choose placements.</li>
 *   <li>Emit gap 0, real 0, gap 1, real 1, …, gap m, giving each placed item a
 *       harmonized timestamp strictly inside its gap.</li>
 * </ol>
 *
 * <p>The output is strictly descending by {@code created_at} as long as the real items
 * carry distinct timestamps. Real items are returned untouched; injected items are
 * copies carrying {@code injected=true} and completed injection metadata.
 *
 * <p>Only an unknown strategy raises; empty inputs, a zero budget and unsatisfiable gap
 * constraints all produce a shorter or unchanged timeline. Stateless and thread-safe.
 */
public class TimelineMerger {

    /** Newest first; ties broken by lexical id so the order is total. */
    public static final Comparator<Item> NEWEST_FIRST =
        Comparator.comparing(Item::getCreatedAt).reversed().thenComparing(Item::getId);

    private final Map<StrategyType, InjectionPlanner> planners;

    public TimelineMerger() {
        this(defaultPlanners());
    }

    TimelineMerger(Map<StrategyType, InjectionPlanner> planners) {
        this.planners = Map.copyOf(planners);
    }

    public List<Item> merge(List<Item> realItems, List<Item> injectableItems, InjectionStrategy strategy) {
        InjectionStrategy effective = strategy != null ? strategy : InjectionStrategy.of(StrategyType.UNIFORM);
        InjectionPlanner planner = planners.get(effective.type());
        if (planner == null) {
            throw new UnknownStrategyException(String.valueOf(effective.type()));
        }

        List<Item> real = sortedCopy(realItems);
        List<Item> injectable = selectionOrder(injectableItems, effective);
        int budget = effective.budget(injectable.size());

        if (budget == 0) {
            return List.copyOf(real);
        }
        if (real.isEmpty()) {
            // no anchors: tag matching has nothing to match against
            return effective.type() == StrategyType.TAG_MATCH
                ? List.of()
                : injectWithoutAnchors(injectable.subList(0, budget), effective);
        }

        List<Item> candidates = effective.type() == StrategyType.TAG_MATCH
            ? injectable
            : injectable.subList(0, budget);
        List<Gap> gaps = gapsOf(real);
        List<Placement> placements = planner.plan(new PlanningInput(real, candidates, gaps, budget, effective));

        return assemble(real, candidates, gaps, placements, effective);
    }

    static List<Gap> gapsOf(List<Item> real) {
        List<Gap> gaps = new ArrayList<>(real.size() + 1);
        for (int g = 0; g <= real.size(); g++) {
            Item newer = g > 0 ? real.get(g - 1) : null;
            Item older = g < real.size() ? real.get(g) : null;
            gaps.add(new Gap(g, newer, older));
        }
        return gaps;
    }

    private static List<Item> assemble(List<Item> real, List<Item> candidates, List<Gap> gaps,
                                       List<Placement> placements, InjectionStrategy strategy) {
        Item[] byGap = new Item[gaps.size()];
        for (Placement p : placements) {
            if (byGap[p.gapIndex()] != null) {
                throw new IllegalStateException("Planner placed two items into gap " + p.gapIndex());
            }
            Gap gap = gaps.get(p.gapIndex());
            byGap[p.gapIndex()] = candidates.get(p.itemIndex())
                .injectedAt(TimestampHarmonizer.forGap(gap), strategy.type().value());
        }

        List<Item> merged = new ArrayList<>(real.size() + placements.size());
        for (int g = 0; g < gaps.size(); g++) {
            if (byGap[g] != null) {
                merged.add(byGap[g]);
            }
            if (g < real.size()) {
                merged.add(real.get(g));
            }
        }
        return List.copyOf(merged);
    }

    private static List<Item> injectWithoutAnchors(List<Item> chosen, InjectionStrategy strategy) {
        List<Item> ordered = new ArrayList<>(chosen);
        ordered.sort(NEWEST_FIRST);
        List<Instant> stamps = TimestampHarmonizer.strictlyDescending(ordered);
        List<Item> result = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            result.add(ordered.get(i).injectedAt(stamps.get(i), strategy.type().value()));
        }
        return List.copyOf(result);
    }

    private static List<Item> sortedCopy(List<Item> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<Item> copy = new ArrayList<>(items);
        copy.sort(NEWEST_FIRST);
        return copy;
    }

    private static List<Item> selectionOrder(List<Item> injectable, InjectionStrategy strategy) {
        List<Item> ordered = sortedCopy(injectable);
        if (strategy.shuffleInjectable() && ordered.size() > 1) {
            ordered = new ArrayList<>(ordered);
            Random random = strategy.shuffleSeed() != null ? new Random(strategy.shuffleSeed()) : new Random();
            Collections.shuffle(ordered, random);
        }
        return ordered;
    }

    private static Map<StrategyType, InjectionPlanner> defaultPlanners() {
        Map<StrategyType, InjectionPlanner> planners = new EnumMap<>(StrategyType.class);
        planners.put(StrategyType.UNIFORM,    new UniformPlanner());
        planners.put(StrategyType.AFTER_N,    new AfterNPlanner());
        planners.put(StrategyType.FIRST_ONLY, new FirstOnlyPlanner());
        planners.put(StrategyType.TAG_MATCH,  new TagMatchPlanner());
        return planners;
    }
}
