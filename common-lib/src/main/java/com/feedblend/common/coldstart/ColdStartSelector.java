package com.feedblend.common.coldstart;

import com.feedblend.common.model.InjectionMetadata;
import com.feedblend.common.model.Item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks a bounded, diversified set of generic items for users without usable
 * personalization signal (anonymous, new, below the interaction floor, or tracking
 * disabled).
 *
 * <h3>Diversification</h3>
 * Items are partitioned by category, defined as the item's lexically first tag
 * ({@value #UNCATEGORIZED} when untagged). Categories are visited round-robin in order
 * of first appearance, one item per visit, so no single category fills the head of
 * the result. Within a category the input order is kept unless a shuffle is requested.
 *
 * <p>Every returned item carries a {@code cold_start} source hint. Never fails: an
 * empty pool or a non-positive limit yields an empty list. Stateless.
 */
public final class ColdStartSelector {

    static final String UNCATEGORIZED = "uncategorized";

    static final String EXPLANATION = "Popular content while we learn what you like";

    public List<Item> select(List<Item> pool, int limit) {
        return select(pool, limit, true, null);
    }

    public List<Item> select(List<Item> pool, int limit, boolean diversify) {
        return select(pool, limit, diversify, null);
    }

    /**
     * @param pool        curated candidate items
     * @param limit       maximum number of items to expose
     * @param diversify   round-robin across categories when {@code true}
     * @param shuffle     when non-null, shuffles within each category (or the whole pool
     *                    when not diversifying) using this generator
     * @return at most {@code limit} items, each marked with source {@code cold_start}
     */
    public List<Item> select(List<Item> pool, int limit, boolean diversify, Random shuffle) {
        if (pool == null || pool.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<Item> ordered = diversify
            ? roundRobin(partition(pool, shuffle), limit)
            : head(pool, limit, shuffle);

        List<Item> marked = new ArrayList<>(ordered.size());
        for (Item item : ordered) {
            marked.add(item.withSourceHint(InjectionMetadata.SOURCE_COLD_START, EXPLANATION));
        }
        return List.copyOf(marked);
    }

    static String categoryOf(Item item) {
        return item.getTags().isEmpty() ? UNCATEGORIZED : item.getTags().iterator().next();
    }

    private static Map<String, List<Item>> partition(List<Item> pool, Random shuffle) {
        Map<String, List<Item>> byCategory = new LinkedHashMap<>();
        for (Item item : pool) {
            byCategory.computeIfAbsent(categoryOf(item), c -> new ArrayList<>()).add(item);
        }
        if (shuffle != null) {
            byCategory.values().forEach(bucket -> Collections.shuffle(bucket, shuffle));
        }
        return byCategory;
    }

    private static List<Item> roundRobin(Map<String, List<Item>> byCategory, int limit) {
        List<Iterator<Item>> cursors = new ArrayList<>();
        byCategory.values().forEach(bucket -> cursors.add(bucket.iterator()));

        List<Item> result = new ArrayList<>(limit);
        while (result.size() < limit && !cursors.isEmpty()) {
            Iterator<Iterator<Item>> round = cursors.iterator();
            while (round.hasNext() && result.size() < limit) {
                Iterator<Item> cursor = round.next();
                if (cursor.hasNext()) {
                    result.add(cursor.next());
                }
                if (!cursor.hasNext()) {
                    round.remove();
                }
            }
        }
        return result;
    }

    private static List<Item> head(List<Item> pool, int limit, Random shuffle) {
        List<Item> copy = new ArrayList<>(pool);
        if (shuffle != null) {
            Collections.shuffle(copy, shuffle);
        }
        return copy.size() > limit ? copy.subList(0, limit) : copy;
    }
}
