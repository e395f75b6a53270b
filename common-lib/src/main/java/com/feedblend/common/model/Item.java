package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A post or candidate flowing through one blend request.
 *
 * <p>Identity, author, timestamp, tags and engagement are fixed at construction.
 * The engine adds three annotations ({@code score}, {@code injected},
 * {@code injection_metadata}); each may be set at most once per request, and setting
 * one returns a new copy rather than mutating this instance.
 *
 * <p>Tags are lower-cased and deduplicated on the way in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = {"score", "injected", "injection_metadata"}, allowGetters = true)
public final class Item {

    private final String id;
    private final String authorId;
    private final Instant createdAt;
    private final SortedSet<String> tags;
    private final EngagementCounts engagement;
    private final boolean synthetic;

    // ── annotations, set only by the engine ──────────────────────────────────
    private final Double score;
    private final boolean injected;
    private final InjectionMetadata injectionMetadata;

    @JsonCreator
    public Item(@JsonProperty("id")         String id,
                @JsonProperty("author_id")  String authorId,
                @JsonProperty("created_at") Instant createdAt,
                @JsonProperty("tags")       Collection<String> tags,
                @JsonProperty("engagement") EngagementCounts engagement,
                @JsonProperty("synthetic")  boolean synthetic) {
        this(id, authorId, createdAt, normalizeTags(tags), engagement, synthetic, null, false, null);
    }

    private Item(String id, String authorId, Instant createdAt, SortedSet<String> tags,
                 EngagementCounts engagement, boolean synthetic,
                 Double score, boolean injected, InjectionMetadata injectionMetadata) {
        this.id                = Objects.requireNonNull(id, "id");
        this.authorId          = authorId;
        this.createdAt         = Objects.requireNonNull(createdAt, "created_at");
        this.tags              = tags;
        this.engagement        = engagement != null ? engagement : EngagementCounts.NONE;
        this.synthetic         = synthetic;
        this.score             = score;
        this.injected          = injected;
        this.injectionMetadata = injectionMetadata;
    }

    public static Item of(String id, String authorId, Instant createdAt, String... tags) {
        return new Item(id, authorId, createdAt, Arrays.asList(tags), EngagementCounts.NONE, false);
    }

    public static Item of(String id, String authorId, Instant createdAt,
                          EngagementCounts engagement, String... tags) {
        return new Item(id, authorId, createdAt, Arrays.asList(tags), engagement, false);
    }

    // ── annotation copies ───────────────────────────────────────────────────

    /**
     * @throws IllegalStateException if a score was already assigned in this request
     */
    public Item withScore(double value) {
        if (score != null) {
            throw new IllegalStateException("Score already assigned to item " + id);
        }
        return new Item(id, authorId, createdAt, tags, engagement, synthetic,
                        value, injected, injectionMetadata);
    }

    /**
     * Attaches the producer's source and explanation ahead of merging.
     *
     * @throws IllegalStateException if metadata was already attached
     */
    public Item withSourceHint(String source, String explanation) {
        if (injectionMetadata != null) {
            throw new IllegalStateException("Injection metadata already attached to item " + id);
        }
        return new Item(id, authorId, createdAt, tags, engagement, synthetic,
                        score, injected, InjectionMetadata.hint(source, explanation));
    }

    /**
     * Returns the injected form of this item: harmonized timestamp, {@code injected=true}
     * and completed metadata. Source and explanation come from an earlier hint when
     * present.
     *
     * @throws IllegalStateException if this item was already injected
     */
    public Item injectedAt(Instant harmonizedAt, String strategy) {
        if (injected) {
            throw new IllegalStateException("Item " + id + " was already injected");
        }
        String source = injectionMetadata != null && injectionMetadata.source() != null
            ? injectionMetadata.source() : InjectionMetadata.SOURCE_TIMELINE;
        String explanation = injectionMetadata != null && injectionMetadata.explanation() != null
            ? injectionMetadata.explanation() : InjectionMetadata.DEFAULT_EXPLANATION;
        InjectionMetadata completed = new InjectionMetadata(source, strategy, explanation, score);
        return new Item(id, authorId, harmonizedAt, tags, engagement, synthetic,
                        score, true, completed);
    }

    /** True if the two items have at least one tag in common. */
    public boolean sharesTagWith(Item other) {
        if (tags.isEmpty() || other.tags.isEmpty()) {
            return false;
        }
        return !Collections.disjoint(tags, other.tags);
    }

    // ── accessors ───────────────────────────────────────────────────────────

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("author_id")
    public String getAuthorId() {
        return authorId;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("tags")
    public Set<String> getTags() {
        return tags;
    }

    @JsonProperty("engagement")
    public EngagementCounts getEngagement() {
        return engagement;
    }

    @JsonProperty("synthetic")
    public boolean isSynthetic() {
        return synthetic;
    }

    @JsonProperty("score")
    public Double getScore() {
        return score;
    }

    @JsonIgnore
    public boolean hasScore() {
        return score != null;
    }

    @JsonProperty("injected")
    public boolean isInjected() {
        return injected;
    }

    @JsonProperty("injection_metadata")
    public InjectionMetadata getInjectionMetadata() {
        return injectionMetadata;
    }

    private static SortedSet<String> normalizeTags(Collection<String> raw) {
        TreeSet<String> normalized = new TreeSet<>();
        if (raw != null) {
            for (String tag : raw) {
                if (tag != null && !tag.isBlank()) {
                    normalized.add(tag.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSortedSet(normalized);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item other)) return false;
        return synthetic == other.synthetic
            && injected == other.injected
            && id.equals(other.id)
            && Objects.equals(authorId, other.authorId)
            && createdAt.equals(other.createdAt)
            && tags.equals(other.tags)
            && engagement.equals(other.engagement)
            && Objects.equals(score, other.score)
            && Objects.equals(injectionMetadata, other.injectionMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, authorId, createdAt, tags, engagement, synthetic,
                            score, injected, injectionMetadata);
    }

    @Override
    public String toString() {
        return "Item{id=" + id + ", createdAt=" + createdAt
             + (injected ? ", injected" : "")
             + (score != null ? ", score=" + score : "") + "}";
    }
}
