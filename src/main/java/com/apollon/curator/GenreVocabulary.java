package com.apollon.curator;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed vocabulary of broad genre families used for loose genre matching.
 * <p>
 * A free-form tag belongs to a family when the lower-cased tag contains the family keyword,
 * so "dark ambient" and "ambient pop" both match "ambient" (and the latter also "pop").
 */
public final class GenreVocabulary {
    private GenreVocabulary() {}

    // Order matters: centroid ranking breaks frequency ties by first appearance.
    public static final List<String> BROAD_KEYWORDS = List.of(
        "ambient", "techno", "house", "trance", "dubstep", "drum and bass", "electronic", "edm",
        "rock", "metal", "punk", "indie", "pop", "jazz", "blues", "soul", "funk", "disco",
        "hip hop", "rap", "r&b", "folk", "country", "classical", "reggae", "latin"
    );

    /**
     * Lower-cases and trims tags, dropping blank ones.
     * @param tags raw genre tags
     * @return normalized tags in first-seen order
     */
    public static Set<String> normalize(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) return normalized;
        for (String tag : tags) {
            if (tag == null) continue;
            String t = tag.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) normalized.add(t);
        }
        return normalized;
    }

    /**
     * Returns the broad keywords contained in any of the given tags.
     * @param tags raw or normalized genre tags
     * @return matching keywords in vocabulary order
     */
    public static Set<String> keywordsOf(Collection<String> tags) {
        Set<String> normalized = normalize(tags);
        Set<String> keywords = new LinkedHashSet<>();
        for (String keyword : BROAD_KEYWORDS) {
            for (String tag : normalized) {
                if (tag.contains(keyword)) {
                    keywords.add(keyword);
                    break;
                }
            }
        }
        return keywords;
    }

    /**
     * Returns the broad keywords contained in a single tag.
     */
    public static List<String> keywordsOf(String tag) {
        if (tag == null) return List.of();
        String t = tag.trim().toLowerCase(Locale.ROOT);
        return BROAD_KEYWORDS.stream().filter(t::contains).toList();
    }
}
