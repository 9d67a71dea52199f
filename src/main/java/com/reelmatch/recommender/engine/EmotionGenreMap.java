package com.reelmatch.recommender.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Mood keyword to genre list. French and English keys are separate surface forms of the
 * same mood. Lookup order follows insertion order.
 */
public final class EmotionGenreMap {

    private static final List<String> JOY = List.of("Comedy", "Adventure", "Family", "Animation");
    private static final List<String> ANGER = List.of("Action", "Thriller", "Crime");
    private static final List<String> SADNESS = List.of("Drama", "Romance");
    private static final List<String> FEAR = List.of("Horror", "Thriller", "Mystery");

    private final Map<String, List<String>> genresByEmotion;

    public EmotionGenreMap(Map<String, List<String>> genresByEmotion) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        genresByEmotion.forEach((emotion, genres) -> copy.put(normalize(emotion), List.copyOf(genres)));
        this.genresByEmotion = Collections.unmodifiableMap(copy);
    }

    public static EmotionGenreMap defaults() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("joie", JOY);
        table.put("joy", JOY);
        table.put("colère", ANGER);
        table.put("anger", ANGER);
        table.put("tristesse", SADNESS);
        table.put("sadness", SADNESS);
        table.put("peur", FEAR);
        table.put("fear", FEAR);
        return new EmotionGenreMap(table);
    }

    public static String normalize(String emotion) {
        return emotion == null ? "" : emotion.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Exact key first, then the first key that contains the token or is contained in it.
     * A blank token never matches.
     */
    public Optional<List<String>> genresFor(String emotion) {
        String normalized = normalize(emotion);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        List<String> exact = genresByEmotion.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        return genresByEmotion.entrySet().stream()
            .filter(entry -> entry.getKey().contains(normalized) || normalized.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    public List<String> emotions() {
        return genresByEmotion.keySet().stream().sorted().toList();
    }
}
