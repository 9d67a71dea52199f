package com.reelmatch.recommender.engine;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.model.EmotionMatchStatus;
import com.reelmatch.recommender.model.EmotionRecommendation;
import com.reelmatch.recommender.model.RankedResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static com.reelmatch.recommender.MovieFixtures.catalog;
import static com.reelmatch.recommender.MovieFixtures.movie;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmotionScorerTest {

    private final Catalog catalog = catalog(
        movie("Toy Story", "Toys come alive.", 7.9, 75, "Animation", "Comedy", "Family"),
        movie("Paddington", "A bear in London.", 7.2, 20, "Comedy", "Family"),
        movie("The Mask", "A mask gives powers.", 5.5, 30, "Comedy", "Fantasy"),
        movie("Heat", "Cops and robbers.", 7.9, 30, "Action", "Crime", "Drama"),
        movie("The Notebook", "A love story.", 7.7, 35, "Romance", "Drama"),
        movie("The Shining", "A haunted hotel.", 8.2, 25, "Horror", "Thriller")
    );

    private final EmotionScorer scorer = new EmotionScorer(catalog, EmotionGenreMap.defaults());

    private static List<String> titles(EmotionRecommendation recommendation) {
        return recommendation.results().stream().map(result -> result.movie().title()).toList();
    }

    @Nested
    @DisplayName("mapping")
    class MappingTests {

        @Test
        void shouldMapEnglishAndFrenchKeysToSameGenres() {
            EmotionRecommendation joy = scorer.recommendByEmotion("joy", 5, 6.0);
            EmotionRecommendation joie = scorer.recommendByEmotion("  JOIE ", 5, 6.0);

            assertThat(joy.genres()).containsExactly("Comedy", "Adventure", "Family", "Animation");
            assertThat(joie.genres()).isEqualTo(joy.genres());
            assertThat(titles(joie)).isEqualTo(titles(joy));
        }

        @Test
        void shouldFallBackToSubstringMatch() {
            assertThat(scorer.recommendByEmotion("joyful", 5, 6.0).genres())
                .containsExactly("Comedy", "Adventure", "Family", "Animation");
            assertThat(scorer.recommendByEmotion("sad", 5, 6.0).genres())
                .containsExactly("Drama", "Romance");
            assertThat(scorer.recommendByEmotion("colère", 5, 6.0).genres())
                .containsExactly("Action", "Thriller", "Crime");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "boredom", "xyz"})
        void shouldReportNoMappingForUnknownEmotion(String emotion) {
            EmotionRecommendation recommendation = scorer.recommendByEmotion(emotion, 5, 6.0);

            assertThat(recommendation.status()).isEqualTo(EmotionMatchStatus.NO_MAPPING);
            assertThat(recommendation.mapped()).isFalse();
            assertThat(recommendation.results()).isEmpty();
        }

        @Test
        void shouldListAvailableEmotionsSorted() {
            assertThat(scorer.availableEmotions())
                .hasSize(8)
                .contains("joy", "joie", "peur", "fear")
                .isSorted();
        }
    }

    @Nested
    @DisplayName("ranking")
    class RankingTests {

        @Test
        void shouldRankByGenreCoverageThenRating() {
            EmotionRecommendation recommendation = scorer.recommendByEmotion("joy", 5, 6.0);

            assertThat(recommendation.status()).isEqualTo(EmotionMatchStatus.MATCHED);
            // Toy Story covers three of the four joy genres, Paddington two
            assertThat(titles(recommendation)).containsExactly("Toy Story", "Paddington");
        }

        @Test
        void shouldNeverReturnMoviesBelowMinRating() {
            EmotionRecommendation recommendation = scorer.recommendByEmotion("joy", 10, 7.5);

            assertThat(recommendation.results())
                .extracting(result -> result.movie().voteAverage())
                .allSatisfy(rating -> assertThat(rating).isGreaterThanOrEqualTo(7.5));
            assertThat(titles(recommendation)).containsExactly("Toy Story");
        }

        @Test
        void shouldLimitToN() {
            assertThat(scorer.recommendByEmotion("sadness", 1, 0).results()).hasSize(1);
            assertThat(scorer.recommendByEmotion("sadness", 0, 0).results()).isEmpty();
        }

        @Test
        void shouldComputeWeightedScore() {
            RankedResult top = scorer.recommendByEmotion("fear", 1, 6.0).results().get(0);

            double expected = 0.5 * 2 / 3 + 0.3 * 8.2 / 10 + 0.2 * Math.log1p(25) / 10;
            assertThat(top.movie().title()).isEqualTo("The Shining");
            assertThat(top.score()).isCloseTo(expected, within(1e-12));
            assertThat(EmotionScorer.score(top.movie(), Set.of("Horror", "Thriller", "Mystery")))
                .isCloseTo(expected, within(1e-12));
        }
    }

    @Test
    @DisplayName("Genre filter applies even when the rating passes")
    void shouldReturnNoMatchesWhenOnlyOtherGenresExist() {
        EmotionScorer horrorOnly = new EmotionScorer(
            catalog(movie("The Shining", 9.0, "Horror")), EmotionGenreMap.defaults());

        EmotionRecommendation recommendation = horrorOnly.recommendByEmotion("joy", 5, 6.0);

        assertThat(recommendation.results()).isEmpty();
        assertThat(recommendation.status()).isEqualTo(EmotionMatchStatus.NO_MATCHES);
        assertThat(recommendation.mapped()).isTrue();
    }
}
