package com.example.clipscore_backend.scoring.profile;

import com.example.clipscore_backend.scoring.assess.AssessorCatalog;
import com.example.clipscore_backend.scoring.exception.InvalidCategoryException;
import com.example.clipscore_backend.scoring.exception.ProfileConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.example.clipscore_backend.scoring.assess.ComponentNames.AUTHENTICITY;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.CONTENT_MATCH;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.ENGAGEMENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CategoryProfileRegistryTest {

    private final CategoryProfileRegistry registry = CategoryProfileRegistry.defaults(AssessorCatalog.defaults());
    private final Set<String> implemented = AssessorCatalog.defaults().names();

    @Test
    void loadsBuiltInProfilesInDeclarationOrder() {
        assertThat(registry.profiles()).extracting(CategoryProfile::id)
                .containsExactly("heartwarming", "motivational", "traumatic");
        for (CategoryProfile profile : registry.profiles()) {
            double sum = profile.componentWeights().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(sum).isCloseTo(1.0, within(1e-9));
            assertThat(profile.componentWeights()).hasSize(6).containsKey(profile.gatingComponent());
        }
    }

    @Test
    void resolvesIdsIgnoringCaseAndSurroundingWhitespace() {
        assertThat(registry.profile("  Traumatic ").id()).isEqualTo("traumatic");
        assertThat(registry.contains("MOTIVATIONAL")).isTrue();
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void unknownCategoryFailsWithItsId() {
        assertThatThrownBy(() -> registry.profile("unknown_category"))
                .isInstanceOf(InvalidCategoryException.class)
                .extracting(ex -> ((InvalidCategoryException) ex).getCategoryId())
                .isEqualTo("unknown_category");
        assertThatThrownBy(() -> registry.profile(null)).isInstanceOf(InvalidCategoryException.class);
    }

    @Test
    void rejectsWeightsThatDoNotSumToOne() {
        CategoryProfile broken = minimal("broken")
                .weight(AUTHENTICITY, 0.5)
                .weight(CONTENT_MATCH, 0.4)
                .build();

        assertThatThrownBy(() -> new CategoryProfileRegistry(List.of(broken), implemented))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("sum to 0.9000");
    }

    @Test
    void rejectsUnimplementedComponents() {
        CategoryProfile broken = minimal("broken")
                .weight(AUTHENTICITY, 0.5)
                .weight("laughTrack", 0.5)
                .build();

        assertThatThrownBy(() -> new CategoryProfileRegistry(List.of(broken), implemented))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("laughTrack");
    }

    @Test
    void rejectsGatingOnUnweightedComponent() {
        CategoryProfile broken = minimal("broken")
                .weight(CONTENT_MATCH, 0.5)
                .weight(ENGAGEMENT, 0.5)
                .build();

        assertThatThrownBy(() -> new CategoryProfileRegistry(List.of(broken), implemented))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("unweighted component authenticity");
    }

    @Test
    void rejectsMissingEmotionTierAndDuplicateIds() {
        CategoryProfile noMild = CategoryProfile.builder("nomild")
                .emotions(EmotionTier.STRONG, "a")
                .emotions(EmotionTier.MODERATE, "b")
                .weight(AUTHENTICITY, 1.0)
                .gating(AUTHENTICITY, 0.4, 0.6)
                .confidence(0.3, 10)
                .labels(AuthenticityLabel.AUTHENTIC, AuthenticityLabel.QUESTIONABLE, AuthenticityLabel.LIKELY_STAGED)
                .build();
        assertThatThrownBy(() -> new CategoryProfileRegistry(List.of(noMild), implemented))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("mild");

        CategoryProfile ok = minimal("Same").weight(AUTHENTICITY, 1.0).build();
        CategoryProfile sameId = minimal("same").weight(AUTHENTICITY, 1.0).build();
        assertThatThrownBy(() -> new CategoryProfileRegistry(List.of(ok, sameId), implemented))
                .isInstanceOf(ProfileConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void derivedKeywordListsAreOrderedAndDistinct() {
        CategoryProfile heartwarming = registry.profile("heartwarming");

        assertThat(heartwarming.contentKeywords()).startsWith("reunion", "reunited").doesNotHaveDuplicates();
        assertThat(heartwarming.emotionKeywords()).startsWith("crying").contains("made me cry", "heartwarming");
        assertThat(heartwarming.speechPhrases()).contains("thank you", "i love you");
    }

    private static CategoryProfile.Builder minimal(String id) {
        return CategoryProfile.builder(id)
                .emotions(EmotionTier.STRONG, "a")
                .emotions(EmotionTier.MODERATE, "b")
                .emotions(EmotionTier.MILD, "c")
                .gating(AUTHENTICITY, 0.4, 0.6)
                .confidence(0.3, 10)
                .labels(AuthenticityLabel.AUTHENTIC, AuthenticityLabel.QUESTIONABLE, AuthenticityLabel.LIKELY_STAGED);
    }
}
