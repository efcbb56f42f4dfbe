package com.example.clipscore_backend.scoring.profile;

import com.example.clipscore_backend.scoring.assess.AssessorCatalog;
import com.example.clipscore_backend.scoring.exception.InvalidCategoryException;
import com.example.clipscore_backend.scoring.exception.ProfileConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup of category profiles. Profiles are validated once on construction; an inconsistent
 * profile aborts start-up instead of failing individual requests.
 */
public class CategoryProfileRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(CategoryProfileRegistry.class);
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final Map<String, CategoryProfile> profiles;
    private final List<CategoryProfile> order;

    public CategoryProfileRegistry(Collection<CategoryProfile> profiles, Set<String> implementedComponents) {
        Map<String, CategoryProfile> byId = new LinkedHashMap<>();
        for (CategoryProfile profile : profiles) {
            validate(profile, implementedComponents);
            String key = normalize(profile.id());
            if (byId.putIfAbsent(key, profile) != null) {
                throw new ProfileConfigurationException("Duplicate category profile: " + profile.id());
            }
        }
        this.profiles = Map.copyOf(byId);
        this.order = List.copyOf(byId.values());
        LOGGER.info("CategoryProfileRegistry loaded profiles={}", byId.keySet());
    }

    public static CategoryProfileRegistry defaults(AssessorCatalog catalog) {
        return new CategoryProfileRegistry(CategoryProfiles.all(), catalog.names());
    }

    /**
     * Resolves a profile by identifier.
     *
     * @param id category identifier, matched case-insensitively.
     * @return the matching profile.
     * @throws InvalidCategoryException when the identifier is unknown.
     */
    public CategoryProfile profile(String id) {
        CategoryProfile profile = id == null ? null : profiles.get(normalize(id));
        if (profile == null) {
            throw new InvalidCategoryException(id);
        }
        return profile;
    }

    public boolean contains(String id) {
        return id != null && profiles.containsKey(normalize(id));
    }

    public List<CategoryProfile> profiles() {
        return order;
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }

    private static void validate(CategoryProfile profile, Set<String> implementedComponents) {
        String id = profile.id();
        Map<String, Double> weights = profile.componentWeights();
        if (weights.isEmpty()) {
            throw new ProfileConfigurationException("Profile " + id + " defines no component weights");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double weight = entry.getValue();
            if (weight < 0.0 || weight > 1.0) {
                throw new ProfileConfigurationException("Profile " + id + " weight out of range for " + entry.getKey() + ": " + weight);
            }
            if (!implementedComponents.contains(entry.getKey())) {
                throw new ProfileConfigurationException("Profile " + id + " references unimplemented component " + entry.getKey());
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ProfileConfigurationException(String.format(Locale.ROOT,
                    "Profile %s weights sum to %.4f instead of 1.0", id, sum));
        }
        GatingRule gating = profile.gating();
        if (!weights.containsKey(gating.component())) {
            throw new ProfileConfigurationException("Profile " + id + " gates on unweighted component " + gating.component());
        }
        if (gating.penalty() <= 0.0 || gating.penalty() > 1.0) {
            throw new ProfileConfigurationException("Profile " + id + " gating penalty must be in (0, 1]");
        }
        if (gating.threshold() < 0.0 || gating.threshold() > 1.0) {
            throw new ProfileConfigurationException("Profile " + id + " gating threshold must be in [0, 1]");
        }
        for (EmotionTier tier : EmotionTier.values()) {
            if (!profile.viewerEmotionTiers().containsKey(tier)) {
                throw new ProfileConfigurationException("Profile " + id + " misses emotion tier " + tier.id());
            }
        }
    }
}
