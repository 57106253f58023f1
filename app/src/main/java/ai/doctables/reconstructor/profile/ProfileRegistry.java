package ai.doctables.reconstructor.profile;

import ai.doctables.reconstructor.model.Fragment;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, immutable set of document profiles. Built once and handed to the engine.
 */
public class ProfileRegistry {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileRegistry.class);

    private final List<DocumentProfile> profiles;
    private final double minConfidence;

    public ProfileRegistry(List<DocumentProfile> profiles) {
        this(profiles, DEFAULT_MIN_CONFIDENCE);
    }

    public ProfileRegistry(List<DocumentProfile> profiles, double minConfidence) {
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]");
        }
        this.profiles = List.copyOf(Objects.requireNonNull(profiles, "profiles"));
        this.minConfidence = minConfidence;
    }

    public static ProfileRegistry empty() {
        return new ProfileRegistry(List.of());
    }

    /**
     * Registry holding the built-in profiles.
     */
    public static ProfileRegistry withDefaults(double minConfidence) {
        return new ProfileRegistry(List.of(new MarksDistributionProfile(), new StaffListProfile()), minConfidence);
    }

    /**
     * Picks the profile with the strictly highest confidence at or above the threshold. Ties keep the
     * earlier registered profile; a profile that throws is skipped.
     */
    public Optional<ProfileMatch> select(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context) {
        ProfileMatch best = null;
        for (DocumentProfile profile : profiles) {
            ProfileDetection detection;
            try {
                detection = Objects.requireNonNull(profile.detect(fragments, pageTexts, context), "detection");
            } catch (RuntimeException ex) {
                LOGGER.warn("Profile {} failed during detection: {}", profile.id(), ex.getMessage(), ex);
                continue;
            }
            LOGGER.debug("Profile {} scored {}", profile.id(), detection.confidence());
            if (detection.confidence() >= minConfidence
                    && (best == null || detection.confidence() > best.confidence())) {
                best = new ProfileMatch(profile, detection);
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<DocumentProfile> findById(String id) {
        return profiles.stream().filter(profile -> profile.id().equals(id)).findFirst();
    }

    public List<String> profileIds() {
        return profiles.stream().map(DocumentProfile::id).toList();
    }

    public double minConfidence() {
        return minConfidence;
    }
}
