package ai.doctables.reconstructor.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Confidence a profile has in a document, plus whatever it noticed on the way.
 */
public record ProfileDetection(String profileId, double confidence, Map<String, Object> metadata) {

    public ProfileDetection {
        Objects.requireNonNull(profileId, "profileId");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
