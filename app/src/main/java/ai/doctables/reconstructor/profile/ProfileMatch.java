package ai.doctables.reconstructor.profile;

import java.util.Objects;

/**
 * The profile chosen for a document together with its detection.
 */
public record ProfileMatch(DocumentProfile profile, ProfileDetection detection) {

    public ProfileMatch {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(detection, "detection");
    }

    public double confidence() {
        return detection.confidence();
    }
}
