package ai.doctables.reconstructor.profile;

import java.util.Optional;

/**
 * Descriptive metadata a profile extracts from a document.
 */
public record DocumentMetadata(Optional<String> title,
                               Optional<String> organization,
                               Optional<String> reportingPeriod,
                               Optional<String> subjectOrCode,
                               Optional<String> profileId,
                               Optional<String> profileVersion,
                               double profileConfidence) {

    public DocumentMetadata {
        title = title == null ? Optional.empty() : title;
        organization = organization == null ? Optional.empty() : organization;
        reportingPeriod = reportingPeriod == null ? Optional.empty() : reportingPeriod;
        subjectOrCode = subjectOrCode == null ? Optional.empty() : subjectOrCode;
        profileId = profileId == null ? Optional.empty() : profileId;
        profileVersion = profileVersion == null ? Optional.empty() : profileVersion;
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), 0.0);
    }

    public DocumentMetadata withConfidence(double confidence) {
        return new DocumentMetadata(title, organization, reportingPeriod, subjectOrCode, profileId, profileVersion,
                confidence);
    }
}
