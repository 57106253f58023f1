package ai.doctables.reconstructor.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-document record of a batch run.
 */
public record DocumentOutcome(String documentName,
                              boolean success,
                              Optional<ReconstructionResult> result,
                              Optional<String> errorMessage,
                              Duration processingTime) {

    public DocumentOutcome {
        Objects.requireNonNull(documentName, "documentName");
        result = result == null ? Optional.empty() : result;
        errorMessage = errorMessage == null ? Optional.empty() : errorMessage;
        processingTime = processingTime == null ? Duration.ZERO : processingTime;
        if (success && result.isEmpty()) {
            throw new IllegalArgumentException("A successful outcome must carry a result");
        }
    }

    public static DocumentOutcome succeeded(ReconstructionResult result, Duration processingTime) {
        return new DocumentOutcome(result.documentName(), true, Optional.of(result), Optional.empty(), processingTime);
    }

    public static DocumentOutcome failed(String documentName, String errorMessage, Duration processingTime) {
        return new DocumentOutcome(documentName, false, Optional.empty(), Optional.ofNullable(errorMessage),
                processingTime);
    }
}
