package ai.doctables.reconstructor.segment;

/**
 * Raised when segmentation is requested with a strategy that does not exist.
 */
public class SegmentationException extends RuntimeException {

    public SegmentationException(String message) {
        super(message);
    }
}
