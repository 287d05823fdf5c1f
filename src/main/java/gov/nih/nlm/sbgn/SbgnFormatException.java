package gov.nih.nlm.sbgn;

/**
 * Thrown when an SBGN-ML document does not have the structure required for
 * conversion.
 */
public class SbgnFormatException extends RuntimeException {

	public SbgnFormatException(String message) {
		super(message);
	}
}
