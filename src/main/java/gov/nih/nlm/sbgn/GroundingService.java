package gov.nih.nlm.sbgn;

import java.util.List;

/**
 * Grounds free text to a term of one of several controlled vocabularies.
 */
@FunctionalInterface
public interface GroundingService {

	/**
	 * Ground text against the candidate vocabularies, in order.
	 *
	 * @param prefixes Candidate vocabulary prefixes, in order of preference
	 * @param text     Text to ground
	 * @return Grounding from the first vocabulary containing the text, or null
	 *         if none does
	 */
	Grounding ground(List<String> prefixes, String text);
}
