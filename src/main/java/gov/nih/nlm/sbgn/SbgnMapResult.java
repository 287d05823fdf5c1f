package gov.nih.nlm.sbgn;

import java.util.List;

/**
 * Intermediate graph description of an SBGN map.
 *
 * @param title   Text of the map notes, or null
 * @param reified Arcs grouped by process, in order of first appearance
 * @param direct  Arcs between entity glyphs, in document order
 */
public record SbgnMapResult(String title, List<ReifiedGroup> reified, List<DirectArc> direct) {

	public SbgnMapResult {
		reified = List.copyOf(reified);
		direct = List.copyOf(direct);
	}
}
