package gov.nih.nlm.sbgn;

import java.util.List;
import java.util.Map;

/**
 * All arcs touching one process or logic gate, grouped by relationship type.
 *
 * @param process Process or logic gate id
 * @param targets Arcs leaving the process, by relationship type
 * @param sources Arcs entering the process, by relationship type
 */
public record ReifiedGroup(String process, Map<String, List<ReifiedArc>> targets,
		Map<String, List<ReifiedArc>> sources) {
}
