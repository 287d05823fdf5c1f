package gov.nih.nlm.sbgn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Classifies resolved arcs into arcs between entity glyphs, and arcs grouped
 * by the process or logic gate they enter or leave.
 */
public class ArcReifier {

	private static final Logger LOGGER = LogManager.getLogger(ArcReifier.class);

	/**
	 * Reified groups, and direct arcs.
	 *
	 * @param reified Arcs grouped by process, in order of first appearance
	 * @param direct  Arcs between entity glyphs
	 */
	public record Reification(List<ReifiedGroup> reified, List<DirectArc> direct) {
	}

	// Accumulate the arcs of one process before freezing them
	private static class GroupBuilder {

		final String process;
		final Map<String, List<ReifiedArc>> targets = new LinkedHashMap<>();
		final Map<String, List<ReifiedArc>> sources = new LinkedHashMap<>();

		GroupBuilder(String process) {
			this.process = process;
		}

		ReifiedGroup build() {
			return new ReifiedGroup(process, freeze(targets), freeze(sources));
		}

		static Map<String, List<ReifiedArc>> freeze(Map<String, List<ReifiedArc>> arcsByClass) {
			Map<String, List<ReifiedArc>> frozen = new LinkedHashMap<>();
			arcsByClass.forEach((arcClass, arcs) -> frozen.put(arcClass, List.copyOf(arcs)));
			return Collections.unmodifiableMap(frozen);
		}
	}

	/**
	 * Classify arcs by the kinds of their endpoints. An arc leaving a process is
	 * added to the targets of the process, an arc entering a process to its
	 * sources, and an arc between entity glyphs is kept as a direct arc. Arcs
	 * between processes are dropped.
	 *
	 * @param arcs Resolved arcs
	 * @return Reified groups, and direct arcs
	 */
	public static Reification reifyArcs(List<ResolvedArc> arcs) {
		Map<String, GroupBuilder> groups = new LinkedHashMap<>();
		List<DirectArc> direct = new ArrayList<>();
		for (ResolvedArc arc : arcs) {
			ArcEndpoint source = arc.source();
			ArcEndpoint target = arc.target();
			switch (source.kind()) {
			case PROCESS:
				switch (target.kind()) {
				case NODE:
					LOGGER.info("handling {} from {} to {}", arc.arcClass(), source.id(), target.id());
					groups.computeIfAbsent(source.processId(), GroupBuilder::new).targets
							.computeIfAbsent(arc.arcClass(), k -> new ArrayList<>())
							.add(new ReifiedArc(arc.arcId(), arc.arcClass(), target.entity()));
					break;
				case PROCESS:
					LOGGER.warn("unhandled process->process {} from {} to {}", arc.arcClass(), source.id(),
							target.id());
					break;
				}
				break;
			case NODE:
				switch (target.kind()) {
				case PROCESS:
					LOGGER.info("handling {} from {} to {}", arc.arcClass(), source.id(), target.id());
					groups.computeIfAbsent(target.processId(), GroupBuilder::new).sources
							.computeIfAbsent(arc.arcClass(), k -> new ArrayList<>())
							.add(new ReifiedArc(arc.arcId(), arc.arcClass(), source.entity()));
					break;
				case NODE:
					LOGGER.info("handling direct {} from {} to {}", arc.arcClass(), source.id(), target.id());
					direct.add(new DirectArc(arc.arcId(), arc.arcClass(), source.entity(), target.entity()));
					break;
				}
				break;
			}
		}
		List<ReifiedGroup> reified = new ArrayList<>();
		for (GroupBuilder group : groups.values()) {
			reified.add(group.build());
		}
		return new Reification(reified, direct);
	}
}
