package gov.nih.nlm.sbgn;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SBGN glyph classes handled by the converter.
 */
public enum GlyphClass {

	COMPARTMENT("compartment", Role.STRUCTURE),
	PROCESS("process", Role.PROCESS),
	OMITTED_PROCESS("omitted process", Role.PROCESS),
	UNCERTAIN_PROCESS("uncertain process", Role.PROCESS),
	ASSOCIATION("association", Role.PROCESS),
	DISSOCIATION("dissociation", Role.PROCESS),
	AND("and", Role.LOGIC_GATE),
	OR("or", Role.LOGIC_GATE),
	NOT("not", Role.LOGIC_GATE),
	PHENOTYPE("phenotype", Role.ENTITY),
	COMPLEX("complex", Role.ENTITY),
	MACROMOLECULE("macromolecule", Role.ENTITY),
	SIMPLE_CHEMICAL("simple chemical", Role.ENTITY),
	NUCLEIC_ACID_FEATURE("nucleic acid feature", Role.ENTITY),
	STATE_VARIABLE("state variable", Role.AUXILIARY),
	UNIT_OF_INFORMATION("unit of information", Role.AUXILIARY);

	/**
	 * Part a glyph class plays in a map
	 */
	public enum Role {
		STRUCTURE, PROCESS, LOGIC_GATE, ENTITY, AUXILIARY
	}

	private static final Map<String, GlyphClass> bySbgnClass = new HashMap<>();

	static {
		for (GlyphClass glyphClass : values()) {
			bySbgnClass.put(glyphClass.sbgnClass, glyphClass);
		}
	}

	private final String sbgnClass;
	private final Role role;

	GlyphClass(String sbgnClass, Role role) {
		this.sbgnClass = sbgnClass;
		this.role = role;
	}

	/**
	 * Find the glyph class with the specified SBGN-ML "class" attribute value.
	 *
	 * @param sbgnClass Attribute value
	 * @return Matching glyph class, or null if the class is not handled
	 */
	public static GlyphClass fromSbgnClass(String sbgnClass) {
		return bySbgnClass.get(sbgnClass);
	}

	@JsonValue
	public String getSbgnClass() {
		return sbgnClass;
	}

	public Role getRole() {
		return role;
	}

	public boolean isProcess() {
		return role == Role.PROCESS;
	}

	public boolean isLogicGate() {
		return role == Role.LOGIC_GATE;
	}

	@Override
	public String toString() {
		return sbgnClass;
	}
}
