package gov.nih.nlm.sbgn;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapEntityTest {

    // --- GlyphClass tests ---

    @Test
    void fromSbgnClass_known() {
        assertEquals(GlyphClass.SIMPLE_CHEMICAL, GlyphClass.fromSbgnClass("simple chemical"));
        assertEquals(GlyphClass.NUCLEIC_ACID_FEATURE, GlyphClass.fromSbgnClass("nucleic acid feature"));
    }

    @Test
    void fromSbgnClass_unknown() {
        assertNull(GlyphClass.fromSbgnClass("perturbing agent"));
        assertNull(GlyphClass.fromSbgnClass("Macromolecule"));
    }

    @Test
    void roles() {
        assertTrue(GlyphClass.PROCESS.isProcess());
        assertTrue(GlyphClass.OMITTED_PROCESS.isProcess());
        assertTrue(GlyphClass.DISSOCIATION.isProcess());
        assertTrue(GlyphClass.AND.isLogicGate());
        assertTrue(GlyphClass.NOT.isLogicGate());
        assertFalse(GlyphClass.COMPLEX.isProcess());
        assertEquals(GlyphClass.Role.ENTITY, GlyphClass.PHENOTYPE.getRole());
        assertEquals(GlyphClass.Role.AUXILIARY, GlyphClass.STATE_VARIABLE.getRole());
        assertEquals("unit of information", GlyphClass.UNIT_OF_INFORMATION.toString());
    }

    // --- EntityReference tests ---

    @Test
    void entityReference_prefixRequiresIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> new EntityReference("hgnc", null, "TP53"));
    }

    @Test
    void entityReference_ungroundedAndUnknown() {
        assertFalse(EntityReference.ungrounded("IFNB1").isGrounded());
        EntityReference unknown = EntityReference.unknown("RAB5*");
        assertTrue(unknown.isGrounded());
        assertEquals("?", unknown.prefix());
        assertEquals("?", unknown.identifier());
    }

    // --- Glyph tests ---

    @Test
    void glyph_listsAreCopied() {
        List<String> states = new ArrayList<>(List.of("P"));
        Glyph glyph = new Glyph("g1", GlyphClass.MACROMOLECULE, EntityReference.ungrounded("TP53"), states,
                List.of(), null);
        states.add("ubq");

        assertEquals(List.of("P"), glyph.states());
        assertThrows(UnsupportedOperationException.class, () -> glyph.info().add("x"));
    }

    @Test
    void complexGlyph_classIsComplex() {
        ComplexGlyph complex = new ComplexGlyph("cx", "TP53:MAPK1", ComplexDecomposer.decomposeComplexLabel(
                "TP53:MAPK1"));
        assertEquals(GlyphClass.COMPLEX, complex.glyphClass());
        assertEquals(2, complex.components().size());
    }

    @Test
    void modificationTag() {
        assertEquals("-ubq", ModificationTag.UBIQUITINATION.getSuffix());
        assertEquals("P", ModificationTag.PHOSPHORYLATION.getTag());
    }
}
