package gov.nih.nlm.sbgn;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlyphTableBuilderTest {

    private static final Path testSbgnDir = Paths.get(System.getProperty("user.dir")).resolve("src/test/data/sbgn");
    private static Map<String, MapEntity> glyphs;
    private static Map<String, Compartment> compartments;
    private static GroundingResolver resolver;

    @BeforeAll
    static void setUp() {
        Document doc = SbgnXmlReader.parseXmlFile(testSbgnDir.resolve("pamp_signaling.xml.sbgn").toFile());
        Element sbgnMap = SbgnXmlReader.getSbgnChildren(doc.getDocumentElement(), "map").get(0);
        resolver = new GroundingResolver(RecordingGroundingService.forPampSignaling());
        compartments = CompartmentTableBuilder.buildCompartmentTable(sbgnMap, resolver);
        glyphs = GlyphTableBuilder.buildGlyphTable(sbgnMap, compartments, resolver);
    }

    private static Element parseMap(String xml) {
        Document doc = SbgnXmlReader.parseXmlString(xml);
        return SbgnXmlReader.getSbgnChildren(doc.getDocumentElement(), "map").get(0);
    }

    // --- table shape tests ---

    @Test
    void buildGlyphTable_orderOfConstruction() {
        assertEquals(List.of("ph1", "g_tlr3", "g_tbk1", "g_atp", "g_adp", "g_ifnb1", "g_ikbke", "cx1"),
                List.copyOf(glyphs.keySet()));
    }

    @Test
    void buildGlyphTable_skipsStructureAndUnhandledGlyphs() {
        for (String id : List.of("c1", "c2", "c3", "pr1", "pr2", "and1", "g_polyic", "g_tlr3_s1", "g_tlr3_u1")) {
            assertFalse(glyphs.containsKey(id), id);
        }
    }

    @Test
    void buildGlyphTable_unmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> glyphs.remove("ph1"));
    }

    // --- entity glyph tests ---

    @Test
    void buildGlyphTable_phenotypeGrounded() {
        Glyph phenotype = (Glyph) glyphs.get("ph1");
        assertEquals(GlyphClass.PHENOTYPE, phenotype.glyphClass());
        assertEquals(new EntityReference("go", "0006954", "inflammatory response"), phenotype.entity());
        assertNull(phenotype.compartment());
    }

    @Test
    void buildGlyphTable_macromoleculeWithStatesInfoAndCompartment() {
        Glyph tlr3 = (Glyph) glyphs.get("g_tlr3");
        assertEquals(GlyphClass.MACROMOLECULE, tlr3.glyphClass());
        assertEquals(new EntityReference("hgnc", "11849", "TLR3"), tlr3.entity());
        assertEquals(List.of("P"), tlr3.states());
        assertEquals(List.of("receptor"), tlr3.info());
        assertEquals(compartments.get("c2"), tlr3.compartment());
    }

    @Test
    void buildGlyphTable_macromoleculeWithSeveralReferencesIsComplex() {
        Glyph tbk1 = (Glyph) glyphs.get("g_tbk1");
        assertEquals(GlyphClass.COMPLEX, tbk1.glyphClass());
        assertEquals(new EntityReference("hgnc", "11584", "TBK1"), tbk1.entity());
    }

    @Test
    void buildGlyphTable_chemicalWithSeveralReferencesKeepsFirst() {
        Glyph adp = (Glyph) glyphs.get("g_adp");
        assertEquals(GlyphClass.SIMPLE_CHEMICAL, adp.glyphClass());
        assertEquals(new EntityReference("chebi", "16761", "ADP"), adp.entity());
    }

    @Test
    void buildGlyphTable_labelGroundedWhenNoReferences() {
        Glyph atp = (Glyph) glyphs.get("g_atp");
        assertEquals(new EntityReference("chebi", "15422", "ATP"), atp.entity());
        assertTrue(atp.states().isEmpty());
        assertTrue(atp.info().isEmpty());
    }

    @Test
    void buildGlyphTable_groundingFailureKeepsLabel() {
        Glyph ifnb1 = (Glyph) glyphs.get("g_ifnb1");
        assertEquals(GlyphClass.NUCLEIC_ACID_FEATURE, ifnb1.glyphClass());
        assertEquals(EntityReference.ungrounded("IFNB1"), ifnb1.entity());
        assertTrue(resolver.getFailedLabels().contains("IFNB1"));
    }

    @Test
    void buildGlyphTable_complexMemberIncluded() {
        Glyph ikbke = (Glyph) glyphs.get("g_ikbke");
        assertEquals(GlyphClass.MACROMOLECULE, ikbke.glyphClass());
        assertEquals(new EntityReference("hgnc", "14552", "IKBKE"), ikbke.entity());
    }

    @Test
    void buildGlyphTable_complexDecomposed() {
        ComplexGlyph complex = (ComplexGlyph) glyphs.get("cx1");
        assertEquals(GlyphClass.COMPLEX, complex.glyphClass());
        assertEquals("TBK1-P:IKBKE-ubq:GTP", complex.label());
        assertEquals(List.of("TBK1", "IKBKE", "GTP"), List.copyOf(complex.components().keySet()));
    }

    // --- edge case tests ---

    @Test
    void buildGlyphTable_danglingCompartmentIsNull() {
        Element map = parseMap("""
                <sbgn xmlns="http://sbgn.org/libsbgn/0.3"><map>
                  <glyph class="simple chemical" id="g1" compartmentRef="c9"><label text="ATP"/></glyph>
                </map></sbgn>""");
        Map<String, MapEntity> table = GlyphTableBuilder.buildGlyphTable(map, Map.of(),
                new GroundingResolver(new RecordingGroundingService()));

        assertNull(((Glyph) table.get("g1")).compartment());
    }

    @Test
    void buildGlyphTable_missingClassOrIdSkipped() {
        Element map = parseMap("""
                <sbgn xmlns="http://sbgn.org/libsbgn/0.3"><map>
                  <glyph id="g1"><label text="A"/></glyph>
                  <glyph class="macromolecule"><label text="B"/></glyph>
                  <glyph class="macromolecule" id="g3"><label text="TP53"/></glyph>
                </map></sbgn>""");
        Map<String, MapEntity> table = GlyphTableBuilder.buildGlyphTable(map, Map.of(),
                new GroundingResolver(new RecordingGroundingService()));

        assertEquals(List.of("g3"), List.copyOf(table.keySet()));
    }

    @Test
    void buildGlyphTable_complexReplacesEarlierEntry() {
        // A member reusing the id of its complex is replaced by the complex
        Element map = parseMap("""
                <sbgn xmlns="http://sbgn.org/libsbgn/0.3"><map>
                  <glyph class="complex" id="cx"><label text="TP53:MAPK1"/>
                    <glyph class="macromolecule" id="cx"><label text="TP53"/></glyph>
                  </glyph>
                </map></sbgn>""");
        Map<String, MapEntity> table = GlyphTableBuilder.buildGlyphTable(map, Map.of(),
                new GroundingResolver(new RecordingGroundingService()));

        assertEquals(1, table.size());
        assertTrue(table.get("cx") instanceof ComplexGlyph);
    }

    @Test
    void buildGlyphTable_emptyComplexLabel() {
        Element map = parseMap("""
                <sbgn xmlns="http://sbgn.org/libsbgn/0.3"><map>
                  <glyph class="complex" id="cx"/>
                </map></sbgn>""");
        Map<String, MapEntity> table = GlyphTableBuilder.buildGlyphTable(map, Map.of(),
                new GroundingResolver(new RecordingGroundingService()));

        assertTrue(((ComplexGlyph) table.get("cx")).components().isEmpty());
    }
}
