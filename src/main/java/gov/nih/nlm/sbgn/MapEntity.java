package gov.nih.nlm.sbgn;

/**
 * A glyph table entry, which an arc endpoint may resolve to.
 */
public interface MapEntity {

	String glyphId();

	GlyphClass glyphClass();
}
