package gov.nih.nlm.sbgn;

/**
 * An arc with both endpoints resolved.
 *
 * @param arcId    Arc id
 * @param arcClass Relationship type, verbatim
 * @param source   Source endpoint
 * @param target   Target endpoint
 */
public record ResolvedArc(String arcId, String arcClass, ArcEndpoint source, ArcEndpoint target) {
}
