package no.cantara.kcr.supersession;

/**
 * Outcome of removing a document from its supersession chain.
 *
 * @param chainReconnected true when the successor was spliced onto the predecessor
 * @param promotedCurrentId predecessor that became the current version, or {@code null}
 */
public record RemovalResult(boolean chainReconnected, String promotedCurrentId) {}
