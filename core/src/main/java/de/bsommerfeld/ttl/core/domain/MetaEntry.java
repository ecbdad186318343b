package de.bsommerfeld.ttl.core.domain;

/**
 * One key-value pair of the metadata extension layer.
 *
 * @param scope attachment level
 * @param owner document or corpus name, {@code null} for
 *              {@link MetaScope#GLOBAL}
 * @param key   key, unique per owner
 * @param value current value
 */
public record MetaEntry(MetaScope scope, String owner, String key, String value) {
}
