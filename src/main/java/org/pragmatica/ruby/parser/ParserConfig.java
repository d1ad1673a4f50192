package org.pragmatica.ruby.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled  memoize named rules per offset within a single parse
 * @param captureComments attach comments to the nodes that follow them; when off they are skipped
 */
public record ParserConfig(
    boolean packratEnabled,
    boolean captureComments
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        true
    );
}
