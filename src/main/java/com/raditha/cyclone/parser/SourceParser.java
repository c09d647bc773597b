package com.raditha.cyclone.parser;

/**
 * Turns the text of one source file into a syntax tree.
 * Implementations hold no per-file state and may be shared between threads.
 */
public interface SourceParser {

    /**
     * Parse a single file.
     *
     * @param fileId identifier recorded in every span of the tree
     * @param text   complete file contents
     * @return the syntax tree, whitespace and comments excluded
     * @throws SourceParseException if the text is malformed or unsupported
     */
    SyntaxTree parse(String fileId, String text) throws SourceParseException;
}
