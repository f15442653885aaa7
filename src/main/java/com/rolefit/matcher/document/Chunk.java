package com.rolefit.matcher.document;

/**
 * A window of consecutive words taken from one document.
 *
 * @param index       position of the chunk in its document's chunk sequence
 * @param text        the window's text, exactly {@code source.substring(startOffset, endOffset)}
 * @param startOffset character offset of the first word
 * @param endOffset   character offset just past the last word
 */
public record Chunk(int index, String text, int startOffset, int endOffset) {

    public int length() {
        return endOffset - startOffset;
    }
}
