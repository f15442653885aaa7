package com.rolefit.matcher.document;

import com.rolefit.matcher.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into overlapping windows of whole words.
 *
 * <p>Words are maximal runs of non-whitespace characters. Consecutive windows share
 * {@code overlapWords} words; the last window may be shorter than the others and ends
 * on the last word of the text. Splitting is purely whitespace based, so identical input
 * always produces identical boundaries regardless of locale.
 */
public class Chunker {

    private static final Logger log = LoggerFactory.getLogger(Chunker.class);
    private static final Pattern WORD = Pattern.compile("\\S+");

    public static final int DEFAULT_WINDOW_WORDS = 200;
    public static final int DEFAULT_OVERLAP_WORDS = 75;

    private final int windowWords;
    private final int overlapWords;

    public Chunker() {
        this(DEFAULT_WINDOW_WORDS, DEFAULT_OVERLAP_WORDS);
    }

    public Chunker(int windowWords, int overlapWords) {
        if (windowWords <= 0) {
            throw new ConfigException("Chunk window must be positive, got " + windowWords);
        }
        if (overlapWords < 0) {
            throw new ConfigException("Chunk overlap cannot be negative, got " + overlapWords);
        }
        if (overlapWords >= windowWords) {
            throw new ConfigException("Chunk overlap (" + overlapWords
                + ") must be smaller than the window (" + windowWords + ")");
        }
        this.windowWords = windowWords;
        this.overlapWords = overlapWords;
    }

    /**
     * Split text into ordered chunks.
     *
     * @param text the text to split
     * @return chunks in document order; empty when the text has no words
     */
    public List<Chunk> chunk(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }

        List<int[]> words = wordSpans(text);
        if (words.isEmpty()) {
            return Collections.emptyList();
        }

        int stride = windowWords - overlapWords;
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = Math.min(start + windowWords, words.size());
            int from = words.get(start)[0];
            int to = words.get(end - 1)[1];
            chunks.add(new Chunk(chunks.size(), text.substring(from, to), from, to));
            if (end == words.size()) {
                break;
            }
            start += stride;
        }

        log.debug("Chunked {} words into {} chunks (window={}, overlap={})",
                  words.size(), chunks.size(), windowWords, overlapWords);
        return chunks;
    }

    private List<int[]> wordSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            spans.add(new int[] {m.start(), m.end()});
        }
        return spans;
    }

    public int getWindowWords() {
        return windowWords;
    }

    public int getOverlapWords() {
        return overlapWords;
    }
}
