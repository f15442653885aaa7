package com.rolefit.matcher.semantic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline embedding provider based on signed feature hashing of word unigrams and bigrams.
 *
 * <p>Vectors are L2-normalised. Output depends only on the text and the dimension, so it is
 * stable across runs and machines. It captures lexical overlap, not meaning; use a model
 * endpoint for real semantic similarity.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(HashingEmbeddingProvider.class);
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}+#]*");
    private static final double BIGRAM_WEIGHT = 0.5;

    public static final int DEFAULT_DIMENSION = 384;

    private final int dimension;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("Texts cannot be null");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text == null ? "" : text));
        }
        log.debug("Embedded {} texts locally (dimension={})", texts.size(), dimension);
        return vectors;
    }

    private float[] embedOne(String text) {
        double[] acc = new double[dimension];
        List<String> tokens = tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            add(acc, tokens.get(i), 1.0);
            if (i + 1 < tokens.size()) {
                add(acc, tokens.get(i) + ' ' + tokens.get(i + 1), BIGRAM_WEIGHT);
            }
        }

        double norm = 0.0;
        for (double v : acc) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);

        float[] vector = new float[dimension];
        if (norm > 0.0) {
            for (int i = 0; i < dimension; i++) {
                vector[i] = (float) (acc[i] / norm);
            }
        }
        return vector;
    }

    private void add(double[] acc, String feature, double weight) {
        int h = fnv1a(feature);
        int bucket = Math.floorMod(h, dimension);
        double sign = ((h >>> 31) & 1) == 0 ? 1.0 : -1.0;
        acc[bucket] += sign * weight;
    }

    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    private static int fnv1a(String s) {
        int hash = 0x811c9dc5;
        for (int i = 0; i < s.length(); i++) {
            hash ^= s.charAt(i);
            hash *= 0x01000193;
        }
        return hash;
    }

    @Override
    public String getModel() {
        return "hashing-" + dimension;
    }

    public int getDimension() {
        return dimension;
    }
}
