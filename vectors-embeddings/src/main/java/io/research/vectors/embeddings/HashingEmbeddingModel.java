package io.research.vectors.embeddings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Feature-hashing embedding model for development and tests.
 *
 * <p>Each token is mapped to a deterministic Gaussian vector seeded by its SHA-256 hash,
 * and a text's embedding is the sum of its token vectors. Texts that share words
 * therefore point in similar directions, which is enough to exercise text search
 * end to end without a neural model.</p>
 *
 * <p><b>Warning:</b> the vectors capture word overlap only, not meaning.</p>
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(HashingEmbeddingModel.class);

    public static final String MODEL_PREFIX = "hashing";

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final String modelId;
    private final int dimensions;
    private final boolean normalizeOutput;
    private final boolean lowercase;

    public HashingEmbeddingModel(EmbeddingConfig config) {
        this(MODEL_PREFIX + "-" + config.dimensions(), config);
    }

    public HashingEmbeddingModel(String modelId, EmbeddingConfig config) {
        this.modelId = modelId;
        this.dimensions = config.dimensions();
        this.normalizeOutput = config.normalizeOutput();
        this.lowercase = config.lowercase();

        log.info("Initialized HashingEmbeddingModel: {} ({}d)", modelId, dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] embedding = new float[dimensions];
        for (String token : tokenize(text)) {
            Random random = new Random(seed(token));
            for (int i = 0; i < dimensions; i++) {
                embedding[i] += (float) random.nextGaussian();
            }
        }

        if (normalizeOutput) {
            normalize(embedding);
        }
        return embedding;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // Nothing to close
    }

    List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        String source = lowercase ? text.toLowerCase(Locale.ROOT) : text;
        for (String token : TOKEN_SEPARATOR.split(source)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static long seed(String token) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = md.digest(token.getBytes(StandardCharsets.UTF_8));

        // Convert first 8 bytes to long
        long result = 0;
        for (int i = 0; i < 8; i++) {
            result = (result << 8) | (hash[i] & 0xFF);
        }
        return result;
    }

    private static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);

        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
    }
}
