package com.embedcache.cache;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Locale;

import com.embedcache.store.Namespace;

/**
 * Maps a model configuration to its cache partition.
 *
 * <p>Every field that changes output bytes (backend, model id, native width, normalize flag,
 * truncation width) feeds a SHA-256 over a length-prefixed encoding, so configurations that print alike never share
 * a namespace. The resulting name is {@code emb_<model slug>_<16 hex chars>}.
 */
public final class NamespaceResolver {
    private static final int MAX_SLUG_LENGTH = 24;
    private static final int DIGEST_HEX_LENGTH = 16;

    private NamespaceResolver() {
    }

    /**
     * @param nativeDimension untruncated width of the model's vectors; hashing models use it as the
     *     bucket count, so it changes every component
     */
    public static Namespace resolve(EmbeddingModelConfig config, boolean normalize, int nativeDimension) {
        if (nativeDimension <= 0) {
            throw new IllegalArgumentException("nativeDimension must be positive: " + nativeDimension);
        }
        String digest = HexFormat.of().formatHex(CacheKeys.sha256(identity(config, normalize, nativeDimension)));
        return new Namespace("emb_" + slug(config.modelId()) + "_" + digest.substring(0, DIGEST_HEX_LENGTH));
    }

    private static byte[] identity(EmbeddingModelConfig config, boolean normalize, int nativeDimension) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeField(out, config.backend().name());
            writeField(out, config.modelId());
            out.writeInt(nativeDimension);
            out.writeBoolean(normalize);
            out.writeInt(config.truncateDim() == null ? -1 : config.truncateDim());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static void writeField(DataOutputStream out, String value) throws IOException {
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(encoded.length);
        out.write(encoded);
    }

    static String slug(String modelId) {
        String slug = modelId.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("_+$", "");
        }
        return slug.isEmpty() ? "model" : slug;
    }
}
