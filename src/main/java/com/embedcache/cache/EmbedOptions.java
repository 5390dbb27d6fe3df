package com.embedcache.cache;

/**
 * @param normalize L2-normalize vectors before caching and returning them; part of namespace
 *                  selection
 */
public record EmbedOptions(boolean normalize) {
    public static final EmbedOptions DEFAULT = new EmbedOptions(false);
    public static final EmbedOptions NORMALIZED = new EmbedOptions(true);
}
