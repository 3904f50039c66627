package org.netpreserve.evidence.config;

/**
 * @param path directory holding the content store
 */
public record StoreConfig(String path) {
}
