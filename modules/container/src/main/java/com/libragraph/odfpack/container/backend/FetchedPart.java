package com.libragraph.odfpack.container.backend;

/**
 * Bytes of one part as read from a backend, with the modification time
 * in whole seconds when the backend has one ({@code -1} otherwise).
 */
public record FetchedPart(byte[] data, long timestamp) {
}
