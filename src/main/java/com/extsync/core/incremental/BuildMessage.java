package com.extsync.core.incremental;

/**
 * Structured diagnostic reported by an incremental rebuild.
 */
public record BuildMessage(String text) {}
