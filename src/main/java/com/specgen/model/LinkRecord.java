package com.specgen.model;

/**
 * An extra documentation link collected from a {@code !link} line.
 *
 * @param label The link text.
 * @param url   The target URL.
 */
public record LinkRecord(String label, String url) {
}
