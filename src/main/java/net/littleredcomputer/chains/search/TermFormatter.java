// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

/**
 * Canonicalizes terms into the form the term database uses. Must be deterministic and
 * idempotent.
 */
public interface TermFormatter {
    String format(String term, String language);
}
