// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

/**
 * When anti-factual variables get their terms.
 */
public enum BeamSearchProtocol {
    /** During frontier expansion, from the anti-factual instantiator. */
    AF_IN_LINE,
    /** After a complete factual mapping has been found, as replacements. */
    AF_POST_HOC,
}
