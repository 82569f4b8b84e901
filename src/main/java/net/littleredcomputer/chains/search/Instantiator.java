// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import java.util.Set;

/**
 * Looks up terms in a term database. Implementations must behave as pure functions of
 * the query and their (static) database. An empty result is an ordinary answer.
 */
public interface Instantiator {
    Set<String> query(Query query);
}
