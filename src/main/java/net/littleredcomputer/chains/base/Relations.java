// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.Scanner;

/**
 * Reads relation tables.
 */
public final class Relations {
    private static final Splitter commaSplitter = Splitter.on(',').trimResults().limit(3);

    private Relations() {}

    public static ImmutableList<Relation> parseFrom(String table) {
        return parseFrom(new StringReader(table));
    }

    /**
     * Parses a relation table. The first line is a header and is skipped; every other
     * nonblank line reads {@code type,description,surface_form}. The surface form is the
     * remainder of the line, so it may itself contain commas.
     * @param table textual relation table
     * @return relations in table order
     */
    public static ImmutableList<Relation> parseFrom(Reader table) {
        Scanner s = new Scanner(table);
        if (!s.hasNextLine()) throw new IllegalArgumentException("no header line");
        s.nextLine();
        ImmutableList.Builder<Relation> b = ImmutableList.builder();
        while (s.hasNextLine()) {
            String line = s.nextLine();
            if (line.trim().isEmpty()) continue;
            List<String> fields = commaSplitter.splitToList(line);
            if (fields.size() != 3 || fields.get(0).isEmpty()) {
                throw new IllegalArgumentException("malformed relation: " + line);
            }
            b.add(new Relation(fields.get(0), fields.get(1), fields.get(2)));
        }
        return b.build();
    }

    /**
     * @throws IllegalArgumentException if two relations share a type
     */
    public static ImmutableMap<String, Relation> byType(Iterable<Relation> relations) {
        ImmutableMap.Builder<String, Relation> b = ImmutableMap.builder();
        for (Relation r : relations) b.put(r.type(), r);
        return b.buildOrThrow();
    }
}
