// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.reduce;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.chains.base.Case;
import net.littleredcomputer.chains.base.CaseLink;
import net.littleredcomputer.chains.base.Relation;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Composition rules for pairs of linked relations. A rule maps a {@link CaseLink} to the
 * {@link Reduction} it composes into. Only one of a link and its {@link CaseLink#equivalent()}
 * is ever stored; looking up the other yields the inverse reduction.
 */
public class Reducer {
    private static final Logger log = LogManager.getFormatterLogger(Reducer.class);
    private static final Splitter commaSplitter = Splitter.on(',').trimResults();

    @Nullable private final ImmutableSet<String> relationTypes;  // null: any type may be composed into
    private final Map<CaseLink, Reduction> rules = new HashMap<>();

    /**
     * A reducer that accepts reductions into any relation type.
     */
    public Reducer() {
        this.relationTypes = null;
    }

    /**
     * A reducer that only composes into the types of the given relations.
     */
    public Reducer(Iterable<Relation> relations) {
        ImmutableSet.Builder<String> b = ImmutableSet.builder();
        for (Relation r : relations) b.add(r.type());
        this.relationTypes = b.build();
    }

    /**
     * Registers a rule. Registering a link that is already present, directly or through
     * its equivalent, is ignored unless strict is set.
     * @throws IllegalArgumentException on a duplicate registration in strict mode
     */
    public void register(CaseLink caseLink, Reduction reduction, boolean strict) {
        if (rules.containsKey(caseLink) || rules.containsKey(caseLink.equivalent())) {
            if (strict) throw new IllegalArgumentException(caseLink + " has already been registered");
            log.debug("ignoring duplicate registration of %s", caseLink);
            return;
        }
        rules.put(caseLink, reduction);
    }

    public int size() { return rules.size(); }

    @CheckReturnValue
    public Optional<Reduction> reduceCaseLink(CaseLink caseLink) {
        Reduction r = rules.get(caseLink);
        if (r != null) return Optional.of(r);
        r = rules.get(caseLink.equivalent());
        return r == null ? Optional.empty() : Optional.of(r.inverse());
    }

    /**
     * Composes two linked templates into one spanning their outer endpoints.
     * @return the composed template, or empty if the templates are not linked or no
     * rule covers the link
     * @throws IllegalArgumentException if the templates are circularly linked
     */
    @CheckReturnValue
    public Optional<RelationalTemplate> reduceTemplates(RelationalTemplate t1, RelationalTemplate t2) {
        CaseLink link = CaseLink.fromTemplates(t1, t2);
        String first, second;
        switch (link.linkCase()) {
            case ZERO:
                return Optional.empty();
            case ONE:
                first = t1.sourceId();
                second = t2.targetId();
                break;
            case TWO:
                first = t1.sourceId();
                second = t2.sourceId();
                break;
            case THREE:
                first = t1.targetId();
                second = t2.targetId();
                break;
            case FOUR:
                first = t1.targetId();
                second = t2.sourceId();
                break;
            default:
                throw new IllegalArgumentException("unsupported case: " + link.linkCase());
        }
        Optional<Reduction> reduction = reduceCaseLink(link);
        if (!reduction.isPresent()) return Optional.empty();
        Reduction r = reduction.get();
        if (relationTypes != null && !relationTypes.contains(r.relationType())) return Optional.empty();
        return Optional.of(r.order() == ReductionOrder.REVERSE
                ? new RelationalTemplate(second, r.relationType(), first)
                : new RelationalTemplate(first, r.relationType(), second));
    }

    /**
     * Finds every variable that can serve as the answer when pairingId is the paired
     * variable of pairingTemplate. The partner of pairingId in pairingTemplate is an
     * answer at zero hops; each time another template of the tree is composed into the
     * current pairing template (keeping pairingId as an endpoint), the partner in the
     * composed template is an answer at one more hop. Every composition order is tried,
     * so an answer may be reported at several hop counts.
     * <p>
     * The search is depth first and lazy: work is done only as answers are consumed.
     * @throws IllegalArgumentException if pairingId is not an endpoint of pairingTemplate
     */
    public Stream<AnswerId> validAnswerIds(RelationalTree tree, RelationalTemplate pairingTemplate, String pairingId) {
        if (!pairingTemplate.contains(pairingId)) {
            throw new IllegalArgumentException("pairing variable " + pairingId + " not in " + pairingTemplate);
        }
        return StreamSupport.stream(new Answers(tree.templates(), pairingTemplate, pairingId), false);
    }

    /**
     * @return the largest hop count reachable from any endpoint of any template of the tree
     */
    public int maxReasoningHops(RelationalTree tree) {
        int max = 0;
        for (RelationalTemplate t : tree.templates()) {
            for (String id : ImmutableList.of(t.sourceId(), t.targetId())) {
                max = Math.max(max, validAnswerIds(tree, t, id).mapToInt(AnswerId::reasoningHops).max().orElse(0));
            }
        }
        return max;
    }

    private class Answers implements Spliterator<AnswerId> {
        private class Frame {
            final ImmutableList<RelationalTemplate> templates;
            final RelationalTemplate pairing;
            final int hops;
            boolean entered = false;
            int next = 0;  // index of the next template to try composing

            Frame(ImmutableList<RelationalTemplate> templates, RelationalTemplate pairing, int hops) {
                this.templates = templates;
                this.pairing = pairing;
                this.hops = hops;
            }
        }

        private final String pairingId;
        private final Deque<Frame> stack = new ArrayDeque<>();

        Answers(ImmutableList<RelationalTemplate> templates, RelationalTemplate pairingTemplate, String pairingId) {
            this.pairingId = pairingId;
            stack.push(new Frame(templates, pairingTemplate, 0));
        }

        @Override
        public boolean tryAdvance(Consumer<? super AnswerId> action) {
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (!f.entered) {
                    f.entered = true;
                    if (f.templates.contains(f.pairing)) {
                        action.accept(new AnswerId(f.pairing.partnerOf(pairingId), f.hops));
                        return true;
                    }
                    continue;
                }
                if (f.next >= f.templates.size()) {
                    stack.pop();
                    continue;
                }
                RelationalTemplate t = f.templates.get(f.next++);
                if (t.equals(f.pairing)) continue;
                Optional<RelationalTemplate> reduced = reduceTemplates(t, f.pairing);
                if (reduced.isPresent() && reduced.get().contains(pairingId)) {
                    ImmutableList.Builder<RelationalTemplate> rest = ImmutableList.builder();
                    for (RelationalTemplate u : f.templates) {
                        if (!u.equals(t) && !u.equals(f.pairing)) rest.add(u);
                    }
                    rest.add(reduced.get());
                    stack.push(new Frame(rest.build(), reduced.get(), f.hops + 1));
                }
            }
            return false;
        }

        @Override
        public Spliterator<AnswerId> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return NONNULL;
        }
    }

    public static Reducer parseFrom(String table, List<Relation> relations, boolean strict) {
        return parseFrom(new StringReader(table), relations, strict);
    }

    /**
     * Parses a reduction table. The first line is a header and is skipped; every other
     * nonblank line reads {@code relation1,relation2,case,reduction_type,reduction_order},
     * where case is a {@link Case} name or number.
     * @param table textual reduction table
     * @param relations the known relations; the reducer only composes into their types
     * @param strict whether duplicate (or equivalent) rules are an error
     * @return a reducer holding every rule of the table
     */
    public static Reducer parseFrom(Reader table, List<Relation> relations, boolean strict) {
        Reducer reducer = new Reducer(relations);
        Scanner s = new Scanner(table);
        if (!s.hasNextLine()) throw new IllegalArgumentException("no header line");
        s.nextLine();
        while (s.hasNextLine()) {
            String line = s.nextLine();
            if (line.trim().isEmpty()) continue;
            List<String> f = commaSplitter.splitToList(line);
            if (f.size() != 5) throw new IllegalArgumentException("malformed reduction: " + line);
            for (String type : f.subList(0, 2)) {
                if (!reducer.relationTypes.contains(type)) throw new IllegalArgumentException("unknown relation: " + type);
            }
            reducer.register(new CaseLink(f.get(0), f.get(1), Case.parse(f.get(2))),
                    new Reduction(f.get(3), ReductionOrder.valueOf(f.get(4).toUpperCase())),
                    strict);
        }
        log.debug("loaded %d reduction rules", reducer.size());
        return reducer;
    }
}
