// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Ranks candidates by how close their semantic distance is to a target distance. Each
 * query result contributes |target - distance| for each of its terms; the contributions
 * of a term are combined by the aggregator (sum by default) and lower is better. Terms
 * missing from any result of the collection are dropped. Ties keep first-seen order.
 */
public class SemanticDistanceSorter implements QueryResultSorter {
    private final double target;
    private final SemanticDistanceCalculator calculator;
    private final Function<List<Double>, Double> aggregator;
    @Nullable private Map<String, List<Double>> collection;
    private int count = 0;

    public SemanticDistanceSorter(double target, SemanticDistanceCalculator calculator) {
        this(target, calculator, SemanticDistanceSorter::sum);
    }

    public SemanticDistanceSorter(double target,
                                  SemanticDistanceCalculator calculator,
                                  Function<List<Double>, Double> aggregator) {
        this.target = target;
        this.calculator = calculator;
        this.aggregator = aggregator;
    }

    public static double sum(List<Double> xs) {
        double s = 0;
        for (double x : xs) s += x;
        return s;
    }

    @Override
    public void newCollection(InstantiatorVariant variant) {
        collection = new LinkedHashMap<>();
        count = 0;
    }

    @Override
    public void addQueryResult(Set<String> result, Query query, @Nullable String existingTerm) {
        if (collection == null) throw new IllegalStateException("no open collection");
        ++count;
        for (String term : result) {
            double d = calculator.distance(term, query, existingTerm);
            collection.computeIfAbsent(term, k -> new ArrayList<>()).add(Math.abs(target - d));
        }
    }

    @Override
    public List<String> sortCollection() {
        if (collection == null) throw new IllegalStateException("no open collection");
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> e : collection.entrySet()) {
            if (e.getValue().size() == count) scores.put(e.getKey(), aggregator.apply(e.getValue()));
        }
        List<String> terms = new ArrayList<>(scores.keySet());
        terms.sort(Comparator.comparing(scores::get));
        collection = null;
        count = 0;
        return terms;
    }
}
