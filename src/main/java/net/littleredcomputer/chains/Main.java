// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import net.littleredcomputer.chains.base.GenericTree;
import net.littleredcomputer.chains.base.Relation;
import net.littleredcomputer.chains.base.RelationalTree;
import net.littleredcomputer.chains.base.Relations;
import net.littleredcomputer.chains.reduce.Reducer;
import net.littleredcomputer.chains.transform.GeneratorFilter;
import net.littleredcomputer.chains.transform.GenericTreeGenerator;
import net.littleredcomputer.chains.transform.RelationalTreeGenerator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.Reader;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class Main {
    private static Joiner spaceJoiner = Joiner.on(' ');
    private static Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();
    private static Splitter colonSplitter = Splitter.on(':').trimResults();

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to generate: generic or relational")
                .addOption("size", true, "number of relations per tree")
                .addOption("relations", true, "filename of relation table")
                .addOption("reductions", true, "filename of reduction table")
                .addOption("noreducer", false, "do not use the reduction table")
                .addOption("lenient", false, "ignore duplicate reductions")
                .addOption("seed", true, "random seed")
                .addOption("genericprob", true, "probability of dropping a generic tree")
                .addOption("relationalprobs", true, "hops:probability,... of dropping a relational tree")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader file(CommandLine cmd, String option) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return new BufferedReader(new FileReader(cmd.getOptionValue(option)));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static Map<Integer, GeneratorFilter> hopFilters(String probabilities, SGBRandom random) {
        Map<Integer, GeneratorFilter> filters = new HashMap<>();
        for (String entry : commaSplitter.split(probabilities)) {
            List<String> kv = colonSplitter.splitToList(entry);
            if (kv.size() != 2) throw new IllegalArgumentException("expected hops:probability, got " + entry);
            filters.put(Integer.parseInt(kv.get(0)), new GeneratorFilter(Double.parseDouble(kv.get(1)), random));
        }
        return filters;
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        int size = Integer.parseInt(cmd.getOptionValue("size", "2"));
        SGBRandom random = new SGBRandom(Integer.parseInt(cmd.getOptionValue("seed", "314159")));
        double genericProb = Double.parseDouble(cmd.getOptionValue("genericprob", "0"));
        GenericTreeGenerator generic = new GenericTreeGenerator(new GeneratorFilter(genericProb, random));
        switch (task) {
            case "generic":
                generic.generate(size).forEach(System.out::println);
                break;
            case "relational": {
                List<Relation> relations = Relations.parseFrom(file(cmd, "relations"));
                Reducer reducer = null;
                if (cmd.hasOption("reductions") && !cmd.hasOption("noreducer")) {
                    reducer = Reducer.parseFrom(file(cmd, "reductions"), relations, !cmd.hasOption("lenient"));
                }
                List<GenericTree> trees = generic.generate(size).collect(Collectors.toList());
                List<RelationalTree> result = new RelationalTreeGenerator(relations, reducer,
                        hopFilters(cmd.getOptionValue("relationalprobs", ""), random))
                        .setLogInterval(logInterval(cmd))
                        .generate(trees);
                for (RelationalTree t : result) {
                    System.out.println(spaceJoiner.join(t.templates()));
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
