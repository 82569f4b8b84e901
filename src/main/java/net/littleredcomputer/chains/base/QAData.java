// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One multiple-choice QA sample. Each pairing template has exactly one bound endpoint;
 * a tree template with the same relation type can be paired with it, fixing the
 * corresponding tree variable to that endpoint's term.
 */
public final class QAData {
    private final String identifier;
    private final String question;
    private final String correctAnswerLabel;
    private final ImmutableMap<String, String> answerChoices;  // label -> term, in choice order
    private final ImmutableList<Template> pairingTemplates;

    public QAData(String identifier,
                  String question,
                  String correctAnswerLabel,
                  Map<String, String> answerChoices,
                  List<Template> pairingTemplates) {
        this.identifier = Objects.requireNonNull(identifier);
        this.question = Objects.requireNonNull(question);
        this.correctAnswerLabel = Objects.requireNonNull(correctAnswerLabel);
        this.answerChoices = ImmutableMap.copyOf(answerChoices);
        this.pairingTemplates = ImmutableList.copyOf(pairingTemplates);
        if (!this.answerChoices.containsKey(correctAnswerLabel)) {
            throw new IllegalArgumentException("correct answer label not among choices: " + correctAnswerLabel);
        }
        for (Template t : this.pairingTemplates) {
            if (t.source().isBound() == t.target().isBound()) {
                throw new IllegalArgumentException("pairing template must have exactly one free variable: " + t);
            }
        }
    }

    public String identifier() { return identifier; }
    public String question() { return question; }
    public String correctAnswerLabel() { return correctAnswerLabel; }
    public ImmutableMap<String, String> answerChoices() { return answerChoices; }
    public ImmutableList<Template> pairingTemplates() { return pairingTemplates; }

    public String correctAnswer() { return answerChoices.get(correctAnswerLabel); }

    @Override
    public String toString() { return identifier + ": " + question; }
}
