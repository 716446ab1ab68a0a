package com.phillippitts.voxbank.service.tokenize;

import com.phillippitts.voxbank.domain.Token;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Output of {@link VoxTokenizer}: accepted tokens in input order plus the rejected words.
 *
 * @param tokens word and pause tokens in input order
 * @param issues rejected words, in input order
 */
public record TokenizationResult(List<Token> tokens, List<ValidationIssue> issues) {

    public TokenizationResult {
        tokens = List.copyOf(tokens);
        issues = List.copyOf(issues);
    }

    public static TokenizationResult empty() {
        return new TokenizationResult(List.of(), List.of());
    }

    /**
     * Accepted words in order, duplicates included.
     */
    public List<String> words() {
        return tokens.stream().filter(Token::isWord).map(Token::word).toList();
    }

    /**
     * Accepted words in first-occurrence order without duplicates.
     */
    public List<String> distinctWords() {
        return List.copyOf(new LinkedHashSet<>(words()));
    }

    public int wordCount() {
        return (int) tokens.stream().filter(Token::isWord).count();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
