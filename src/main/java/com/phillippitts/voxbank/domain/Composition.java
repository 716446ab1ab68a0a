package com.phillippitts.voxbank.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered assembly input: the original token sequence with every word token resolved to
 * a clip. Unresolved words are dropped in {@link #resolve(List, Map)}; pauses are kept in
 * place.
 *
 * @param tokens word and pause tokens in their original order
 * @param clips resolved clip per word token, same length as {@code tokens}, {@code null} at pauses
 */
public record Composition(List<Token> tokens, List<WordClip> clips) {

    public Composition {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(clips, "clips must not be null");
        if (tokens.size() != clips.size()) {
            throw new IllegalArgumentException("tokens and clips must have the same length");
        }
        tokens = List.copyOf(tokens);
        clips = Collections.unmodifiableList(new ArrayList<>(clips));
    }

    /**
     * Builds a composition by indexing each word token into the per-word results, so the
     * order is always the token order and never generation completion order.
     *
     * @param tokens tokens in original order
     * @param results per-word results keyed by normalized word
     * @return composition containing only resolvable words plus all pauses
     */
    public static Composition resolve(List<Token> tokens, Map<String, GenerationResult> results) {
        List<Token> kept = new ArrayList<>(tokens.size());
        List<WordClip> clips = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.isPause()) {
                kept.add(token);
                clips.add(null);
                continue;
            }
            GenerationResult result = results.get(token.word());
            if (result != null && result.isResolved()) {
                kept.add(token);
                clips.add(result.clip());
            }
        }
        return new Composition(kept, clips);
    }

    public WordClip clipAt(int index) {
        return clips.get(index);
    }

    public int size() {
        return tokens.size();
    }

    public int wordCount() {
        return (int) tokens.stream().filter(Token::isWord).count();
    }

    public List<String> words() {
        return tokens.stream().filter(Token::isWord).map(Token::word).toList();
    }
}
