package com.phillippitts.voxbank.service.tokenize;

import com.phillippitts.voxbank.config.properties.TokenizerProperties;
import com.phillippitts.voxbank.domain.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits announcement text into ordered word and pause tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on whitespace; em and en dashes are treated as standalone dashes</li>
 *   <li>Lower-case and trim each chunk, strip leading and trailing punctuation</li>
 *   <li>Trailing punctuation becomes a pause token after the word: ellipsis, then
 *       sentence end (. ! ?), then clause break (, ; :), then dash, strongest wins</li>
 *   <li>A leading ellipsis becomes a pause before the word</li>
 *   <li>Words must match {@code [a-z0-9_-]+} and fit the configured maximum length;
 *       others are reported as {@link ValidationIssue}s and produce no token</li>
 *   <li>Apostrophes are dropped ({@code don't} to {@code dont}) unless contraction
 *       expansion is enabled; digit words are spelled out only when number expansion is
 *       enabled</li>
 * </ul>
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
public class VoxTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern VALID_WORD = Pattern.compile("[a-z0-9_-]+");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private static final Map<String, List<String>> CONTRACTIONS = Map.ofEntries(
            Map.entry("don't", List.of("do", "not")),
            Map.entry("doesn't", List.of("does", "not")),
            Map.entry("didn't", List.of("did", "not")),
            Map.entry("can't", List.of("can", "not")),
            Map.entry("won't", List.of("will", "not")),
            Map.entry("isn't", List.of("is", "not")),
            Map.entry("aren't", List.of("are", "not")),
            Map.entry("wasn't", List.of("was", "not")),
            Map.entry("weren't", List.of("were", "not")),
            Map.entry("shouldn't", List.of("should", "not")),
            Map.entry("couldn't", List.of("could", "not")),
            Map.entry("wouldn't", List.of("would", "not")),
            Map.entry("haven't", List.of("have", "not")),
            Map.entry("hasn't", List.of("has", "not")),
            Map.entry("i'm", List.of("i", "am")),
            Map.entry("you're", List.of("you", "are")),
            Map.entry("we're", List.of("we", "are")),
            Map.entry("they're", List.of("they", "are")),
            Map.entry("it's", List.of("it", "is")),
            Map.entry("that's", List.of("that", "is")),
            Map.entry("there's", List.of("there", "is")),
            Map.entry("let's", List.of("let", "us")),
            Map.entry("i'll", List.of("i", "will")),
            Map.entry("we'll", List.of("we", "will")),
            Map.entry("you'll", List.of("you", "will")),
            Map.entry("i've", List.of("i", "have")),
            Map.entry("we've", List.of("we", "have")),
            Map.entry("i'd", List.of("i", "would"))
    );

    private final TokenizerProperties properties;

    public VoxTokenizer(TokenizerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Tokenizes text into word and pause tokens.
     *
     * @param text input text (may be null or blank)
     * @return accepted tokens and rejected words, both in input order
     */
    public TokenizationResult tokenize(String text) {
        if (text == null || text.isBlank()) {
            return TokenizationResult.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace("…", "...")
                .replace("—", " - ")
                .replace("–", " - ");

        List<Token> tokens = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        String[] chunks = WHITESPACE.split(normalized.trim());
        for (int position = 0; position < chunks.length; position++) {
            tokenizeChunk(chunks[position], position, tokens, issues);
        }
        return new TokenizationResult(tokens, issues);
    }

    /**
     * Normalizes and validates a pre-tokenized composition. Word tokens are lower-cased and
     * trimmed; invalid words are reported and dropped; pauses are kept as given.
     *
     * @param composition caller-built token sequence
     * @return accepted tokens and rejected words, both in input order
     */
    public TokenizationResult normalize(List<Token> composition) {
        List<Token> tokens = new ArrayList<>(composition.size());
        List<ValidationIssue> issues = new ArrayList<>();
        for (int position = 0; position < composition.size(); position++) {
            Token token = composition.get(position);
            if (token.isPause()) {
                tokens.add(token);
                continue;
            }
            String word = token.word().trim().toLowerCase(Locale.ROOT);
            String problem = word.isEmpty() ? "is empty" : validate(word);
            if (problem == null) {
                tokens.add(Token.word(word));
            } else {
                issues.add(new ValidationIssue(position, word, problem));
            }
        }
        return new TokenizationResult(tokens, issues);
    }

    private void tokenizeChunk(String chunk, int position, List<Token> tokens, List<ValidationIssue> issues) {
        int start = 0;
        int end = chunk.length();
        while (start < end && !isWordChar(chunk.charAt(start))) {
            start++;
        }
        while (end > start && !isWordChar(chunk.charAt(end - 1))) {
            end--;
        }
        if (start == end) {
            // Pure punctuation, e.g. "-" or "..."
            Token pause = pauseFor(chunk);
            if (pause != null) {
                tokens.add(pause);
            }
            return;
        }

        String leading = chunk.substring(0, start);
        String core = chunk.substring(start, end);
        String trailing = chunk.substring(end);

        if (leading.contains("...")) {
            tokens.add(Token.pause("...", properties.getEllipsisPauseMs()));
        }
        for (String word : expand(core)) {
            String problem = validate(word);
            if (problem == null) {
                tokens.add(Token.word(word));
            } else {
                issues.add(new ValidationIssue(position, word, problem));
            }
        }
        Token pause = pauseFor(trailing);
        if (pause != null) {
            tokens.add(pause);
        }
    }

    private List<String> expand(String core) {
        if (core.isEmpty()) {
            return List.of();
        }
        if (core.indexOf('\'') >= 0) {
            if (properties.isExpandContractions()) {
                List<String> expanded = CONTRACTIONS.get(core);
                if (expanded != null) {
                    return expanded;
                }
            }
            core = core.replace("'", "");
        }
        if (properties.isExpandNumbers() && DIGITS.matcher(core).matches() && core.length() <= 6) {
            return NumberWords.spell(Long.parseLong(core));
        }
        return List.of(core);
    }

    private String validate(String word) {
        if (word.length() > properties.getMaxWordLength()) {
            return "exceeds " + properties.getMaxWordLength() + " characters";
        }
        if (!VALID_WORD.matcher(word).matches()) {
            return "contains unsupported characters";
        }
        return null;
    }

    private Token pauseFor(String punctuation) {
        if (punctuation.isEmpty()) {
            return null;
        }
        if (punctuation.contains("...")) {
            return Token.pause("...", properties.getEllipsisPauseMs());
        }
        if (containsAny(punctuation, ".!?")) {
            return Token.pause(".", properties.getPeriodPauseMs());
        }
        if (containsAny(punctuation, ",;:")) {
            return Token.pause(",", properties.getCommaPauseMs());
        }
        if (punctuation.indexOf('-') >= 0) {
            return Token.pause("-", properties.getDashPauseMs());
        }
        return null;
    }

    private static boolean containsAny(String text, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (text.indexOf(chars.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    // Any script: non-ASCII words must reach validation and be reported.
    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
