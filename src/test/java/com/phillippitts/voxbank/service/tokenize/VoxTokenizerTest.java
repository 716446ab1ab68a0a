package com.phillippitts.voxbank.service.tokenize;

import com.phillippitts.voxbank.config.properties.TokenizerProperties;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.domain.TokenKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VoxTokenizerTest {

    private TokenizerProperties props;
    private VoxTokenizer tokenizer;

    @BeforeEach
    void setUp() {
        props = new TokenizerProperties();
        tokenizer = new VoxTokenizer(props);
    }

    @Test
    void splitsWordsAndTurnsTrailingPunctuationIntoPauses() {
        TokenizationResult result = tokenizer.tokenize("Hello, world!");

        assertThat(result.tokens()).containsExactly(
                Token.word("hello"),
                Token.pause(",", 150),
                Token.word("world"),
                Token.pause(".", 200));
        assertThat(result.hasIssues()).isFalse();
    }

    @Test
    void lowercasesAndCollapsesWhitespace() {
        TokenizationResult result = tokenizer.tokenize("  GATE   Two\tclosed \n");

        assertThat(result.words()).containsExactly("gate", "two", "closed");
    }

    @Test
    void emptyAndBlankInputYieldNothing() {
        assertThat(tokenizer.tokenize("").tokens()).isEmpty();
        assertThat(tokenizer.tokenize("   ").tokens()).isEmpty();
        assertThat(tokenizer.tokenize(null).tokens()).isEmpty();
    }

    @Test
    void ellipsisWinsOverOtherPunctuation() {
        TokenizationResult result = tokenizer.tokenize("wait... now");

        assertThat(result.tokens()).containsExactly(
                Token.word("wait"),
                Token.pause("...", 250),
                Token.word("now"));
    }

    @Test
    void unicodeEllipsisAndLeadingEllipsisAreRecognized() {
        TokenizationResult result = tokenizer.tokenize("…and then…");

        assertThat(result.tokens()).containsExactly(
                Token.pause("...", 250),
                Token.word("and"),
                Token.word("then"),
                Token.pause("...", 250));
    }

    @Test
    void standaloneDashesBecomeDashPauses() {
        TokenizationResult result = tokenizer.tokenize("north — south - east");

        assertThat(result.tokens()).extracting(Token::kind).containsExactly(
                TokenKind.WORD, TokenKind.PAUSE, TokenKind.WORD, TokenKind.PAUSE, TokenKind.WORD);
        assertThat(result.tokens().get(1).pauseDurationMs()).isEqualTo(100);
    }

    @Test
    void keepsHyphenatedAndUnderscoredWords() {
        assertThat(tokenizer.tokenize("well-known snake_case").words())
                .containsExactly("well-known", "snake_case");
    }

    @Test
    void stripsApostrophesWhenContractionExpansionIsOff() {
        assertThat(tokenizer.tokenize("Don't panic").words()).containsExactly("dont", "panic");
    }

    @Test
    void expandsContractionsWhenEnabled() {
        props.setExpandContractions(true);

        assertThat(tokenizer.tokenize("Don’t stop, it's fine").words())
                .containsExactly("do", "not", "stop", "it", "is", "fine");
    }

    @Test
    void digitsStayLiteralUnlessNumberExpansionIsEnabled() {
        assertThat(tokenizer.tokenize("gate 42").words()).containsExactly("gate", "42");

        props.setExpandNumbers(true);

        assertThat(tokenizer.tokenize("gate 42").words()).containsExactly("gate", "forty", "two");
        assertThat(tokenizer.tokenize("1204").words())
                .containsExactly("one", "thousand", "two", "hundred", "four");
    }

    @Test
    void reportsInvalidWordsWithoutDroppingTheRest() {
        TokenizationResult result = tokenizer.tokenize("hello wörld again");

        assertThat(result.words()).containsExactly("hello", "again");
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.position()).isEqualTo(1);
            assertThat(issue.word()).isEqualTo("wörld");
            assertThat(issue.reason()).isEqualTo("contains unsupported characters");
        });
    }

    @Test
    void rejectsWordsLongerThanTheLimit() {
        props.setMaxWordLength(5);

        TokenizationResult result = tokenizer.tokenize("short toolong");

        assertThat(result.words()).containsExactly("short");
        assertThat(result.issues()).singleElement()
                .extracting(ValidationIssue::reason).isEqualTo("exceeds 5 characters");
    }

    @Test
    void usesConfiguredPauseDurations() {
        props.setPeriodPauseMs(400);
        props.setCommaPauseMs(80);

        TokenizationResult result = tokenizer.tokenize("one, two.");

        assertThat(result.tokens()).containsExactly(
                Token.word("one"), Token.pause(",", 80), Token.word("two"), Token.pause(".", 400));
    }

    @Test
    void repeatedWordsKeepEveryOccurrence() {
        TokenizationResult result = tokenizer.tokenize("go go go");

        assertThat(result.words()).containsExactly("go", "go", "go");
        assertThat(result.distinctWords()).containsExactly("go");
        assertThat(result.wordCount()).isEqualTo(3);
    }

    @Test
    void normalizeLowercasesWordsAndKeepsPauses() {
        TokenizationResult result = tokenizer.normalize(List.of(
                Token.word(" Alpha "), Token.pause("custom", 500), Token.word("BRAVO")));

        assertThat(result.tokens()).containsExactly(
                Token.word("alpha"), Token.pause("custom", 500), Token.word("bravo"));
    }

    @Test
    void normalizeReportsEmptyAndInvalidWords() {
        TokenizationResult result = tokenizer.normalize(List.of(
                Token.word(""), Token.word("ok"), Token.word("no way")));

        assertThat(result.words()).containsExactly("ok");
        assertThat(result.issues()).extracting(ValidationIssue::reason)
                .containsExactly("is empty", "contains unsupported characters");
    }
}
