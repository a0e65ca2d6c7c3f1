package com.cadenceai.infrastructure.parse.tokenizer;

import com.cadenceai.domain.parse.lexicon.MultiWordIdiom;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.Token;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanTokenizerTest {

    private SpanTokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = ParserFixtures.tokenizer();
    }

    @Nested
    @DisplayName("Span exactness")
    class Spans {

        @Test
        @DisplayName("every token's span slices its original text out of the source")
        void spans_slice_original_text() {
            String source = "Make the  chorus   brighter, and then add 3dB of reverb!";
            TokenStream stream = tokenizer.tokenize(source);

            for (Token token : stream.tokens()) {
                assertThat(token.span().slice(source)).isEqualTo(token.originalText());
            }
        }

        @Test
        @DisplayName("allTokens tiles the source, whitespace included")
        void all_tokens_tile_source() {
            String source = "  widen the pad\tin the 2nd verse ";
            TokenStream stream = tokenizer.tokenize(source);

            String rebuilt = stream.allTokens().stream().map(Token::originalText).collect(Collectors.joining());
            assertThat(rebuilt).isEqualTo(source);
            assertThat(stream.tokens()).noneMatch(Token::isWhitespace);
        }

        @Test
        @DisplayName("null and empty input give an empty stream")
        void null_and_empty() {
            assertThat(tokenizer.tokenize(null).isEmpty()).isTrue();
            assertThat(tokenizer.tokenize("").tokens()).isEmpty();
        }

        @Test
        @DisplayName("typography folding keeps offsets and original text")
        void smart_quotes_keep_offsets() {
            String source = "the track called “Glass Pad”";
            TokenStream stream = tokenizer.tokenize(source);

            Token quote = stream.tokens().get(stream.tokens().size() - 1);
            assertThat(quote.type()).isEqualTo(TokenType.QUOTE);
            assertThat(quote.originalText()).isEqualTo("“Glass Pad”");
            assertThat(quote.normalizedText()).isEqualTo("\"glass pad\"");
            assertThat(stream.normalizedSource()).hasSize(source.length());
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("numbers, ordinals, attached units and ratios")
        void numeric_shapes() {
            List<Token> tokens = tokenizer.tokenize("1st 7st 120bpm 3:2 -2 4.5").tokens();

            assertThat(tokens).extracting(Token::type).containsExactly(
                    TokenType.ORDINAL, TokenType.UNIT, TokenType.UNIT, TokenType.UNIT,
                    TokenType.OPERATOR, TokenType.NUMBER, TokenType.NUMBER);
        }

        @Test
        @DisplayName("an apostrophe between letters stays inside the word")
        void contraction_is_one_token() {
            List<Token> tokens = tokenizer.tokenize("don't touch the drums").tokens();

            assertThat(tokens.get(0).type()).isEqualTo(TokenType.CONTRACTION);
            assertThat(tokens.get(0).originalText()).isEqualTo("don't");
        }

        @Test
        @DisplayName("an unclosed quote runs to the end of the input")
        void unclosed_quote() {
            List<Token> tokens = tokenizer.tokenize("call it 'Glass Pad").tokens();

            Token last = tokens.get(tokens.size() - 1);
            assertThat(last.type()).isEqualTo(TokenType.QUOTE);
            assertThat(last.originalText()).isEqualTo("'Glass Pad");
        }

        @Test
        @DisplayName("word class tags are attached")
        void tags() {
            List<Token> tokens = tokenizer.tokenize("mute the drums").tokens();

            assertThat(tokens.get(0).hasTag(TokenTag.VERB)).isTrue();
            assertThat(tokens.get(1).hasTag(TokenTag.DETERMINER)).isTrue();
        }
    }

    @Nested
    @DisplayName("Multi-word merge")
    class Merge {

        @Test
        @DisplayName("idioms merge into one token that keeps component spans")
        void idiom_merges() {
            TokenStream stream = tokenizer.tokenize("and  then add reverb");
            Token merged = stream.tokens().get(0);

            assertThat(merged.type()).isEqualTo(TokenType.MULTI_WORD);
            assertThat(merged.normalizedText()).isEqualTo("and then");
            assertThat(merged.originalText()).isEqualTo("and  then");
            assertThat(merged.merged()).isTrue();
            assertThat(merged.componentSpans()).containsExactly(new Span(0, 3), new Span(5, 9));
            assertThat(merged.hasTag(TokenTag.CONJUNCTION)).isTrue();
            assertThat(stream.metadata().mergedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("merging can be switched off")
        void merge_disabled() {
            TokenizerConfig config = new TokenizerConfig(false, false, true, true, List.of());
            List<Token> tokens = tokenizer.tokenize("and then add reverb", config).tokens();

            assertThat(tokens).hasSize(4);
            assertThat(tokens).noneMatch(Token::merged);
        }

        @Test
        @DisplayName("additional idioms from the config are merged too")
        void additional_idiom() {
            TokenizerConfig config = TokenizerConfig.DEFAULT
                    .withAdditionalIdioms(List.of(MultiWordIdiom.of("side chain", 5, TokenTag.VERB)));
            List<Token> tokens = tokenizer.tokenize("Side chain the bass", config).tokens();

            assertThat(tokens.get(0).normalizedText()).isEqualTo("side chain");
            assertThat(tokens.get(0).hasTag(TokenTag.VERB)).isTrue();
        }

        @Test
        @DisplayName("between equal idioms the one listed first wins")
        void equal_idioms_keep_table_order() {
            MultiWordIdiom verb = new MultiWordIdiom(List.of("side", "chain"), "sidechain", Set.of(TokenTag.VERB), 5);
            MultiWordIdiom noun = new MultiWordIdiom(List.of("side", "chain"), "side chain", Set.of(TokenTag.NOUN), 5);

            Token verbFirst = tokenizer.tokenize("side chain the bass",
                    TokenizerConfig.DEFAULT.withAdditionalIdioms(List.of(verb, noun))).tokens().get(0);
            Token nounFirst = tokenizer.tokenize("side chain the bass",
                    TokenizerConfig.DEFAULT.withAdditionalIdioms(List.of(noun, verb))).tokens().get(0);

            assertThat(verbFirst.normalizedText()).isEqualTo("sidechain");
            assertThat(verbFirst.hasTag(TokenTag.VERB)).isTrue();
            assertThat(nounFirst.normalizedText()).isEqualTo("side chain");
            assertThat(nounFirst.hasTag(TokenTag.NOUN)).isTrue();
        }

        @Test
        @DisplayName("a higher priority beats table order")
        void priority_beats_table_order() {
            MultiWordIdiom low = new MultiWordIdiom(List.of("side", "chain"), "sidechain", Set.of(TokenTag.VERB), 5);
            MultiWordIdiom high = new MultiWordIdiom(List.of("side", "chain"), "side chain", Set.of(TokenTag.NOUN), 6);

            Token token = tokenizer.tokenize("side chain the bass",
                    TokenizerConfig.DEFAULT.withAdditionalIdioms(List.of(low, high))).tokens().get(0);

            assertThat(token.normalizedText()).isEqualTo("side chain");
        }

        @Test
        @DisplayName("an idiom with no positive priority is rejected")
        void invalid_idiom_rejected() {
            MultiWordIdiom broken = new MultiWordIdiom(List.of("side", "chain"), "side chain", Set.of(), 0);

            assertThatThrownBy(() -> TokenizerConfig.DEFAULT.withAdditionalIdioms(List.of(broken)))
                    .isInstanceOf(InvalidTokenizerConfigException.class)
                    .hasMessageContaining("side chain");
        }
    }

    @Nested
    @DisplayName("Stability")
    class Stability {

        private final List<String> utterances = List.of(
                "and then add reverb",
                "add reverb as well as delay",
                "mute every other bar in the chorus",
                "brighten the pad a little",
                "go ahead and widen it at the same time",
                "keep four on the floor on the beat",
                "Make the  chorus   brighter, and then add 3dB of reverb!",
                "call it 'Warm Keys'");

        @Test
        @DisplayName("tokenizing the same text twice gives equal streams")
        void tokenize_is_deterministic() {
            for (String utterance : utterances) {
                assertThat(tokenizer.tokenize(utterance)).as(utterance).isEqualTo(tokenizer.tokenize(utterance));
            }
        }

        @Test
        @DisplayName("a merged token's text re-tokenizes to the same single token")
        void merge_is_idempotent() {
            List<Token> merged = utterances.stream()
                    .flatMap(utterance -> tokenizer.tokenize(utterance).tokens().stream())
                    .filter(Token::merged)
                    .toList();
            assertThat(merged).isNotEmpty();

            for (Token token : merged) {
                List<Token> again = tokenizer.tokenize(token.normalizedText()).tokens();

                assertThat(again).as(token.normalizedText()).hasSize(1);
                assertThat(again.get(0).merged()).isTrue();
                assertThat(again.get(0).normalizedText()).isEqualTo(token.normalizedText());
                assertThat(again.get(0).tags()).isEqualTo(token.tags());
            }
        }
    }

    @Nested
    @DisplayName("Word view")
    class WordView {

        @Test
        @DisplayName("merged tokens expand back into their component words")
        void merged_tokens_expand() {
            String source = "in the chorus";
            List<Word> words = TokenStreams.words(tokenizer.tokenize(source));

            assertThat(words).extracting(Word::text).containsExactly("in", "the", "chorus");
            assertThat(words.get(1).span().slice(source)).isEqualTo("the");
            assertThat(words.get(0).tokenIndex()).isEqualTo(words.get(1).tokenIndex());
        }

        @Test
        @DisplayName("surface keeps a single space where the source had a gap")
        void surface_joins_with_gaps() {
            List<Word> words = TokenStreams.words(tokenizer.tokenize("raise  it +3dB"));

            assertThat(TokenStreams.surface(words)).isEqualTo("raise it +3dB");
            assertThat(TokenStreams.spanOf(words)).isEqualTo(new Span(0, 14));
        }
    }
}
