package com.cadenceai.infrastructure.parse.reference;

import com.cadenceai.domain.parse.lexicon.NamingLexicon;
import com.cadenceai.domain.parse.lexicon.NamingVerbEntry;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.reference.NamedReferenceType;
import com.cadenceai.domain.parse.model.reference.NamingOperation;
import com.cadenceai.domain.parse.model.reference.QuoteStyle;
import com.cadenceai.domain.parse.model.reference.ReferenceWarningCode;
import com.cadenceai.domain.parse.model.reference.ResolutionStrategy;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds user-given names: quoted strings with their surrounding naming context,
 * unquoted names after a naming verb, and #tag / @tag references.
 *
 * Quoted names are always matched exactly downstream. Nothing here guesses which entity a name means.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NamedReferenceAnalyzer {

    private static final int CONTEXT_BEFORE = 4;

    private static final Set<String> RESERVED_NAMES = Set.of("all", "none", "everything", "it", "this", "that");
    private static final String SPECIAL_CHARACTERS = "<>{}[]|\\";
    private static final Set<String> ARTICLES = Set.of("the", "a", "an");
    private static final Set<String> DEMONSTRATIVES = Set.of("it", "this", "that");
    private static final Set<String> TAG_SIGILS = Set.of("#", "@");

    private final NamingLexicon namingLexicon;

    @Value("${parser.names.max-length:100}")
    private int maxNameLength = 100;

    /** A quoted run: words {@code [start, end)} of the word view. */
    private record Quote(int start, int end, String name, QuoteStyle style, boolean closed) {}

    private record VerbAt(int start, int end, String form, NamingVerbEntry entry) {}

    private record Context(NamedReferenceType type, NamingOperation operation, String verb,
                           String entityType, String entityKeyword, int start, int end, double confidence) {}

    public List<NamedReference> analyze(TokenStream stream) {
        List<Word> words = TokenStreams.words(stream);
        List<Draft> drafts = new ArrayList<>();
        Set<Integer> claimed = new HashSet<>();

        for (Quote quote : quotes(words, stream.source())) {
            Context context = classify(words, quote);
            for (int k = quote.start(); k < quote.end(); k++) claimed.add(k);

            List<ReferenceWarningCode> codes = new ArrayList<>(nameIssues(quote.name()));
            if (!quote.closed()) codes.add(ReferenceWarningCode.UNCLOSED_QUOTE);
            if (context.type() == NamedReferenceType.RENAMING_COMMAND && renamingSourceMissing(words, quote)) {
                codes.add(ReferenceWarningCode.RENAMING_SOURCE_MISSING);
            }
            drafts.add(new Draft(context.start(), context.end(), quote.name(), context, quote.style(),
                    ResolutionStrategy.forQuoteStyle(quote.style()), codes));
        }

        drafts.addAll(tags(words, claimed));
        drafts.addAll(bareNames(words, claimed));
        drafts.sort(Comparator.comparingInt(Draft::start));

        List<NamedReference> references = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            references.add(draft.toReference("ref:" + references.size(), words));
        }
        if (!references.isEmpty()) {
            log.debug("[NamedReference] {} references: {}", references.size(),
                    references.stream().map(NamedReference::name).collect(Collectors.joining(", ")));
        }
        return references;
    }

    private record Draft(int start, int end, String name, Context context, QuoteStyle style,
                         ResolutionStrategy strategy, List<ReferenceWarningCode> codes) {

        NamedReference toReference(String refId, List<Word> words) {
            List<Word> covered = words.subList(start, end);
            Span span = TokenStreams.spanOf(covered);
            List<AnalysisWarning> warnings = codes.stream()
                    .map(code -> new AnalysisWarning(code, describe(code, name), span))
                    .toList();
            return new NamedReference(refId, name, TokenStreams.surface(covered), context.type(), style,
                    context.entityType(), context.entityKeyword(), context.verb(), context.operation(),
                    span, strategy, context.confidence(), warnings);
        }
    }

    // ── Quotes ──

    private static List<Quote> quotes(List<Word> words, String source) {
        List<Quote> quotes = new ArrayList<>();
        for (int i = 0; i < words.size(); i++) {
            Word word = words.get(i);
            if (word.type() == TokenType.QUOTE) {
                String folded = word.text();
                char open = folded.charAt(0);
                boolean closed = folded.length() > 1 && folded.charAt(folded.length() - 1) == open;
                String original = word.original();
                String name = original.substring(1, closed ? original.length() - 1 : original.length());
                quotes.add(new Quote(i, i + 1, name, QuoteStyle.of(original.charAt(0)), closed));
            } else if (word.is("`")) {
                int close = i + 1;
                while (close < words.size() && !words.get(close).is("`")) close++;
                boolean closed = close < words.size();
                int end = closed ? close + 1 : words.size();
                int nameStart = word.span().end();
                int nameEnd = closed ? words.get(close).span().start() : words.get(end - 1).span().end();
                String name = source.substring(nameStart, Math.max(nameStart, nameEnd));
                quotes.add(new Quote(i, end, name, QuoteStyle.BACKTICK, closed));
                i = end - 1;
            }
        }
        return quotes;
    }

    /**
     * Tries the naming contexts in a fixed order; the first that applies wins.
     */
    private Context classify(List<Word> words, Quote quote) {
        int windowStart = Math.max(0, quote.start() - CONTEXT_BEFORE);
        List<Word> before = words.subList(windowStart, quote.start());
        Optional<Word> after = quote.end() < words.size() ? Optional.of(words.get(quote.end())) : Optional.empty();

        Optional<VerbAt> reference = verbEndingAt(words, windowStart, quote.start(), NamingOperation.REFERENCE_BY_NAME);
        if (reference.isPresent()) {
            VerbAt verb = reference.get();
            int start = quote.start();
            String entityType = null;
            String keyword = null;
            for (int k = windowStart; k < verb.start(); k++) {
                Optional<String> type = namingLexicon.entityType(words.get(k).text());
                if (type.isPresent()) {
                    entityType = type.get();
                    keyword = words.get(k).text();
                    start = k;
                    break;
                }
            }
            if (keyword == null) start = verb.start();
            return new Context(verb.entry().pattern(), NamingOperation.REFERENCE_BY_NAME, verb.form(),
                    entityType, keyword, start, quote.end(), 0.9);
        }

        Optional<String> typeAfter = after.flatMap(word -> namingLexicon.entityType(word.text()));
        if (typeAfter.isPresent()) {
            int start = quote.start();
            if (!before.isEmpty() && ARTICLES.contains(before.get(before.size() - 1).text())) start--;
            return new Context(NamedReferenceType.QUOTED_WITH_TYPE, NamingOperation.REFERENCE_BY_NAME, null,
                    typeAfter.get(), after.get().text(), start, quote.end() + 1, 0.85);
        }

        Optional<VerbAt> assign = verbEndingAt(words, windowStart, quote.start(), NamingOperation.ASSIGN_NAME);
        if (assign.isPresent()) {
            return new Context(NamedReferenceType.NAMING_COMMAND, NamingOperation.ASSIGN_NAME, assign.get().form(),
                    null, null, quote.start(), quote.end(), 0.9);
        }

        Optional<VerbAt> rename = verbWithin(words, windowStart, quote.start(), NamingOperation.RENAME);
        if (rename.isPresent()) {
            return new Context(NamedReferenceType.RENAMING_COMMAND, NamingOperation.RENAME, rename.get().form(),
                    null, null, quote.start(), quote.end(), 0.85);
        }

        Optional<VerbAt> search = verbWithin(words, windowStart, quote.start(), NamingOperation.SEARCH_BY_NAME);
        if (search.isPresent()) {
            return new Context(NamedReferenceType.QUOTED_STANDALONE, NamingOperation.SEARCH_BY_NAME, search.get().form(),
                    null, null, quote.start(), quote.end(), 0.85);
        }

        return new Context(NamedReferenceType.QUOTED_STANDALONE, NamingOperation.REFERENCE_BY_NAME, null,
                null, null, quote.start(), quote.end(), 0.8);
    }

    /**
     * Longest naming verb of {@code operation} that ends exactly at {@code end}.
     */
    private Optional<VerbAt> verbEndingAt(List<Word> words, int from, int end, NamingOperation operation) {
        for (int size = Math.min(namingLexicon.maxVerbWords(), end - from); size >= 1; size--) {
            Optional<VerbAt> verb = verbAt(words, end - size, end, operation);
            if (verb.isPresent()) return verb;
        }
        return Optional.empty();
    }

    private Optional<VerbAt> verbWithin(List<Word> words, int from, int end, NamingOperation operation) {
        for (int start = from; start < end; start++) {
            for (int size = Math.min(namingLexicon.maxVerbWords(), end - start); size >= 1; size--) {
                Optional<VerbAt> verb = verbAt(words, start, start + size, operation);
                if (verb.isPresent()) return verb;
            }
        }
        return Optional.empty();
    }

    private Optional<VerbAt> verbAt(List<Word> words, int start, int end, NamingOperation operation) {
        String phrase = joinText(words.subList(start, end));
        return namingLexicon.lookupVerb(phrase)
                .filter(entry -> operation == null || entry.operation() == operation)
                .map(entry -> new VerbAt(start, end, phrase, entry));
    }

    /**
     * "rename to 'New'": the new name follows the rename verb and its preposition directly,
     * so nothing names the entity being renamed.
     */
    private boolean renamingSourceMissing(List<Word> words, Quote quote) {
        Optional<VerbAt> rename = verbWithin(words, Math.max(0, quote.start() - CONTEXT_BEFORE), quote.start(),
                NamingOperation.RENAME);
        if (rename.isEmpty()) return false;
        VerbAt verb = rename.get();
        String preposition = verb.entry().preposition();
        if (preposition == null || verb.form().endsWith(" " + preposition)) return false;
        return verb.end() == quote.start() - 1 && words.get(verb.end()).is(preposition);
    }

    // ── Tags ──

    private List<Draft> tags(List<Word> words, Set<Integer> claimed) {
        List<Draft> drafts = new ArrayList<>();
        for (int i = 0; i + 1 < words.size(); i++) {
            Word sigil = words.get(i);
            Word name = words.get(i + 1);
            if (!TAG_SIGILS.contains(sigil.text()) || claimed.contains(i) || claimed.contains(i + 1)) continue;
            if (sigil.span().end() != name.span().start() || name.isPunctuation() || name.type() == TokenType.QUOTE) continue;

            Context context = new Context(NamedReferenceType.TAGGED_REFERENCE, NamingOperation.REFERENCE_BY_NAME,
                    null, null, null, i, i + 2, 0.9);
            drafts.add(new Draft(i, i + 2, name.original(), context, QuoteStyle.NONE,
                    ResolutionStrategy.TAG_MATCH, nameIssues(name.original())));
            claimed.add(i);
            claimed.add(i + 1);
        }
        return drafts;
    }

    // ── Unquoted names ──

    /**
     * Unquoted names are only taken right after a naming verb: "the track called Glass Pad",
     * "call it Warm Keys", "rename Lead to Hook".
     */
    private List<Draft> bareNames(List<Word> words, Set<Integer> claimed) {
        List<Draft> drafts = new ArrayList<>();
        int i = 0;
        while (i < words.size()) {
            Optional<VerbAt> found = Optional.empty();
            for (int size = Math.min(namingLexicon.maxVerbWords(), words.size() - i); size >= 1 && found.isEmpty(); size--) {
                if (anyClaimed(claimed, i, i + size)) continue;
                found = verbAt(words, i, i + size, null).filter(verb -> takesBareName(words, verb));
            }
            if (found.isEmpty()) {
                i++;
                continue;
            }

            VerbAt verb = found.get();
            NamingOperation operation = verb.entry().operation();
            int nameStart = verb.end();
            if (operation == NamingOperation.ASSIGN_NAME && nameStart < words.size()
                    && DEMONSTRATIVES.contains(words.get(nameStart).text())) {
                nameStart++;
            }

            int nameEnd = bareNameEnd(words, nameStart, claimed);
            if (nameEnd > nameStart) {
                drafts.add(bareDraft(words, verb, nameStart, nameEnd));
                claimed.addAll(range(nameStart, nameEnd));
            }
            int next = Math.max(verb.end(), nameEnd);

            // "rename Lead to Hook": the second name follows the preposition
            String preposition = verb.entry().preposition();
            if (operation == NamingOperation.RENAME && nameEnd > nameStart && preposition != null
                    && nameEnd < words.size() && words.get(nameEnd).is(preposition)) {
                int targetEnd = bareNameEnd(words, nameEnd + 1, claimed);
                if (targetEnd > nameEnd + 1) {
                    drafts.add(bareDraft(words, verb, nameEnd + 1, targetEnd));
                    claimed.addAll(range(nameEnd + 1, targetEnd));
                    next = targetEnd;
                }
            }
            i = next;
        }
        return drafts;
    }

    /**
     * Commands only count in imperative position, so "the track name is long" names nothing.
     */
    private static boolean takesBareName(List<Word> words, VerbAt verb) {
        return switch (verb.entry().operation()) {
            case REFERENCE_BY_NAME -> true;
            case ASSIGN_NAME, RENAME -> verb.start() == 0 || words.get(verb.start() - 1).isPunctuation()
                    || words.get(verb.start() - 1).hasTag(TokenTag.CONJUNCTION);
            case REMOVE_NAME, SEARCH_BY_NAME -> false;
        };
    }

    private Draft bareDraft(List<Word> words, VerbAt verb, int nameStart, int nameEnd) {
        String name = TokenStreams.surface(words.subList(nameStart, nameEnd));
        NamingOperation operation = verb.entry().operation();
        NamedReferenceType type = operation == NamingOperation.REFERENCE_BY_NAME ? NamedReferenceType.BARE_NAME
                : operation == NamingOperation.RENAME ? NamedReferenceType.RENAMING_COMMAND
                : NamedReferenceType.NAMING_COMMAND;

        String entityType = null;
        String keyword = null;
        int start = nameStart;
        if (operation == NamingOperation.REFERENCE_BY_NAME) {
            start = verb.start();
            for (int k = Math.max(0, verb.start() - CONTEXT_BEFORE); k < verb.start(); k++) {
                Optional<String> hint = namingLexicon.entityType(words.get(k).text());
                if (hint.isPresent()) {
                    entityType = hint.get();
                    keyword = words.get(k).text();
                    start = k;
                    break;
                }
            }
        }

        List<ReferenceWarningCode> codes = new ArrayList<>(nameIssues(name));
        codes.add(ReferenceWarningCode.AMBIGUOUS_BARE_NAME);
        Context context = new Context(type, operation, verb.form(), entityType, keyword, start, nameEnd, 0.6);
        return new Draft(start, nameEnd, name, context, QuoteStyle.NONE, ResolutionStrategy.FUZZY_MATCH, codes);
    }

    /**
     * A bare name runs to the next punctuation, conjunction or preposition. It may not open with
     * a determiner or pronoun ("call the chorus" is not naming anything "the chorus").
     */
    private static int bareNameEnd(List<Word> words, int start, Set<Integer> claimed) {
        if (start >= words.size()) return start;
        Word first = words.get(start);
        if (first.hasTag(TokenTag.DETERMINER) || first.hasTag(TokenTag.PRONOUN)) return start;
        int end = start;
        while (end < words.size()) {
            Word word = words.get(end);
            if (claimed.contains(end) || word.isPunctuation() || word.type() == TokenType.QUOTE || word.is("`")
                    || word.hasTag(TokenTag.CONJUNCTION) || word.hasTag(TokenTag.PREPOSITION)) {
                break;
            }
            end++;
        }
        return end;
    }

    // ── Warnings ──

    private List<ReferenceWarningCode> nameIssues(String name) {
        List<ReferenceWarningCode> codes = new ArrayList<>();
        if (name.isBlank()) codes.add(ReferenceWarningCode.EMPTY_NAME);
        if (name.length() > maxNameLength) codes.add(ReferenceWarningCode.NAME_TOO_LONG);
        if (name.chars().anyMatch(ch -> Character.isISOControl(ch) || SPECIAL_CHARACTERS.indexOf(ch) >= 0)) {
            codes.add(ReferenceWarningCode.SPECIAL_CHARACTERS);
        }
        if (RESERVED_NAMES.contains(name.strip().toLowerCase(Locale.ROOT))) codes.add(ReferenceWarningCode.RESERVED_NAME);
        return codes;
    }

    private static String describe(ReferenceWarningCode code, String name) {
        return switch (code) {
            case EMPTY_NAME -> "Empty name";
            case UNCLOSED_QUOTE -> "Quote opened but never closed";
            case NAME_TOO_LONG -> "Name \"" + abbreviate(name) + "\" is unusually long";
            case SPECIAL_CHARACTERS -> "Name \"" + abbreviate(name) + "\" contains unusual characters";
            case RESERVED_NAME -> "\"" + name + "\" is a reserved word, not a name";
            case RENAMING_SOURCE_MISSING -> "Rename has a new name but nothing to rename";
            case AMBIGUOUS_BARE_NAME -> "Unquoted name \"" + name + "\" could also be ordinary words";
            default -> code.code();
        };
    }

    private static String abbreviate(String name) {
        return name.length() <= 30 ? name : name.substring(0, 30) + "...";
    }

    private static boolean anyClaimed(Set<Integer> claimed, int start, int end) {
        for (int k = start; k < end; k++) {
            if (claimed.contains(k)) return true;
        }
        return false;
    }

    private static List<Integer> range(int start, int end) {
        List<Integer> indices = new ArrayList<>(end - start);
        for (int k = start; k < end; k++) indices.add(k);
        return indices;
    }

    private static String joinText(List<Word> words) {
        return words.stream().map(Word::text).collect(Collectors.joining(" "));
    }
}
