package com.cadenceai.infrastructure.parse.time;

import com.cadenceai.domain.parse.lexicon.SectionEntry;
import com.cadenceai.domain.parse.lexicon.SectionLexicon;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.time.DurationUnit;
import com.cadenceai.domain.parse.model.time.MusicalPosition;
import com.cadenceai.domain.parse.model.time.PositionAnchor;
import com.cadenceai.domain.parse.model.time.TemporalRelation;
import com.cadenceai.domain.parse.model.time.TimeExpression;
import com.cadenceai.domain.parse.model.time.TimeRange;
import com.cadenceai.domain.parse.model.time.TimeWarningCode;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.domain.parse.model.unit.ParsedNumber;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.cadenceai.domain.parse.model.time.TemporalRelation.AFTER;
import static com.cadenceai.domain.parse.model.time.TemporalRelation.BEFORE;
import static com.cadenceai.domain.parse.model.time.TemporalRelation.BETWEEN;
import static com.cadenceai.domain.parse.model.time.TemporalRelation.DURING;
import static com.cadenceai.domain.parse.model.time.TemporalRelation.SINCE;
import static com.cadenceai.domain.parse.model.time.TemporalRelation.UNTIL;

/**
 * Parses musical time references: sections ("the second chorus"), bar/beat positions ("at bar 5
 * beat 3"), ranges ("from bar 8 to 16"), durations ("for 4 bars"), repetitions ("every other bar")
 * and whole-song phrases ("everywhere").
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeExpressionAnalyzer {

    private enum Construct {
        DURATION,
        LOCATION,
        POINT,
        RELATIVE,
        RANGE,
        WHOLE
    }

    private record Preposition(Construct construct, TemporalRelation relation) {}

    private record PrepositionAt(Preposition preposition, int end) {}

    private record UnitAt(DurationUnit unit, int end) {}

    private static final Map<String, Preposition> PREPOSITIONS = Map.ofEntries(
            Map.entry("for", new Preposition(Construct.DURATION, null)),
            Map.entry("over", new Preposition(Construct.DURATION, null)),
            Map.entry("during", new Preposition(Construct.LOCATION, DURING)),
            Map.entry("in", new Preposition(Construct.LOCATION, DURING)),
            Map.entry("within", new Preposition(Construct.LOCATION, DURING)),
            Map.entry("throughout", new Preposition(Construct.WHOLE, DURING)),
            Map.entry("across", new Preposition(Construct.WHOLE, DURING)),
            Map.entry("at", new Preposition(Construct.POINT, null)),
            Map.entry("on", new Preposition(Construct.POINT, null)),
            Map.entry("before", new Preposition(Construct.RELATIVE, BEFORE)),
            Map.entry("after", new Preposition(Construct.RELATIVE, AFTER)),
            Map.entry("until", new Preposition(Construct.RELATIVE, UNTIL)),
            Map.entry("till", new Preposition(Construct.RELATIVE, UNTIL)),
            Map.entry("up to", new Preposition(Construct.RELATIVE, UNTIL)),
            Map.entry("up until", new Preposition(Construct.RELATIVE, UNTIL)),
            Map.entry("since", new Preposition(Construct.RELATIVE, SINCE)),
            Map.entry("starting from", new Preposition(Construct.RELATIVE, SINCE)),
            Map.entry("starting at", new Preposition(Construct.RELATIVE, SINCE)),
            Map.entry("beginning at", new Preposition(Construct.RELATIVE, SINCE)),
            Map.entry("beginning from", new Preposition(Construct.RELATIVE, SINCE)),
            Map.entry("from", new Preposition(Construct.RANGE, null)),
            Map.entry("between", new Preposition(Construct.RANGE, BETWEEN))
    );

    private static final Set<TemporalRelation> RELATIVE_RELATIONS = EnumSet.of(BEFORE, AFTER, UNTIL, SINCE);

    private static final Set<String> RANGE_ENDS = Set.of("to", "through", "thru", "until", "till");

    private static final Map<String, Integer> ORDINALS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("1st", 1),
            Map.entry("second", 2), Map.entry("2nd", 2),
            Map.entry("third", 3), Map.entry("3rd", 3),
            Map.entry("fourth", 4), Map.entry("4th", 4),
            Map.entry("fifth", 5), Map.entry("5th", 5),
            Map.entry("sixth", 6), Map.entry("6th", 6),
            Map.entry("seventh", 7), Map.entry("7th", 7),
            Map.entry("eighth", 8), Map.entry("8th", 8),
            Map.entry("ninth", 9), Map.entry("9th", 9),
            Map.entry("tenth", 10), Map.entry("10th", 10)
    );

    // instances back from the last one
    private static final Map<String, Integer> FROM_END = Map.of(
            "last", 0,
            "final", 0,
            "penultimate", 1
    );

    private static final List<String> WHOLE_SONG = List.of(
            "everywhere", "throughout", "overall", "globally",
            "the whole song", "the entire song", "the whole track", "the entire track",
            "the whole thing", "the entire thing", "the whole mix", "the entire mix", "all of it"
    );

    private static final Set<String> SONG_NOUNS = Set.of("the song", "the track", "the mix", "it");

    private static final Map<String, PositionAnchor> RELATIVE_POSITIONS = Map.ofEntries(
            Map.entry("start", PositionAnchor.START),
            Map.entry("beginning", PositionAnchor.START),
            Map.entry("top", PositionAnchor.START),
            Map.entry("head", PositionAnchor.START),
            Map.entry("end", PositionAnchor.END),
            Map.entry("tail", PositionAnchor.END),
            Map.entry("bottom", PositionAnchor.END),
            Map.entry("middle", PositionAnchor.MIDDLE),
            Map.entry("center", PositionAnchor.MIDDLE),
            Map.entry("halfway", PositionAnchor.MIDDLE),
            Map.entry("midpoint", PositionAnchor.MIDDLE)
    );

    // section forms that are also everyday words
    private static final Set<String> AMBIGUOUS_SECTION_FORMS = Set.of(
            "build", "break", "drop", "hook", "tag", "fill", "ramp", "transition", "opening", "ending", "solo"
    );

    private static final Set<String> QUANTIFYING_WORDS = Set.of("every", "each", "all", "both", "any");

    private static final int MAX_BEAT = 16;
    private static final int MAX_PREPOSITION_WORDS = 2;
    private static final int MAX_WHOLE_WORDS = 3;

    private final SectionLexicon sectionLexicon;
    private final NumberParser numberParser;

    private record Issue(TimeWarningCode code, String message, List<String> candidates) {
        Issue(TimeWarningCode code, String message) {
            this(code, message, List.of());
        }
    }

    /**
     * A parsed range ending before word {@code end}.
     */
    private record Match(int end, TimeRange range, double confidence, List<Issue> issues) {}

    /**
     * A range endpoint: a section, or a position ({@code position} set when it is a bar/beat).
     */
    private record Ref(int end, TimeRange range, MusicalPosition position, List<Issue> issues) {}

    /**
     * Parses a time expression starting at the first word of {@code window}.
     */
    public Optional<TimeExpression> parse(List<Word> window) {
        if (window == null || window.isEmpty()) {
            return Optional.empty();
        }
        return parseAt(window, 0).map(match -> toExpression(window, 0, match));
    }

    /**
     * Slides the parser over the utterance. A section immediately followed by a bar range or
     * position combines into an intersection: "in the chorus from bar 8 to 16".
     */
    public List<TimeExpression> scan(List<Word> words) {
        List<Integer> starts = new ArrayList<>();
        List<Match> matches = new ArrayList<>();
        int i = 0;
        while (i < words.size()) {
            Optional<Match> match = parseAt(words, i);
            if (match.isPresent()) {
                starts.add(i);
                matches.add(match.get());
                i = match.get().end();
            } else {
                i++;
            }
        }

        List<TimeExpression> expressions = new ArrayList<>();
        for (int k = 0; k < matches.size(); k++) {
            Match current = matches.get(k);
            int start = starts.get(k);
            if (k + 1 < matches.size() && starts.get(k + 1) == current.end()
                    && current.range() instanceof TimeRange.Section
                    && isBarRangeOrPoint(matches.get(k + 1).range())) {
                Match next = matches.get(k + 1);
                List<Issue> issues = new ArrayList<>(current.issues());
                issues.addAll(next.issues());
                TimeRange composite = new TimeRange.Composite(List.of(current.range(), next.range()),
                        TimeRange.Combination.INTERSECTION);
                expressions.add(toExpression(words, start,
                        new Match(next.end(), composite, Math.min(current.confidence(), next.confidence()), issues)));
                k++;
            } else {
                expressions.add(toExpression(words, start, current));
            }
        }
        if (!expressions.isEmpty()) {
            log.debug("[TimeExpression] {} time expressions in {} words", expressions.size(), words.size());
        }
        return expressions;
    }

    private Optional<Match> parseAt(List<Word> words, int i) {
        if (words.get(i).isPunctuation()) {
            return Optional.empty();
        }
        return fromRange(words, i)
                .or(() -> between(words, i))
                .or(() -> duration(words, i))
                .or(() -> prepositional(words, i))
                .or(() -> repetition(words, i))
                .or(() -> wholeSong(words, i))
                .or(() -> bareSection(words, i));
    }

    // ---- forms ------------------------------------------------------------

    /**
     * "from bar 8 to bar 16", "from the verse to the chorus"; a missing end reads as "since".
     */
    private Optional<Match> fromRange(List<Word> words, int i) {
        if (!text(words, i).equals("from")) {
            return Optional.empty();
        }
        Optional<Ref> start = reference(words, i + 1, false);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        Ref a = start.get();
        if (RANGE_ENDS.contains(text(words, a.end()))) {
            Optional<Ref> end = reference(words, a.end() + 1, true);
            if (end.isPresent()) {
                return Optional.of(range(a, end.get(), 0.8, false));
            }
        }
        List<Issue> issues = new ArrayList<>(a.issues());
        issues.add(new Issue(TimeWarningCode.INCOMPLETE_RANGE, "Range has a start but no end"));
        return Optional.of(new Match(a.end(), new TimeRange.Relative(SINCE, a.range()), 0.6, issues));
    }

    /**
     * "between bar 8 and bar 16", "between the verse and the chorus".
     */
    private Optional<Match> between(List<Word> words, int i) {
        if (!text(words, i).equals("between")) {
            return Optional.empty();
        }
        Optional<Ref> start = reference(words, i + 1, false);
        if (start.isEmpty() || !text(words, start.get().end()).equals("and")) {
            return Optional.empty();
        }
        return reference(words, start.get().end() + 1, true)
                .map(end -> range(start.get(), end, 0.7, true));
    }

    private Match range(Ref a, Ref b, double confidence, boolean between) {
        List<Issue> issues = new ArrayList<>(a.issues());
        issues.addAll(b.issues());
        if (a.position() != null && b.position() != null) {
            if (b.position().compareTo(a.position()) < 0) {
                issues.add(new Issue(TimeWarningCode.CONFLICTING_REFERENCES, "Range ends before it starts"));
            }
            return new Match(b.end(), new TimeRange.Absolute(a.position(), b.position()), confidence, issues);
        }
        if (a.range() instanceof TimeRange.Section first && b.range() instanceof TimeRange.Section second
                && first.sectionName().equals(second.sectionName())
                && first.ordinal() != null && second.ordinal() != null && second.ordinal() < first.ordinal()) {
            issues.add(new Issue(TimeWarningCode.CONFLICTING_REFERENCES, "Range ends before it starts"));
        }
        TimeRange union = new TimeRange.Composite(List.of(a.range(), b.range()), TimeRange.Combination.UNION);
        return new Match(b.end(), between ? new TimeRange.Relative(BETWEEN, union) : union, confidence, issues);
    }

    /**
     * "for 4 bars", "over two beats", "for 2 bars from bar 9".
     */
    private Optional<Match> duration(List<Word> words, int i) {
        Optional<PrepositionAt> prep = preposition(words, i)
                .filter(at -> at.preposition().construct() == Construct.DURATION);
        if (prep.isEmpty()) {
            return Optional.empty();
        }
        int k = prep.get().end();
        Optional<ParsedNumber> value = numberParser.parse(text(words, k)).filter(number -> !number.explicitSign());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<UnitAt> unitAt = durationUnit(words, k + 1);
        if (unitAt.isEmpty()) {
            return Optional.empty();
        }
        int end = unitAt.get().end();
        DurationUnit unit = unitAt.get().unit();

        TimeRange from = null;
        List<Issue> issues = new ArrayList<>();
        if (text(words, end).equals("from") || text(words, end).equals("starting")) {
            int refStart = text(words, end).equals("starting") && Set.of("at", "from").contains(text(words, end + 1))
                    ? end + 2 : end + 1;
            Optional<Ref> anchor = reference(words, refStart, false);
            if (anchor.isPresent()) {
                from = anchor.get().range();
                issues.addAll(anchor.get().issues());
                end = anchor.get().end();
            }
        }
        return Optional.of(new Match(end, new TimeRange.Duration(value.get().value(), unit, from), 0.8, issues));
    }

    /**
     * Preposition + section ("in the chorus", "before the bridge") or + position ("at bar 5",
     * "at the end of the verse").
     */
    private Optional<Match> prepositional(List<Word> words, int i) {
        Optional<PrepositionAt> prep = preposition(words, i);
        if (prep.isEmpty() || prep.get().preposition().construct() == Construct.RANGE) {
            return Optional.empty();
        }
        TemporalRelation relation = prep.get().preposition().relation();
        int k = prep.get().end();
        boolean relative = relation != null && RELATIVE_RELATIONS.contains(relation);

        Optional<Ref> section = sectionRef(words, k);
        if (section.isPresent()) {
            TimeRange range = relative ? new TimeRange.Relative(relation, section.get().range()) : section.get().range();
            return Optional.of(new Match(section.get().end(), range, 0.8, section.get().issues()));
        }
        return positionRef(words, k).map(position -> {
            TimeRange range = relative ? new TimeRange.Relative(relation, position.range()) : position.range();
            return new Match(position.end(), range, 0.7, position.issues());
        });
    }

    /**
     * "every bar", "every other beat", "every 4 bars", "every second bar in the chorus".
     */
    private Optional<Match> repetition(List<Word> words, int i) {
        if (!text(words, i).equals("every")) {
            return Optional.empty();
        }
        int k = i + 1;
        int interval = 1;
        boolean everyOther = false;
        if (text(words, k).equals("other")) {
            interval = 2;
            everyOther = true;
            k++;
        } else if (ORDINALS.containsKey(text(words, k)) && durationUnit(words, k + 1).isPresent()) {
            interval = ORDINALS.get(text(words, k));
            k++;
        } else {
            Optional<Integer> count = integer(words, k);
            if (count.isPresent() && count.get() > 0) {
                interval = count.get();
                k++;
            }
        }
        Optional<UnitAt> unitAt = durationUnit(words, k);
        if (unitAt.isEmpty()) {
            return Optional.empty();
        }
        int end = unitAt.get().end();
        DurationUnit unit = unitAt.get().unit();

        TimeRange within = null;
        List<Issue> issues = new ArrayList<>();
        if (Set.of("in", "of", "during", "within").contains(text(words, end))) {
            Optional<Ref> section = sectionRef(words, end + 1);
            if (section.isPresent()) {
                within = section.get().range();
                issues.addAll(section.get().issues());
                end = section.get().end();
            }
        }
        return Optional.of(new Match(end, new TimeRange.Repetition(interval, unit, everyOther, within), 0.7, issues));
    }

    /**
     * "everywhere", "for the whole song", "throughout the track".
     */
    private Optional<Match> wholeSong(List<Word> words, int i) {
        Optional<Match> phrase = wholePhrase(words, i);
        if (phrase.isPresent()) {
            return phrase;
        }
        Optional<PrepositionAt> prep = preposition(words, i);
        if (prep.isEmpty()) {
            return Optional.empty();
        }
        int k = prep.get().end();
        Optional<Match> afterPreposition = wholePhrase(words, k);
        if (afterPreposition.isPresent()) {
            return afterPreposition;
        }
        if (prep.get().preposition().construct() == Construct.WHOLE) {
            for (int size = 2; size >= 1; size--) {
                if (SONG_NOUNS.contains(joinText(words, k, k + size))) {
                    return Optional.of(new Match(k + size, new TimeRange.Whole(text(words, i)), 0.9, List.of()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Match> wholePhrase(List<Word> words, int k) {
        for (int size = Math.min(MAX_WHOLE_WORDS, words.size() - k); size >= 1; size--) {
            String phrase = joinText(words, k, k + size);
            if (WHOLE_SONG.contains(phrase)) {
                return Optional.of(new Match(k + size, new TimeRange.Whole(phrase), 0.9, List.of()));
            }
        }
        return Optional.empty();
    }

    /**
     * A section mentioned without a preposition: "make the chorus brighter".
     */
    private Optional<Match> bareSection(List<Word> words, int i) {
        Word first = words.get(i);
        // "solo the drums" is a command, not the solo section
        if (first.hasTag(TokenTag.VERB) && (i == 0 || !text(words, i - 1).equals("the"))) {
            return Optional.empty();
        }
        return sectionRef(words, i).map(ref -> {
            List<Issue> issues = new ArrayList<>(ref.issues());
            String form = joinText(words, i, ref.end());
            if (AMBIGUOUS_SECTION_FORMS.stream().anyMatch(ambiguous -> form.endsWith(ambiguous))) {
                issues.add(new Issue(TimeWarningCode.AMBIGUOUS_SECTION,
                        "\"" + form + "\" may not refer to a song section"));
            }
            return new Match(ref.end(), ref.range(), 0.5, issues);
        });
    }

    // ---- references -------------------------------------------------------

    private Optional<Ref> reference(List<Word> words, int k, boolean allowBareNumber) {
        Optional<Ref> position = positionRef(words, k);
        if (position.isPresent()) {
            return position;
        }
        Optional<Ref> section = sectionRef(words, k);
        if (section.isPresent() || !allowBareNumber) {
            return section;
        }
        // "from bar 8 to 16": the end bar may be a bare number
        return integer(words, k).map(bar -> position(k + 1, bar, null));
    }

    /**
     * "[the] [ordinal|last] SECTION [number]".
     */
    private Optional<Ref> sectionRef(List<Word> words, int k) {
        int j = k;
        if (text(words, j).equals("the")) j++;

        Integer ordinal = null;
        boolean isLast = false;
        int fromEnd = 0;
        String marker = text(words, j);
        if (ORDINALS.containsKey(marker)) {
            ordinal = ORDINALS.get(marker);
            j++;
        } else if (j < words.size() && words.get(j).type() == TokenType.ORDINAL) {
            Optional<Integer> digits = numberParser.parseInteger(marker.replaceAll("\\D", ""));
            if (digits.isEmpty()) {
                // "12345678901st" does not fit an ordinal
                return Optional.empty();
            }
            ordinal = digits.get();
            j++;
        } else if (FROM_END.containsKey(marker)) {
            isLast = true;
            fromEnd = FROM_END.get(marker);
            j++;
        }

        SectionEntry entry = null;
        String form = null;
        for (int size = Math.min(sectionLexicon.maxFormWords(), words.size() - j); size >= 1 && entry == null; size--) {
            String candidate = joinText(words, j, j + size);
            Optional<SectionEntry> found = sectionLexicon.lookup(candidate);
            if (found.isPresent()) {
                entry = found.get();
                form = candidate;
                j += size;
            }
        }
        if (entry == null) {
            return Optional.empty();
        }

        if (ordinal == null && !isLast) {
            Optional<Integer> number = integer(words, j);
            if (number.isPresent() && number.get() > 0) {
                ordinal = number.get();
                j++;
            }
        }

        List<Issue> issues = new ArrayList<>();
        if (entry.repeats() && ordinal == null && !isLast && !isPlural(form, entry) && !quantified(words, k)) {
            String name = entry.canonical();
            issues.add(new Issue(TimeWarningCode.MISSING_ORDINAL,
                    "\"" + name + "\" repeats; which one is meant?",
                    List.of("first " + name, "second " + name, "last " + name, "every " + name)));
        }
        return Optional.of(new Ref(j, new TimeRange.Section(entry.canonical(), ordinal, isLast, fromEnd), null, issues));
    }

    /**
     * "bar N [beat M]", "beat M [of bar N]", "[the] start|end|middle [of SECTION|the song]".
     */
    private Optional<Ref> positionRef(List<Word> words, int k) {
        String head = text(words, k);
        if (head.equals("bar") || head.equals("measure")) {
            Optional<Integer> bar = integer(words, k + 1);
            if (bar.isEmpty()) {
                return Optional.empty();
            }
            int j = k + 2;
            Integer beat = null;
            int beatAt = text(words, j).equals(",") ? j + 1 : j;
            if (text(words, beatAt).equals("beat") && integer(words, beatAt + 1).isPresent()) {
                beat = integer(words, beatAt + 1).get();
                j = beatAt + 2;
            }
            return Optional.of(position(j, bar.get(), beat));
        }
        if (head.equals("beat")) {
            Optional<Integer> beat = integer(words, k + 1);
            if (beat.isEmpty()) {
                return Optional.empty();
            }
            int j = k + 2;
            int bar = 1;
            if (text(words, j).equals("of") && Set.of("bar", "measure").contains(text(words, j + 1))
                    && integer(words, j + 2).isPresent()) {
                bar = integer(words, j + 2).get();
                j += 3;
            }
            return Optional.of(position(j, bar, beat.get()));
        }

        int j = text(words, k).equals("the") ? k + 1 : k;
        PositionAnchor anchor = RELATIVE_POSITIONS.get(text(words, j));
        if (anchor == null) {
            return Optional.empty();
        }
        j++;
        TimeRange of = null;
        List<Issue> issues = new ArrayList<>();
        if (text(words, j).equals("of")) {
            Optional<Ref> section = sectionRef(words, j + 1);
            if (section.isPresent()) {
                of = section.get().range();
                issues.addAll(section.get().issues());
                j = section.get().end();
            } else if (SONG_NOUNS.contains(joinText(words, j + 1, j + 3))) {
                j += 3;
            } else if (SONG_NOUNS.contains(text(words, j + 1))) {
                j += 2;
            }
        }
        return Optional.of(new Ref(j, new TimeRange.Point(null, anchor, of), null, issues));
    }

    private Ref position(int end, int bar, Integer beat) {
        MusicalPosition position = new MusicalPosition(bar, beat, null);
        return new Ref(end, new TimeRange.Point(position, null, null), position, barIssues(bar, beat));
    }

    private static List<Issue> barIssues(int bar, Integer beat) {
        List<Issue> issues = new ArrayList<>();
        if (bar < 1) {
            issues.add(new Issue(TimeWarningCode.BAR_OUT_OF_RANGE, "Bar " + bar + " is before the first bar"));
        }
        if (beat != null && (beat < 1 || beat > MAX_BEAT)) {
            issues.add(new Issue(TimeWarningCode.BEAT_OUT_OF_RANGE, "Beat " + beat + " is outside 1-" + MAX_BEAT));
        }
        return issues;
    }

    // ---- helpers ----------------------------------------------------------

    private static Optional<PrepositionAt> preposition(List<Word> words, int i) {
        for (int size = Math.min(MAX_PREPOSITION_WORDS, words.size() - i); size >= 1; size--) {
            Preposition preposition = PREPOSITIONS.get(joinText(words, i, i + size));
            if (preposition != null) {
                return Optional.of(new PrepositionAt(preposition, i + size));
            }
        }
        return Optional.empty();
    }

    /**
     * Duration unit starting at {@code k}: "bars", "quarter notes".
     */
    private static Optional<UnitAt> durationUnit(List<Word> words, int k) {
        for (int size = Math.min(2, words.size() - k); size >= 1; size--) {
            int end = k + size;
            Optional<DurationUnit> unit = DurationUnit.fromAlias(joinText(words, k, end));
            if (unit.isPresent()) {
                return unit.map(found -> new UnitAt(found, end));
            }
        }
        return Optional.empty();
    }

    private Optional<Integer> integer(List<Word> words, int k) {
        if (k >= words.size() || words.get(k).type() == TokenType.ORDINAL) {
            return Optional.empty();
        }
        return numberParser.parseInteger(text(words, k));
    }

    private boolean isPlural(String form, SectionEntry entry) {
        if (!form.endsWith("s")) {
            return false;
        }
        String dropS = form.substring(0, form.length() - 1);
        String dropEs = form.length() > 2 ? form.substring(0, form.length() - 2) : dropS;
        return sectionLexicon.lookup(dropS).filter(entry::equals).isPresent()
                || sectionLexicon.lookup(dropEs).filter(entry::equals).isPresent();
    }

    private static boolean quantified(List<Word> words, int k) {
        return k > 0 && QUANTIFYING_WORDS.contains(text(words, k - 1));
    }

    private static boolean isBarRangeOrPoint(TimeRange range) {
        return range instanceof TimeRange.Absolute
                || (range instanceof TimeRange.Point point && point.position() != null);
    }

    private static TimeExpression toExpression(List<Word> words, int start, Match match) {
        List<Word> covered = words.subList(start, match.end());
        Span span = TokenStreams.spanOf(covered);
        List<AnalysisWarning> warnings = match.issues().stream()
                .map(issue -> new AnalysisWarning(issue.code(), issue.message(), span, issue.candidates()))
                .toList();
        return new TimeExpression(match.range(), TokenStreams.surface(covered), span, covered.size(),
                match.confidence(), warnings);
    }

    private static String text(List<Word> words, int k) {
        return k >= 0 && k < words.size() ? words.get(k).text() : "";
    }

    private static String joinText(List<Word> words, int from, int to) {
        if (to > words.size()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int k = from; k < to; k++) {
            if (k > from) sb.append(' ');
            sb.append(words.get(k).text());
        }
        return sb.toString();
    }
}
