package com.cadenceai.infrastructure.parse.coordination;

import com.cadenceai.domain.parse.lexicon.ConjunctionEntry;
import com.cadenceai.domain.parse.lexicon.ConjunctionLexicon;
import com.cadenceai.domain.parse.lexicon.WordClassLexicon;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.coordination.Conjunction;
import com.cadenceai.domain.parse.model.coordination.ConjunctionPosition;
import com.cadenceai.domain.parse.model.coordination.Constituent;
import com.cadenceai.domain.parse.model.coordination.ConstituentRole;
import com.cadenceai.domain.parse.model.coordination.CoordinationAnalysis;
import com.cadenceai.domain.parse.model.coordination.CoordinationKind;
import com.cadenceai.domain.parse.model.coordination.CoordinationLevel;
import com.cadenceai.domain.parse.model.coordination.CoordinationWarningCode;
import com.cadenceai.domain.parse.model.coordination.EllipsisAnalysis;
import com.cadenceai.domain.parse.model.coordination.EllipsisType;
import com.cadenceai.domain.parse.model.coordination.NWayCoordination;
import com.cadenceai.domain.parse.model.coordination.ParsedCoordination;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Finds conjunctions, splits their conjuncts, and classifies the coordination:
 * "add reverb and delay", "first cut the lows, then boost the vocals", "either the bass or the kick".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoordinationAnalyzer {

    private static final int MAX_FORM_WINDOW = 4;

    private static final Set<String> BOUNDARY_PUNCTUATION = Set.of(",", ";", ".", "!", "?", ":");
    private static final Set<String> SENTENCE_PUNCTUATION = Set.of(";", ".", "!", "?");
    private static final Set<String> LIST_CONJUNCTIONS = Set.of("and", "or");
    private static final Set<String> MAKE_VERBS = Set.of("make", "keep", "get", "leave");

    private static final Set<CoordinationKind> ELLIPTICAL_KINDS = EnumSet.of(
            CoordinationKind.PARALLEL, CoordinationKind.ADDITIVE, CoordinationKind.ALTERNATIVE,
            CoordinationKind.CONTRASTIVE, CoordinationKind.SEQUENTIAL, CoordinationKind.CONCURRENT
    );

    /**
     * Shape of the two sides of a conjunction, as seen by the level rules and ellipsis patterns.
     */
    private record Sides(
            List<Word> left,
            List<Word> right,
            CoordinationKind kind,
            boolean leftStartsVerb,
            boolean rightStartsVerb,
            boolean leftStartsNominal,
            boolean rightStartsNominal,
            int leftPreposition,
            int rightPreposition,
            boolean leftEndsAdjective,
            boolean rightAdjectivesOnly,
            boolean makePattern
    ) {
        boolean leftHasPreposition() {
            return leftPreposition > 0;
        }

        boolean rightHasPreposition() {
            return rightPreposition >= 0;
        }

        boolean rightStartsPreposition() {
            return rightPreposition == 0;
        }
    }

    private record LevelRule(String name, CoordinationLevel level, int priority, Predicate<Sides> test) {}

    private record EllipsisPattern(String id, EllipsisType type, boolean elidedInFirst,
                                   Predicate<Sides> test, Function<Sides, String> shared) {}

    private static final List<LevelRule> LEVEL_RULES = List.of(
            new LevelRule("two_verbs", CoordinationLevel.SENTENCE, 20,
                    s -> s.leftStartsVerb() && s.rightStartsVerb()),
            new LevelRule("sequential", CoordinationLevel.SENTENCE, 20,
                    s -> s.kind() == CoordinationKind.SEQUENTIAL),
            new LevelRule("conditional", CoordinationLevel.SENTENCE, 20,
                    s -> s.kind() == CoordinationKind.CONDITIONAL),
            new LevelRule("adjective_list", CoordinationLevel.ADJECTIVE, 18,
                    s -> s.makePattern() && s.leftEndsAdjective() && s.rightAdjectivesOnly()),
            new LevelRule("contrastive_constraint", CoordinationLevel.SENTENCE, 16,
                    s -> s.kind() == CoordinationKind.CONTRASTIVE),
            new LevelRule("noun_list_after_verb", CoordinationLevel.VERB_PHRASE, 15,
                    s -> s.leftStartsVerb() && !s.leftHasPreposition() && s.rightStartsNominal()),
            new LevelRule("prep_phrase_list", CoordinationLevel.PREP_PHRASE, 12,
                    s -> s.rightStartsPreposition() || (s.leftHasPreposition() && s.rightStartsNominal()))
    );

    // most specific first; full_command closes the table
    private static final List<EllipsisPattern> ELLIPSIS_PATTERNS = List.of(
            new EllipsisPattern("object_sharing", EllipsisType.RIGHT_NODE, true,
                    s -> s.left().size() == 1 && s.leftStartsVerb() && s.rightStartsVerb() && s.right().size() > 1,
                    s -> TokenStreams.surface(s.right().subList(1, s.right().size()))),
            new EllipsisPattern("adjective_sharing", EllipsisType.CONJUNCTION_REDUCTION, false,
                    s -> s.makePattern() && s.leftEndsAdjective() && s.rightAdjectivesOnly(),
                    s -> TokenStreams.surface(s.left().subList(0, s.left().size() - 1))),
            new EllipsisPattern("scope_sharing", EllipsisType.GAPPING, true,
                    s -> s.leftStartsVerb() && !s.leftHasPreposition() && s.rightStartsVerb() && s.rightHasPreposition(),
                    s -> TokenStreams.surface(s.right().subList(s.rightPreposition(), s.right().size()))),
            new EllipsisPattern("verb_and_prep_sharing", EllipsisType.CONJUNCTION_REDUCTION, false,
                    s -> s.leftStartsVerb() && s.leftHasPreposition() && s.rightStartsNominal(),
                    s -> s.left().get(0).text() + " " + s.left().get(s.leftPreposition()).text()),
            new EllipsisPattern("verb_sharing", EllipsisType.CONJUNCTION_REDUCTION, false,
                    s -> s.leftStartsVerb() && s.rightStartsNominal(),
                    s -> s.left().get(0).text()),
            new EllipsisPattern("full_command", EllipsisType.NONE, false,
                    s -> s.leftStartsVerb() && s.rightStartsVerb(),
                    s -> null)
    );

    private final ConjunctionLexicon conjunctionLexicon;
    private final WordClassLexicon wordClassLexicon;
    private final MorphologicalNormalizer morphologicalNormalizer;

    /**
     * A matched conjunction occurrence; {@code end} is exclusive.
     */
    private record Point(int start, int end, ConjunctionEntry entry, String surface) {
        boolean opener() {
            return entry.hasCorrelative()
                    && (entry.position() == ConjunctionPosition.CORRELATIVE || entry.position() == ConjunctionPosition.PREFIX);
        }
    }

    /**
     * Coordination before nesting and list warnings are attached.
     */
    private record Draft(Point point, Span pointSpan, Point partner, Span partnerSpan,
                         CoordinationKind kind, CoordinationLevel level,
                         List<Constituent> constituents, EllipsisAnalysis ellipsis, double confidence,
                         List<AnalysisWarning> warnings) {}

    public CoordinationAnalysis analyze(List<Word> words) {
        if (words.isEmpty()) {
            return CoordinationAnalysis.EMPTY;
        }
        List<Point> points = scan(words);
        boolean[] inPoint = new boolean[words.size()];
        for (Point point : points) {
            for (int k = point.start(); k < point.end(); k++) inPoint[k] = true;
        }

        List<Draft> drafts = new ArrayList<>();
        Set<Point> absorbed = new HashSet<>();
        for (Point point : points) {
            if (absorbed.contains(point)) continue;
            Point partner = point.opener() ? findPartner(words, points, point, absorbed) : null;
            if (partner != null) absorbed.add(partner);
            drafts.add(draft(words, inPoint, point, partner));
        }

        List<NWayCoordination> lists = new ArrayList<>();
        List<Integer> listConjunctions = new ArrayList<>();
        detectLists(words, inPoint, points, lists, listConjunctions);
        commaSplices(words, inPoint, lists).ifPresent(drafts::addAll);

        List<ParsedCoordination> coordinations = new ArrayList<>();
        drafts.sort(Comparator.comparingInt(d -> d.point().start()));
        for (Draft d : drafts) {
            coordinations.add(finish(d, drafts, listConjunctions));
        }

        if (!coordinations.isEmpty() || !lists.isEmpty()) {
            log.debug("[Coordination] {} coordinations, {} lists", coordinations.size(), lists.size());
        }
        return new CoordinationAnalysis(coordinations, lists);
    }

    // ---- scanning ---------------------------------------------------------

    private List<Point> scan(List<Word> words) {
        List<Point> points = new ArrayList<>();
        int window = Math.min(MAX_FORM_WINDOW, conjunctionLexicon.maxFormWords());
        int i = 0;
        while (i < words.size()) {
            Point match = null;
            for (int size = Math.min(window, words.size() - i); size >= 1 && match == null; size--) {
                if (containsPunctuation(words, i, i + size)) continue;
                String phrase = joinText(words, i, i + size);
                Optional<ConjunctionEntry> entry = conjunctionLexicon.lookup(phrase);
                if (entry.isPresent() && countsAsConjunction(words, points, i, entry.get())) {
                    match = new Point(i, i + size, entry.get(), phrase);
                }
            }
            if (match != null) {
                points.add(match);
                i = match.end();
            } else {
                i++;
            }
        }
        return points;
    }

    /**
     * "the first chorus" is an ordinal and "but not harsh" is a negated conjunct, not openers.
     */
    private boolean countsAsConjunction(List<Word> words, List<Point> points, int i, ConjunctionEntry entry) {
        String canonical = entry.canonical();
        if (canonical.equals("first") && i > 0 && words.get(i - 1).hasTag(TokenTag.DETERMINER)) {
            return false;
        }
        if (canonical.equals("not") && !points.isEmpty() && points.get(points.size() - 1).end() == i) {
            return false;
        }
        return true;
    }

    private Point findPartner(List<Word> words, List<Point> points, Point opener, Set<Point> absorbed) {
        String partner = opener.entry().correlative();
        for (Point candidate : points) {
            if (candidate.start() < opener.end() || absorbed.contains(candidate)) continue;
            if (sentenceBreakBetween(words, opener.end(), candidate.start())) return null;
            if (candidate.surface().equals(partner) || candidate.surface().endsWith(" " + partner)) {
                return candidate;
            }
        }
        return null;
    }

    // ---- drafting ---------------------------------------------------------

    private Draft draft(List<Word> words, boolean[] inPoint, Point point, Point partner) {
        ConjunctionEntry entry = point.entry();
        CoordinationKind kind = entry.kind();
        List<Word> first;
        List<Word> second;
        boolean conjunctionLedFirst;

        if (partner != null) {
            first = trim(words, point.end(), partner.start());
            second = trim(words, partner.end(), nextBoundary(words, inPoint, partner.end(), true));
            conjunctionLedFirst = true;
        } else if (entry.position() == ConjunctionPosition.PREFIX || entry.position() == ConjunctionPosition.CORRELATIVE) {
            int clauseStart = previousBoundary(words, inPoint, point.start());
            if (clauseStart < point.start()) {
                first = trim(words, clauseStart, point.start());
                second = trim(words, point.end(), nextBoundary(words, inPoint, point.end(), false));
                conjunctionLedFirst = false;
            } else {
                int conditionEnd = nextBoundary(words, inPoint, point.end(), false);
                first = trim(words, point.end(), conditionEnd);
                second = conditionEnd < words.size() && words.get(conditionEnd).is(",")
                        ? trim(words, conditionEnd + 1, nextBoundary(words, inPoint, conditionEnd + 1, true))
                        : List.of();
                conjunctionLedFirst = true;
            }
        } else {
            first = trim(words, previousBoundary(words, inPoint, point.start()), point.start());
            second = entry.position() == ConjunctionPosition.SUFFIX
                    ? List.of()
                    : trim(words, point.end(), nextBoundary(words, inPoint, point.end(), true));
            conjunctionLedFirst = false;
        }

        Span conjunctionSpan = TokenStreams.spanOf(words.subList(point.start(), point.end()));
        Sides sides = sides(first, second, kind);
        CoordinationLevel level = level(sides);

        EllipsisAnalysis ellipsis = EllipsisAnalysis.NONE;
        int elidedIn = -1;
        if (ELLIPTICAL_KINDS.contains(kind) && !first.isEmpty() && !second.isEmpty()) {
            for (EllipsisPattern pattern : ELLIPSIS_PATTERNS) {
                if (pattern.test().test(sides)) {
                    ellipsis = new EllipsisAnalysis(pattern.id(), pattern.type(), pattern.shared().apply(sides));
                    elidedIn = pattern.elidedInFirst() ? 0 : 1;
                    break;
                }
            }
        }

        List<Constituent> constituents = new ArrayList<>();
        ConstituentRole[] roles = roles(kind, entry.position(), partner != null, conjunctionLedFirst);
        constituents.add(constituent(0, first, roles[0]));
        if (entry.position() != ConjunctionPosition.SUFFIX) {
            constituents.add(constituent(1, second, roles[1]));
        }
        if (ellipsis.detected() && elidedIn >= 0) {
            constituents.set(elidedIn, constituents.get(elidedIn).withElision(ellipsis.shared()));
        }

        List<AnalysisWarning> warnings = new ArrayList<>();
        if (entry.correlativeRequired() && point.opener() && partner == null) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.MISSING_CORRELATIVE,
                    "\"" + point.surface() + "\" expects a matching \"" + entry.correlative() + "\"", conjunctionSpan));
        }
        Set<CoordinationKind> alternatives = conjunctionLexicon.alternativeKinds(point.surface());
        if (!alternatives.isEmpty()) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.AMBIGUOUS_CONJUNCTION,
                    "\"" + point.surface() + "\" can express more than one relation", conjunctionSpan,
                    alternatives.stream().map(k -> k.name().toLowerCase(Locale.ROOT)).sorted().toList()));
        }
        if (level == CoordinationLevel.MIXED) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.AMBIGUOUS_SCOPE,
                    "Cannot tell what \"" + point.surface() + "\" coordinates", conjunctionSpan));
        }
        if (ellipsis.detected()) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.ELLIPSIS_DETECTED,
                    "Shared material \"" + ellipsis.shared() + "\" is elided (" + ellipsis.patternId() + ")",
                    conjunctionSpan));
        }

        Span partnerSpan = partner == null ? null : TokenStreams.spanOf(words.subList(partner.start(), partner.end()));
        return new Draft(point, conjunctionSpan, partner, partnerSpan, kind, level, constituents, ellipsis,
                confidence(words, point), warnings);
    }

    private ParsedCoordination finish(Draft draft, List<Draft> all, List<Integer> listConjunctions) {
        Point point = draft.point();
        ConjunctionEntry entry = point.entry();
        List<AnalysisWarning> warnings = new ArrayList<>(draft.warnings());
        Span conjunctionSpan = draft.pointSpan();

        boolean nested = all.stream()
                .filter(other -> other != draft)
                .anyMatch(other -> draft.constituents().stream()
                        .anyMatch(c -> !c.isEmpty() && c.span().contains(other.pointSpan())));
        if (nested) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.NESTED_COORDINATION,
                    "Another coordination sits inside a conjunct of \"" + point.surface() + "\"", conjunctionSpan));
        }
        if (listConjunctions.contains(point.start())) {
            warnings.add(new AnalysisWarning(CoordinationWarningCode.THREE_WAY_COORDINATION,
                    "\"" + point.surface() + "\" closes a list of three or more items", conjunctionSpan));
        }

        Conjunction conjunction = new Conjunction(entry.canonical(), point.surface(), entry.position(),
                entry.priority(), conjunctionSpan, draft.partnerSpan());

        List<Span> covered = new ArrayList<>();
        covered.add(conjunctionSpan);
        draft.constituents().stream().filter(c -> !c.isEmpty()).map(Constituent::span).forEach(covered::add);

        return new ParsedCoordination(draft.kind(), draft.level(), conjunction, draft.constituents(),
                entry.orderStrict(), draft.partner() != null, draft.ellipsis(), draft.kind().rhetoricalRelation(),
                Span.covering(covered), draft.confidence(), warnings);
    }

    // ---- comma splices ----------------------------------------------------

    private static final ConjunctionEntry COMMA =
            new ConjunctionEntry(List.of(","), CoordinationKind.SEQUENTIAL, true, ConjunctionPosition.INFIX, null, false, 0);

    /**
     * Two verb-initial clauses joined only by a comma: "add reverb, boost the bass".
     */
    private Optional<List<Draft>> commaSplices(List<Word> words, boolean[] inPoint, List<NWayCoordination> lists) {
        List<Draft> splices = new ArrayList<>();
        for (int c = 0; c < words.size(); c++) {
            if (!words.get(c).is(",")) continue;
            Span commaSpan = words.get(c).span();
            if (lists.stream().anyMatch(list -> list.span().contains(commaSpan))) continue;

            List<Word> left = trim(words, previousBoundary(words, inPoint, c), c);
            List<Word> right = trim(words, c + 1, nextBoundary(words, inPoint, c + 1, true));
            if (left.isEmpty() || right.isEmpty() || !isVerb(left.get(0)) || !isVerb(right.get(0))) continue;
            // a clause opened by a conjunction ("if it clips, ...") is not a splice
            int clauseStart = previousBoundary(words, inPoint, c);
            if (clauseStart > 0 && inPoint[clauseStart - 1]) continue;

            Point point = new Point(c, c + 1, COMMA, ",");
            List<Constituent> constituents = List.of(
                    constituent(0, left, ConstituentRole.FIRST_CONJUNCT),
                    constituent(1, right, ConstituentRole.SECOND_CONJUNCT));
            List<AnalysisWarning> warnings = List.of(new AnalysisWarning(CoordinationWarningCode.COMMA_SPLICE,
                    "Two commands are joined only by a comma", commaSpan));
            splices.add(new Draft(point, commaSpan, null, null, CoordinationKind.SEQUENTIAL, CoordinationLevel.SENTENCE,
                    constituents, EllipsisAnalysis.NONE, 0.4, warnings));
        }
        return splices.isEmpty() ? Optional.empty() : Optional.of(splices);
    }

    // ---- n-way lists ------------------------------------------------------

    /**
     * "bass, drums, and keys": comma-separated items closed by "and"/"or", at least three items.
     */
    private void detectLists(List<Word> words, boolean[] inPoint, List<Point> points,
                             List<NWayCoordination> lists, List<Integer> listConjunctions) {
        for (Point point : points) {
            if (!LIST_CONJUNCTIONS.contains(point.surface())) continue;
            int c = point.start();

            List<List<Word>> items = new ArrayList<>();
            boolean oxford = c > 0 && words.get(c - 1).is(",");
            int segmentEnd = oxford ? c - 1 : c;
            while (true) {
                int segmentStart = segmentEnd;
                while (segmentStart > 0 && !words.get(segmentStart - 1).isPunctuation() && !inPoint[segmentStart - 1]) {
                    segmentStart--;
                }
                if (segmentStart < segmentEnd) items.add(0, words.subList(segmentStart, segmentEnd));
                if (segmentStart > 0 && words.get(segmentStart - 1).is(",")) {
                    segmentEnd = segmentStart - 1;
                } else {
                    break;
                }
            }
            List<Word> last = trim(words, point.end(), nextBoundary(words, inPoint, point.end(), true));
            if (!last.isEmpty()) items.add(last);
            if (items.size() < 3) continue;

            List<Word> head = items.get(0);
            boolean othersVerbal = items.subList(1, items.size()).stream().anyMatch(item -> isVerb(item.get(0)));
            if (head.size() > 1 && isVerb(head.get(0)) && !othersVerbal) {
                items.set(0, head.subList(1, head.size()));
            }

            List<Span> itemSpans = items.stream().map(TokenStreams::spanOf).toList();
            lists.add(new NWayCoordination(
                    items.stream().map(TokenStreams::surface).toList(),
                    itemSpans,
                    point.surface(),
                    oxford,
                    Span.covering(itemSpans)));
            listConjunctions.add(c);
        }
    }

    // ---- classification ---------------------------------------------------

    private Sides sides(List<Word> left, List<Word> right, CoordinationKind kind) {
        boolean leftStartsVerb = !left.isEmpty() && isVerb(left.get(0));
        boolean rightStartsVerb = !right.isEmpty() && isVerb(right.get(0));
        int leftPreposition = -1;
        for (int k = 1; k < left.size() && leftPreposition < 0; k++) {
            if (left.get(k).hasTag(TokenTag.PREPOSITION)) leftPreposition = k;
        }
        int rightPreposition = -1;
        for (int k = 0; k < right.size() && rightPreposition < 0; k++) {
            if (right.get(k).hasTag(TokenTag.PREPOSITION)) rightPreposition = k;
        }
        boolean leftEndsAdjective = !left.isEmpty() && isAdjective(left.get(left.size() - 1));
        boolean rightAdjectivesOnly = !right.isEmpty() && right.stream().allMatch(this::isAdjective);
        boolean makePattern = !left.isEmpty() && MAKE_VERBS.contains(lemma(left.get(0)));
        return new Sides(left, right, kind, leftStartsVerb, rightStartsVerb,
                !left.isEmpty() && isNominal(left.get(0)), !right.isEmpty() && isNominal(right.get(0)),
                leftPreposition, rightPreposition, leftEndsAdjective, rightAdjectivesOnly, makePattern);
    }

    private static CoordinationLevel level(Sides sides) {
        return LEVEL_RULES.stream()
                .sorted(Comparator.comparingInt(LevelRule::priority).reversed())
                .filter(rule -> rule.test().test(sides))
                .map(LevelRule::level)
                .findFirst()
                .orElseGet(() -> sides.leftStartsNominal() && sides.rightStartsNominal()
                        ? CoordinationLevel.NOUN_PHRASE
                        : CoordinationLevel.MIXED);
    }

    private static ConstituentRole[] roles(CoordinationKind kind, ConjunctionPosition position,
                                           boolean linked, boolean conjunctionLedFirst) {
        return switch (kind) {
            case CONDITIONAL -> conjunctionLedFirst
                    ? new ConstituentRole[]{ConstituentRole.CONDITION, ConstituentRole.ACTION}
                    : new ConstituentRole[]{ConstituentRole.ACTION, ConstituentRole.CONDITION};
            case CAUSAL -> new ConstituentRole[]{ConstituentRole.EFFECT, ConstituentRole.CAUSE};
            case CORRECTIVE -> linked || position != ConjunctionPosition.INFIX
                    ? new ConstituentRole[]{ConstituentRole.FIRST_CONJUNCT, ConstituentRole.CORRECTION}
                    : new ConstituentRole[]{ConstituentRole.CORRECTION, ConstituentRole.SECOND_CONJUNCT};
            case ELABORATIVE -> new ConstituentRole[]{ConstituentRole.FIRST_CONJUNCT, ConstituentRole.ELABORATION};
            default -> new ConstituentRole[]{ConstituentRole.FIRST_CONJUNCT, ConstituentRole.SECOND_CONJUNCT};
        };
    }

    private static double confidence(List<Word> words, Point point) {
        ConjunctionEntry entry = point.entry();
        boolean contentBothSides = point.start() > 0 && point.end() < words.size();
        double confidence = 0.5;
        if (contentBothSides) confidence += 0.2;
        if (entry.priority() >= 12) confidence += 0.1;
        if (point.start() == 0 && entry.position() == ConjunctionPosition.INFIX) confidence -= 0.2;
        if (entry.forms().contains("and") && contentBothSides) confidence += 0.1;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    // ---- word classes -----------------------------------------------------

    private boolean isVerb(Word word) {
        return word.hasTag(TokenTag.VERB) || wordClassLexicon.has(lemma(word), TokenTag.VERB);
    }

    private boolean isAdjective(Word word) {
        return word.hasTag(TokenTag.ADJECTIVE) || wordClassLexicon.has(lemma(word), TokenTag.ADJECTIVE);
    }

    private boolean isNominal(Word word) {
        if (word.hasTag(TokenTag.DETERMINER) || word.hasTag(TokenTag.PRONOUN)) return true;
        return !word.isPunctuation() && !isVerb(word) && !isAdjective(word) && !word.hasTag(TokenTag.PREPOSITION);
    }

    private String lemma(Word word) {
        return morphologicalNormalizer.lemmatize(word.text()).lemma();
    }

    // ---- boundaries -------------------------------------------------------

    /**
     * Index of the first boundary at or after {@code from}: punctuation, or a conjunction when
     * {@code stopAtConjunctions} is set.
     */
    private static int nextBoundary(List<Word> words, boolean[] inPoint, int from, boolean stopAtConjunctions) {
        int k = from;
        while (k < words.size()) {
            Word word = words.get(k);
            if (BOUNDARY_PUNCTUATION.contains(word.text()) && word.isPunctuation()) break;
            if (stopAtConjunctions && inPoint[k]) break;
            k++;
        }
        return k;
    }

    /**
     * First index of the clause ending just before {@code to}.
     */
    private static int previousBoundary(List<Word> words, boolean[] inPoint, int to) {
        int k = to;
        while (k > 0) {
            Word word = words.get(k - 1);
            if ((BOUNDARY_PUNCTUATION.contains(word.text()) && word.isPunctuation()) || inPoint[k - 1]) break;
            k--;
        }
        return k;
    }

    private static boolean sentenceBreakBetween(List<Word> words, int from, int to) {
        for (int k = from; k < to; k++) {
            if (words.get(k).isPunctuation() && SENTENCE_PUNCTUATION.contains(words.get(k).text())) return true;
        }
        return false;
    }

    private static List<Word> trim(List<Word> words, int from, int to) {
        int start = from;
        int end = Math.min(to, words.size());
        while (start < end && words.get(start).isPunctuation()) start++;
        while (end > start && words.get(end - 1).isPunctuation()) end--;
        return start < end ? words.subList(start, end) : List.of();
    }

    private static Constituent constituent(int index, List<Word> words, ConstituentRole role) {
        if (words.isEmpty()) {
            return new Constituent(index, "", null, role, false, null);
        }
        return new Constituent(index, TokenStreams.surface(words), TokenStreams.spanOf(words), role, false, null);
    }

    private static boolean containsPunctuation(List<Word> words, int from, int to) {
        for (int k = from; k < to; k++) {
            if (words.get(k).isPunctuation()) return true;
        }
        return false;
    }

    private static String joinText(List<Word> words, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int k = from; k < to; k++) {
            if (k > from) sb.append(' ');
            sb.append(words.get(k).text());
        }
        return sb.toString();
    }
}
