package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.InflectedForm;
import com.cadenceai.domain.parse.lexicon.MorphologyLexicon;
import com.cadenceai.domain.parse.model.token.InflectionType;
import com.cadenceai.domain.parse.model.token.WordClass;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Domain verb and adjective paradigms. Irregular and domain-specific forms live here so the
 * suffix rules only ever handle novel vocabulary.
 * <p>
 * When one surface form fills several paradigm cells ("set" is base, past and participle),
 * the first cell in paradigm order wins.
 */
@Component
public class StaticMorphologyLexicon implements MorphologyLexicon {

    private record VerbParadigm(String lemma, String thirdPerson, String past,
                                String pastParticiple, String presentParticiple) {}

    private record AdjectiveParadigm(String base, String comparative, String superlative,
                                     String nominalization, String verb) {}

    private static final List<VerbParadigm> VERBS = List.of(
            verb("make makes made made making"),
            verb("add adds added added adding"),
            verb("remove removes removed removed removing"),
            verb("delete deletes deleted deleted deleting"),
            verb("change changes changed changed changing"),
            verb("set sets set set setting"),
            verb("move moves moved moved moving"),
            verb("copy copies copied copied copying"),
            verb("duplicate duplicates duplicated duplicated duplicating"),
            verb("keep keeps kept kept keeping"),
            verb("put puts put put putting"),
            verb("get gets got gotten getting"),
            verb("give gives gave given giving"),
            verb("take takes took taken taking"),
            verb("bring brings brought brought bringing"),
            verb("cut cuts cut cut cutting"),
            verb("split splits split split splitting"),
            verb("try tries tried tried trying"),
            verb("undo undoes undid undone undoing"),
            verb("redo redoes redid redone redoing"),
            verb("brighten brightens brightened brightened brightening"),
            verb("darken darkens darkened darkened darkening"),
            verb("widen widens widened widened widening"),
            verb("narrow narrows narrowed narrowed narrowing"),
            verb("tighten tightens tightened tightened tightening"),
            verb("loosen loosens loosened loosened loosening"),
            verb("soften softens softened softened softening"),
            verb("harden hardens hardened hardened hardening"),
            verb("warm warms warmed warmed warming"),
            verb("cool cools cooled cooled cooling"),
            verb("thicken thickens thickened thickened thickening"),
            verb("thin thins thinned thinned thinning"),
            verb("smooth smooths smoothed smoothed smoothing"),
            verb("sharpen sharpens sharpened sharpened sharpening"),
            verb("deepen deepens deepened deepened deepening"),
            verb("flatten flattens flattened flattened flattening"),
            verb("strengthen strengthens strengthened strengthened strengthening"),
            verb("weaken weakens weakened weakened weakening"),
            verb("sweeten sweetens sweetened sweetened sweetening"),
            verb("fatten fattens fattened fattened fattening"),
            verb("dampen dampens dampened dampened dampening"),
            verb("quicken quickens quickened quickened quickening"),
            verb("liven livens livened livened livening"),
            verb("heighten heightens heightened heightened heightening"),
            verb("lighten lightens lightened lightened lightening"),
            verb("boost boosts boosted boosted boosting"),
            verb("reduce reduces reduced reduced reducing"),
            verb("increase increases increased increased increasing"),
            verb("decrease decreases decreased decreased decreasing"),
            verb("raise raises raised raised raising"),
            verb("lower lowers lowered lowered lowering"),
            verb("compress compresses compressed compressed compressing"),
            verb("expand expands expanded expanded expanding"),
            verb("limit limits limited limited limiting"),
            verb("gate gates gated gated gating"),
            verb("filter filters filtered filtered filtering"),
            verb("equalize equalizes equalized equalized equalizing"),
            verb("saturate saturates saturated saturated saturating"),
            verb("distort distorts distorted distorted distorting"),
            verb("modulate modulates modulated modulated modulating"),
            verb("pan pans panned panned panning"),
            verb("mute mutes muted muted muting"),
            verb("solo solos soloed soloed soloing"),
            verb("fade fades faded faded fading"),
            verb("crossfade crossfades crossfaded crossfaded crossfading"),
            verb("trim trims trimmed trimmed trimming"),
            verb("extend extends extended extended extending"),
            verb("shorten shortens shortened shortened shortening"),
            verb("lengthen lengthens lengthened lengthened lengthening"),
            verb("stretch stretches stretched stretched stretching"),
            verb("pitch pitches pitched pitched pitching"),
            verb("detune detunes detuned detuned detuning"),
            verb("retune retunes retuned retuned retuning"),
            verb("sidechain sidechains sidechained sidechained sidechaining"),
            verb("automate automates automated automated automating"),
            verb("transpose transposes transposed transposed transposing"),
            verb("harmonize harmonizes harmonized harmonized harmonizing"),
            verb("reharmonize reharmonizes reharmonized reharmonized reharmonizing"),
            verb("revoice revoices revoiced revoiced revoicing"),
            verb("quantize quantizes quantized quantized quantizing"),
            verb("humanize humanizes humanized humanized humanizing"),
            verb("syncopate syncopates syncopated syncopated syncopating"),
            verb("arpeggiate arpeggiates arpeggiated arpeggiated arpeggiating"),
            verb("arrange arranges arranged arranged arranging"),
            verb("orchestrate orchestrates orchestrated orchestrated orchestrating"),
            verb("layer layers layered layered layering"),
            verb("double doubles doubled doubled doubling"),
            verb("loop loops looped looped looping"),
            verb("repeat repeats repeated repeated repeating"),
            verb("swap swaps swapped swapped swapping"),
            verb("replace replaces replaced replaced replacing"),
            verb("switch switches switched switched switching"),
            verb("mix mixes mixed mixed mixing"),
            verb("blend blends blended blended blending"),
            verb("balance balances balanced balanced balancing"),
            verb("normalize normalizes normalized normalized normalizing"),
            verb("reverse reverses reversed reversed reversing"),
            verb("invert inverts inverted inverted inverting"),
            verb("preserve preserves preserved preserved preserving"),
            verb("maintain maintains maintained maintained maintaining"),
            verb("adjust adjusts adjusted adjusted adjusting"),
            verb("tweak tweaks tweaked tweaked tweaking"),
            verb("fix fixes fixed fixed fixing"),
            verb("apply applies applied applied applying")
    );

    private static final List<AdjectiveParadigm> ADJECTIVES = List.of(
            adjective("bright", "brighter", "brightest", "brightness", "brighten"),
            adjective("dark", "darker", "darkest", "darkness", "darken"),
            adjective("wide", "wider", "widest", "width", "widen"),
            adjective("narrow", "narrower", "narrowest", "narrowness", "narrow"),
            adjective("tight", "tighter", "tightest", "tightness", "tighten"),
            adjective("loose", "looser", "loosest", "looseness", "loosen"),
            adjective("loud", "louder", "loudest", "loudness", null),
            adjective("quiet", "quieter", "quietest", "quietness", null),
            adjective("soft", "softer", "softest", "softness", "soften"),
            adjective("hard", "harder", "hardest", "hardness", "harden"),
            adjective("warm", "warmer", "warmest", "warmth", "warm"),
            adjective("cool", "cooler", "coolest", "coolness", "cool"),
            adjective("thick", "thicker", "thickest", "thickness", "thicken"),
            adjective("thin", "thinner", "thinnest", "thinness", "thin"),
            adjective("heavy", "heavier", "heaviest", "heaviness", null),
            adjective("light", "lighter", "lightest", "lightness", "lighten"),
            adjective("dense", "denser", "densest", "density", null),
            adjective("sparse", "sparser", "sparsest", "sparseness", null),
            adjective("punchy", "punchier", "punchiest", "punchiness", null),
            adjective("muddy", "muddier", "muddiest", "muddiness", null),
            adjective("clean", "cleaner", "cleanest", "cleanness", null),
            adjective("dirty", "dirtier", "dirtiest", "dirtiness", null),
            adjective("crisp", "crispier", "crispiest", "crispness", null),
            adjective("smooth", "smoother", "smoothest", "smoothness", "smooth"),
            adjective("rough", "rougher", "roughest", "roughness", null),
            adjective("big", "bigger", "biggest", "bigness", null),
            adjective("small", "smaller", "smallest", "smallness", null),
            adjective("full", "fuller", "fullest", "fullness", null),
            adjective("empty", "emptier", "emptiest", "emptiness", null),
            adjective("rich", "richer", "richest", "richness", null),
            adjective("lean", "leaner", "leanest", "leanness", null),
            adjective("sharp", "sharper", "sharpest", "sharpness", "sharpen"),
            adjective("flat", "flatter", "flattest", "flatness", "flatten"),
            adjective("deep", "deeper", "deepest", "depth", "deepen"),
            adjective("shallow", "shallower", "shallowest", "shallowness", null),
            adjective("fast", "faster", "fastest", "speed", null),
            adjective("slow", "slower", "slowest", "slowness", null),
            adjective("high", "higher", "highest", null, null),
            adjective("low", "lower", "lowest", null, null),
            adjective("short", "shorter", "shortest", null, "shorten"),
            adjective("long", "longer", "longest", null, "lengthen"),
            adjective("strong", "stronger", "strongest", "strength", "strengthen"),
            adjective("weak", "weaker", "weakest", "weakness", "weaken"),
            adjective("dry", "drier", "driest", "dryness", null),
            adjective("wet", "wetter", "wettest", "wetness", null),
            adjective("funky", "funkier", "funkiest", "funkiness", null),
            adjective("jazzy", "jazzier", "jazziest", "jazziness", null),
            adjective("groovy", "groovier", "grooviest", "grooviness", null),
            adjective("mellow", "mellower", "mellowest", "mellowness", null),
            adjective("airy", "airier", "airiest", "airiness", null),
            adjective("gritty", "grittier", "grittiest", "grittiness", null),
            adjective("ethereal", "more ethereal", "most ethereal", null, null),
            adjective("aggressive", "more aggressive", "most aggressive", "aggression", null),
            adjective("gentle", "gentler", "gentlest", "gentleness", null),
            adjective("dynamic", "more dynamic", "most dynamic", null, null),
            adjective("static", "more static", "most static", null, null),
            adjective("energetic", "more energetic", "most energetic", null, null),
            adjective("lush", "lusher", "lushest", "lushness", null)
    );

    private static final Map<String, InflectedForm> VERB_FORMS = indexVerbs();
    private static final Map<String, InflectedForm> ADJECTIVE_FORMS = indexAdjectives();
    private static final Set<String> KNOWN_WORDS = collectKnownWords();

    @Override
    public Optional<InflectedForm> lookupVerbForm(String form) {
        return Optional.ofNullable(VERB_FORMS.get(form));
    }

    @Override
    public Optional<InflectedForm> lookupAdjectiveForm(String form) {
        return Optional.ofNullable(ADJECTIVE_FORMS.get(form));
    }

    @Override
    public boolean isKnownWord(String word) {
        return KNOWN_WORDS.contains(word);
    }

    private static VerbParadigm verb(String forms) {
        String[] f = forms.split(" ");
        return new VerbParadigm(f[0], f[1], f[2], f[3], f[4]);
    }

    private static AdjectiveParadigm adjective(String base, String comparative, String superlative,
                                               String nominalization, String verb) {
        return new AdjectiveParadigm(base, comparative, superlative, nominalization, verb);
    }

    private static Map<String, InflectedForm> indexVerbs() {
        Map<String, InflectedForm> index = new HashMap<>();
        for (VerbParadigm v : VERBS) {
            index.putIfAbsent(v.lemma(), new InflectedForm(v.lemma(), InflectionType.BASE, WordClass.VERB));
            index.putIfAbsent(v.thirdPerson(), new InflectedForm(v.lemma(), InflectionType.THIRD_PERSON_S, WordClass.VERB));
            index.putIfAbsent(v.past(), new InflectedForm(v.lemma(), InflectionType.PAST_TENSE, WordClass.VERB));
            index.putIfAbsent(v.pastParticiple(), new InflectedForm(v.lemma(), InflectionType.PAST_PARTICIPLE, WordClass.VERB));
            index.putIfAbsent(v.presentParticiple(), new InflectedForm(v.lemma(), InflectionType.PRESENT_PARTICIPLE, WordClass.VERB));
        }
        return Map.copyOf(index);
    }

    private static Map<String, InflectedForm> indexAdjectives() {
        Map<String, InflectedForm> index = new HashMap<>();
        for (AdjectiveParadigm a : ADJECTIVES) {
            index.putIfAbsent(a.base(), new InflectedForm(a.base(), InflectionType.BASE, WordClass.ADJECTIVE));
            index.putIfAbsent(a.comparative(), new InflectedForm(a.base(), InflectionType.COMPARATIVE, WordClass.ADJECTIVE));
            index.putIfAbsent(a.superlative(), new InflectedForm(a.base(), InflectionType.SUPERLATIVE, WordClass.ADJECTIVE));
            if (a.nominalization() != null) {
                index.putIfAbsent(a.nominalization(), new InflectedForm(a.base(), InflectionType.NOMINALIZATION, WordClass.NOUN));
            }
        }
        return Map.copyOf(index);
    }

    private static Set<String> collectKnownWords() {
        Set<String> words = new HashSet<>();
        VERBS.forEach(v -> words.add(v.lemma()));
        for (AdjectiveParadigm a : ADJECTIVES) {
            words.add(a.base());
            if (a.verb() != null) {
                words.add(a.verb());
            }
        }
        words.addAll(StaticWordClassLexicon.VERBS);
        words.addAll(StaticWordClassLexicon.ADJECTIVES);
        return Set.copyOf(words);
    }
}
