package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.NamingLexicon;
import com.cadenceai.domain.parse.lexicon.NamingVerbEntry;
import com.cadenceai.domain.parse.model.reference.NamedReferenceType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.cadenceai.domain.parse.model.reference.NamingOperation.ASSIGN_NAME;
import static com.cadenceai.domain.parse.model.reference.NamingOperation.REFERENCE_BY_NAME;
import static com.cadenceai.domain.parse.model.reference.NamingOperation.REMOVE_NAME;
import static com.cadenceai.domain.parse.model.reference.NamingOperation.RENAME;
import static com.cadenceai.domain.parse.model.reference.NamingOperation.SEARCH_BY_NAME;

/**
 * Naming verbs ("called", "rename", "save as") and the entity keywords that hint at what a
 * name refers to.
 */
@Component
public class StaticNamingLexicon implements NamingLexicon {

    private static final List<NamingVerbEntry> VERBS = List.of(
            new NamingVerbEntry(List.of("called", "known as"), REFERENCE_BY_NAME, NamedReferenceType.CALLED_PATTERN, null, 15),
            new NamingVerbEntry(List.of("named"), REFERENCE_BY_NAME, NamedReferenceType.NAMED_PATTERN, null, 15),
            new NamingVerbEntry(List.of("labelled", "labeled"), REFERENCE_BY_NAME, NamedReferenceType.LABELLED_PATTERN, null, 15),
            new NamingVerbEntry(List.of("titled"), REFERENCE_BY_NAME, NamedReferenceType.TITLED_PATTERN, null, 15),
            new NamingVerbEntry(List.of("with the name", "by the name of", "with name"), REFERENCE_BY_NAME, NamedReferenceType.NAMED_PATTERN, null, 12),
            new NamingVerbEntry(List.of("call", "name", "label", "title", "tag"), ASSIGN_NAME, null, null, 14),
            new NamingVerbEntry(List.of("call it", "name it", "label it", "tag it"), ASSIGN_NAME, null, null, 16),
            new NamingVerbEntry(List.of("mark as", "mark it as"), ASSIGN_NAME, null, "as", 12),
            new NamingVerbEntry(List.of("save as", "save it as"), ASSIGN_NAME, null, "as", 14),
            new NamingVerbEntry(List.of("rename", "relabel", "retitle"), RENAME, null, "to", 15),
            new NamingVerbEntry(List.of("change the name of", "change its name to"), RENAME, null, "to", 13),
            new NamingVerbEntry(List.of("unlabel", "untag", "remove the name from", "clear the name of"), REMOVE_NAME, null, null, 10),
            new NamingVerbEntry(List.of("find", "search for", "look for", "locate"), SEARCH_BY_NAME, null, null, 12),
            new NamingVerbEntry(List.of("go to", "jump to", "navigate to"), SEARCH_BY_NAME, null, null, 12)
    );

    private static final Map<String, List<String>> ENTITY_KEYWORDS = Map.ofEntries(
            Map.entry("track", List.of("track", "tracks")),
            Map.entry("layer", List.of("layer", "layers")),
            Map.entry("section", List.of("section", "sections", "part", "parts")),
            Map.entry("card", List.of("card", "cards")),
            Map.entry("preset", List.of("preset", "presets", "patch", "patches")),
            Map.entry("effect", List.of("effect", "effects", "fx")),
            Map.entry("instrument", List.of("instrument", "instruments")),
            Map.entry("board", List.of("board", "boards")),
            Map.entry("deck", List.of("deck", "decks")),
            Map.entry("bus", List.of("bus", "buses", "buss", "busses")),
            Map.entry("channel", List.of("channel", "channels")),
            Map.entry("group", List.of("group", "groups")),
            Map.entry("pattern", List.of("pattern", "patterns")),
            Map.entry("clip", List.of("clip", "clips", "region", "regions")),
            Map.entry("marker", List.of("marker", "markers")),
            Map.entry("bookmark", List.of("bookmark", "bookmarks")),
            Map.entry("version", List.of("version", "versions", "snapshot", "snapshots")),
            Map.entry("template", List.of("template", "templates"))
    );

    private static final Map<String, NamingVerbEntry> VERBS_BY_FORM = indexVerbs();
    private static final Map<String, String> ENTITY_TYPE_BY_KEYWORD = indexKeywords();
    private static final int MAX_VERB_WORDS = VERBS_BY_FORM.keySet().stream()
            .mapToInt(form -> form.split(" ").length)
            .max()
            .orElse(1);

    @Override
    public Optional<NamingVerbEntry> lookupVerb(String phrase) {
        return Optional.ofNullable(VERBS_BY_FORM.get(phrase));
    }

    @Override
    public int maxVerbWords() {
        return MAX_VERB_WORDS;
    }

    @Override
    public Optional<String> entityType(String keyword) {
        return Optional.ofNullable(ENTITY_TYPE_BY_KEYWORD.get(keyword));
    }

    private static Map<String, NamingVerbEntry> indexVerbs() {
        Map<String, NamingVerbEntry> index = new HashMap<>();
        for (NamingVerbEntry entry : VERBS) {
            for (String form : entry.forms()) {
                index.merge(form, entry, (existing, candidate) ->
                        candidate.priority() > existing.priority() ? candidate : existing);
            }
        }
        return Map.copyOf(index);
    }

    private static Map<String, String> indexKeywords() {
        Map<String, String> index = new HashMap<>();
        ENTITY_KEYWORDS.forEach((type, forms) -> forms.forEach(form -> index.put(form, type)));
        return Map.copyOf(index);
    }
}
