package com.cadenceai.domain.parse.lexicon;

import java.util.List;
import java.util.Optional;

public interface LocalityLexicon {

    Optional<LocalityEntry> lookup(String phrase);

    List<LocalityEntry> entries();
}
