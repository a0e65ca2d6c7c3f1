package com.cadenceai.interfaces.api.parse;

import com.cadenceai.application.parse.UtteranceParseAppService;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.interfaces.api.dto.BatchParseRequest;
import com.cadenceai.interfaces.api.dto.BatchParseResponse;
import com.cadenceai.interfaces.api.dto.LemmaRequest;
import com.cadenceai.interfaces.api.dto.LemmaResponse;
import com.cadenceai.interfaces.api.dto.ParseRequest;
import com.cadenceai.interfaces.api.dto.TokenizeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/parse")
@RequiredArgsConstructor
public class ParseController {

    private final UtteranceParseAppService parseAppService;

    @PostMapping
    public ResponseEntity<UtteranceAnalysis> parse(@Valid @RequestBody ParseRequest request) {
        List<KnownEntity> entities = request.knownEntities() == null ? null : request.knownEntities().stream()
                .map(entity -> new KnownEntity(entity.name(), entity.entityType(), entity.tags()))
                .toList();

        return ResponseEntity.ok(parseAppService.parse(request.text(), entities));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchParseResponse> parseBatch(@Valid @RequestBody BatchParseRequest request) {
        return ResponseEntity.ok(new BatchParseResponse(parseAppService.parseBatch(request.texts())));
    }

    @PostMapping("/tokens")
    public ResponseEntity<TokenStream> tokenize(@Valid @RequestBody TokenizeRequest request) {
        return ResponseEntity.ok(parseAppService.tokenize(request.text()));
    }

    @PostMapping("/lemmas")
    public ResponseEntity<LemmaResponse> lemmatize(@Valid @RequestBody LemmaRequest request) {
        return ResponseEntity.ok(new LemmaResponse(parseAppService.lemmatize(request.words())));
    }
}
