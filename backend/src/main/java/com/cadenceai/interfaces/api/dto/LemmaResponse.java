package com.cadenceai.interfaces.api.dto;

import com.cadenceai.domain.parse.model.token.LemmaResult;

import java.util.List;

public record LemmaResponse(List<LemmaResult> lemmas) {}
