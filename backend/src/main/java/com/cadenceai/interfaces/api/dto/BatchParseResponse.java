package com.cadenceai.interfaces.api.dto;

import com.cadenceai.domain.parse.model.UtteranceAnalysis;

import java.util.List;

public record BatchParseResponse(List<UtteranceAnalysis> results) {}
