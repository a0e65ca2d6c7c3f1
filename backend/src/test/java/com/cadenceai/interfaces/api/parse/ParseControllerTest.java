package com.cadenceai.interfaces.api.parse;

import com.cadenceai.application.parse.UtteranceParseAppService;
import com.cadenceai.application.parse.exception.InputTooLongException;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.coordination.CoordinationAnalysis;
import com.cadenceai.domain.parse.model.locality.LocalityInteraction;
import com.cadenceai.infrastructure.parse.AnalysisFailedException;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ParseController.class)
class ParseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UtteranceParseAppService parseAppService;

    private static UtteranceAnalysis analysisOf(String text) {
        return new UtteranceAnalysis(ParserFixtures.tokenizer().tokenize(text), List.of(), List.of(), List.of(),
                CoordinationAnalysis.EMPTY, List.of(), List.of(), List.of(), List.of(), LocalityInteraction.NONE);
    }

    @Nested
    @DisplayName("POST /api/v1/parse")
    class Parse {

        @Test
        @DisplayName("returns the analysis")
        void parse_ok() throws Exception {
            when(parseAppService.parse(eq("mute it"), isNull())).thenReturn(analysisOf("mute it"));

            mockMvc.perform(post("/api/v1/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"mute it\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.tokens.source").value("mute it"))
                    .andExpect(jsonPath("$.tokens.tokens.length()").value(2));
        }

        @Test
        @DisplayName("known entities are passed through")
        @SuppressWarnings("unchecked")
        void parse_with_entities() throws Exception {
            when(parseAppService.parse(anyString(), anyList())).thenReturn(analysisOf("solo 'Glass Pad'"));

            mockMvc.perform(post("/api/v1/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"text": "solo 'Glass Pad'",
                                     "knownEntities": [{"name": "Glass Pad", "entityType": "track", "tags": ["pad"]}]}
                                    """))
                    .andExpect(status().isOk());

            ArgumentCaptor<List<KnownEntity>> entities = ArgumentCaptor.forClass(List.class);
            verify(parseAppService).parse(eq("solo 'Glass Pad'"), entities.capture());
            assertThat(entities.getValue()).containsExactly(
                    new KnownEntity("Glass Pad", "track", Set.of("pad")));
        }

        @Test
        @DisplayName("blank text is a validation error")
        void blank_text() throws Exception {
            mockMvc.perform(post("/api/v1/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.message").value("Text is required"));
            verifyNoInteractions(parseAppService);
        }

        @Test
        @DisplayName("overlong input maps to 413")
        void input_too_long() throws Exception {
            when(parseAppService.parse(anyString(), any())).thenThrow(new InputTooLongException(2001, 2000));

            mockMvc.perform(post("/api/v1/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"mute it\"}"))
                    .andExpect(status().isPayloadTooLarge())
                    .andExpect(jsonPath("$.code").value("INPUT_TOO_LONG"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/parse/batch")
    class Batch {

        @Test
        @DisplayName("returns one result per text")
        void batch_ok() throws Exception {
            when(parseAppService.parseBatch(List.of("mute it", "add reverb")))
                    .thenReturn(List.of(analysisOf("mute it"), analysisOf("add reverb")));

            mockMvc.perform(post("/api/v1/parse/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"texts\":[\"mute it\",\"add reverb\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results.length()").value(2))
                    .andExpect(jsonPath("$.results[1].tokens.source").value("add reverb"));
        }

        @Test
        @DisplayName("more than 100 texts is rejected by validation")
        void batch_too_large() throws Exception {
            String texts = String.join(",", Collections.nCopies(101, "\"mute it\""));

            mockMvc.perform(post("/api/v1/parse/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"texts\":[" + texts + "]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("A batch must not exceed 100 texts"));
        }

        @Test
        @DisplayName("a worker failure maps to 500")
        void worker_failure() throws Exception {
            when(parseAppService.parseBatch(anyList()))
                    .thenThrow(new AnalysisFailedException("Batch analysis failed: boom"));

            mockMvc.perform(post("/api/v1/parse/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"texts\":[\"mute it\"]}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.code").value("ANALYSIS_FAILED"));
        }
    }

    @Test
    @DisplayName("POST /api/v1/parse/tokens returns the token stream")
    void tokens() throws Exception {
        when(parseAppService.tokenize("add  reverb")).thenReturn(ParserFixtures.tokenizer().tokenize("add  reverb"));

        mockMvc.perform(post("/api/v1/parse/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"add  reverb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens[1].originalText").value("reverb"))
                .andExpect(jsonPath("$.tokens[1].span.start").value(5));
    }

    @Test
    @DisplayName("POST /api/v1/parse/lemmas returns lemmas in order")
    void lemmas() throws Exception {
        when(parseAppService.lemmatize(List.of("muted", "brighter")))
                .thenReturn(ParserFixtures.normalizer().lemmatizeAll(List.of("muted", "brighter")));

        mockMvc.perform(post("/api/v1/parse/lemmas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"words\":[\"muted\",\"brighter\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lemmas[0].lemma").value("mute"))
                .andExpect(jsonPath("$.lemmas[1].lemma").value("bright"));
    }
}
