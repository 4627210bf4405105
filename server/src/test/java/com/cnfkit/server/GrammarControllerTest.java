package com.cnfkit.server;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
final class GrammarControllerTest {

    private static final String BALANCED =
            "{\"start\":\"S\",\"productions\":[{\"lhs\":\"S\",\"rhs\":\"a S b | ε\"}]}";

    @Autowired
    private MockMvc mvc;

    private ResultActions postJson(String path, String body) throws Exception {
        return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    void setsGrammarAndReturnsCnf() throws Exception {
        postJson("/api/grammar", BALANCED)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.start").value("S"))
                .andExpect(jsonPath("$.cnfStart").value("S'"))
                .andExpect(jsonPath("$.removedNonGenerating").isEmpty());
    }

    @Test
    void validatesAndExposesLastTree() throws Exception {
        postJson("/api/grammar", BALANCED).andExpect(status().isOk());

        postJson("/api/validate", "{\"string\":\"a a b b\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.tree.name").value("S'"));
        mvc.perform(get("/api/tree/last")).andExpect(status().isOk());

        postJson("/api/validate", "{\"string\":\"a b b\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.tree").doesNotExist());
        mvc.perform(get("/api/tree/last")).andExpect(status().isNotFound());
    }

    @Test
    void undeclaredVariableIsABadRequest() throws Exception {
        postJson("/api/grammar", "{\"start\":\"S\",\"productions\":[{\"lhs\":\"S\",\"rhs\":\"A b\"}]}")
                .andExpect(status().isBadRequest());
    }

    @Test
    void tooManyTokensIsUnprocessable() throws Exception {
        postJson("/api/grammar", BALANCED).andExpect(status().isOk());
        String input = "a ".repeat(31).strip();

        postJson("/api/validate", "{\"string\":\"" + input + "\"}")
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void generatesSentences() throws Exception {
        postJson("/api/grammar", BALANCED).andExpect(status().isOk());

        postJson("/api/generate", "{\"count\":3}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generated").isArray());
    }

    @Test
    void ping() throws Exception {
        mvc.perform(get("/api/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"));
    }
}
