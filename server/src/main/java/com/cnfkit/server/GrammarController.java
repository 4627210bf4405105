package com.cnfkit.server;

import com.cnfkit.analyzer.AnalyzerException;
import com.cnfkit.analyzer.core.GrammarSession;
import com.cnfkit.analyzer.core.ValidationException;
import com.cnfkit.analyzer.gen.GenerationException;
import com.cnfkit.analyzer.grammar.GrammarRow;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.server.mvc.WebMvcLinkBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api")
class GrammarController {

    private static final Logger log = LoggerFactory.getLogger(GrammarController.class);

    private final GrammarSession session;
    private final AnalyzerProperties properties;

    GrammarController(GrammarSession session, AnalyzerProperties properties) {
        this.session = session;
        this.properties = properties;
    }

    @PostMapping("/grammar")
    GrammarResponse setGrammar(@RequestBody GrammarRequest request) {
        try {
            GrammarSession.GrammarSummary summary =
                    session.setGrammar(
                            request.start(),
                            request.productions() == null ? List.of() : request.productions());
            return new GrammarResponse(
                    summary.cnf().originalStart(),
                    summary.cnf().start(),
                    summary.cleaned().toString(),
                    summary.cnf().text(),
                    summary.removedNonGenerating(),
                    summary.removedUnreachable(),
                    summary.cnf().terminalWrappers());
        } catch (AnalyzerException e) {
            throw toStatus(e);
        }
    }

    @PostMapping("/generate")
    GenerateResponse generate(@RequestBody(required = false) GenerateRequest request) {
        try {
            Set<String> generated =
                    request == null
                            ? session.generate()
                            : session.generate(
                                    orDefault(request.count(), properties.count()),
                                    orDefault(request.attempts(), properties.attempts()),
                                    orDefault(request.maxDepth(), properties.maxDepth()));
            return new GenerateResponse(new ArrayList<>(generated));
        } catch (AnalyzerException e) {
            throw toStatus(e);
        }
    }

    @PostMapping("/validate")
    EntityModel<ValidateResponse> validate(@RequestBody ValidateRequest request) {
        List<String> tokens = GrammarSession.tokenize(request.string());
        try {
            GrammarSession.ValidationResult result = session.validate(tokens);
            ValidateResponse response =
                    new ValidateResponse(
                            result.accepted(), result.derivation().map(TreeView::of).orElse(null));
            return EntityModel.of(
                    response,
                    WebMvcLinkBuilder.linkTo(WebMvcLinkBuilder.methodOn(GrammarController.class).lastTree())
                            .withRel("lastTree"));
        } catch (AnalyzerException e) {
            throw toStatus(e);
        }
    }

    @GetMapping("/tree/last")
    ResponseEntity<TreeView> lastTree() {
        return session.lastTree()
                .map(tree -> ResponseEntity.ok(TreeView.of(tree)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/ping")
    Map<String, String> ping() {
        return Map.of("status", "OK", "message", "Server running");
    }

    private static ResponseStatusException toStatus(AnalyzerException e) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if (e instanceof GenerationException generation) {
            status =
                    generation.reason() == GenerationException.Reason.NO_GRAMMAR
                            ? HttpStatus.CONFLICT
                            : HttpStatus.UNPROCESSABLE_ENTITY;
        } else if (e instanceof ValidationException validation) {
            status =
                    switch (validation.reason()) {
                        case NO_GRAMMAR -> HttpStatus.CONFLICT;
                        case TOO_MANY_TOKENS -> HttpStatus.UNPROCESSABLE_ENTITY;
                        case RECONSTRUCTION -> HttpStatus.INTERNAL_SERVER_ERROR;
                    };
        }
        log.info("Request rejected with {}: {}", e.reasonCode(), e.getMessage());
        return new ResponseStatusException(status, e.getMessage(), e);
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    record GrammarRequest(String start, List<GrammarRow> productions) {}

    record GrammarResponse(
            String start,
            String cnfStart,
            String cleaned,
            String cnf,
            List<String> removedNonGenerating,
            List<String> removedUnreachable,
            Map<String, String> terminalWrappers) {}

    record GenerateRequest(Integer count, Integer attempts, Integer maxDepth) {}

    record GenerateResponse(List<String> generated) {}

    record ValidateRequest(String string) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ValidateResponse(boolean accepted, TreeView tree) {}
}
