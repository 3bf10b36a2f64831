package io.weave.api;

import io.weave.governance.TurnKind;
import io.weave.governance.Weave;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ContextControllerTest {

    private Weave weave;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        weave = new Weave();
        mvc = MockMvcBuilders.standaloneSetup(new ContextController(weave))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        weave.close();
    }

    @Test
    void context_containsOnlyTheCausalCone() throws Exception {
        var a = weave.record("a", "alice", List.of());
        weave.record("noise-1", "carol", List.of());
        weave.record("noise-2", "carol", List.of());
        weave.record("b", "bob", List.of(a.id()));

        mvc.perform(get("/api/context/bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("bob"))
                .andExpect(jsonPath("$.coneSize").value(2))
                .andExpect(jsonPath("$.totalEvents").value(4))
                .andExpect(jsonPath("$.compressionRatio", closeTo(0.5, 1e-9)))
                .andExpect(jsonPath("$.events[0].content").value("a"))
                .andExpect(jsonPath("$.events[1].content").value("b"));
    }

    @Test
    void context_ofUnknownSource_isEmpty() throws Exception {
        weave.record("a", "alice", List.of());

        mvc.perform(get("/api/context/nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coneSize").value(0))
                .andExpect(jsonPath("$.compressionRatio", closeTo(1.0, 1e-9)))
                .andExpect(jsonPath("$.events", hasSize(0)));
    }

    @Test
    void context_onEmptyLedger_hasZeroRatio() throws Exception {
        mvc.perform(get("/api/context/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(0))
                .andExpect(jsonPath("$.compressionRatio", closeTo(0.0, 1e-9)));
    }

    @Test
    void metrics_countKindsSourcesAndPendingYields() throws Exception {
        var a = weave.recordTurn(TurnKind.SPEECH, "said it", "alice", List.of());
        weave.recordTurn(TurnKind.ACTION, "did it", "bob", List.of(a.id()));
        var y = weave.submitYield("deploy", "bob", "prod", Set.of("carol"), List.of());
        weave.requestApprovalAsync(y, null, null);

        mvc.perform(get("/api/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(3))
                .andExpect(jsonPath("$.byKind.SPEECH").value(1))
                .andExpect(jsonPath("$.byKind.ACTION").value(1))
                .andExpect(jsonPath("$.byKind.YIELD").value(1))
                .andExpect(jsonPath("$.bySource.bob").value(2))
                .andExpect(jsonPath("$.pendingYields").value(1));
    }
}
