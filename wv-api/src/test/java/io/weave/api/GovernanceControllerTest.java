package io.weave.api;

import com.jayway.jsonpath.JsonPath;
import io.weave.core.EventId;
import io.weave.governance.GovernanceListener;
import io.weave.governance.Weave;
import io.weave.governance.YieldTurn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GovernanceControllerTest {

    private Weave weave;
    private GovernanceListener listener;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        weave = new Weave();
        listener = mock(GovernanceListener.class);
        weave.yieldHandler().addListener(listener);
        mvc = MockMvcBuilders.standaloneSetup(new GovernanceController(weave, new WeaveProperties()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        weave.close();
    }

    private String submit(String body) throws Exception {
        var json = mvc.perform(post("/api/yields").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(json, "$.id");
        verify(listener, atLeastOnce()).onRequested(any());
        return id;
    }

    private String awaitStatus(String id) throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            var res = mvc.perform(get("/api/yields/" + id)).andReturn().getResponse();
            assertThat(res.getStatus()).isEqualTo(200);
            String status = JsonPath.read(res.getContentAsString(), "$.status");
            if (!"PENDING".equals(status)) return status;
            Thread.sleep(20);
        }
        throw new AssertionError("yield " + id + " never resolved");
    }

    @Test
    void submit_recordsYieldAndListsItPending() throws Exception {
        var id = submit("{\"content\":{\"cmd\":\"deploy\"},\"source\":\"agent\",\"reason\":\"prod\","
                + "\"requiredApprovers\":[\"alice\",\"bob\"]}");

        assertThat(weave.ledger().contains(new EventId(id))).isTrue();
        mvc.perform(get("/api/yields"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(id))
                .andExpect(jsonPath("$[0].originalKind").value("ACTION"))
                .andExpect(jsonPath("$[0].pendingApprovers", hasSize(2)));
    }

    @Test
    void approvals_resolveUnderAllStrategy() throws Exception {
        var id = submit("{\"content\":\"deploy\",\"source\":\"agent\",\"reason\":\"prod\","
                + "\"requiredApprovers\":[\"alice\",\"bob\"],\"strategy\":\"ALL\"}");

        mvc.perform(post("/api/yields/" + id + "/approve").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approver\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true));
        mvc.perform(get("/api/yields/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approvedBy[0]").value("alice"))
                .andExpect(jsonPath("$.pendingApprovers[0]").value("bob"));

        mvc.perform(post("/api/yields/" + id + "/approve").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approver\":\"bob\"}"))
                .andExpect(status().isOk());

        assertThat(awaitStatus(id)).isEqualTo("APPROVED");
        verify(listener, timeout(2_000)).onApproval(any(YieldTurn.class));
    }

    @Test
    void get_rightAfterFinalApproval_neverMisses() throws Exception {
        for (int i = 0; i < 20; i++) {
            var id = submit("{\"content\":\"x\",\"source\":\"agent\",\"requiredApprovers\":[\"alice\"]}");

            mvc.perform(post("/api/yields/" + id + "/approve").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"approver\":\"alice\"}"))
                    .andExpect(status().isOk());
            mvc.perform(get("/api/yields/" + id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(id));

            assertThat(awaitStatus(id)).isEqualTo("APPROVED");
        }
    }

    @Test
    void hugeDeadline_stillResolves() throws Exception {
        var id = submit("{\"content\":\"x\",\"source\":\"agent\",\"requiredApprovers\":[],"
                + "\"timeoutMillis\":9223372036854775807}");

        assertThat(awaitStatus(id)).isEqualTo("APPROVED");
    }

    @Test
    void approve_byUnlistedApprover_isUnprocessable() throws Exception {
        var id = submit("{\"content\":\"x\",\"source\":\"agent\",\"requiredApprovers\":[\"alice\"]}");

        mvc.perform(post("/api/yields/" + id + "/approve").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approver\":\"mallory\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("invalid_approver"));

        assertThat(weave.yieldHandler().isPending(new EventId(id))).isTrue();
    }

    @Test
    void reject_vetoesAndReportsRejector() throws Exception {
        var id = submit("{\"content\":\"x\",\"source\":\"agent\",\"requiredApprovers\":[\"alice\",\"bob\"],"
                + "\"strategy\":\"ANY\"}");

        mvc.perform(post("/api/yields/" + id + "/reject").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rejector\":\"bob\",\"reason\":\"too risky\"}"))
                .andExpect(status().isOk());

        assertThat(awaitStatus(id)).isEqualTo("REJECTED");
        mvc.perform(get("/api/yields/" + id))
                .andExpect(jsonPath("$.rejectedBy").value("bob"))
                .andExpect(jsonPath("$.detail").value("too risky"));
        verify(listener, timeout(2_000)).onRejection(any(), eq("bob"), eq("too risky"));
    }

    @Test
    void shortDeadline_timesOut() throws Exception {
        var id = submit("{\"content\":\"x\",\"source\":\"agent\",\"requiredApprovers\":[\"alice\"],"
                + "\"timeoutMillis\":50}");

        assertThat(awaitStatus(id)).isEqualTo("TIMEOUT");
    }

    @Test
    void decisionsOnUnknownYield_areNotFound() throws Exception {
        mvc.perform(get("/api/yields/missing")).andExpect(status().isNotFound());
        mvc.perform(post("/api/yields/missing/approve").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approver\":\"alice\"}"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/yields/missing/reject").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rejector\":\"alice\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void submit_withoutSource_isBadRequest() throws Exception {
        mvc.perform(post("/api/yields").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"x\"}"))
                .andExpect(status().isBadRequest());
    }
}
