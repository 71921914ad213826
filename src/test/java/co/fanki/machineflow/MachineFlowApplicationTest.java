package co.fanki.machineflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end test of the REST API over the full application context.
 *
 * <p>Registers a machine whose guards route on {@code errorCount}, runs it
 * once cleanly and once after an error was recorded.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@AutoConfigureMockMvc
class MachineFlowApplicationTest {

    private static final String MACHINE = """
            {"name": "routing", "machine": {
              "title": "Routing",
              "nodes": [
                {"name": "A", "type": "init"},
                {"name": "B", "type": "task"},
                {"name": "C", "type": "task"}
              ],
              "edges": [
                {"source": "A", "target": "B", "label": "when: errorCount == 0"},
                {"source": "A", "target": "C", "label": "when: errorCount > 0"}
              ]
            }}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void whenCallingHealth_givenRunningApplication_shouldAnswerUp()
            throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("up"));
    }

    @Test
    void whenRunningMachine_givenNoErrors_shouldCompleteOnHappyBranch()
            throws Exception {
        register();
        final String runId = createRun();

        mockMvc.perform(post("/api/runs/" + runId + "/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quiescent").value(true))
                .andExpect(jsonPath("$.state.paths[0].currentNode").value("B"))
                .andExpect(jsonPath("$.state.paths[0].status")
                        .value("COMPLETED"));
    }

    @Test
    void whenRunningMachine_givenRecordedError_shouldTakeErrorBranch()
            throws Exception {
        register();
        final String runId = createRun();

        mockMvc.perform(post("/api/runs/" + runId + "/errors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"upstream failed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errorCount").value(1));

        mockMvc.perform(post("/api/runs/" + runId + "/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.paths[0].currentNode")
                        .value("C"));
    }

    @Test
    void whenValidatingMachine_givenRegisteredMachine_shouldReportEntry()
            throws Exception {
        register();

        mockMvc.perform(get("/api/machines/routing/validation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.missingEntryPoints").value(false));
    }

    @Test
    void whenCreatingRun_givenUnknownMachine_shouldAnswerNotFound()
            throws Exception {
        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"machine\": \"does-not-exist\"}"))
                .andExpect(status().isNotFound());
    }

    private void register() throws Exception {
        mockMvc.perform(post("/api/machines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MACHINE))
                .andExpect(status().isCreated());
    }

    private String createRun() throws Exception {
        final MvcResult result = mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"machine\": \"routing\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        final JsonNode body = objectMapper.readTree(
                result.getResponse().getContentAsString());
        assertEquals("routing", body.path("machineName").asText());
        return body.path("id").asText();
    }

}
