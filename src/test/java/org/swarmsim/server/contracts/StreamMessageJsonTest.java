package org.swarmsim.server.contracts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.swarmsim.runtime.model.AgentState;
import org.swarmsim.runtime.model.SwarmMode;
import org.swarmsim.server.config.SimulationSettings;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the field names clients rely on.
 */
@Tag("unit")
class StreamMessageJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void tickMessage_usesSnakeCaseAndTypeDiscriminator() {
        TickMessage message = new TickMessage("abc", 3, List.of(new AgentState(0, new double[] {1, 2, 3}, new double[] {0, 0, 1})));

        JsonNode json = mapper.valueToTree(message);

        assertThat(json.get("type").asText()).isEqualTo("tick");
        assertThat(json.get("simulation_id").asText()).isEqualTo("abc");
        assertThat(json.get("tick").asLong()).isEqualTo(3);
        JsonNode agent = json.get("agents").get(0);
        assertThat(agent.get("id").asInt()).isZero();
        assertThat(agent.get("position").size()).isEqualTo(3);
        assertThat(agent.get("heading").get(2).asDouble()).isEqualTo(1.0);
    }

    @Test
    void snapshot_embedsParams() {
        SimulationParams params = SimulationParams.from(SimulationSettings.of(5, SwarmMode.TORUS));

        JsonNode json = mapper.valueToTree(new SimulationSnapshot("abc", 0, params, List.of()));

        assertThat(json.get("type").asText()).isEqualTo("snapshot");
        assertThat(json.get("params").get("num_agents").asInt()).isEqualTo(5);
        assertThat(json.get("params").get("mode").asText()).isEqualTo("torus");
        assertThat(json.get("params").get("update_interval").asDouble()).isEqualTo(0.1);
        assertThat(json.get("params").get("strict_turn_rate").asBoolean()).isFalse();
    }

    @Test
    void shutdown_carriesReason() {
        JsonNode json = mapper.valueToTree(new ShutdownMessage(ShutdownMessage.REASON_ERROR));

        assertThat(json.get("type").asText()).isEqualTo("shutdown");
        assertThat(json.get("reason").asText()).isEqualTo("error");
    }
}
