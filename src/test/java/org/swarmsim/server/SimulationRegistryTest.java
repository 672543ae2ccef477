package org.swarmsim.server;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.swarmsim.junit.extensions.logging.LogWatchExtension;
import org.swarmsim.runtime.model.SwarmMode;
import org.swarmsim.server.config.InvalidConfigurationException;
import org.swarmsim.server.config.SimulationSettings;
import org.swarmsim.server.contracts.IStreamMessage;
import org.swarmsim.server.contracts.ShutdownMessage;
import org.swarmsim.server.contracts.SimulationSummary;
import org.swarmsim.server.engine.InstanceState;
import org.swarmsim.server.engine.SimulationInstance;
import org.swarmsim.server.engine.Subscription;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SimulationRegistryTest {

    private SimulationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimulationRegistry(ConfigFactory.parseString("""
            max-agents = 50
            subscriber-buffer-size = 64
            loop-shutdown-timeout-ms = 2000
            """));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void create_registersIdleSimulationUnderUniqueId() {
        SimulationInstance first = registry.create(SimulationSettings.of(10, SwarmMode.SWARM));
        SimulationInstance second = registry.create(SimulationSettings.of(3, SwarmMode.HPP));

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(registry.get(first.getId())).containsSame(first);
        assertThat(registry.require(second.getId())).isSameAs(second);
        assertThat(first.getState()).isEqualTo(InstanceState.IDLE);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void create_withSeed_isReproducible() {
        SimulationSettings settings = new SimulationSettings(8, SwarmMode.TORUS, 0.1, 0.1, 42L, false);

        SimulationInstance a = registry.create(settings);
        SimulationInstance b = registry.create(settings);

        assertThat(b.snapshot().agents().get(5).position()).containsExactly(a.snapshot().agents().get(5).position());
    }

    @Test
    void create_rejectsMoreAgentsThanConfiguredLimit() {
        assertThatThrownBy(() -> registry.create(SimulationSettings.of(51, SwarmMode.SWARM)))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("50");
        assertThat(registry.size()).isZero();
    }

    @Test
    void unknownId_isNotFound() {
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("missing"))
            .isInstanceOf(SimulationNotFoundException.class)
            .hasMessageContaining("missing");
        assertThat(registry.delete("missing")).isFalse();
    }

    @Test
    void list_summarizesSimulationsInCreationOrder() {
        SimulationInstance first = registry.create(SimulationSettings.of(4, SwarmMode.DPP));
        SimulationInstance second = registry.create(SimulationSettings.of(6, SwarmMode.SWARM));

        List<SimulationSummary> summaries = registry.list();

        assertThat(summaries).extracting(SimulationSummary::simulationId).containsExactly(first.getId(), second.getId());
        assertThat(summaries.get(0).mode()).isEqualTo("dpp");
        assertThat(summaries.get(0).numAgents()).isEqualTo(4);
        assertThat(summaries.get(0).state()).isEqualTo("IDLE");
        assertThat(summaries.get(0).tick()).isZero();
    }

    @Test
    void delete_closesInstanceAndNotifiesSubscribers() throws InterruptedException {
        SimulationInstance instance = registry.create(SimulationSettings.of(5, SwarmMode.SWARM));
        Subscription subscription = instance.register();

        assertThat(registry.delete(instance.getId())).isTrue();

        assertThat(registry.get(instance.getId())).isEmpty();
        assertThat(instance.getState()).isEqualTo(InstanceState.CLOSED);
        IStreamMessage message;
        do {
            message = subscription.poll(2, TimeUnit.SECONDS);
        } while (message != null && !(message instanceof ShutdownMessage));
        assertThat(message).isEqualTo(new ShutdownMessage(ShutdownMessage.REASON_DELETED));
        assertThat(registry.delete(instance.getId())).isFalse();
    }

    @Test
    void close_deletesEverySimulation() {
        SimulationInstance instance = registry.create(SimulationSettings.of(5, SwarmMode.SWARM));
        instance.register();

        registry.close();

        assertThat(registry.size()).isZero();
        assertThat(instance.getState()).isEqualTo(InstanceState.CLOSED);
    }

    @Test
    void nonPositiveOptions_areRejected() {
        assertThatThrownBy(() -> new SimulationRegistry(ConfigFactory.parseString("subscriber-buffer-size = 0")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
