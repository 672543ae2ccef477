package org.swarmsim.runtime.model;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class AgentTest {

    @Test
    @DisplayName("advance moves along the new heading by speed * timestep")
    void advance_integratesPosition() {
        Agent agent = new Agent(7, new Vector3D(1, 2, 3), Vector3D.PLUS_K, 2.0, 360, 40);

        agent.advance(Vector3D.PLUS_I, 0.5);

        assertThat(agent.getHeading()).isEqualTo(Vector3D.PLUS_I);
        assertThat(agent.getPosition().getX()).isCloseTo(2.0, within(1e-12));
        assertThat(agent.getPosition().getY()).isCloseTo(2.0, within(1e-12));
        assertThat(agent.getPosition().getZ()).isCloseTo(3.0, within(1e-12));
        assertThat(agent.getId()).isEqualTo(7);
        assertThat(agent.getSpeed()).isEqualTo(2.0);
        assertThat(agent.getVision()).isEqualTo(360.0);
    }

    @Test
    void toState_copiesPositionAndHeading() {
        Agent agent = new Agent(1, new Vector3D(1, 2, 3), Vector3D.PLUS_J, 1.0, 360, 40);

        AgentState state = agent.toState();
        agent.advance(Vector3D.PLUS_I, 1.0);

        assertThat(state.id()).isEqualTo(1);
        assertThat(state.position()).containsExactly(1.0, 2.0, 3.0);
        assertThat(state.heading()).containsExactly(0.0, 1.0, 0.0);
    }

    @Test
    void constructor_rejectsNonUnitHeading() {
        assertThatThrownBy(() -> new Agent(0, Vector3D.ZERO, new Vector3D(1, 1, 0), 1.0, 360, 40))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unit vector");
    }

    @Test
    void constructor_rejectsNonPositiveSpeed() {
        assertThatThrownBy(() -> new Agent(0, Vector3D.ZERO, Vector3D.PLUS_I, 0.0, 360, 40))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("speed");
        assertThatThrownBy(() -> new Agent(0, Vector3D.ZERO, Vector3D.PLUS_I, -1.0, 360, 40))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsNonFinitePosition() {
        assertThatThrownBy(() -> new Agent(0, new Vector3D(Double.NaN, 0, 0), Vector3D.PLUS_I, 1.0, 360, 40))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsNegativeTurningAngle() {
        assertThatThrownBy(() -> new Agent(0, Vector3D.ZERO, Vector3D.PLUS_I, 1.0, 360, -5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
