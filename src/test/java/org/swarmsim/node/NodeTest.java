package org.swarmsim.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.swarmsim.junit.extensions.logging.ExpectLog;
import org.swarmsim.junit.extensions.logging.LogLevel;
import org.swarmsim.junit.extensions.logging.LogWatchExtension;
import org.swarmsim.node.processes.AbstractProcess;
import org.swarmsim.node.spi.IServiceProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Node: process instantiation, dependency wiring and lifecycle ordering.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NodeTest {

    static final List<String> EVENTS = new ArrayList<>();

    private Node node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.stop();
            node = null;
        }
        EVENTS.clear();
    }

    @Test
    @DisplayName("Providers are instantiated before the processes that require them")
    void constructor_instantiatesInDependencyOrder() {
        Config config = ConfigFactory.parseString("""
            node.processes {
              consumer {
                className = "org.swarmsim.node.NodeTest$ConsumerProcess"
                require { greeting = "provider" }
              }
              provider {
                className = "org.swarmsim.node.NodeTest$ProviderProcess"
                options { text = "hello" }
              }
            }
            """);

        node = new Node(config);

        assertThat(node.getProcessNames()).containsExactly("provider", "consumer");
        ConsumerProcess consumer = (ConsumerProcess) node.getProcess("consumer").orElseThrow();
        assertThat(consumer.greeting).isEqualTo("hello");
    }

    @Test
    void startAndStop_runInOppositeOrder() {
        Config config = ConfigFactory.parseString("""
            node.processes {
              consumer {
                className = "org.swarmsim.node.NodeTest$ConsumerProcess"
                require { greeting = "provider" }
              }
              provider {
                className = "org.swarmsim.node.NodeTest$ProviderProcess"
                options { text = "hi" }
              }
            }
            """);
        node = new Node(config);

        node.start();
        node.stop();
        node = null;

        assertThat(EVENTS).containsExactly("start provider", "start consumer", "stop consumer", "stop provider");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Configuration path 'node.processes' not found. No processes will be loaded.")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No processes configured to start. The node will be idle.")
    void missingProcessConfiguration_leavesNodeIdle() {
        node = new Node(ConfigFactory.parseString("node {}"));

        node.start();

        assertThat(node.getProcessNames()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to initialize process 'invalid-process'. Skipping this process.")
    void unknownClass_isSkipped() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              valid-process { className = "org.swarmsim.node.NodeTest$ProviderProcess" }
              invalid-process { className = "org.nonexistent.InvalidProcess" }
            }
            """));

        assertThat(node.getProcessNames()).containsExactly("valid-process");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to initialize process 'not-a-process'. Skipping this process.")
    void classNotImplementingIProcess_isSkipped() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              not-a-process { className = "java.lang.String" }
            }
            """));

        assertThat(node.getProcessNames()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to start process 'failing-start'. The node may be unstable.")
    void failingStart_doesNotStopOtherProcesses() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              failing-start { className = "org.swarmsim.node.NodeTest$FailingStartProcess" }
              provider { className = "org.swarmsim.node.NodeTest$ProviderProcess" }
            }
            """));

        node.start();

        assertThat(EVENTS).contains("start provider");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to initialize the node.")
    void circularDependency_failsNodeConstruction() {
        Config config = ConfigFactory.parseString("""
            node.processes {
              a { className = "org.swarmsim.node.NodeTest$ConsumerProcess", require { greeting = "b" } }
              b { className = "org.swarmsim.node.NodeTest$ConsumerProcess", require { greeting = "a" } }
            }
            """);

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("Circular dependency detected among processes: [a, b]. Check the 'require' configuration.");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to initialize the node.")
    void undefinedDependency_failsNodeConstruction() {
        Config config = ConfigFactory.parseString("""
            node.processes {
              consumer { className = "org.swarmsim.node.NodeTest$ConsumerProcess", require { greeting = "ghost" } }
            }
            """);

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("Process 'consumer' depends on 'ghost' which is not defined in the configuration.");
    }

    public static class ProviderProcess extends AbstractProcess implements IServiceProvider {
        public ProviderProcess(String processName, Map<String, Object> dependencies, Config options) {
            super(processName, dependencies, options);
        }

        @Override
        public Object getExposedService() {
            return options.hasPath("text") ? options.getString("text") : "default";
        }

        @Override
        public void start() {
            EVENTS.add("start provider");
        }

        @Override
        public void stop() {
            EVENTS.add("stop provider");
        }
    }

    public static class ConsumerProcess extends AbstractProcess {
        final String greeting;

        public ConsumerProcess(String processName, Map<String, Object> dependencies, Config options) {
            super(processName, dependencies, options);
            this.greeting = getDependency("greeting", String.class);
        }

        @Override
        public void start() {
            EVENTS.add("start consumer");
        }

        @Override
        public void stop() {
            EVENTS.add("stop consumer");
        }
    }

    public static class FailingStartProcess extends AbstractProcess {
        public FailingStartProcess(String processName, Map<String, Object> dependencies, Config options) {
            super(processName, dependencies, options);
        }

        @Override
        public void start() {
            throw new IllegalStateException("cannot start");
        }

        @Override
        public void stop() {
            // nothing to release
        }
    }
}
