package incident.commander.orchestration;

import static incident.commander.orchestration.support.OrchestrationFixtures.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.error.exception.GraphDefinitionException;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.state.TimelineEvent;
import incident.commander.orchestration.support.OrchestrationFixtures;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StateGraph Tests")
class StateGraphTest {

  private ExecutorService pool;
  private StateGraph graph;
  private List<String> executed;
  private Incident incident;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(2);
    graph = new StateGraph("test", OrchestrationFixtures.logicExecutor(), pool, CLOCK);
    executed = new CopyOnWriteArrayList<>();
    incident = OrchestrationFixtures.incident("Disk full", IncidentSeverity.MEDIUM);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private GraphNode recording(String name) {
    return state -> {
      executed.add(name);
      return StateUpdate.builder()
          .context(name + "_seen", true)
          .timeline(TimelineEvent.of(name, name, "ran " + name, Map.of(), CLOCK.instant()))
          .build();
    };
  }

  private GraphNode failing(String name) {
    return state -> {
      executed.add(name);
      throw new IllegalStateException(name + " exploded");
    };
  }

  @Nested
  @DisplayName("Traversal")
  class Traversal {

    @Test
    @DisplayName("linear graph runs every node in order and stops at END")
    void linear() {
      // Given
      graph
          .addNode("a", recording("a"))
          .addNode("b", recording("b"))
          .addEdge(StateGraph.START, "a")
          .addEdge("a", "b")
          .addEdge("b", StateGraph.END);

      // When
      GraphState state = graph.run(incident, Map.of("seed", 1));

      // Then
      assertThat(executed).containsExactly("a", "b");
      assertThat(state.completedNodes()).containsExactly("a", "b");
      assertThat(state.phases()).containsExactly("a", "b");
      assertThat(state.context()).containsEntry("seed", 1).containsEntry("b_seen", true);
      assertThat(state.isFailed()).isFalse();
    }

    @Test
    @DisplayName("fan-in node reachable by two paths runs once")
    void fanInRunsOnce() {
      // Given
      graph
          .addNode("a", recording("a"))
          .addNode("b", recording("b"))
          .addNode("c", recording("c"))
          .addNode("join", recording("join"))
          .addEdge(StateGraph.START, "a")
          .addEdge("a", "b")
          .addEdge("a", "c")
          .addEdge("b", "join")
          .addEdge("c", "join")
          .addEdge("join", StateGraph.END);

      // When
      graph.run(incident, Map.of());

      // Then
      assertThat(executed).containsExactly("a", "b", "c", "join");
    }

    @Test
    @DisplayName("later nodes see earlier updates")
    void stateFlowsForward() {
      // Given
      graph
          .addNode("writer", state -> StateUpdate.builder().context("answer", 42).build())
          .addNode(
              "reader",
              state ->
                  StateUpdate.builder().context("doubled", (int) state.context().get("answer") * 2).build())
          .addEdge(StateGraph.START, "writer")
          .addEdge("writer", "reader");

      // When
      GraphState state = graph.run(incident, Map.of());

      // Then
      assertThat(state.context()).containsEntry("doubled", 84);
    }

    @Test
    @DisplayName("runAsync completes with the final state")
    void runAsync() throws Exception {
      // Given
      graph.addNode("a", recording("a")).addEdge(StateGraph.START, "a");

      // When
      GraphState state = graph.runAsync(incident, Map.of()).get(5, TimeUnit.SECONDS);

      // Then
      assertThat(state.completedNodes()).containsExactly("a");
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("required node failure stops the run with FAILED status and an error event")
    void requiredFailureStops() {
      // Given
      graph
          .addNode("a", recording("a"))
          .addNode("boom", failing("boom"))
          .addNode("after", recording("after"))
          .addEdge(StateGraph.START, "a")
          .addEdge("a", "boom")
          .addEdge("boom", "after");

      // When
      GraphState state = graph.run(incident, Map.of());

      // Then
      assertThat(executed).containsExactly("a", "boom");
      assertThat(state.isFailed()).isTrue();
      assertThat(state.failedNode()).isEqualTo("boom");
      assertThat(state.failureReason()).contains("boom exploded");
      assertThat(state.incident().status()).isEqualTo(IncidentStatus.FAILED);

      TimelineEvent last = state.timeline().get(state.timeline().size() - 1);
      assertThat(last.phase()).isEqualTo(TimelineEvent.ERROR_PHASE);
      assertThat(last.metadata())
          .containsEntry("node", "boom")
          .containsEntry("incident_id", incident.id())
          .containsEntry("error_type", "IllegalStateException");
    }

    @Test
    @DisplayName("best-effort node failure is recorded and the walk continues")
    void bestEffortContinues() {
      // Given
      graph
          .addNode("flaky", failing("flaky"), NodeOptions.bestEffort())
          .addNode("after", recording("after"))
          .addEdge(StateGraph.START, "flaky")
          .addEdge("flaky", "after");

      // When
      GraphState state = graph.run(incident, Map.of());

      // Then
      assertThat(executed).containsExactly("flaky", "after");
      assertThat(state.isFailed()).isFalse();
      assertThat(state.values()).containsKey(StateKeys.nodeError("flaky"));
      assertThat((String) state.values().get("flaky_error")).contains("flaky exploded");
      assertThat(state.completedNodes()).containsExactly("after");
    }
  }

  @Nested
  @DisplayName("Definition")
  class Definition {

    @Test
    @DisplayName("duplicate node is rejected")
    void duplicateNode() {
      graph.addNode("a", recording("a"));

      assertThatThrownBy(() -> graph.addNode("a", recording("a")))
          .isInstanceOf(GraphDefinitionException.class);
    }

    @Test
    @DisplayName("reserved names cannot be nodes")
    void reservedNames() {
      assertThatThrownBy(() -> graph.addNode(StateGraph.START, recording("s")))
          .isInstanceOf(GraphDefinitionException.class);
      assertThatThrownBy(() -> graph.addNode(StateGraph.END, recording("e")))
          .isInstanceOf(GraphDefinitionException.class);
    }

    @Test
    @DisplayName("edges must reference known nodes")
    void unknownEdgeTarget() {
      graph.addNode("a", recording("a"));

      assertThatThrownBy(() -> graph.addEdge("a", "missing"))
          .isInstanceOf(GraphDefinitionException.class);
      assertThatThrownBy(() -> graph.addEdge("missing", "a"))
          .isInstanceOf(GraphDefinitionException.class);
      assertThatThrownBy(() -> graph.addEdge(StateGraph.END, "a"))
          .isInstanceOf(GraphDefinitionException.class);
    }

    @Test
    @DisplayName("graph without an entry edge cannot run")
    void noEntry() {
      graph.addNode("a", recording("a"));

      assertThatThrownBy(() -> graph.run(incident, Map.of()))
          .isInstanceOf(GraphDefinitionException.class);
    }
  }
}
