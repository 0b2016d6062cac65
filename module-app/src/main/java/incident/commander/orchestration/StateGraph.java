package incident.commander.orchestration;

import incident.commander.core.domain.model.incident.Incident;
import incident.commander.error.exception.GraphDefinitionException;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.infrastructure.util.ExceptionUtils;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.state.TimelineEvent;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * Directed graph of {@link GraphNode}s executed breadth-first from {@link #START}.
 *
 * <ul>
 *   <li>each node runs at most once per run (visited set)
 *   <li>successors are enqueued in edge-declaration order; {@link #END} is never executed
 *   <li>a required node failing stops the run: the partial state is returned with {@code
 *       failedNode}, {@code failureReason}, an {@code error} timeline event and status FAILED
 *   <li>a best-effort node failing is logged and recorded under {@code <node>_error}
 * </ul>
 *
 * <p>Definition methods are not thread-safe; wire the graph once, then run it from any number of
 * threads.
 */
@Slf4j
public class StateGraph {

  public static final String START = "__start__";
  public static final String END = "__end__";

  private final String name;
  private final LogicExecutor executor;
  private final Executor asyncExecutor;
  private final Clock clock;
  private final Map<String, NodeSpec> nodes = new LinkedHashMap<>();
  private final Map<String, List<String>> edges = new LinkedHashMap<>();

  public StateGraph(String name, LogicExecutor executor, Executor asyncExecutor, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public StateGraph addNode(String nodeName, GraphNode node) {
    return addNode(nodeName, node, NodeOptions.required());
  }

  public StateGraph addNode(String nodeName, GraphNode node, NodeOptions options) {
    if (nodeName == null || nodeName.isBlank()) {
      throw new GraphDefinitionException("node name cannot be blank");
    }
    if (START.equals(nodeName) || END.equals(nodeName)) {
      throw new GraphDefinitionException("reserved node name: " + nodeName);
    }
    if (nodes.containsKey(nodeName)) {
      throw new GraphDefinitionException("duplicate node: " + nodeName);
    }
    nodes.put(nodeName, new NodeSpec(Objects.requireNonNull(node, "node"), options));
    return this;
  }

  public StateGraph addEdge(String from, String to) {
    if (END.equals(from)) {
      throw new GraphDefinitionException("edge cannot leave " + END);
    }
    if (START.equals(to)) {
      throw new GraphDefinitionException("edge cannot enter " + START);
    }
    if (!START.equals(from) && !nodes.containsKey(from)) {
      throw new GraphDefinitionException("unknown edge source: " + from);
    }
    if (!END.equals(to) && !nodes.containsKey(to)) {
      throw new GraphDefinitionException("unknown edge target: " + to);
    }
    edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
    return this;
  }

  /**
   * Runs to completion or to the first required-node failure. Node failures are never thrown.
   *
   * @throws GraphDefinitionException when nothing leaves {@link #START}
   */
  public GraphState run(Incident incident, Map<String, Object> initialContext) {
    if (!edges.containsKey(START)) {
      throw new GraphDefinitionException("graph '" + name + "' has no entry edge from " + START);
    }
    GraphState state = new GraphState(incident, initialContext);
    log.info("[StateGraph] run started: graph={}, incidentId={}", name, incident.id());

    Queue<String> queue = new ArrayDeque<>(edges.get(START));
    Set<String> visited = new HashSet<>();

    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (END.equals(current) || !visited.add(current)) {
        continue;
      }
      NodeSpec spec = nodes.get(current);
      NodeRun outcome = runNode(current, spec.node(), state);

      if (outcome.error() == null) {
        state.apply(outcome.update());
        state.markCompleted(current);
      } else if (spec.options().isRequired()) {
        fail(state, current, outcome.error());
        return state;
      } else {
        String reason = ExceptionUtils.describe(outcome.error());
        log.warn(
            "[StateGraph] best-effort node failed, continuing: graph={}, node={}, reason={}",
            name,
            current,
            reason);
        state.recordNodeError(current, reason);
      }
      queue.addAll(edges.getOrDefault(current, List.of()));
    }

    log.info(
        "[StateGraph] run completed: graph={}, incidentId={}, nodes={}",
        name,
        incident.id(),
        state.completedNodes());
    return state;
  }

  public CompletableFuture<GraphState> runAsync(
      Incident incident, Map<String, Object> initialContext) {
    return CompletableFuture.supplyAsync(() -> run(incident, initialContext), asyncExecutor);
  }

  public String name() {
    return name;
  }

  public List<String> nodeNames() {
    return List.copyOf(nodes.keySet());
  }

  private NodeRun runNode(String nodeName, GraphNode node, GraphState state) {
    return executor.executeOrCatch(
        () -> new NodeRun(node.execute(state), null),
        e -> new NodeRun(null, e),
        TaskContext.of("StateGraph", nodeName, state.incident().id()));
  }

  private void fail(GraphState state, String node, Throwable error) {
    String reason = ExceptionUtils.describe(error);
    log.error(
        "[StateGraph] required node failed, run stopped: graph={}, node={}, incidentId={}, reason={}",
        name,
        node,
        state.incident().id(),
        reason);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("node", node);
    metadata.put("incident_id", state.incident().id());
    metadata.put("error_type", ExceptionUtils.unwrapAsyncException(error).getClass().getSimpleName());
    state.markFailed(
        node,
        reason,
        TimelineEvent.of(
            TimelineEvent.ERROR_PHASE,
            node,
            "Node " + node + " failed: " + reason,
            metadata,
            clock.instant()));
  }

  private record NodeSpec(GraphNode node, NodeOptions options) {}

  private record NodeRun(StateUpdate update, Throwable error) {}
}
