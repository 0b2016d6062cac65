package incident.commander.orchestration;

import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateUpdate;

/** One unit of work in a {@link StateGraph}. Reads the state, returns a partial update. */
@FunctionalInterface
public interface GraphNode {

  StateUpdate execute(GraphState state) throws Exception;
}
