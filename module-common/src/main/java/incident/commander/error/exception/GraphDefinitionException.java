package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;

/** Thrown while wiring a graph: duplicate node, unknown edge endpoint or reserved name. */
public class GraphDefinitionException extends ServerBaseException {

  public GraphDefinitionException(String detail) {
    super(CommonErrorCode.GRAPH_DEFINITION_INVALID, detail);
  }
}
