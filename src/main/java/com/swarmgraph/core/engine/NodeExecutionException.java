package com.swarmgraph.core.engine;

import com.swarmgraph.core.SwarmException;

/**
 * A node failed and the run was aborted. The cause is usually a
 * {@link com.swarmgraph.core.llm.GenerationFailure}.
 */
public class NodeExecutionException extends SwarmException {

    private final String nodeId;
    private final int iteration;

    public NodeExecutionException(String nodeId, int iteration, Throwable cause) {
        super("Node '" + nodeId + "' failed in pass " + (iteration + 1) + ": " + cause.getMessage(), cause);
        this.nodeId = nodeId;
        this.iteration = iteration;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Completed-pass count when the node ran (0 for the first pass). */
    public int getIteration() {
        return iteration;
    }
}
