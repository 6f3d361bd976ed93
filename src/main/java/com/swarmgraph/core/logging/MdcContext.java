package com.swarmgraph.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for run-scoped structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String SWARM = "swarm";
    public static final String NODE_ID = "nodeId";
    public static final String PASS = "pass";

    private MdcContext() {}

    public static void setRun(String runId, String swarm) {
        MDC.put(RUN_ID, runId);
        MDC.put(SWARM, swarm);
    }

    /**
     * @param pass 1-based refinement pass the node runs in
     */
    public static void setNode(String runId, String swarm, String nodeId, int pass) {
        setRun(runId, swarm);
        MDC.put(NODE_ID, nodeId);
        MDC.put(PASS, String.valueOf(pass));
    }

    public static void clearNode() {
        MDC.remove(NODE_ID);
        MDC.remove(PASS);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(SWARM);
        clearNode();
    }
}
