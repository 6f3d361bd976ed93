package com.swarmgraph.core.llm;

public record ProbeResult(String provider, boolean reachable, long latencyMs, String detail) {}
