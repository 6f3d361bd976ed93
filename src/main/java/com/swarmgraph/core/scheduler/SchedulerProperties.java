package com.swarmgraph.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "swarm.scheduler")
public class SchedulerProperties {

    /** Upper bound on nodes of one round executing at the same time. */
    private int maxParallel = 8;

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }
}
