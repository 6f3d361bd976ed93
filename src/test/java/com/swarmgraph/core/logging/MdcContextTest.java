package com.swarmgraph.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setNodePopulatesRunAndNodeKeys() {
        MdcContext.setNode("RUN-1", "card-game", "supervisor", 1);

        assertEquals("RUN-1", MDC.get(MdcContext.RUN_ID));
        assertEquals("card-game", MDC.get(MdcContext.SWARM));
        assertEquals("supervisor", MDC.get(MdcContext.NODE_ID));
        assertEquals("1", MDC.get(MdcContext.PASS));
    }

    @Test
    void clearNodeKeepsRunKeys() {
        MdcContext.setNode("RUN-1", "card-game", "supervisor", 1);
        MdcContext.clearNode();

        assertEquals("RUN-1", MDC.get(MdcContext.RUN_ID));
        assertNull(MDC.get(MdcContext.NODE_ID));
        assertNull(MDC.get(MdcContext.PASS));
    }

    @Test
    void clearRemovesEverything() {
        MdcContext.setNode("RUN-1", "card-game", "supervisor", 1);
        MdcContext.clear();

        assertNull(MDC.get(MdcContext.RUN_ID));
        assertNull(MDC.get(MdcContext.SWARM));
        assertNull(MDC.get(MdcContext.NODE_ID));
    }
}
