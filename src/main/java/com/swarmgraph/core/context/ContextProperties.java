package com.swarmgraph.core.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for {@link NotesContextInjector}.
 */
@Component
@ConfigurationProperties(prefix = "swarm.context")
public class ContextProperties {

    /** Upper bound on notes appended to one prompt. */
    private int maxNotes = 3;

    /** Background notes that may be injected into specialist prompts. */
    private List<String> notes = new ArrayList<>();

    public int getMaxNotes() {
        return maxNotes;
    }

    public void setMaxNotes(int maxNotes) {
        this.maxNotes = maxNotes;
    }

    public List<String> getNotes() {
        return notes;
    }

    public void setNotes(List<String> notes) {
        this.notes = notes;
    }
}
