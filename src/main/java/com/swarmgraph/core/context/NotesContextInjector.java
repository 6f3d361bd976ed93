package com.swarmgraph.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Injects the configured notes that share the most keywords with the query.
 * <p>
 * Notes with no keyword in common are never injected, so an empty or unrelated note set
 * leaves the prompt untouched. Selected notes are appended as a
 * {@code <relevant_context>} block, best match first.
 */
@Component
public class NotesContextInjector implements ContextInjector {

    private static final Logger log = LoggerFactory.getLogger(NotesContextInjector.class);

    private static final int MIN_KEYWORD_LENGTH = 3;

    private final List<String> notes;
    private final int maxNotes;

    @Autowired
    public NotesContextInjector(ContextProperties properties) {
        this(properties.getNotes(), properties.getMaxNotes());
    }

    public NotesContextInjector(List<String> notes, int maxNotes) {
        this.notes = List.copyOf(notes);
        this.maxNotes = maxNotes;
    }

    @Override
    public String inject(String basePrompt, String query) {
        if (notes.isEmpty() || maxNotes <= 0) {
            return basePrompt;
        }
        Set<String> queryWords = keywords(query);
        if (queryWords.isEmpty()) {
            return basePrompt;
        }

        List<ScoredNote> ranked = IntStream.range(0, notes.size())
                .mapToObj(i -> new ScoredNote(i, notes.get(i), relevance(queryWords, notes.get(i))))
                .filter(n -> n.relevance() > 0)
                .sorted(Comparator.comparingDouble(ScoredNote::relevance).reversed()
                        .thenComparingInt(ScoredNote::index))
                .limit(maxNotes)
                .toList();
        if (ranked.isEmpty()) {
            return basePrompt;
        }
        log.debug("Injecting {} context note(s)", ranked.size());
        return basePrompt + format(ranked);
    }

    static Set<String> keywords(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() >= MIN_KEYWORD_LENGTH)
                .collect(Collectors.toSet());
    }

    private static double relevance(Set<String> queryWords, String note) {
        Set<String> noteWords = keywords(note);
        long shared = queryWords.stream().filter(noteWords::contains).count();
        return (double) shared / queryWords.size();
    }

    private static String format(List<ScoredNote> ranked) {
        var sb = new StringBuilder("\n\n<relevant_context>\n")
                .append("The following are relevant notes from past interactions:\n");
        for (int i = 0; i < ranked.size(); i++) {
            var note = ranked.get(i);
            sb.append('[').append(i + 1).append("] (relevance: ")
                    .append(Math.round(note.relevance() * 100)).append("%) ")
                    .append(note.text()).append('\n');
        }
        return sb.append("</relevant_context>").toString();
    }

    private record ScoredNote(int index, String text, double relevance) {}
}
