package dk.trustworks.templatefiller.utils.word;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Summary of one template fill.
 *
 * @param valuesReplaced      number of value placeholders replaced
 * @param imagesInserted      number of pictures inserted
 * @param sectionsExpanded    number of structured placeholders expanded
 * @param unresolved          names of placeholders left verbatim, in first-seen order
 * @param imageFailures       image placeholders whose insertion was aborted
 */
public record FillReport(
        int valuesReplaced,
        int imagesInserted,
        int sectionsExpanded,
        Set<String> unresolved,
        List<ImageFailure> imageFailures
) {

    public FillReport {
        unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
        imageFailures = List.copyOf(imageFailures);
    }

    public boolean hasImageFailures() {
        return !imageFailures.isEmpty();
    }
}
