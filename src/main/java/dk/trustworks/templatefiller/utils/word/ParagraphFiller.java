package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Value and structured pass over one paragraph.
 *
 * <p>A paragraph holding a structured placeholder is handed to the
 * {@link StructuredSectionExpander} as a whole. Otherwise value placeholders are spliced
 * last-to-first, rebuilding the {@link RunTextIndex} after each edit, and every run a
 * splice edited (the receiving run, emptied runs, the run keeping the suffix) gets the
 * canonical body formatting. Image placeholders are left for
 * {@link ImagePlaceholderWriter}.
 */
public class ParagraphFiller {

    private final PlaceholderScanner scanner;
    private final RunSplicer splicer;
    private final RunFormatter formatter;
    private final StructuredSectionExpander expander;

    public ParagraphFiller(PlaceholderScanner scanner, RunSplicer splicer, RunFormatter formatter,
                           StructuredSectionExpander expander) {
        this.scanner = scanner;
        this.splicer = splicer;
        this.formatter = formatter;
        this.expander = expander;
    }

    public void fill(XWPFParagraph paragraph, FillContext context) {
        RunTextIndex index = RunTextIndex.build(paragraph);
        List<PlaceholderMatch> matches = scanner.scan(index.text(), context.values(), context.images());
        if (matches.isEmpty()) {
            return;
        }

        Optional<PlaceholderMatch> structured = matches.stream()
                .filter(match -> match.kind() == PlaceholderKind.STRUCTURED)
                .findFirst();
        if (structured.isPresent()) {
            String name = structured.get().name();
            StructuredToken token = StructuredToken.fromName(name).orElseThrow();
            expander.expand(paragraph, token, context.value(name));
            context.sectionExpanded();
            return;
        }

        for (PlaceholderMatch match : matches) {
            if (match.kind() == PlaceholderKind.UNRESOLVED) {
                context.unresolved(match.name());
            }
        }

        Set<XWPFRun> editedRuns = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = matches.size() - 1; i >= 0; i--) {
            PlaceholderMatch match = matches.get(i);
            if (match.kind() == PlaceholderKind.VALUE) {
                SpliceResult result = splicer.splice(index, match.start(), match.end(), context.value(match.name()));
                editedRuns.addAll(result.editedRuns());
                context.valueReplaced();
                index = RunTextIndex.build(paragraph);
            }
        }
        formatter.applyValueFormatting(editedRuns);
    }
}
