package dk.trustworks.templatefiller.utils.word;

import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Image pass over one paragraph: every {@code {{IMAGE_*}}} placeholder with data in the
 * image map is removed and replaced by an inline picture at the same position.
 *
 * <p>The picture is added to the run that held the start of the placeholder. Whatever
 * followed the placeholder in that run (text, tabs, breaks) is moved to a new run right
 * after it, with the same run properties, so the reading order stays prefix, picture, suffix.
 *
 * <p>A placeholder whose data cannot be decoded or embedded stays in the paragraph and is
 * recorded as an {@link ImageFailure} on the {@link FillContext}.
 */
@JBossLog
public class ImagePlaceholderWriter {

    private final PlaceholderScanner scanner;
    private final RunSplicer splicer;
    private final BoxFitScaler scaler;
    private final TemplateLayout layout;

    public ImagePlaceholderWriter(PlaceholderScanner scanner, RunSplicer splicer, BoxFitScaler scaler, TemplateLayout layout) {
        this.scanner = scanner;
        this.splicer = splicer;
        this.scaler = scaler;
        this.layout = layout;
    }

    public void fill(XWPFParagraph paragraph, FillContext context) {
        RunTextIndex index = RunTextIndex.build(paragraph);
        List<PlaceholderMatch> matches = scanner.scan(index.text(), context.values(), context.images());
        for (int i = matches.size() - 1; i >= 0; i--) {
            PlaceholderMatch match = matches.get(i);
            if (match.kind() != PlaceholderKind.IMAGE) {
                continue;
            }
            Optional<DecodedImage> image = context.image(match.name());
            if (image.isEmpty()) {
                continue;
            }
            insert(paragraph, index, match, image.get(), context);
            index = RunTextIndex.build(paragraph);
        }
    }

    private void insert(XWPFParagraph paragraph, RunTextIndex index, PlaceholderMatch match,
                        DecodedImage image, FillContext context) {
        ImageBox box = scaler.fit(image.bytes(), layout.widthFor(match.name()));
        if (box.isFallback()) {
            log.warnf("Dimensions of %s could not be read, inserting with fallback size %.2fx%.2f in",
                    match.name(), box.widthInches(), box.heightInches());
        }

        SpliceResult result = splicer.splice(index, match.start(), match.end(), "");
        XWPFRun run = result.run();
        splitTail(paragraph, run, result.runIndex(), result.textIndex(), result.offsetAfterReplacement());
        try {
            run.addPicture(new ByteArrayInputStream(image.bytes()), image.pictureType(), image.fileName(),
                    box.widthEmu(), box.heightEmu());
            context.imageInserted();
            log.debugf("Inserted %s at %.2fx%.2f in", match.name(), box.widthInches(), box.heightInches());
        } catch (InvalidFormatException | IOException e) {
            log.errorf(e, "Could not embed image %s", match.name());
            context.imageFailed(match.name(), "could not embed picture: " + e.getMessage());
            CTText element = run.getCTR().getTArray(result.textIndex());
            RunText.set(element, RunText.valueOf(element) + "{{" + match.name() + "}}");
        }
    }

    /**
     * Moves everything after the given point of the run into a new run right after it:
     * the rest of the split {@code w:t} and every later sibling. The new run is a copy of
     * the original, so it keeps the run properties.
     */
    private static void splitTail(XWPFParagraph paragraph, XWPFRun run, int runIndex, int textIndex, int offset) {
        CTR ctr = run.getCTR();
        List<XmlObject> content = RunText.content(ctr);
        int position = RunText.positionOf(ctr, textIndex);
        CTText split = ctr.getTArray(textIndex);
        String text = RunText.valueOf(split);
        if (offset >= text.length() && position == content.size() - 1) {
            return;
        }

        XWPFRun tail = paragraph.insertNewRun(runIndex + 1);
        tail.getCTR().set(ctr.copy());
        List<XmlObject> tailContent = RunText.content(tail.getCTR());

        for (int i = content.size() - 1; i > position; i--) {
            RunText.remove(content.get(i));
        }
        RunText.set(split, text.substring(0, offset));

        for (int i = position - 1; i >= 0; i--) {
            RunText.remove(tailContent.get(i));
        }
        RunText.set(tail.getCTR().getTArray(0), text.substring(offset));
    }
}
