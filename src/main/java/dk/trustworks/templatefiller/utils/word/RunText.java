package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;

/**
 * Text access for runs at the level of their {@code w:t} elements.
 *
 * <p>A run's text is the concatenation of its {@code w:t} elements. Tabs, breaks and
 * drawings are separate sibling elements; edits go through single {@code w:t} elements so
 * those siblings keep their place.
 */
public final class RunText {

    static final String WORDML_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private static final QName TEXT = new QName(WORDML_NS, "t");
    private static final QName BREAK = new QName(WORDML_NS, "br");
    private static final QName TAB = new QName(WORDML_NS, "tab");
    private static final QName XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space");

    private RunText() {
    }

    public static String read(XWPFRun run) {
        CTR ctr = run.getCTR();
        int size = ctr.sizeOfTArray();
        if (size == 0) {
            return "";
        }
        if (size == 1) {
            return valueOf(ctr.getTArray(0));
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < size; i++) {
            text.append(valueOf(ctr.getTArray(i)));
        }
        return text.toString();
    }

    /**
     * Sets the text of a run the engine created itself, which holds at most one {@code w:t}.
     */
    public static void write(XWPFRun run, String text) {
        run.setText(text, 0);
    }

    static String valueOf(CTText t) {
        String value = t.getStringValue();
        return value != null ? value : "";
    }

    /** Replaces the text of one {@code w:t} element. */
    static void set(CTText element, String text) {
        element.setStringValue(text);
        if (needsPreserve(text)) {
            XmlCursor cursor = element.newCursor();
            try {
                cursor.setAttributeText(XML_SPACE, "preserve");
            } finally {
                cursor.dispose();
            }
        }
    }

    /**
     * Writes {@code head + value + tail} into a {@code w:t} element. Line breaks in
     * {@code value} become {@code w:br} and tabs become {@code w:tab}; each is inserted
     * right after the element, followed by a new {@code w:t} for the next part. The tail
     * always ends up in the last {@code w:t} written.
     *
     * @return the number of {@code w:t} elements added after {@code element}
     */
    static int write(CTText element, String head, String value, String tail) {
        String normalized = value.replace("\r\n", "\n").replace('\r', '\n');
        List<String> parts = new ArrayList<>();
        List<QName> separators = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c == '\n' || c == '\t') {
                parts.add(normalized.substring(start, i));
                separators.add(c == '\n' ? BREAK : TAB);
                start = i + 1;
            }
        }
        parts.add(normalized.substring(start));

        if (separators.isEmpty()) {
            set(element, head + parts.get(0) + tail);
            return 0;
        }
        set(element, head + parts.get(0));

        int added = 0;
        XmlCursor cursor = element.newCursor();
        try {
            cursor.toEndToken();
            cursor.toNextToken();
            for (int i = 0; i < separators.size(); i++) {
                cursor.insertElement(separators.get(i));
                boolean last = i == separators.size() - 1;
                String part = last ? parts.get(i + 1) + tail : parts.get(i + 1);
                if (part.isEmpty() && !last) {
                    continue;
                }
                cursor.beginElement(TEXT);
                if (needsPreserve(part)) {
                    cursor.insertAttributeWithValue(XML_SPACE, "preserve");
                }
                if (!part.isEmpty()) {
                    cursor.insertChars(part);
                }
                cursor.toNextToken();
                added++;
            }
        } finally {
            cursor.dispose();
        }
        return added;
    }

    /**
     * Child elements of a run in document order, without its {@code w:rPr}.
     */
    static List<XmlObject> content(CTR ctr) {
        List<XmlObject> children = new ArrayList<>();
        XmlCursor cursor = ctr.newCursor();
        try {
            if (cursor.toFirstChild()) {
                do {
                    if (!"rPr".equals(cursor.getName().getLocalPart())) {
                        children.add(cursor.getObject());
                    }
                } while (cursor.toNextSibling());
            }
        } finally {
            cursor.dispose();
        }
        return children;
    }

    /**
     * Position in {@link #content(CTR)} of the run's {@code textIndex}-th {@code w:t}.
     */
    static int positionOf(CTR ctr, int textIndex) {
        XmlCursor cursor = ctr.newCursor();
        try {
            int position = 0;
            int seen = 0;
            if (cursor.toFirstChild()) {
                do {
                    QName name = cursor.getName();
                    if ("rPr".equals(name.getLocalPart())) {
                        continue;
                    }
                    if (TEXT.equals(name)) {
                        if (seen == textIndex) {
                            return position;
                        }
                        seen++;
                    }
                    position++;
                } while (cursor.toNextSibling());
            }
        } finally {
            cursor.dispose();
        }
        throw new IndexOutOfBoundsException("Run has no w:t at index " + textIndex);
    }

    static void remove(XmlObject element) {
        XmlCursor cursor = element.newCursor();
        try {
            cursor.removeXml();
        } finally {
            cursor.dispose();
        }
    }

    private static boolean needsPreserve(String text) {
        return !text.isEmpty()
                && (Character.isWhitespace(text.charAt(0)) || Character.isWhitespace(text.charAt(text.length() - 1)));
    }
}
