package dk.trustworks.templatefiller.utils.word;

/**
 * One block of the risk/mitigant mini-language. Either a risk entry (name and mitigant)
 * or, when neither the tab nor the label pattern matched, plain text.
 */
public record RiskBlock(String riskName, String mitigant, String plainText) {

    public static RiskBlock risk(String riskName, String mitigant) {
        return new RiskBlock(riskName, mitigant, null);
    }

    public static RiskBlock plain(String text) {
        return new RiskBlock(null, null, text);
    }

    public boolean isPlain() {
        return plainText != null;
    }
}
