package dk.trustworks.templatefiller.utils.word;

public record SponsorLine(String text, LineKind kind) {
}
