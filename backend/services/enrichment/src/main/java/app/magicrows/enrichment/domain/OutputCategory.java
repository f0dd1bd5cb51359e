package app.magicrows.enrichment.domain;

public record OutputCategory(
        String name,
        String description
) {
}
