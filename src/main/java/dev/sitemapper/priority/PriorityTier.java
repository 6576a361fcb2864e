package dev.sitemapper.priority;

/**
 * Importance tiers a page can be classified into, with the sitemap priority each one maps to.
 */
public enum PriorityTier {
    /** Home page and whole-site landing sections. */
    HIGHEST(1.0),
    /** Product pages, content categories, core guides. */
    HIGH(0.80),
    /** Quickstarts, installation guides, tag listings. */
    MEDIUM(0.64),
    /** Concept pages, long-form posts, regular documentation and the default. */
    STANDARD(0.51),
    /** Legacy reference pages, tag collections, deeply nested pages. */
    LOW(0.41);

    private final double priority;

    PriorityTier(double priority) {
        this.priority = priority;
    }

    public double priority() {
        return priority;
    }
}
