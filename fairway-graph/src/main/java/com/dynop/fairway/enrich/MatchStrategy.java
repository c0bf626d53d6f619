package com.dynop.fairway.enrich;

/**
 * How an auxiliary dataset is joined onto sections.
 */
public enum MatchStrategy {

    /** Exact geometry (WKT) equality. */
    GEOMETRY(new GeometryKeyMatcher()),

    /** Same route id and overlapping kilometre range. */
    ROUTE_KM(new RouteKmMatcher());

    private final SectionMatcher matcher;

    MatchStrategy(SectionMatcher matcher) {
        this.matcher = matcher;
    }

    public SectionMatcher matcher() {
        return matcher;
    }
}
