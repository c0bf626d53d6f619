package com.dynop.fairway.graph;

/**
 * Attribute keys the pipeline itself reads or writes on nodes and edges.
 *
 * <p>Everything else on a node or edge is carried through from the source exports under its
 * original column name.
 */
public final class Attributes {

    public static final String GEOMETRY = "geometry";
    public static final String LEGACY_GEOMETRY = "Geometry";
    public static final String X = "x";
    public static final String Y = "y";

    public static final String NODE_ID = "node_id";
    public static final String COUNTRY_CODE = "countrycode";
    public static final String DATA_SOURCE = "data_source";
    public static final String SUBGRAPH = "subgraph";

    public static final String ID = "Id";
    public static final String LENGTH_M = "length_m";
    public static final String IS_BORDER = "is_border";
    public static final String SECTION_REF = "sectionref";
    public static final String FAIRWAY_ID = "fairway_id";

    public static final String BRIDGEHEAD = "bridgehead";
    public static final String DISTANCE_GAP = "distance_gap";
    public static final String CONNECTION_TYPE = "connection_type";

    private Attributes() {
        // Constants
    }
}
