package com.dynop.fairway;

/**
 * Exception thrown when required input data is missing or unusable and a stage must abort.
 *
 * <p>Possible error codes:
 * <ul>
 *   <li>{@code MISSING_COLUMN} - A table lacks a column the stage cannot work without</li>
 *   <li>{@code NO_INPUT_FILES} - No per-region files were found for a multi-file build</li>
 *   <li>{@code MISSING_DATASET} - A required enrichment dataset was not supplied</li>
 *   <li>{@code INVALID_CRS} - A coordinate reference system code could not be resolved</li>
 * </ul>
 *
 * <p>Unmatched join keys and malformed single geometries are not reported through this
 * exception; they are logged and the affected record is skipped.
 */
public class FairwayDataException extends RuntimeException {

    public static final String MISSING_COLUMN = "MISSING_COLUMN";
    public static final String NO_INPUT_FILES = "NO_INPUT_FILES";
    public static final String MISSING_DATASET = "MISSING_DATASET";
    public static final String INVALID_CRS = "INVALID_CRS";

    private final String errorCode;
    private final String source;

    /**
     * Creates a data exception.
     *
     * @param errorCode Error code
     * @param source    Table, file or dataset the problem was found in
     * @param message   Description of the problem
     */
    public FairwayDataException(String errorCode, String source, String message) {
        super(String.format("%s: %s (%s)", errorCode, message, source));
        this.errorCode = errorCode;
        this.source = source;
    }

    /**
     * Creates a data exception wrapping a lower level cause.
     *
     * @param errorCode Error code
     * @param source    Table, file or dataset the problem was found in
     * @param message   Description of the problem
     * @param cause     Underlying cause
     */
    public FairwayDataException(String errorCode, String source, String message, Throwable cause) {
        super(String.format("%s: %s (%s)", errorCode, message, source), cause);
        this.errorCode = errorCode;
        this.source = source;
    }

    /**
     * Shortcut for a missing required column.
     *
     * @param table  Table name
     * @param column Missing column
     * @return the exception
     */
    public static FairwayDataException missingColumn(String table, String column) {
        return new FairwayDataException(MISSING_COLUMN, table, "Required column '" + column + "' not found");
    }

    /**
     * @return Error code (e.g., "MISSING_COLUMN")
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return Table, file or dataset name the error refers to
     */
    public String getSource() {
        return source;
    }
}
