package com.dynop.fairway.io;

import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reader for per-region GeoJSON FeatureCollection exports.
 *
 * <p>Feature properties are read with Jackson and keep their JSON types: strings, integral
 * numbers as {@code Long}, other numbers as {@code Double}, booleans, and {@code null}.
 * Nested objects and arrays are kept as their JSON text. Geometries are parsed with the JTS
 * GeoJSON reader; a feature whose geometry cannot be parsed is kept without geometry and a
 * warning is logged.
 *
 * <h2>File naming</h2>
 * <p>The multi-region network is exported as one file per country and page, e.g.
 * {@code Node_DE_0.geojson}, {@code FairwaySection_BE_1.geojson},
 * {@code SailingSpeed_AT_0.geojson}.
 */
public final class GeoJsonFeatureReader {

    private static final Logger LOGGER = Logger.getLogger(GeoJsonFeatureReader.class.getName());

    private final ObjectMapper objectMapper;

    public GeoJsonFeatureReader() {
        this(new ObjectMapper());
    }

    public GeoJsonFeatureReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads one FeatureCollection file.
     *
     * @param file GeoJSON file
     * @return Table named after the file name
     * @throws IOException if the file cannot be read or is not a FeatureCollection
     */
    public FeatureTable read(Path file) throws IOException {
        String name = file.getFileName().toString();
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.path("features").isArray()) {
            throw new IOException("Not a GeoJSON FeatureCollection: " + file);
        }

        GeoJsonReader geometryReader = new GeoJsonReader();
        List<FeatureRecord> records = new ArrayList<>();
        int badGeometries = 0;
        int index = 0;
        for (JsonNode feature : root.get("features")) {
            Map<String, Object> properties = new LinkedHashMap<>();
            JsonNode props = feature.path("properties");
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), toValue(field.getValue()));
            }

            Geometry geometry = null;
            JsonNode geometryNode = feature.get("geometry");
            if (geometryNode != null && !geometryNode.isNull()) {
                try {
                    geometry = geometryReader.read(geometryNode.toString());
                } catch (ParseException | RuntimeException e) {
                    badGeometries++;
                    final int featureIndex = index;
                    LOGGER.log(Level.WARNING, () -> String.format("Unreadable geometry in feature %d of %s: %s",
                            featureIndex, name, e.getMessage()));
                }
            }
            records.add(new FeatureRecord(properties, geometry));
            index++;
        }

        int skipped = badGeometries;
        LOGGER.info(() -> String.format("Loaded %d features from %s%s", records.size(), name,
                skipped > 0 ? " (" + skipped + " without readable geometry)" : ""));
        return new FeatureTable(name, records);
    }

    /**
     * Reads every file in a directory matching a glob, in file-name order.
     *
     * @param directory Directory holding the per-region exports
     * @param glob      File name pattern, e.g. {@code Node_*.geojson}
     * @return One table per file
     * @throws FairwayDataException with code {@code NO_INPUT_FILES} when nothing matches
     * @throws IOException          if a file cannot be read
     */
    public List<FeatureTable> readAll(Path directory, String glob) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new FairwayDataException(FairwayDataException.NO_INPUT_FILES, directory.toString(),
                    "Input directory does not exist");
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        if (files.isEmpty()) {
            throw new FairwayDataException(FairwayDataException.NO_INPUT_FILES, directory.toString(),
                    "No files matching " + glob);
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));

        List<FeatureTable> tables = new ArrayList<>();
        for (Path file : files) {
            tables.add(read(file));
        }
        LOGGER.info(() -> String.format("Read %d files matching %s in %s", tables.size(), glob, directory));
        return tables;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.toString();
    }
}
