package org.geofacet.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads grid layouts from CSV files in the geofacet grid format.
 * <p>
 * Format:
 * <ul>
 *   <li>the first line is a header,</li>
 *   <li>{@code row} and {@code col} columns are required,</li>
 *   <li>the first column whose name contains {@code code} (case-insensitive) supplies the region code,</li>
 *   <li>an optional {@code name} column supplies display names,</li>
 *   <li>every other column is stored as per-entry metadata under its column name.</li>
 * </ul>
 * Fields may be double-quoted to embed commas; a doubled quote inside a quoted field
 * is a literal quote. Blank lines are ignored.
 */
public final class GridLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GridLoader.class);

    private static final String ROW_COLUMN = "row";
    private static final String COL_COLUMN = "col";
    private static final String NAME_COLUMN = "name";
    private static final String CODE_FRAGMENT = "code";

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");
    // codes such as FIPS "01" or ZIP "02134"
    private static final Pattern LEADING_ZERO = Pattern.compile("[-+]?0\\d.*");

    private GridLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads a grid from a CSV file. The grid is named after the file without its extension.
     *
     * @param csvPath path of the CSV file
     * @return the loaded grid
     * @throws GridLoadException       if the file is missing or malformed
     * @throws GridValidationException if the entries violate a grid invariant
     */
    public static GeoGrid load(Path csvPath) throws GridLoadException {
        if (!Files.isRegularFile(csvPath)) {
            throw new GridLoadException("Grid file not found: " + csvPath);
        }
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            return parse(gridName(csvPath.getFileName().toString()), reader, csvPath.toString());
        } catch (IOException e) {
            throw new GridLoadException("Failed to read grid file: " + csvPath, e);
        }
    }

    /**
     * Loads a grid from {@code <directory>/<fileName>}, appending {@code .csv} when missing.
     */
    public static GeoGrid load(String fileName, Path directory) throws GridLoadException {
        String csvName = fileName.endsWith(".csv") ? fileName : fileName + ".csv";
        return load(directory.resolve(csvName));
    }

    /**
     * Loads a grid from a classpath resource.
     *
     * @param resourceName resource path, e.g. {@code "grids/us_state_grid1.csv"}
     * @return the loaded grid
     * @throws GridLoadException if the resource is missing or malformed
     */
    public static GeoGrid loadResource(String resourceName) throws GridLoadException {
        InputStream in = GridLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new GridLoadException("Grid resource not found: " + resourceName);
        }
        String simpleName = resourceName.substring(resourceName.lastIndexOf('/') + 1);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(gridName(simpleName), reader, resourceName);
        } catch (IOException e) {
            throw new GridLoadException("Failed to read grid resource: " + resourceName, e);
        }
    }

    /**
     * Parses CSV content into a grid.
     *
     * @param gridName name given to the resulting grid
     * @param reader   CSV source, not closed by this method
     * @param source   description of the source used in error messages
     */
    static GeoGrid parse(String gridName, Reader reader, String source) throws GridLoadException, IOException {
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);

        List<String> header = null;
        List<GridEntry> entries = new ArrayList<>();
        int rowIdx = -1;
        int colIdx = -1;
        int codeIdx = -1;
        int nameIdx = -1;

        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitLine(line, source, lineNumber);
            if (header == null) {
                header = fields.stream().map(String::trim).toList();
                rowIdx = header.indexOf(ROW_COLUMN);
                colIdx = header.indexOf(COL_COLUMN);
                List<String> missing = new ArrayList<>();
                if (rowIdx < 0) missing.add(ROW_COLUMN);
                if (colIdx < 0) missing.add(COL_COLUMN);
                if (!missing.isEmpty()) {
                    throw new GridLoadException("Missing required columns: " + String.join(", ", missing)
                            + " in " + source);
                }
                codeIdx = findCodeColumn(header);
                if (codeIdx < 0) {
                    throw new GridLoadException(
                            "Missing code column. No column name contains 'code' (case-insensitive) in " + source);
                }
                nameIdx = header.indexOf(NAME_COLUMN);
                continue;
            }
            if (fields.size() != header.size()) {
                throw new GridLoadException(String.format("%s:%d: expected %d fields but found %d",
                        source, lineNumber, header.size(), fields.size()));
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                if (i != rowIdx && i != colIdx && i != codeIdx && i != nameIdx) {
                    metadata.put(header.get(i), typedValue(fields.get(i)));
                }
            }
            entries.add(new GridEntry(
                    fields.get(codeIdx).trim(),
                    parseInt(fields.get(rowIdx), ROW_COLUMN, source, lineNumber),
                    parseInt(fields.get(colIdx), COL_COLUMN, source, lineNumber),
                    nameIdx >= 0 ? fields.get(nameIdx).trim() : null,
                    metadata));
        }

        if (header == null) {
            throw new GridLoadException("Grid file is empty: " + source);
        }
        GeoGrid grid = GeoGrid.fromEntries(gridName, entries);
        LOG.debug("Loaded grid '{}' with {} entries from {}", gridName, grid.size(), source);
        return grid;
    }

    private static int findCodeColumn(List<String> header) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).contains(CODE_FRAGMENT)) {
                return i;
            }
        }
        return -1;
    }

    private static int parseInt(String raw, String column, String source, int lineNumber) throws GridLoadException {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new GridLoadException(String.format("%s:%d: column '%s' is not an integer: '%s'",
                    source, lineNumber, column, raw), e);
        }
    }

    private static Object typedValue(String raw) {
        String value = raw.trim();
        if (LEADING_ZERO.matcher(value).matches()) {
            return value;
        }
        if (INTEGER.matcher(value).matches() && value.length() <= 18) {
            return Long.parseLong(value);
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return value;
    }

    /**
     * Splits one CSV line into fields, honouring double-quoted fields.
     */
    static List<String> splitLine(String line, String source, int lineNumber) throws GridLoadException {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new GridLoadException(String.format("%s:%d: unterminated quoted field", source, lineNumber));
        }
        fields.add(current.toString());
        return fields;
    }

    private static String gridName(String fileName) {
        return fileName.endsWith(".csv") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }
}
