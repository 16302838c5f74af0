package io.campbellsci.parser.arrays;

import io.campbellsci.parser.ExportSpecs;
import io.campbellsci.parser.ReadSpecs;
import io.campbellsci.parser.reading.CrReader;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.ArrayIdsExportInfoException;
import io.campbellsci.parser.util.ArrayIdsInfoException;
import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.writing.CrWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits mixed-array data by array id, the value of each row's first column. Groups are kept in order of first
 * appearance.
 */
public class ArrayIds {
    private static final Logger LOG = LoggerFactory.getLogger(ArrayIds.class);

    /**
     * @param data Mixed-array rows
     * @param arrayIds The ids to keep; all ids if empty
     * @return The rows grouped by array id. Rows without columns are dropped.
     */
    public static Map<String, DataSet> filterMixedArrayData(final DataSet data, final Collection<String> arrayIds) {
        final Map<String, DataSet> filtered = new LinkedHashMap<>();
        for (final Row row : data) {
            if (row.isEmpty()) {
                continue;
            }
            final ColumnValue first = row.values().get(0);
            final String arrayId = first.toString();
            if (arrayIds.isEmpty() || arrayIds.contains(arrayId)) {
                filtered.computeIfAbsent(arrayId, k -> new DataSet()).add(row);
            }
        }
        return filtered;
    }

    /**
     * @param data Rows already grouped by array id
     * @param arrayIds The ids to keep; all ids if empty
     * @return The selected groups, in their original order.
     */
    public static Map<String, DataSet> filterArrayIdsData(final Map<String, DataSet> data,
            final Collection<String> arrayIds) {
        final Map<String, DataSet> filtered = new LinkedHashMap<>();
        for (final Map.Entry<String, DataSet> entry : data.entrySet()) {
            if (arrayIds.isEmpty() || arrayIds.contains(entry.getKey())) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }

    /**
     * Read mixed-array data and group it by array id.
     *
     * @param path The input file
     * @param specs The read options, typically {@link ReadSpecs#mixedArray()}
     * @param arrayIdNames The ids to keep (all if empty), mapped to the name to group them under. An empty name keeps
     *        the id.
     * @return The rows grouped by array name.
     * @throws CrParserException If the file cannot be read or is malformed
     */
    public static Map<String, DataSet> readArrayIdsData(final Path path, final ReadSpecs specs,
            final Map<String, String> arrayIdNames) throws CrParserException {
        final DataSet mixed = CrReader.readMixedArrayData(path, specs);
        final Map<String, DataSet> byId = filterMixedArrayData(mixed, arrayIdNames.keySet());
        final Map<String, DataSet> byName = new LinkedHashMap<>();
        for (final Map.Entry<String, DataSet> entry : byId.entrySet()) {
            final String name = arrayIdNames.get(entry.getKey());
            byName.put(name == null || name.isEmpty() ? entry.getKey() : name, entry.getValue());
        }
        return byName;
    }

    /**
     * Export each array id's rows to its own file.
     *
     * @param data Mixed-array rows
     * @param arrayIdsFiles The ids to export, mapped to their output file
     * @param specs The export options
     * @throws ArrayIdsInfoException If no array id is given
     * @throws ArrayIdsExportInfoException If an array id has no output file
     * @throws CrParserException If a file cannot be written
     */
    public static void exportArrayIdsToCsv(final DataSet data, final Map<String, Path> arrayIdsFiles,
            final ExportSpecs specs) throws CrParserException {
        if (arrayIdsFiles.isEmpty()) {
            throw new ArrayIdsInfoException("At least one array id must be given!");
        }
        for (final Map.Entry<String, Path> entry : arrayIdsFiles.entrySet()) {
            if (entry.getValue() == null) {
                throw new ArrayIdsExportInfoException(
                        String.format("No file path was found for array id %s", entry.getKey()));
            }
        }
        final Map<String, DataSet> filtered = filterMixedArrayData(data, arrayIdsFiles.keySet());
        for (final Map.Entry<String, DataSet> entry : filtered.entrySet()) {
            final Path path = arrayIdsFiles.get(entry.getKey());
            LOG.debug("Exporting {} rows of array id {} to {}", entry.getValue().size(), entry.getKey(), path);
            CrWriter.exportToCsv(entry.getValue(), path, specs);
        }
    }

    private ArrayIds() {}
}
