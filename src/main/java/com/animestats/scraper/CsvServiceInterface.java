package com.animestats.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV export of the listing table and the star-schema tables.
 */
public interface CsvServiceInterface extends ExportServiceInterface {
    /**
     * Writes one table with a header row. An empty row list still produces the header.
     * @param file target file, replaced if present
     * @param header column names
     * @param rows data rows; null cells are written empty
     * @throws IOException if file writing fails
     */
    void writeTable(Path file, String[] header, List<String[]> rows) throws IOException;
}
