package com.animestats.scraper;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Star-schema storage in PostgreSQL.
 */
public interface PostgresServiceInterface extends ExportServiceInterface {
    /**
     * Creates the listing, fact and edge tables if they don't already exist.
     * @param conn open connection
     * @throws SQLException on DDL failure
     */
    void createTables(Connection conn) throws SQLException;

    /**
     * Replaces the stored run with the given one in a single transaction.
     * @param result run output
     * @throws SQLException if the transaction fails; nothing is committed
     */
    void replaceRun(PipelineResult result) throws SQLException;
}
