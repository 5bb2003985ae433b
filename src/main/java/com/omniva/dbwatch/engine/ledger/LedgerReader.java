package com.omniva.dbwatch.engine.ledger;

import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the ledger rows of the monitored tables
 */
public class LedgerReader {

    public List<LedgerEntry> readEntries(Connection connection, WatchParameters params) throws SQLException {
        List<QualifiedTableName> tables = params.getTables();
        String sql = LedgerStatements.selectLedgerEntries(params.getLedgerTable(), tables.size());

        List<LedgerEntry> entries = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < tables.size(); i++) {
                ps.setString(i + 1, tables.get(i).getFullName());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new LedgerEntry(
                            rs.getInt("ObjectId"),
                            rs.getString("ObjectName"),
                            new LedgerSnapshot(
                                    rs.getObject("LastInsertDate", OffsetDateTime.class),
                                    rs.getObject("LastUpdateDate", OffsetDateTime.class),
                                    rs.getObject("LastDeleteDate", OffsetDateTime.class))));
                }
            }
        }
        return entries;
    }
}
