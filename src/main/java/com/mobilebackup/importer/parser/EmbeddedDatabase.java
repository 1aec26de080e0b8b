package com.mobilebackup.importer.parser;

import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 只读打开备份里的内嵌 SQLite 库。
 */
public final class EmbeddedDatabase {

    private EmbeddedDatabase() {
    }

    /**
     * 以只读方式打开，并跑一次 sqlite_master 查询确认文件真的是个库，
     * 否则“file is not a database”会拖到第一次业务查询才暴露。
     */
    public static Connection openReadOnly(Path file) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        Connection conn = DriverManager.getConnection(
                "jdbc:sqlite:" + file.toAbsolutePath(), config.toProperties());
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT count(*) FROM sqlite_master")) {
            rs.next();
            return conn;
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    public static boolean hasTable(Connection conn, String table) throws SQLException {
        try (var ps = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /** 列名小写集合，用来兼容不同系统版本的 schema 差异 */
    public static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> cols = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                cols.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return cols;
    }
}
