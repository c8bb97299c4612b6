package com.danieljhkim.tabletmgr.tmagent.mysql;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmcommon.config.SystemConfig;
import com.danieljhkim.tabletmgr.tmcommon.exception.MysqlDaemonException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * {@link MysqlDaemon} backed by a small Hikari connection pool to the local daemon.
 *
 * <p>
 * The pool is created on first use so an agent can start while MySQL is still coming up.
 */
public class HikariMysqlDaemon implements MysqlDaemon {

	private static final Logger logger = LoggerFactory.getLogger(HikariMysqlDaemon.class);
	private static final String PREFIX = "mysql.";

	private final SystemConfig config;
	private HikariDataSource dataSource;
	private boolean closed;

	public HikariMysqlDaemon(SystemConfig config) {
		this.config = config;
	}

	@Override
	public int getListeningPort() {
		try (Connection conn = getDataSource().getConnection();
				Statement stmt = conn.createStatement();
				ResultSet rs = stmt.executeQuery("SELECT @@port")) {
			if (!rs.next()) {
				throw new MysqlDaemonException("SELECT @@port returned no rows");
			}
			return rs.getInt(1);
		} catch (SQLException e) {
			throw new MysqlDaemonException("Failed to read mysql port", e);
		}
	}

	private synchronized HikariDataSource getDataSource() {
		if (closed) {
			throw new MysqlDaemonException("mysql daemon connection pool is closed");
		}
		if (dataSource != null) {
			return dataSource;
		}
		String url = config.getProperty(PREFIX + "url", "");
		if (url.isBlank()) {
			throw new MysqlDaemonException("no mysql.url configured");
		}
		try {
			HikariConfig hikari = new HikariConfig();
			hikari.setPoolName("tablet-mysqld");
			hikari.setJdbcUrl(url);
			hikari.setUsername(config.getProperty(PREFIX + "username"));
			hikari.setPassword(config.getProperty(PREFIX + "password"));
			hikari.setMaximumPoolSize(config.getInt(PREFIX + "pool.maxSize", 2));
			hikari.setMinimumIdle(0);
			hikari.setConnectionTimeout(config.getMillis(PREFIX + "pool.connectionTimeoutMs", 5000).toMillis());
			// don't fail pool construction while mysqld is still starting
			hikari.setInitializationFailTimeout(-1);
			dataSource = new HikariDataSource(hikari);
			logger.info("MySQL connection pool initialized for {}", url);
			return dataSource;
		} catch (RuntimeException e) {
			throw new MysqlDaemonException("Failed to initialize mysql connection pool", e);
		}
	}

	@Override
	public synchronized void close() {
		closed = true;
		if (dataSource != null && !dataSource.isClosed()) {
			dataSource.close();
			logger.info("MySQL connection pool closed");
		}
		dataSource = null;
	}
}
