package gr.imsi.athenarc.historian.datasource.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.datasource.DataSourceException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

public class JDBCConnection implements DatabaseConnection {
    private static final Logger LOG = LoggerFactory.getLogger(JDBCConnection.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final String url;
    private final String user;
    private final String password;
    private Connection connection;

    public JDBCConnection(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    @Override
    public JDBCConnection connect() {
        try {
            Properties properties = new Properties();
            if (user != null) {
                properties.setProperty("user", user);
            }
            if (password != null) {
                properties.setProperty("password", password);
            }
            connection = DriverManager.getConnection(url, properties);
            LOG.info("Initialized JDBC connection {}", url);
            return this;
        } catch (SQLException e) {
            throw new DataSourceException("Could not connect to " + url, e);
        }
    }

    @Override
    public boolean isValid() {
        try {
            return connection != null && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            LOG.warn("Validation of JDBC connection {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DataSourceException("Error closing connection to " + url, e);
        }
    }

    public String getUrl() {
        return url;
    }

    public Connection getConnection() {
        return connection;
    }
}
