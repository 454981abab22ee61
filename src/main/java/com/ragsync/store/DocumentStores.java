package com.ragsync.store;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

import com.ragsync.runtime.ConfigurationException;

public final class DocumentStores {
    private DocumentStores() {
    }

    public static DocumentStore open(String connectionString, boolean initializeSchema) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new ConfigurationException("Store connection string is empty");
        }
        String trimmed = connectionString.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("file:")) {
            return LocalJsonDocumentStore.open(localPath(trimmed));
        }
        JdbcTarget target = toJdbcTarget(trimmed);
        JdbcDocumentStore store = JdbcDocumentStore.connect(target.url(), target.properties());
        if (initializeSchema) {
            store.initializeSchema();
        }
        return store;
    }

    static JdbcTarget toJdbcTarget(String connectionString) {
        String lower = connectionString.toLowerCase(Locale.ROOT);
        if (lower.startsWith("jdbc:postgresql:")) {
            return new JdbcTarget(connectionString, new Properties());
        }
        if (!lower.startsWith("postgresql://") && !lower.startsWith("postgres://")) {
            throw new ConfigurationException("Unsupported store connection string scheme; expected postgresql://, jdbc:postgresql: or file:");
        }
        URI uri;
        try {
            uri = new URI(connectionString);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed store connection string: " + e.getReason(), e);
        }
        Properties properties = new Properties();
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            String user = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            properties.setProperty("user", decode(user));
            if (colon >= 0) {
                properties.setProperty("password", decode(userInfo.substring(colon + 1)));
            }
        }
        StringBuilder url = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
        if (uri.getPort() > 0) {
            url.append(':').append(uri.getPort());
        }
        String database = uri.getRawPath();
        url.append(database == null || database.isEmpty() ? "/postgres" : database);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            url.append('?').append(uri.getRawQuery());
        }
        return new JdbcTarget(url.toString(), properties);
    }

    static Path localPath(String fileUri) {
        if (fileUri.regionMatches(true, 0, "file://", 0, 7)) {
            return Path.of(URI.create(fileUri));
        }
        return Path.of(fileUri.substring("file:".length()));
    }

    // Only percent-escapes are meaningful in URI user info; a literal '+' stays a plus.
    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    record JdbcTarget(String url, Properties properties) {
    }
}
