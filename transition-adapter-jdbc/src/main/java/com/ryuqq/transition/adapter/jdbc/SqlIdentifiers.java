package com.ryuqq.transition.adapter.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Quotes table, column and index names before they are interpolated into SQL.
 *
 * <p>Type names such as {@code Order} map to reserved words, so every configured
 * identifier is delimited with the database's own quote string. The name is first
 * folded to the case the database uses for unquoted identifiers, so a quoted name
 * refers to the same object as the unquoted one would:</p>
 * <pre>
 * H2, Oracle  : order → "ORDER"
 * PostgreSQL  : order → "order"
 * MySQL       : order → `order`
 * </pre>
 *
 * <p>The database metadata is read once, on first use, through
 * {@link JdbcTemplate#execute(ConnectionCallback)}.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class SqlIdentifiers {

    private static final Logger log = LoggerFactory.getLogger(SqlIdentifiers.class);

    private final JdbcTemplate jdbcTemplate;
    private volatile Style style;

    public SqlIdentifiers(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate cannot be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Quotes an identifier. Schema-qualified names are quoted part by part.
     *
     * @param identifier validated identifier, e.g. {@code order} or {@code audit.transitions}
     * @return delimited identifier
     * @throws IllegalStateException if the database metadata cannot be read
     */
    public String quote(String identifier) {
        return style().quote(identifier);
    }

    private Style style() {
        Style current = style;
        if (current == null) {
            current = jdbcTemplate.execute((ConnectionCallback<Style>) connection -> Style.from(connection.getMetaData()));
            if (current == null) {
                throw new IllegalStateException("Database metadata unavailable");
            }
            style = current;
            log.debug("Resolved identifier style: quote={}, case={}", current.quoteString(), current.identifierCase());
        }
        return current;
    }

    /**
     * Case the database applies to unquoted identifiers.
     */
    enum IdentifierCase {
        UPPER, LOWER, AS_IS
    }

    /**
     * Quoting rules of one database.
     *
     * @param quoteString identifier quote string (empty when the database has none)
     * @param identifierCase case folding for unquoted identifiers
     */
    record Style(String quoteString, IdentifierCase identifierCase) {

        static Style from(DatabaseMetaData metaData) throws SQLException {
            String quote = metaData.getIdentifierQuoteString();
            IdentifierCase identifierCase;
            if (metaData.storesUpperCaseIdentifiers()) {
                identifierCase = IdentifierCase.UPPER;
            } else if (metaData.storesLowerCaseIdentifiers()) {
                identifierCase = IdentifierCase.LOWER;
            } else {
                identifierCase = IdentifierCase.AS_IS;
            }
            return new Style(quote == null || quote.isBlank() ? "" : quote, identifierCase);
        }

        String quote(String identifier) {
            return Arrays.stream(identifier.split("\\."))
                .map(this::quotePart)
                .collect(Collectors.joining("."));
        }

        private String quotePart(String part) {
            String folded;
            switch (identifierCase) {
                case UPPER:
                    folded = part.toUpperCase(Locale.ROOT);
                    break;
                case LOWER:
                    folded = part.toLowerCase(Locale.ROOT);
                    break;
                default:
                    folded = part;
            }
            return quoteString + folded + quoteString;
        }
    }
}
