/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.sql.DataSource;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;

import static tracestore.storage.postgres.Schema.SPAN_TAG;

final class HasSpanTags {
  static final Logger LOG = Logger.getLogger(HasSpanTags.class.getName());
  static final String MESSAGE =
    """
    span_tags doesn't exist, so spans are returned without tags and tag queries are rejected. \
    Execute: CREATE TABLE span_tags (
      span_id BIGINT NOT NULL,
      tag_key VARCHAR(255) NOT NULL,
      tag_value VARCHAR(255) NOT NULL
    );
    CREATE INDEX span_tags_span_id ON span_tags (span_id);
    CREATE INDEX span_tags_key_value ON span_tags (tag_key, tag_value);\
    """;

  /** PostgreSQL reports undefined_table, H2 and others the ANSI base table not found. */
  static boolean isMissingTable(String sqlState) {
    return "42P01".equals(sqlState) || "42S02".equals(sqlState);
  }

  static boolean test(DataSource datasource, DSLContexts context) {
    try (Connection conn = datasource.getConnection()) {
      DSLContext dsl = context.get(conn);
      dsl.select(SPAN_TAG.spanId).from(SPAN_TAG.table).limit(1).fetchAny();
      return true;
    } catch (DataAccessException e) {
      if (isMissingTable(e.sqlState())) {
        LOG.warning(MESSAGE);
        return false;
      }
      problemReading(e);
    } catch (SQLException | RuntimeException e) {
      problemReading(e);
    }
    return false;
  }

  static void problemReading(Exception e) {
    LOG.log(Level.WARNING, "problem reading span_tags", e);
  }
}
