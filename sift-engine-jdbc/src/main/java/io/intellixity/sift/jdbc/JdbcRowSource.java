package io.intellixity.sift.jdbc;

import io.intellixity.sift.error.SourceException;
import io.intellixity.sift.jdbc.dialect.SqlDialect;
import io.intellixity.sift.memory.Coercions;
import io.intellixity.sift.memory.RowSource;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.FieldDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * Table scans over JDBC for in-process evaluation of plans the dialect declined.\n
 *
 * A session holds one connection; every scan runs {@code SELECT <columns> FROM <table>} and
 * streams it. Statements close when drained, and whatever is still open closes with the session.\n
 */
public final class JdbcRowSource implements RowSource {
  private static final Logger log = LoggerFactory.getLogger(JdbcRowSource.class);

  private final JdbcHandle handle;
  private final SqlDialect dialect;
  private final int fetchSize;

  public JdbcRowSource(JdbcHandle handle, SqlDialect dialect, int fetchSize) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.fetchSize = fetchSize;
  }

  /** Scan query for one entity. */
  public String scanSql(EntityDescriptor entity) {
    List<String> cols = new ArrayList<>(entity.fields().size());
    for (FieldDef f : entity.fields()) cols.add(dialect.quoteIdent(f.column()));
    return "SELECT " + String.join(", ", cols) + " FROM " + dialect.quoteIdent(entity.source());
  }

  @Override
  public Session openSession() {
    Connection c;
    try {
      c = handle.client().getConnection();
      if (handle.schema() != null) c.setSchema(handle.schema());
    } catch (SQLException e) {
      throw new SourceException("Cannot open connection for " + handle.id() + ": " + e.getMessage(), e);
    }
    return new JdbcSession(c);
  }

  private final class JdbcSession implements Session {
    private final Connection conn;
    private final List<Statement> open = new ArrayList<>();

    JdbcSession(Connection conn) {
      this.conn = conn;
    }

    @Override
    public Iterator<Object[]> scan(EntityDescriptor entity) {
      String sql = scanSql(entity);
      if (log.isDebugEnabled()) log.debug("sift.jdbc op=scan handleId={} entity={} sql={}", handle.id(), entity.name(), sql);
      try {
        Statement st = conn.createStatement();
        open.add(st);
        if (fetchSize > 0) st.setFetchSize(fetchSize);
        ResultSet rs = st.executeQuery(sql);
        return new RowIterator(entity, st, rs);
      } catch (SQLException e) {
        throw new SourceException("Scan of " + entity.name() + " failed: " + e.getMessage(), e);
      }
    }

    @Override
    public void close() {
      SQLException first = null;
      for (Statement st : open) {
        try {
          st.close();
        } catch (SQLException e) {
          if (first == null) first = e;
        }
      }
      open.clear();
      try {
        conn.close();
      } catch (SQLException e) {
        if (first == null) first = e;
      }
      if (first != null) throw new SourceException("Closing connection for " + handle.id() + " failed: " + first.getMessage(), first);
    }

    private final class RowIterator implements Iterator<Object[]> {
      private final EntityDescriptor entity;
      private final Statement st;
      private final ResultSet rs;
      private Object[] next;
      private boolean done;

      RowIterator(EntityDescriptor entity, Statement st, ResultSet rs) {
        this.entity = entity;
        this.st = st;
        this.rs = rs;
      }

      @Override
      public boolean hasNext() {
        if (next != null) return true;
        if (done) return false;
        try {
          if (!rs.next()) {
            done = true;
            open.remove(st);
            st.close();
            return false;
          }
          List<FieldDef> fields = entity.fields();
          Object[] row = new Object[fields.size()];
          for (int i = 0; i < row.length; i++) row[i] = Coercions.coerce(rs.getObject(i + 1), fields.get(i).type());
          next = row;
          return true;
        } catch (SQLException e) {
          throw new SourceException("Scan of " + entity.name() + " failed: " + e.getMessage(), e);
        }
      }

      @Override
      public Object[] next() {
        if (!hasNext()) throw new NoSuchElementException();
        Object[] r = next;
        next = null;
        return r;
      }
    }
  }
}
