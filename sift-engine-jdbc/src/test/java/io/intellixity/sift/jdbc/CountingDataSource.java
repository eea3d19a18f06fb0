package io.intellixity.sift.jdbc;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/** Delegating DataSource that counts handed-out and still-open connections. */
final class CountingDataSource implements DataSource {
  private final DataSource delegate;
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger open = new AtomicInteger();
  private volatile boolean broken;

  CountingDataSource(DataSource delegate) {
    this.delegate = delegate;
  }

  int opened() { return opened.get(); }

  int open() { return open.get(); }

  /** Makes every later {@link #getConnection()} fail. */
  void breakIt() { broken = true; }

  @Override
  public Connection getConnection() throws SQLException {
    if (broken) throw new SQLException("connection refused");
    Connection c = delegate.getConnection();
    opened.incrementAndGet();
    open.incrementAndGet();
    AtomicBoolean closed = new AtomicBoolean();
    return (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(), new Class<?>[] {Connection.class},
        (proxy, method, args) -> {
          if (method.getName().equals("close") && closed.compareAndSet(false, true)) open.decrementAndGet();
          try {
            return method.invoke(c, args);
          } catch (InvocationTargetException e) {
            throw e.getCause();
          }
        });
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return getConnection();
  }

  @Override public PrintWriter getLogWriter() throws SQLException { return delegate.getLogWriter(); }
  @Override public void setLogWriter(PrintWriter out) throws SQLException { delegate.setLogWriter(out); }
  @Override public void setLoginTimeout(int seconds) throws SQLException { delegate.setLoginTimeout(seconds); }
  @Override public int getLoginTimeout() throws SQLException { return delegate.getLoginTimeout(); }
  @Override public Logger getParentLogger() throws SQLFeatureNotSupportedException { return delegate.getParentLogger(); }
  @Override public <T> T unwrap(Class<T> iface) throws SQLException { return delegate.unwrap(iface); }
  @Override public boolean isWrapperFor(Class<?> iface) throws SQLException { return delegate.isWrapperFor(iface); }
}
