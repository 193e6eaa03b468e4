package chatfeed.listener;

import chatfeed.spi.ChangeChannel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ChangeChannel}: {@link #send} and {@link #push} enqueue payloads that the
 * next {@link #receive} returns. {@link #dropConnection()} makes the current listen
 * connection fail on its next receive.
 */
final class StubChangeChannel implements ChangeChannel {
  final LinkedBlockingQueue<String> pending = new LinkedBlockingQueue<>();
  final List<String> sent = new CopyOnWriteArrayList<>();
  final List<String> calls = new CopyOnWriteArrayList<>();
  final AtomicInteger listens = new AtomicInteger();
  final AtomicInteger unlistens = new AtomicInteger();
  final AtomicInteger failNextListens = new AtomicInteger();
  private final Set<Connection> broken = ConcurrentHashMap.newKeySet();
  private volatile Connection listening;

  @Override
  public void listen(Connection conn, String channel) throws SQLException {
    calls.add("listen:" + channel);
    if (failNextListens.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new SQLException("LISTEN refused");
    }
    listens.incrementAndGet();
    listening = conn;
  }

  @Override
  public void unlisten(Connection conn, String channel) {
    calls.add("unlisten:" + channel);
    unlistens.incrementAndGet();
  }

  @Override
  public List<String> receive(Connection conn, String channel, int timeoutMs) throws SQLException {
    if (conn.isClosed()) {
      throw new SQLException("This connection has been closed.");
    }
    if (broken.contains(conn)) {
      throw new SQLException("An I/O error occurred while sending to the backend.");
    }
    String first;
    try {
      first = pending.poll(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return List.of();
    }
    if (first == null) {
      return List.of();
    }
    List<String> payloads = new ArrayList<>();
    payloads.add(first);
    pending.drainTo(payloads);
    return payloads;
  }

  @Override
  public void send(Connection conn, String channel, String payload) {
    calls.add("send:" + channel);
    sent.add(payload);
    pending.add(payload);
  }

  void push(String payload) {
    pending.add(payload);
  }

  Connection listeningConnection() {
    return listening;
  }

  void dropConnection() {
    Connection conn = listening;
    if (conn != null) {
      broken.add(conn);
    }
  }
}
