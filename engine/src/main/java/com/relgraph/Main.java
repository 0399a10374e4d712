package com.relgraph;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.relgraph.audit.AuditSink;
import com.relgraph.audit.JdbcAuditSink;
import com.relgraph.audit.LoggingAuditSink;
import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import com.relgraph.config.DatabaseConfig;
import com.relgraph.context.RequestContext;
import com.relgraph.model.HierarchyRule;
import com.relgraph.operations.NamespaceSyncOperation.SyncResult;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Wires the engine for a long-running process.
 *
 * <p>With {@code DB_URL} set, audit events go to the {@code audit_event} table, the namespaces
 * named in {@code RELGRAPH_NAMESPACES} (plus {@code global}) are imported at start and exported
 * again at shutdown. Only namespaces that imported cleanly are exported. Without it the engine
 * runs purely in memory and audits to the log. {@link #main} blocks until the JVM shuts down.
 */
public class Main {

  private static final String SYSTEM_ACTOR = "system";

  private final AuthzServiceImpl service;
  @Nullable private final HikariDataSource dataSource;
  private final List<String> namespaces;
  private final Set<String> loaded = new LinkedHashSet<>();
  private final CountDownLatch stopped = new CountDownLatch(1);

  Main(AuthzServiceImpl service, @Nullable HikariDataSource dataSource, List<String> namespaces) {
    this.service = service;
    this.dataSource = dataSource;
    this.namespaces = namespaces;
  }

  public static Main fromEnvironment(Map<String, String> env) {
    DatabaseConfig dbConfig = DatabaseConfig.fromEnvironment(env);
    HikariDataSource dataSource = dbConfig.isConfigured() ? dbConfig.toDataSource() : null;
    AuditSink auditSink =
        dataSource == null ? new LoggingAuditSink() : new JdbcAuditSink(dataSource);
    if (dataSource == null) {
      Logger.info("DB_URL not set, running in memory with audit events in the log");
    }
    AuthzServiceImpl service =
        new AuthzServiceImpl(AuthzServiceImpl.Config.fromEnvironment(env, auditSink));
    return new Main(service, dataSource, parseNamespaces(env.get("RELGRAPH_NAMESPACES")));
  }

  /** {@code global} first, then the comma-separated tenants in the order given. */
  static List<String> parseNamespaces(@Nullable String raw) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    result.add(HierarchyRule.GLOBAL_NAMESPACE);
    if (raw != null) {
      for (String ns : Splitter.on(',').trimResults().omitEmptyStrings().split(raw)) {
        if (!HierarchyRule.GLOBAL_NAMESPACE.equals(ns)) {
          result.add(ns);
        }
      }
    }
    return result.build();
  }

  public AuthzServiceImpl service() {
    return service;
  }

  List<String> namespaces() {
    return namespaces;
  }

  /** The namespaces whose stored copy was imported, and so may be exported again. */
  synchronized Set<String> loadedNamespaces() {
    return ImmutableSet.copyOf(loaded);
  }

  /**
   * Imports every configured namespace, stopping at the first failure. A no-op without a
   * database.
   */
  public Status load() {
    if (dataSource == null) {
      return Status.ok();
    }
    try (Connection conn = dataSource.getConnection()) {
      for (String ns : namespaces) {
        StatusOr<SyncResult> result = service.importNamespace(systemContext(ns), conn);
        if (result.isNotOk()) {
          Logger.error("Import of namespace {} failed: {}", ns, result.getStatus().getMessage());
          return result.getStatus();
        }
        synchronized (this) {
          loaded.add(ns);
        }
      }
      return Status.ok();
    } catch (SQLException e) {
      Logger.error(e, "Could not obtain a database connection.");
      return Status.internal("Database unavailable: " + e.getMessage(), e);
    }
  }

  /**
   * Exports the namespaces that were imported. A namespace that never loaded is left untouched in
   * the database. A no-op without a database.
   */
  public Status save() {
    Set<String> toSave = loadedNamespaces();
    if (dataSource == null || toSave.isEmpty()) {
      return Status.ok();
    }
    try (Connection conn = dataSource.getConnection()) {
      for (String ns : toSave) {
        StatusOr<SyncResult> result = service.exportNamespace(systemContext(ns), conn);
        if (result.isNotOk()) {
          Logger.error("Export of namespace {} failed: {}", ns, result.getStatus().getMessage());
          return result.getStatus();
        }
      }
      return Status.ok();
    } catch (SQLException e) {
      Logger.error(e, "Could not obtain a database connection.");
      return Status.internal("Database unavailable: " + e.getMessage(), e);
    }
  }

  private static RequestContext systemContext(String ns) {
    return RequestContext.forTenant(ns).withActor(SYSTEM_ACTOR).asPlatform();
  }

  /**
   * Loads the configured namespaces. On failure the pool is closed without exporting anything,
   * so the stored graphs stay as they were.
   */
  Status start() {
    Status loadedStatus = load();
    if (loadedStatus.isError()) {
      closePool();
    }
    return loadedStatus;
  }

  /** Exports the loaded namespaces, then closes the pool. Later calls do nothing. */
  void shutdown() {
    if (dataSource == null || dataSource.isClosed()) {
      stopped.countDown();
      return;
    }
    Status saved = save();
    if (saved.isError()) {
      Logger.error("Namespaces were not saved at shutdown: {}", saved);
    }
    closePool();
    stopped.countDown();
  }

  private void closePool() {
    if (dataSource != null && !dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  /** Blocks until {@link #shutdown()} has run. */
  void awaitShutdown() throws InterruptedException {
    stopped.await();
  }

  public static void main(String[] args) throws InterruptedException {
    Main main = Main.fromEnvironment(System.getenv());
    Status started = main.start();
    if (started.isError()) {
      throw new IllegalStateException("Failed to load namespaces: " + started.getMessage());
    }
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down since JVM is shutting down");
                  try {
                    main.shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
    Logger.info("relgraph engine ready with namespaces {}", main.namespaces());
    main.awaitShutdown();
  }
}
