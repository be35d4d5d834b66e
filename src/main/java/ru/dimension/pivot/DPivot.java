package ru.dimension.pivot;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.dbcp2.BasicDataSource;
import ru.dimension.pivot.backend.BType;
import ru.dimension.pivot.config.DPivotConfig;
import ru.dimension.pivot.core.DashboardEngine;
import ru.dimension.pivot.core.PivotEngine;
import ru.dimension.pivot.registry.SchemaRegistry;
import ru.dimension.pivot.service.ConfigRepository;
import ru.dimension.pivot.service.SchemaValidationService;
import ru.dimension.pivot.service.impl.InMemoryConfigRepository;
import ru.dimension.pivot.service.impl.QueryCompilerImpl;
import ru.dimension.pivot.service.impl.ResponseAssemblerImpl;
import ru.dimension.pivot.service.impl.RollupBuilderImpl;
import ru.dimension.pivot.service.impl.SchemaValidationServiceImpl;
import ru.dimension.pivot.storage.ExecutionAdapter;
import ru.dimension.pivot.storage.dialect.ClickHouseDialect;
import ru.dimension.pivot.storage.dialect.DatabaseDialect;
import ru.dimension.pivot.storage.dialect.GenericDialect;
import ru.dimension.pivot.storage.dialect.MsSqlDialect;
import ru.dimension.pivot.storage.dialect.MySqlDialect;
import ru.dimension.pivot.storage.dialect.OracleDialect;
import ru.dimension.pivot.storage.jdbc.JdbcExecutionAdapter;

@Log4j2
public class DPivot implements AutoCloseable {

  private final DPivotConfig dPivotConfig;
  private final ExecutorService executorService;
  private final SchemaValidationService schemaValidationService;

  @Getter
  private final DashboardEngine engine;

  @Getter
  private final ConfigRepository configRepository;

  /**
   * Engine over a caller supplied execution adapter, queries are compiled with the generic dialect
   */
  public DPivot(DPivotConfig dPivotConfig, SchemaRegistry schemaRegistry, ExecutionAdapter executionAdapter) {
    this.dPivotConfig = dPivotConfig;
    this.executorService = null;
    this.schemaValidationService = null;
    this.configRepository = new InMemoryConfigRepository(Clock.system(dPivotConfig.getDefaultZone()));
    this.engine = createEngine(schemaRegistry, new GenericDialect(), executionAdapter);
  }

  public DPivot(DPivotConfig dPivotConfig,
                SchemaRegistry schemaRegistry,
                BType backendType,
                BasicDataSource basicDataSource) {
    this.dPivotConfig = dPivotConfig;

    DatabaseDialect databaseDialect = switch (backendType) {
      case H2, POSTGRES -> new GenericDialect();
      case MYSQL -> new MySqlDialect();
      case CLICKHOUSE -> new ClickHouseDialect();
      case ORACLE -> new OracleDialect();
      case MSSQL -> new MsSqlDialect();
    };

    this.executorService = Executors.newFixedThreadPool(dPivotConfig.getExecutorThreads());
    this.schemaValidationService = new SchemaValidationServiceImpl(schemaRegistry, basicDataSource);
    this.configRepository = new InMemoryConfigRepository(Clock.system(dPivotConfig.getDefaultZone()));

    ExecutionAdapter executionAdapter = new JdbcExecutionAdapter(basicDataSource,
                                                                 databaseDialect,
                                                                 executorService,
                                                                 dPivotConfig.getQueryTimeout());
    this.engine = createEngine(schemaRegistry, databaseDialect, executionAdapter);

    log.info("Pivot engine started for " + backendType + " with " + dPivotConfig.getExecutorThreads() + " threads");
  }

  /**
   * Available only when the engine owns the JDBC data source
   */
  public Optional<SchemaValidationService> getSchemaValidationService() {
    return Optional.ofNullable(schemaValidationService);
  }

  private DashboardEngine createEngine(SchemaRegistry schemaRegistry,
                                       DatabaseDialect databaseDialect,
                                       ExecutionAdapter executionAdapter) {
    Clock clock = Clock.system(dPivotConfig.getDefaultZone());
    return new PivotEngine(dPivotConfig,
                           schemaRegistry,
                           new QueryCompilerImpl(schemaRegistry, databaseDialect, clock),
                           new RollupBuilderImpl(dPivotConfig.getNoValueLabel()),
                           new ResponseAssemblerImpl(),
                           executionAdapter);
  }

  @Override
  public void close() {
    if (executorService == null) {
      return;
    }
    executorService.shutdownNow();
    try {
      if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Query executor did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping query executor");
    }
  }
}
