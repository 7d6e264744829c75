package net.cronhook.adapter.jdbc;

import net.cronhook.core.spi.BrokerSchema;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/** 공유 큐 테이블 마이그레이션 (db/migration/cronhook) */
public final class FlywayBrokerSchema implements BrokerSchema {
    private static final Logger log = LoggerFactory.getLogger(FlywayBrokerSchema.class);

    public static final String LOCATION = "classpath:db/migration/cronhook";
    public static final String HISTORY_TABLE = "cronhook_schema_history";

    private final DataSource ds;

    public FlywayBrokerSchema(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public void migrate() {
        MigrateResult result = Flyway.configure()
                .dataSource(ds)
                .locations(LOCATION)
                .table(HISTORY_TABLE)
                .baselineOnMigrate(true)
                .baselineVersion("0") // 다른 테이블이 있는 스키마에서도 V1부터 적용
                .load()
                .migrate();
        log.info("Broker schema at version {} ({} migrations applied)", result.targetSchemaVersion, result.migrationsExecuted);
    }
}
