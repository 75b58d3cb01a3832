package com.ivamare.eventstore.datasource;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Writer and reader connection pools over one SQLite file.
 *
 * <p>All writes go through a single-connection pool so SQLite never sees two
 * writers from this process. Reads use a separate read-only pool; with WAL
 * journaling they do not block on the writer, but may miss a write that has
 * just committed.
 */
public class SqliteDataSources implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

    static final int DEFAULT_READER_POOL_SIZE = 4;

    private final Path path;
    private final HikariDataSource writer;
    private final HikariDataSource reader;

    private SqliteDataSources(Path path, HikariDataSource writer, HikariDataSource reader) {
        this.path = path;
        this.writer = writer;
        this.reader = reader;
    }

    /**
     * Open both pools with the default busy timeout and reader pool size.
     *
     * @param path database file, created if missing
     * @return opened pools
     */
    public static SqliteDataSources open(Path path) {
        return open(path, Duration.ofSeconds(5), DEFAULT_READER_POOL_SIZE);
    }

    /**
     * Open both pools. The writer is opened first so the WAL files exist
     * before the read-only pool connects.
     *
     * @param path database file, created if missing
     * @param busyTimeout how long SQLite waits on a locked database
     * @param readerPoolSize maximum read connections
     * @return opened pools
     */
    public static SqliteDataSources open(Path path, Duration busyTimeout, int readerPoolSize) {
        String url = "jdbc:sqlite:" + path.toAbsolutePath();

        SQLiteConfig writerConfig = new SQLiteConfig();
        writerConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        writerConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        writerConfig.setBusyTimeout((int) busyTimeout.toMillis());
        HikariDataSource writer = pool("eventstore-rw", url, writerConfig, 1, false);

        SQLiteConfig readerConfig = new SQLiteConfig();
        readerConfig.setReadOnly(true);
        readerConfig.setBusyTimeout((int) busyTimeout.toMillis());
        HikariDataSource reader;
        try {
            reader = pool("eventstore-ro", url, readerConfig, readerPoolSize, true);
        } catch (RuntimeException e) {
            writer.close();
            throw e;
        }

        log.info("Opened SQLite database {} (readers={}, busyTimeout={})", path, readerPoolSize, busyTimeout);
        return new SqliteDataSources(path, writer, reader);
    }

    private static HikariDataSource pool(String poolName, String url, SQLiteConfig config, int size,
                                         boolean readOnly) {
        SQLiteDataSource sqlite = new SQLiteDataSource(config);
        sqlite.setUrl(url);

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(poolName);
        hikari.setDataSource(sqlite);
        hikari.setMaximumPoolSize(size);
        hikari.setMinimumIdle(1);
        hikari.setReadOnly(readOnly);
        return new HikariDataSource(hikari);
    }

    public Path path() {
        return path;
    }

    public HikariDataSource writer() {
        return writer;
    }

    public HikariDataSource reader() {
        return reader;
    }

    @Override
    public void close() {
        reader.close();
        writer.close();
        log.info("Closed SQLite database {}", path);
    }
}
