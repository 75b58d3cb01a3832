package com.ivamare.eventstore.datasource;

import com.ivamare.eventstore.context.OperationContext;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.util.List;

/**
 * JdbcTemplate wrapper that checks the operation context before each
 * statement and bounds the statement with the context deadline.
 */
public class ContextualJdbc {

    private final JdbcTemplate jdbcTemplate;

    public ContextualJdbc(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    public ContextualJdbc(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public int update(OperationContext ctx, String operation, String sql, Object... args) {
        ctx.checkActive(operation);
        return jdbcTemplate.update(statement(ctx, sql, args));
    }

    public <T> T query(OperationContext ctx, String operation, String sql,
                       ResultSetExtractor<T> extractor, Object... args) {
        ctx.checkActive(operation);
        return jdbcTemplate.query(statement(ctx, sql, args), extractor);
    }

    public <T> List<T> query(OperationContext ctx, String operation, String sql,
                             RowMapper<T> rowMapper, Object... args) {
        return query(ctx, operation, sql, new RowMapperResultSetExtractor<>(rowMapper), args);
    }

    private static PreparedStatementCreator statement(OperationContext ctx, String sql, Object... args) {
        return con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            int timeout = ctx.queryTimeoutSeconds();
            if (timeout > 0) {
                ps.setQueryTimeout(timeout);
            }
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            return ps;
        };
    }
}
