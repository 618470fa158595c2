package io.github.yok.deploykit.core.task;

import com.google.common.collect.ImmutableList;
import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.core.TaskContext;
import io.github.yok.deploykit.core.TaskWork;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies that every listed table exists and can be queried.
 *
 * <p>
 * Each table is probed with a query that returns no rows. Every missing table is collected before
 * the work fails, so one run reports them all. Table names are restricted to plain, optionally
 * schema-qualified identifiers because they are placed into SQL text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableCheckWork implements TaskWork {

    /** Accepted table identifier, optionally qualified with dots. */
    static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][A-Za-z0-9_.]*$");

    private final List<String> tables;

    /**
     * Creates the work.
     *
     * @param tables tables to check
     * @throws ConfigurationException when the list is empty or a name is not a plain identifier
     */
    public TableCheckWork(List<String> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new ConfigurationException("table-check task requires at least one table");
        }
        for (String table : tables) {
            if (table == null || !IDENTIFIER.matcher(table).matches()) {
                throw new ConfigurationException("Invalid table identifier: " + table);
            }
        }
        this.tables = ImmutableList.copyOf(tables);
    }

    public List<String> getTables() {
        return tables;
    }

    @Override
    public void execute(TaskContext context) throws Exception {
        Connection conn = context.connection();
        List<String> missing = new ArrayList<>();
        for (String table : tables) {
            try (Statement st = conn.createStatement()) {
                st.executeQuery("SELECT 1 FROM " + table + " WHERE 1 = 0").close();
                log.info("[{}] Table present: {}", context.getTaskName(), table);
            } catch (SQLException e) {
                log.warn("[{}] Table missing or unreadable: {} ({})", context.getTaskName(),
                        table, e.getMessage());
                missing.add(table);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing tables: " + missing);
        }
    }
}
