package io.github.yok.deploykit.core.task;

import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.core.TaskContext;
import io.github.yok.deploykit.core.TaskWork;
import io.github.yok.deploykit.db.ConnectionHandle;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.init.ScriptUtils;

/**
 * Executes a SQL script inside one transaction on the task's single connection.
 *
 * <p>
 * The script is located through a Spring {@link ResourceLoader}, so {@code classpath:} and
 * {@code file:} locations both work. Statements are split by {@link ScriptUtils} on {@code ;}.
 * Any failing statement rolls the whole script back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqlScriptWork implements TaskWork {

    private final ResourceLoader resourceLoader;
    private final String location;

    /**
     * Creates the work.
     *
     * @param resourceLoader loader used to locate the script
     * @param location script location
     * @throws ConfigurationException when the location is blank
     */
    public SqlScriptWork(ResourceLoader resourceLoader, String location) {
        if (StringUtils.isBlank(location)) {
            throw new ConfigurationException("sql-script task requires a script location");
        }
        this.resourceLoader = resourceLoader;
        this.location = location.trim();
    }

    public String getLocation() {
        return location;
    }

    @Override
    public void execute(TaskContext context) throws Exception {
        Resource script = resourceLoader.getResource(location);
        if (!script.exists()) {
            throw new ConfigurationException("SQL script not found: " + location);
        }
        ConnectionHandle handle = context.handle();
        log.info("[{}] Executing SQL script {} on {}", context.getTaskName(), location,
                handle.getName());
        handle.inTransaction(conn -> {
            ScriptUtils.executeSqlScript(conn,
                    new EncodedResource(script, StandardCharsets.UTF_8));
            return null;
        });
    }
}
