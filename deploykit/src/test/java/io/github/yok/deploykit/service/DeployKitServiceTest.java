package io.github.yok.deploykit.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.deploykit.config.ConnectionConfig;
import io.github.yok.deploykit.config.ConnectionConfigValidator;
import io.github.yok.deploykit.config.RunnerConfig;
import io.github.yok.deploykit.core.TaskWork;
import io.github.yok.deploykit.credential.DelegatingCredentialResolver;
import io.github.yok.deploykit.db.ConnectionBroker;
import io.github.yok.deploykit.db.ConnectionDescriptor;
import io.github.yok.deploykit.db.Sleeper;
import io.github.yok.deploykit.util.ErrorHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverManager;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.yaml.snakeyaml.Yaml;

class DeployKitServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    @TempDir
    Path tempDir;

    private final FakeProcessControl process = new FakeProcessControl();
    private final StaticListableBeanFactory beans = new StaticListableBeanFactory();
    private ConnectionConfig connectionConfig;
    private RunnerConfig runnerConfig;
    private BrokerFactory brokerFactory;

    @BeforeEach
    void setup() {
        ErrorHandler.restoreForCurrentThread();
        ConnectionConfig.Entry warehouse = new ConnectionConfig.Entry();
        warehouse.setName("warehouse");
        warehouse.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        warehouse.setDriverClass("org.h2.Driver");
        connectionConfig = new ConnectionConfig();
        connectionConfig.setConnections(new ArrayList<>(Collections.singletonList(warehouse)));

        runnerConfig = new RunnerConfig();
        runnerConfig.setRecordPath(tempDir.resolve("default.yml").toString());
        runnerConfig.setTasks(new ArrayList<>(Arrays.asList(
                task("create", "sql-script", false, "classpath:sql/create_scores.sql"),
                task("check", "table-check", true, null))));
        runnerConfig.getTasks().get(1).setTables(Collections.singletonList("predictions"));

        brokerFactory = new BrokerFactory(
                (d, password) -> DriverManager.getConnection(d.toJdbcUrl(), "sa", ""),
                DelegatingCredentialResolver.defaults(), Sleeper.THREAD);
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreForCurrentThread();
    }

    private static RunnerConfig.TaskEntry task(String name, String type, boolean idempotent,
            String script) {
        RunnerConfig.TaskEntry entry = new RunnerConfig.TaskEntry();
        entry.setName(name);
        entry.setType(type);
        entry.setIdempotent(idempotent);
        entry.setConnections(new ArrayList<>(Collections.singletonList("warehouse")));
        entry.setScript(script);
        return entry;
    }

    private DeployKitService service() {
        return new DeployKitService(connectionConfig, runnerConfig,
                new ConnectionConfigValidator(),
                new TaskCatalog(new DefaultResourceLoader(), beans), brokerFactory, process,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> readRecord(Path path) throws Exception {
        return new Yaml().load(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    @Test
    void execute_正常ケース_全タスク成功で0を返し記録が書き出されること() throws Exception {
        int code = service().execute(new RunRequest());

        assertEquals(0, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("SUCCESS", record.get("outcome"));
        assertEquals("2026-03-01T06:00:00Z", record.get("asOf"));
        assertTrue(process.hooks.isEmpty());
        assertEquals(1, process.removed.size());
        assertTrue(process.halts().isEmpty());
    }

    @Test
    void execute_正常ケース_引数の記録先とasOfが優先されること() throws Exception {
        RunRequest request = new RunRequest();
        request.setRecordPath(tempDir.resolve("out/run.yml").toString());
        request.setAsOf(Instant.parse("2026-02-28T00:00:00Z"));
        request.setTasks(Collections.singletonList("create"));

        int code = service().execute(request);

        assertEquals(0, code);
        assertFalse(Files.exists(tempDir.resolve("default.yml")));
        Map<String, Object> record = readRecord(tempDir.resolve("out/run.yml"));
        assertEquals("2026-02-28T00:00:00Z", record.get("asOf"));
        assertEquals(1, ((List<?>) record.get("tasks")).size());
    }

    @Test
    void execute_正常ケース_冪等タスクの失敗後に成功があれば2を返すこと() throws Exception {
        runnerConfig.getTasks().add(0,
                task("broken", "sql-script", true, "classpath:sql/broken.sql"));

        int code = service().execute(new RunRequest());

        assertEquals(2, code);
        assertEquals("PARTIAL_FAILURE",
                readRecord(tempDir.resolve("default.yml")).get("outcome"));
    }

    @Test
    void execute_異常ケース_非冪等タスクの失敗で1を返し後続がスキップされること() throws Exception {
        runnerConfig.getTasks().add(0,
                task("broken", "sql-script", false, "classpath:sql/broken.sql"));

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("FAILURE", record.get("outcome"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tasks = (List<Map<String, Object>>) record.get("tasks");
        assertEquals("FAILED", tasks.get(0).get("state"));
        assertEquals("SKIPPED", tasks.get(1).get("state"));
        assertEquals("SKIPPED", tasks.get(2).get("state"));
    }

    @Test
    void execute_異常ケース_設定エラーは1を返し拒否された記録が書き出されること() throws Exception {
        runnerConfig.getTasks().add(task("shell", "shell", false, null));

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("FAILURE", record.get("outcome"));
        assertTrue(String.valueOf(record.get("failure")).contains("Unknown type 'shell'"));
        assertEquals(Collections.emptyList(), record.get("tasks"));
        assertTrue(process.hooks.isEmpty());
    }

    @Test
    void execute_異常ケース_未知の接続を参照した場合は全タスクがスキップされること() throws Exception {
        runnerConfig.getTasks().get(1).setConnections(Collections.singletonList("archive"));

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertTrue(String.valueOf(record.get("failure"))
                .contains("references unknown connection 'archive'"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tasks = (List<Map<String, Object>>) record.get("tasks");
        assertEquals("SKIPPED", tasks.get(0).get("state"));
        assertEquals("SKIPPED", tasks.get(1).get("state"));
    }

    @Test
    void execute_異常ケース_接続できない場合はタスクが失敗し接続状態が記録されること() throws Exception {
        ConnectionConfig.Retry retry = new ConnectionConfig.Retry();
        retry.setMaxAttempts(1);
        connectionConfig.getConnections().get(0).setRetry(retry);
        brokerFactory = new BrokerFactory((d, password) -> {
            throw new SQLTransientConnectionException("connection refused", "08001");
        }, DelegatingCredentialResolver.defaults(), Sleeper.THREAD);

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> connections =
                (List<Map<String, Object>>) record.get("connections");
        assertEquals("FAILED", connections.get(0).get("state"));
        assertEquals(1, connections.get(0).get("attempts"));
    }

    @Test
    void execute_異常ケース_タスクがErrorを送出しても記録が確定し1を返すこと() throws Exception {
        TaskWork crash = ctx -> {
            throw new Error("boom");
        };
        beans.addBean("crash", crash);
        RunnerConfig.TaskEntry crashEntry = task("crash", "bean", false, null);
        crashEntry.setBean("crash");
        runnerConfig.getTasks().add(0, crashEntry);

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("FAILURE", record.get("outcome"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tasks = (List<Map<String, Object>>) record.get("tasks");
        assertEquals("FAILED", tasks.get(0).get("state"));
        assertTrue(String.valueOf(tasks.get(0).get("error")).contains("boom"));
        assertEquals("SKIPPED", tasks.get(1).get("state"));
        assertTrue(process.hooks.isEmpty());
    }

    @Test
    void execute_異常ケース_Errorが実行の外で発生しても拒否された記録が書き出されること()
            throws Exception {
        brokerFactory = new BrokerFactory((d, password) -> {
            throw new SQLTransientConnectionException("unreachable", "08001");
        }, DelegatingCredentialResolver.defaults(), Sleeper.THREAD) {
            @Override
            public ConnectionBroker create(List<ConnectionDescriptor> descriptors) {
                throw new NoClassDefFoundError("org/h2/Driver");
            }
        };

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("FAILURE", record.get("outcome"));
        assertTrue(String.valueOf(record.get("failure")).contains("org/h2/Driver"));
        assertTrue(process.hooks.isEmpty());
    }

    @Test
    void execute_異常ケース_部分失敗の終了コードが0の場合は実行せず1を返すこと() throws Exception {
        runnerConfig.getExitCodes().setPartialFailure(0);

        int code = service().execute(new RunRequest());

        assertEquals(1, code);
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals("FAILURE", record.get("outcome"));
        assertTrue(String.valueOf(record.get("failure")).contains("must be non-zero"));
        assertEquals(Collections.emptyList(), record.get("tasks"));
    }

    @Test
    void execute_異常ケース_ErrorHandlerが例外送出モードでも記録と解除が行われること() {
        ErrorHandler.throwForCurrentThread();
        runnerConfig.getTasks().add(task("shell", "shell", false, null));

        DeployKitService service = service();
        assertThrows(IllegalStateException.class, () -> service.execute(new RunRequest()));

        assertTrue(Files.exists(tempDir.resolve("default.yml")));
        assertTrue(process.hooks.isEmpty());
    }

    @Test
    void execute_正常ケース_シャットダウン要求で残りがスキップされ143となること() throws Exception {
        AtomicReference<Thread> hook = new AtomicReference<>();
        TaskWork stop = ctx -> {
            Thread shutdown = process.hooks.get(0);
            hook.set(shutdown);
            shutdown.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!ctx.isCancellationRequested() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
        };
        beans.addBean("stop", stop);
        RunnerConfig.TaskEntry stopEntry = task("stop", "bean", true, null);
        stopEntry.setConnections(new ArrayList<>());
        stopEntry.setBean("stop");
        runnerConfig.getTasks().add(0, stopEntry);

        int code = service().execute(new RunRequest());
        hook.get().join(5000);

        assertEquals(143, code);
        assertEquals(Collections.singletonList(143), process.halts());
        Map<String, Object> record = readRecord(tempDir.resolve("default.yml"));
        assertEquals(Boolean.TRUE, record.get("cancelled"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tasks = (List<Map<String, Object>>) record.get("tasks");
        assertEquals("SUCCEEDED", tasks.get(0).get("state"));
        assertEquals("SKIPPED", tasks.get(1).get("state"));
    }
}
