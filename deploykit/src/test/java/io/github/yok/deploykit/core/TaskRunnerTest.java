package io.github.yok.deploykit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.credential.DelegatingCredentialResolver;
import io.github.yok.deploykit.db.ConnectionBroker;
import io.github.yok.deploykit.db.ConnectionDescriptor;
import io.github.yok.deploykit.db.ConnectionException;
import io.github.yok.deploykit.db.ConnectionFactory;
import io.github.yok.deploykit.db.ConnectionState;
import io.github.yok.deploykit.db.RetryPolicy;
import java.sql.Connection;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    private ConnectionFactory factory;
    private ConnectionBroker broker;
    private CancellationToken cancellation;
    private RecordingListener listener;
    private TaskRunner runner;
    private List<String> executed;

    @BeforeEach
    void setup() throws Exception {
        factory = mock(ConnectionFactory.class);
        when(factory.open(any(), any())).thenReturn(mock(Connection.class));
        ConnectionDescriptor db = ConnectionDescriptor.builder("db")
                .url("jdbc:postgresql://db.internal/app")
                .retryPolicy(new RetryPolicy(3, Duration.ofMillis(5), 2.0, null, false))
                .build();
        broker = new ConnectionBroker(Collections.singletonList(db), factory,
                DelegatingCredentialResolver.defaults(), delay -> {
                });
        cancellation = new CancellationToken();
        listener = new RecordingListener();
        runner = new TaskRunner(broker, Arrays.asList(listener, new LoggingRunEventListener()),
                Clock.fixed(NOW, ZoneOffset.UTC), cancellation);
        executed = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    private Task ok(String name) {
        return Task.builder(name).connections("db").work(ctx -> {
            assertNotNull(ctx.connection("db"));
            executed.add(name);
        }).build();
    }

    private Task failing(String name, boolean idempotent) {
        return Task.builder(name).connections("db").idempotent(idempotent).work(ctx -> {
            executed.add(name);
            throw new IllegalStateException(name + " exploded");
        }).build();
    }

    private static List<TaskState> states(RunRecord record) {
        List<TaskState> states = new ArrayList<>();
        for (TaskDescriptor task : record.getTasks()) {
            states.add(task.getState());
        }
        return states;
    }

    @Test
    void run_正常ケース_全タスク成功でSUCCESSとなること() {
        RunRecord record = runner.run(Arrays.asList(ok("A"), ok("B"), ok("C")));

        assertEquals(RunOutcome.SUCCESS, record.getOutcome());
        assertFalse(record.isCancelled());
        assertEquals(Arrays.asList("A", "B", "C"), executed);
        assertEquals(Arrays.asList(TaskState.SUCCEEDED, TaskState.SUCCEEDED, TaskState.SUCCEEDED),
                states(record));
        assertEquals(NOW, record.getAsOf());
        assertEquals(1, record.getTasks().get(0).getPosition());
        assertEquals(NOW, record.getTasks().get(0).getStartedAt());
        assertEquals(ConnectionState.CONNECTED, record.getConnections().get(0).getState());
    }

    @Test
    void run_正常ケース_タスク遷移ごとにイベントが発行されること() {
        RunRecord record = runner.run(Arrays.asList(ok("A"), ok("B")));

        assertEquals(1, listener.started);
        assertSame(record, listener.finished);
        assertEquals(Arrays.asList("A:PENDING>RUNNING", "A:RUNNING>SUCCEEDED",
                "B:PENDING>RUNNING", "B:RUNNING>SUCCEEDED"), listener.transitions());
        assertEquals(record.getRunId(), listener.events.get(0).getRunId());
        assertNull(listener.events.get(1).getError());
    }

    @Test
    void run_異常ケース_非冪等タスクの失敗で以降がSKIPPEDとなりFAILUREとなること() {
        RunRecord record = runner.run(Arrays.asList(ok("A"), failing("B", false), ok("C")));

        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertEquals(Arrays.asList("A", "B"), executed);
        assertEquals(Arrays.asList(TaskState.SUCCEEDED, TaskState.FAILED, TaskState.SKIPPED),
                states(record));
        TaskDescriptor b = record.task("B").get();
        TaskException error = assertInstanceOf(TaskException.class, b.getError());
        assertEquals("B", error.getTaskName());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(b.getErrorMessage().contains("B exploded"));
        assertNull(record.task("C").get().getStartedAt());
        assertEquals("B:RUNNING>FAILED", listener.transitions().get(3));
        assertNotNull(listener.events.get(3).getError());
    }

    @Test
    void run_正常ケース_冪等タスクの失敗後に成功があればPARTIAL_FAILUREとなること() {
        RunRecord record = runner.run(Arrays.asList(failing("A", true), ok("B"), ok("C")));

        assertEquals(RunOutcome.PARTIAL_FAILURE, record.getOutcome());
        assertEquals(Arrays.asList("A", "B", "C"), executed);
        assertEquals(Arrays.asList(TaskState.FAILED, TaskState.SUCCEEDED, TaskState.SUCCEEDED),
                states(record));
    }

    @Test
    void run_異常ケース_冪等タスクの失敗後に成功がなければFAILUREとなること() {
        RunRecord record = runner.run(Arrays.asList(ok("A"), failing("B", true)));

        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertEquals(2, record.count(TaskState.SUCCEEDED) + record.count(TaskState.FAILED));
    }

    @Test
    void run_異常ケース_到達不能な接続は3回試行されタスクは実行されないこと() throws Exception {
        when(factory.open(any(), any()))
                .thenThrow(new SQLTransientConnectionException("No route to host", "08001"));

        RunRecord record = runner.run(Arrays.asList(ok("A"), ok("B")));

        verify(factory, times(3)).open(any(), any());
        assertTrue(executed.isEmpty());
        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertEquals(Arrays.asList(TaskState.FAILED, TaskState.SKIPPED), states(record));
        TaskDescriptor a = record.task("A").get();
        ConnectionException error = assertInstanceOf(ConnectionException.class, a.getError());
        assertEquals("db", error.getDescriptorName());
        assertEquals(3, error.getAttempts());
        assertNull(a.getStartedAt());
        assertEquals("A:PENDING>FAILED", listener.transitions().get(0));
        assertEquals(ConnectionState.FAILED, record.getConnections().get(0).getState());
    }

    @Test
    void run_異常ケース_タスク名の重複は実行前にConfigurationExceptionとなること() throws Exception {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> runner.run(Arrays.asList(ok("A"), ok("A"))));

        assertTrue(ex.getMessage().contains("duplicate task name 'A'"));
        RunRecord record = ex.getRunRecord().get();
        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertEquals(Arrays.asList(TaskState.SKIPPED, TaskState.SKIPPED), states(record));
        assertNotNull(record.getFailure());
        assertTrue(executed.isEmpty());
        verify(factory, never()).open(any(), any());
        assertSame(record, listener.finished);
    }

    @Test
    void run_異常ケース_未登録の接続を参照するとConfigurationExceptionとなること() {
        Task stray = Task.builder("stray").connections("nowhere").work(ctx -> {
        }).build();

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> runner.run(Arrays.asList(ok("A"), stray)));

        assertTrue(ex.getMessage().contains("unknown connection 'nowhere'"));
        assertTrue(executed.isEmpty());
    }

    @Test
    void run_正常ケース_キャンセル後の残りタスクはSKIPPEDとなること() {
        Task cancelling = Task.builder("A").work(ctx -> {
            executed.add("A");
            cancellation.cancel("SIGTERM");
            assertTrue(ctx.isCancellationRequested());
        }).build();

        RunRecord record = runner.run(Arrays.asList(cancelling, ok("B"), ok("C")));

        assertTrue(record.isCancelled());
        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertEquals(Arrays.asList("A"), executed);
        assertEquals(Arrays.asList(TaskState.SUCCEEDED, TaskState.SKIPPED, TaskState.SKIPPED),
                states(record));
    }

    @Test
    void run_正常ケース_失敗時もリースが返却されること() {
        runner.run(Arrays.asList(failing("A", true)));

        broker.acquire("db").release();
    }

    @Test
    void run_異常ケース_宣言していない接続を使うとタスクが失敗すること() {
        Task undeclared = Task.builder("A").connections("db").work(ctx -> ctx.connection("other"))
                .build();

        RunRecord record = runner.run(Arrays.asList(undeclared));

        TaskDescriptor a = record.task("A").get();
        assertEquals(TaskState.FAILED, a.getState());
        assertInstanceOf(IllegalArgumentException.class, a.getError().getCause());
    }

    @Test
    void run_異常ケース_AssertionErrorもタスク失敗として記録されること() {
        Task asserting = Task.builder("A").work(ctx -> {
            throw new AssertionError("row count mismatch");
        }).build();

        RunRecord record = runner.run(Arrays.asList(asserting, ok("B")));

        assertEquals(TaskState.FAILED, record.task("A").get().getState());
        assertEquals(TaskState.SKIPPED, record.task("B").get().getState());
    }

    @Test
    void run_異常ケース_Errorを送出したタスクも失敗として記録され実行が継続すること() {
        Task crashing = Task.builder("A").idempotent(true).work(ctx -> {
            throw new Error("boom");
        }).build();

        RunRecord record = runner.run(Arrays.asList(crashing, ok("B")));

        assertEquals(TaskState.FAILED, record.task("A").get().getState());
        assertTrue(record.task("A").get().getErrorMessage().contains("boom"));
        assertEquals(TaskState.SUCCEEDED, record.task("B").get().getState());
        assertEquals(RunOutcome.PARTIAL_FAILURE, record.getOutcome());
        assertSame(record, listener.finished);
    }

    @Test
    void run_異常ケース_StackOverflowErrorで非冪等タスクが失敗すると以降がSKIPPEDとなること() {
        Task recursive = Task.builder("A").connections("db").work(ctx -> {
            throw new StackOverflowError();
        }).build();

        RunRecord record = runner.run(Arrays.asList(recursive, ok("B")));

        assertEquals(Arrays.asList(TaskState.FAILED, TaskState.SKIPPED), states(record));
        assertEquals(RunOutcome.FAILURE, record.getOutcome());
        assertTrue(record.getTasks().get(0).getErrorMessage()
                .contains(StackOverflowError.class.getName()));
        assertNotNull(broker.acquire("db"));
    }

    @Test
    void run_正常ケース_リスナの例外は実行を妨げないこと() {
        RunEventListener broken = new RunEventListener() {
            @Override
            public void onRunStarted(String runId, int taskCount, Instant startedAt) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void onTaskTransition(TaskEvent event) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void onRunFinished(RunRecord record) {
                throw new IllegalStateException("sink down");
            }
        };
        TaskRunner withBroken = new TaskRunner(broker, Arrays.asList(broken),
                Clock.fixed(NOW, ZoneOffset.UTC), cancellation);

        RunRecord record = withBroken.run(Arrays.asList(ok("A")));

        assertEquals(RunOutcome.SUCCESS, record.getOutcome());
    }

    @Test
    void run_正常ケース_指定したasOfが記録され記録は変更できないこと() {
        Instant asOf = Instant.parse("2026-02-28T00:00:00Z");

        RunRecord record = runner.run(Arrays.asList(ok("A")), asOf);

        assertEquals(asOf, record.getAsOf());
        assertThrows(UnsupportedOperationException.class,
                () -> record.getTasks().add(record.getTasks().get(0)));
        assertThrows(IllegalStateException.class, () -> record.getTasks().get(0)
                .transition(TaskState.FAILED, NOW, null));
    }

    @Test
    void run_正常ケース_タスクが空の場合はSUCCESSとなること() {
        RunRecord record = runner.run(Collections.emptyList());

        assertEquals(RunOutcome.SUCCESS, record.getOutcome());
        assertTrue(record.getTasks().isEmpty());
    }

    private static final class RecordingListener implements RunEventListener {

        private int started;
        private RunRecord finished;
        private final List<TaskEvent> events = new ArrayList<>();

        @Override
        public void onRunStarted(String runId, int taskCount, Instant startedAt) {
            started++;
        }

        @Override
        public void onTaskTransition(TaskEvent event) {
            events.add(event);
        }

        @Override
        public void onRunFinished(RunRecord record) {
            finished = record;
        }

        private List<String> transitions() {
            List<String> result = new ArrayList<>();
            for (TaskEvent event : events) {
                result.add(event.getTaskName() + ":" + event.getFrom() + ">" + event.getTo());
            }
            return result;
        }
    }
}
