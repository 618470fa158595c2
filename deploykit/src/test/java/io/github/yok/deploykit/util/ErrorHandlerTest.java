package io.github.yok.deploykit.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void fatal_異常ケース_throw有効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.throwForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.fatal("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.fatal("boom2"));
            assertEquals("boom2", ex2.getMessage());
        } finally {
            ErrorHandler.restoreForCurrentThread();
        }
    }

    @Test
    void fatal_正常ケース_Throwableありを指定する_標準エラーへ根本原因が出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.fatal("boom", new IllegalStateException("wrapper",
                    new IllegalArgumentException("root")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("root"));
    }

    @Test
    void fatal_正常ケース_メッセージのみを指定する_例外が送出されないこと() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.fatal("boom2");
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("ERROR: boom2"));
    }
}
