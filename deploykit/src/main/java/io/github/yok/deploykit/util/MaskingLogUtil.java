package io.github.yok.deploykit.util;

import io.github.yok.deploykit.db.ConnectionDescriptor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Renders connection details for logs without leaking secrets.
 *
 * <p>
 * JDBC URLs have embedded credentials and {@code password=} parameters replaced by {@code ***}.
 * Credential references are shown by scheme only, because a mistyped reference may well be the
 * secret itself.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches embedded credentials in authority-style JDBC URLs.
     */
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#@;]+:)([^@/;]+)(@.*)", Pattern.CASE_INSENSITIVE);
    /**
     * Pattern that matches password parameters in JDBC URLs, query or semicolon style.
     */
    private static final Pattern PASSWORD_PARAM_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        Matcher paramMatcher = PASSWORD_PARAM_PATTERN.matcher(masked);
        if (paramMatcher.find()) {
            masked = paramMatcher.replaceAll("$1***");
        }
        return masked;
    }

    /**
     * Reduces a credential reference to its scheme.
     *
     * @param credentialRef credential reference
     * @return e.g. {@code env:***}, {@code <none>} when absent
     */
    public static String maskCredentialRef(String credentialRef) {
        if (credentialRef == null || credentialRef.isEmpty()) {
            return "<none>";
        }
        int idx = credentialRef.indexOf(':');
        if (idx <= 0) {
            return "***";
        }
        return credentialRef.substring(0, idx + 1) + "***";
    }

    /**
     * Formats a connection descriptor for logging.
     *
     * @param descriptor connection descriptor
     * @return log string
     */
    public static String describe(ConnectionDescriptor descriptor) {
        if (descriptor == null) {
            return "<null>";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("name=").append(descriptor.getName());
        builder.append(", kind=").append(descriptor.getDriverKind());
        builder.append(", url=").append(maskJdbcUrl(descriptor.toJdbcUrl()));
        builder.append(", user=").append(descriptor.getUser());
        builder.append(", credential=").append(maskCredentialRef(descriptor.getCredentialRef()));
        builder.append(", maxAttempts=").append(descriptor.getRetryPolicy().getMaxAttempts());
        return builder.toString();
    }
}
