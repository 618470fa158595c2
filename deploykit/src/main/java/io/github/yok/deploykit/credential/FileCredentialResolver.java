package io.github.yok.deploykit.credential;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves {@code file:/path} references by reading a mounted secret file.
 *
 * <p>
 * The file content is used with trailing line breaks removed, which matches how container
 * orchestrators mount secrets (for example under {@code /secrets}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileCredentialResolver implements CredentialResolver {

    /** Reference scheme handled by this resolver. */
    public static final String SCHEME = "file:";

    @Override
    public boolean supports(String reference) {
        return reference != null && reference.startsWith(SCHEME);
    }

    @Override
    public String resolve(String reference) {
        String location = StringUtils.removeStart(reference, SCHEME).trim();
        if (location.isEmpty()) {
            throw new CredentialResolutionException(
                    "File path is missing in credential reference: " + reference);
        }
        Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            throw new CredentialResolutionException("Secret file not found: " + path);
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("Read secret file {}", path);
            return StringUtils.stripEnd(content, "\r\n");
        } catch (IOException e) {
            throw new CredentialResolutionException("Failed to read secret file: " + path, e);
        }
    }
}
