package io.github.yok.deploykit.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Per-invocation options parsed from the command line.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class RunRequest {
    // Selected task names; empty means all
    private List<String> tasks = new ArrayList<>();
    // Record path override; the configured path when null
    private String recordPath;
    // As-of instant; the run start when null
    private Instant asOf;
}
