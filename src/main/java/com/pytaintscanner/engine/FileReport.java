package com.pytaintscanner.engine;

import com.pytaintscanner.model.FileError;
import com.pytaintscanner.model.Finding;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.ScanStats;
import com.pytaintscanner.model.SkippedFile;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** What one file contributed to a scan. At most one of graph, skipped and error ends up set. */
@Data
public class FileReport {
    private final String file;
    private IrGraph graph;
    private SkippedFile skipped;
    private FileError error;
    private List<Finding> findings = new ArrayList<>();
    private ScanStats stats = new ScanStats();

    public boolean isReady() {
        return graph != null && error == null;
    }

    void fail(String stage, String message) {
        graph = null;
        findings = new ArrayList<>();
        error = new FileError(file, stage, message);
    }
}
