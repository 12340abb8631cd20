package com.stagegate.core.collaborator;

import java.nio.file.Path;

/**
 * @param passed  number of passing tests
 * @param failed  number of failing tests
 * @param logPath full runner output
 */
public record TestRunResult(int passed, int failed, Path logPath) {

    public boolean succeeded() {
        return failed == 0;
    }
}
