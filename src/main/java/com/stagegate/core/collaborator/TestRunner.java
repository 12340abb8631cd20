package com.stagegate.core.collaborator;

public interface TestRunner {

    TestRunResult run(String suiteSelector);
}
