package com.trustgate.guard.policy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TestFilePatternsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "test_app.py",
            "/work/src/test_models.py",
            "pkg/handler_test.go",
            "lib/user_spec.rb",
            "tests/helpers.py",
            "/work/tests/unit/x.py",
            "src/test/java/com/acme/AppTests.java",
            "spec/models/user.rb",
            "web/__tests__/App.jsx",
            "conftest.py",
            "web/src/App.test.tsx",
            "TestParser.java",
            "src/main/java/TestRunner.java"
    })
    void matches_testConventions(String path) {
        assertThat(TestFilePatterns.matches(path)).as(path).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "app.py",
            "contest.py",
            "attestation.py",
            "testutil.java",
            "src/latest/app.py",
            "src/protest_data.py",
            "specification.md",
            "Testing.md",
            "mytests/x.py"
    })
    void matches_ordinaryFiles_false(String path) {
        assertThat(TestFilePatterns.matches(path)).as(path).isFalse();
    }
}
