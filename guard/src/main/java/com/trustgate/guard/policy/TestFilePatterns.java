package com.trustgate.guard.policy;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes test files by naming convention across the common ecosystems.
 * Matching runs on the path with '/' separators.
 */
public final class TestFilePatterns {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(^|/)test_[^/]+$"),              // test_foo.py
            Pattern.compile("(^|/)[^/]+_test\\.[^/]+$"),      // foo_test.py, foo_test.go
            Pattern.compile("(^|/)[^/]+_spec\\.[^/]+$"),      // foo_spec.rb
            Pattern.compile("(^|/)tests/"),
            Pattern.compile("(^|/)test/"),                    // Maven, Gradle
            Pattern.compile("(^|/)spec/"),
            Pattern.compile("(^|/)__tests__/"),               // Jest
            Pattern.compile("(^|/)conftest\\.py$"),
            Pattern.compile("(^|/)[^/]+\\.test\\.[^/]+$"),    // foo.test.ts
            Pattern.compile("(^|/)Test[A-Z][^/]*\\.java$"));  // TestFoo.java

    private TestFilePatterns() {}

    public static boolean matches(Path path) {
        return matches(path.toString().replace(File.separatorChar, '/'));
    }

    public static boolean matches(String path) {
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
