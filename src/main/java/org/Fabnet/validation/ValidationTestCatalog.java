package org.Fabnet.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered battery of validation tests.
 *
 * <p>Built-ins run first in a fixed order; custom tests follow in the order supplied.</p>
 */
public final class ValidationTestCatalog {
    private final LinkedHashMap<String, ValidationTest> testsByCode;

    /**
     * Creates a catalog with built-in tests only.
     */
    public ValidationTestCatalog(ValidationConfig config) {
        this(config, List.of());
    }

    /**
     * Creates a catalog of built-ins followed by {@code customTests}.
     *
     * @throws IllegalArgumentException when a code is blank or registered twice.
     */
    public ValidationTestCatalog(ValidationConfig config, Collection<? extends ValidationTest> customTests) {
        Objects.requireNonNull(customTests, "customTests");
        List<ValidationTest> all = new ArrayList<>(builtIns(Objects.requireNonNull(config, "config").validate()));
        all.addAll(customTests);
        this.testsByCode = materialize(all);
    }

    public static ValidationTestCatalog defaultCatalog() {
        return new ValidationTestCatalog(ValidationConfig.defaults());
    }

    /**
     * Returns tests in execution order.
     */
    public List<ValidationTest> tests() {
        return List.copyOf(testsByCode.values());
    }

    /**
     * Returns the test registered under {@code code}, or null.
     */
    public ValidationTest test(String code) {
        if (code == null) {
            return null;
        }
        return testsByCode.get(code);
    }

    public Set<String> testCodes() {
        return Collections.unmodifiableSet(testsByCode.keySet());
    }

    private static List<ValidationTest> builtIns(ValidationConfig config) {
        return List.of(
                new PocConnectivityTest(),
                new PathContinuityTest(),
                new RequiredAttributesTest(),
                new UtilityConsistencyTest(config.getUtilityRules()),
                new FlowDirectionTest(),
                new PathStructureTest(config.getMinPathNodes(), config.getMaxPathNodes()),
                new LoopDetectionTest()
        );
    }

    private static LinkedHashMap<String, ValidationTest> materialize(List<ValidationTest> tests) {
        LinkedHashMap<String, ValidationTest> map = new LinkedHashMap<>();
        for (ValidationTest test : tests) {
            ValidationTest nonNullTest = Objects.requireNonNull(test, "test");
            String code = Objects.requireNonNull(nonNullTest.code(), "test.code").trim();
            if (code.isEmpty()) {
                throw new IllegalArgumentException("test.code must be non-blank");
            }
            if (map.putIfAbsent(code, nonNullTest) != null) {
                throw new IllegalArgumentException("duplicate validation test code: " + code);
            }
        }
        return map;
    }
}
