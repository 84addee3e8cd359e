package com.questrail.recorder.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One invocation of a test function.
 *
 * <p>
 * A non-parameterized test has exactly one, argument-less test case. A
 * parameterized test has one test case per combination of arguments.
 * </p>
 *
 * @param arguments       the arguments passed to this invocation
 * @param isParameterized whether this case is one of several parameterized invocations
 */
public record TestCaseInfo(List<Argument> arguments, boolean isParameterized) {

    /**
     * A single argument value bound to the parameter at {@code parameterIndex}.
     * The value may be {@code null}.
     */
    public record Argument(int parameterIndex, Object value) {}

    public TestCaseInfo {
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    /**
     * The single test case of a non-parameterized test.
     */
    public static TestCaseInfo nonParameterized() {
        return new TestCaseInfo(List.of(), false);
    }

    /**
     * A parameterized invocation; argument {@code i} binds to parameter {@code i}.
     */
    public static TestCaseInfo parameterized(Object... values) {
        List<Argument> arguments = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            arguments.add(new Argument(i, values[i]));
        }
        return new TestCaseInfo(arguments, true);
    }

    /**
     * Pairs every argument with its declared parameter, in argument order.
     * Arguments whose parameter is not declared are skipped.
     */
    public List<Map.Entry<ParameterInfo, Argument>> argumentsPairedWith(List<ParameterInfo> parameters) {
        Objects.requireNonNull(parameters, "parameters");
        List<Map.Entry<ParameterInfo, Argument>> pairs = new ArrayList<>(arguments.size());
        for (Argument argument : arguments) {
            for (ParameterInfo parameter : parameters) {
                if (parameter.index() == argument.parameterIndex()) {
                    pairs.add(Map.entry(parameter, argument));
                    break;
                }
            }
        }
        return pairs;
    }
}
