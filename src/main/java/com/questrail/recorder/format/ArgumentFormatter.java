package com.questrail.recorder.format;

import com.questrail.recorder.api.ParameterInfo;
import com.questrail.recorder.api.TestCaseInfo;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the arguments of a parameterized test case as
 * {@code label → value, label → value}.
 */
public final class ArgumentFormatter
{
    private ArgumentFormatter() {}

    /**
     * Pairs the arguments of {@code testCase} with {@code parameters} and labels
     * each one. Unlabeled parameters show only the value.
     */
    public static String labeledArguments(TestCaseInfo testCase, List<ParameterInfo> parameters) {
        return testCase.argumentsPairedWith(parameters).stream()
                .map(ArgumentFormatter::labeled)
                .collect(Collectors.joining(", "));
    }

    /**
     * Describes an argument value the way test output shows it: character
     * sequences quoted, everything else by {@link String#valueOf(Object)}.
     */
    public static String describe(Object value) {
        if (value instanceof CharSequence text) {
            return "\"" + text + "\"";
        }
        if (value instanceof Character c) {
            return "\"" + c + "\"";
        }
        return String.valueOf(value);
    }

    private static String labeled(Map.Entry<ParameterInfo, TestCaseInfo.Argument> pair) {
        String description = describe(pair.getValue().value());
        ParameterInfo parameter = pair.getKey();
        if (!parameter.isLabeled()) {
            return description;
        }
        return parameter.label() + " \u2192 " + description;
    }
}
