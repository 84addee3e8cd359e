package com.questrail.recorder.format;

import com.questrail.recorder.api.ParameterInfo;
import com.questrail.recorder.api.TestCaseInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentFormatterTest {

    @Test
    void labelsNamedParameters() {
        List<ParameterInfo> parameters = List.of(
                ParameterInfo.named(0, "input"),
                ParameterInfo.named(1, "expected"));

        String text = ArgumentFormatter.labeledArguments(TestCaseInfo.parameterized("abc", 3), parameters);

        assertEquals("input → \"abc\", expected → 3", text);
    }

    @Test
    void placeholderParametersShowOnlyTheValue() {
        List<ParameterInfo> parameters = List.of(
                ParameterInfo.unlabeled(0),
                ParameterInfo.named(1, "count"));

        String text = ArgumentFormatter.labeledArguments(TestCaseInfo.parameterized(true, 2), parameters);

        assertEquals("true, count → 2", text);
    }

    @Test
    void secondNameTakesPrecedence() {
        List<ParameterInfo> parameters = List.of(new ParameterInfo(0, "for", "user"));

        assertEquals("user → \"ana\"",
                ArgumentFormatter.labeledArguments(TestCaseInfo.parameterized("ana"), parameters));
    }

    @Test
    void placeholderFirstNameWithSecondNameIsLabeled() {
        List<ParameterInfo> parameters = List.of(new ParameterInfo(0, ParameterInfo.PLACEHOLDER, "value"));

        assertEquals("value → 1",
                ArgumentFormatter.labeledArguments(TestCaseInfo.parameterized(1), parameters));
    }

    @Test
    void describesNullAndCharacters() {
        assertEquals("null", ArgumentFormatter.describe(null));
        assertEquals("\"x\"", ArgumentFormatter.describe('x'));
        assertEquals("4.5", ArgumentFormatter.describe(4.5));
    }

    @Test
    void noArgumentsMeansEmptyText() {
        assertEquals("", ArgumentFormatter.labeledArguments(TestCaseInfo.nonParameterized(), List.of()));
    }
}
