package com.questrail.txfile.tool;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ToolArgumentsTest
{
    @Test
    void acceptsSeparateAndInlineValues()
    {
        ToolArguments args = ToolArguments.parse(new String[] { "--input", "a.csv", "--input-format=csv" });

        assertEquals("a.csv", args.require("input"));
        assertEquals("csv", args.require("input-format"));
        assertEquals(Optional.empty(), args.optional("output"));
    }

    @Test
    void inlineValueMayContainEquals()
    {
        ToolArguments args = ToolArguments.parse(new String[] { "--output=dir/a=b.txt" });

        assertEquals(Optional.of("dir/a=b.txt"), args.optional("output"));
    }

    @Test
    void noArgumentsIsEmpty()
    {
        ToolArguments args = ToolArguments.parse(new String[0]);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> args.require("input"));
        assertEquals("missing required option --input", e.getMessage());
    }

    @Test
    void rejectsMalformedArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> ToolArguments.parse(new String[] { "input" }));
        assertThrows(IllegalArgumentException.class, () -> ToolArguments.parse(new String[] { "--input" }));
        assertThrows(IllegalArgumentException.class,
                () -> ToolArguments.parse(new String[] { "--input", "--output", "x" }));
        assertThrows(IllegalArgumentException.class, () -> ToolArguments.parse(new String[] { "--input=" }));
        assertThrows(IllegalArgumentException.class, () -> ToolArguments.parse(new String[] { "--In", "x" }));
    }

    @Test
    void rejectsRepeatedOption()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToolArguments.parse(new String[] { "--input", "a", "--input", "b" }));
        assertEquals("option --input given more than once", e.getMessage());
    }

    @Test
    void requireOnlyRejectsUnknownOptions()
    {
        ToolArguments args = ToolArguments.parse(new String[] { "--input", "a", "--verbose", "yes" });

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> args.requireOnly(Set.of("input")));
        assertEquals("unknown option --verbose", e.getMessage());
    }
}
