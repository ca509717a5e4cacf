package com.sequence.editor.cli;

import lombok.experimental.UtilityClass;

@UtilityClass
public class ExitCodes {
    public static final int OK = 0;
    /** The diagram has error nodes, or reading/writing a file failed. */
    public static final int FAILURE = 1;
    public static final int USAGE = 2;
}
