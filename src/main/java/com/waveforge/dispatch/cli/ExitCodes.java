package com.waveforge.dispatch.cli;

final class ExitCodes {

    static final int OK = 0;
    static final int HALTED = 1;
    static final int USAGE = 2;

    private ExitCodes() {}
}
