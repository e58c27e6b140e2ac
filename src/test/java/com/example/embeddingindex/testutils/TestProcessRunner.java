package com.example.embeddingindex.testutils;

import com.example.embeddingindex.ProcessRunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class TestProcessRunner implements ProcessRunner {
    private final CapturingProcess process;
    private final List<List<String>> commands = new ArrayList<>();

    public TestProcessRunner(CapturingProcess process) {
        this.process = process;
    }

    @Override
    public Process start(List<String> command) throws IOException {
        commands.add(new ArrayList<>(command));
        if (process == null) throw new IOException("no such command: " + command.get(0));
        return process;
    }

    public List<String> lastCommand() {
        return commands.isEmpty() ? null : commands.get(commands.size() - 1);
    }
}
