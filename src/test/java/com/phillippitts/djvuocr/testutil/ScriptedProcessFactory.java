package com.phillippitts.djvuocr.testutil;

import com.phillippitts.djvuocr.service.process.ProcessFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * {@link ProcessFactory} that answers each command with a scripted {@link FakeProcess}.
 * The script may also create files, standing in for the tool's side effects.
 * Every command is recorded.
 */
public final class ScriptedProcessFactory implements ProcessFactory {

    /**
     * Scripted reaction to one command.
     */
    @FunctionalInterface
    public interface Script {
        FakeProcess.Behavior respond(List<String> command) throws IOException;
    }

    private final Script script;
    private final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());
    private final List<FakeProcess> processes = Collections.synchronizedList(new ArrayList<>());

    public ScriptedProcessFactory(Script script) {
        this.script = script;
    }

    public static ScriptedProcessFactory always(FakeProcess.Behavior behavior) {
        return new ScriptedProcessFactory(command -> behavior);
    }

    public static ScriptedProcessFactory by(Function<List<String>, FakeProcess.Behavior> fn) {
        return new ScriptedProcessFactory(fn::apply);
    }

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        commands.add(List.copyOf(command));
        FakeProcess process = new FakeProcess(script.respond(command));
        processes.add(process);
        return process;
    }

    public List<List<String>> commands() {
        synchronized (commands) {
            return List.copyOf(commands);
        }
    }

    public List<FakeProcess> processes() {
        synchronized (processes) {
            return List.copyOf(processes);
        }
    }
}
