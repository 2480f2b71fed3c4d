package work.lcod.pipeline.runner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.model.ExecRuntime;
import work.lcod.pipeline.model.RuntimeDescriptor;

/**
 * Runs a function shipped as a local executable.
 */
public final class ExecFunctionRunner extends ProcessFunctionRunner {
    @Override
    protected List<String> command(RuntimeDescriptor runtime, Path workDir) {
        var exec = (ExecRuntime) runtime;
        var command = new ArrayList<String>();
        command.add(Path.of(exec.path()).toAbsolutePath().normalize().toString());
        command.addAll(exec.args());
        return command;
    }

    @Override
    protected Map<String, String> environment(RuntimeDescriptor runtime) {
        var env = super.environment(runtime);
        EnvEntries.apply(((ExecRuntime) runtime).env(), env);
        return env;
    }
}
