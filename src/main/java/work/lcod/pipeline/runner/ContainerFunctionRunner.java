package work.lcod.pipeline.runner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.lcod.pipeline.model.ContainerRuntime;
import work.lcod.pipeline.model.RuntimeDescriptor;

/**
 * Runs a function packaged as a container image through a docker-compatible engine CLI.
 *
 * <p>Containers get no network unless the declaration asks for it and the run allows it, never
 * gain privileges, and see only the mounts and variables they declare.
 */
public final class ContainerFunctionRunner extends ProcessFunctionRunner {
    private static final List<String> ENGINE_ENV = List.of(
        "HOME", "DOCKER_HOST", "DOCKER_CONFIG", "DOCKER_CERT_PATH", "DOCKER_TLS_VERIFY", "XDG_RUNTIME_DIR"
    );

    private final Settings settings;

    public ContainerFunctionRunner(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    protected List<String> command(RuntimeDescriptor runtime, Path workDir) {
        return command((ContainerRuntime) runtime);
    }

    List<String> command(ContainerRuntime container) {
        var command = new ArrayList<String>();
        command.add(settings.engine());
        command.add("run");
        command.add("--rm");
        command.add("-i");
        command.add("--network");
        command.add(container.network() && settings.allowNetwork() ? "host" : "none");
        command.add("--security-opt=no-new-privileges");
        for (var mount : container.mounts()) {
            command.add("--mount");
            command.add(mountSpec(mount));
        }
        for (var entry : container.env()) {
            command.add("-e");
            command.add(entry);
        }
        command.add(container.image());
        return command;
    }

    @Override
    protected Map<String, String> environment(RuntimeDescriptor runtime) {
        var env = super.environment(runtime);
        for (var name : ENGINE_ENV) {
            var value = System.getenv(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        return env;
    }

    static String mountSpec(ContainerRuntime.Mount mount) {
        var spec = new StringBuilder("type=").append(mount.type().name().toLowerCase(Locale.ROOT));
        if (mount.type() != ContainerRuntime.Mount.Type.TMPFS) {
            var source = mount.type() == ContainerRuntime.Mount.Type.BIND
                ? Path.of(mount.source()).toAbsolutePath().normalize().toString()
                : mount.source();
            spec.append(",source=").append(source);
        }
        spec.append(",target=").append(mount.destination());
        if (!mount.readWrite() && mount.type() != ContainerRuntime.Mount.Type.TMPFS) {
            spec.append(",readonly");
        }
        return spec.toString();
    }

    /**
     * @param engine docker-compatible CLI ({@code docker}, {@code podman})
     * @param allowNetwork whether declarations may request network access at all
     */
    public record Settings(String engine, boolean allowNetwork) {
        public Settings {
            engine = engine == null || engine.isBlank() ? "docker" : engine;
        }

        public static Settings defaults() {
            return new Settings("docker", false);
        }
    }
}
