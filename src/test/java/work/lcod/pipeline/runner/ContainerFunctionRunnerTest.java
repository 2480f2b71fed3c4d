package work.lcod.pipeline.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.model.ContainerRuntime;

class ContainerFunctionRunnerTest {
    @Test
    void isolatesContainersByDefault() {
        var runner = new ContainerFunctionRunner(ContainerFunctionRunner.Settings.defaults());

        var command = runner.command(ContainerRuntime.of("example.org/fn:v1").withNetwork(true));

        assertEquals(List.of(
            "docker", "run", "--rm", "-i",
            "--network", "none",
            "--security-opt=no-new-privileges",
            "example.org/fn:v1"
        ), command);
    }

    @Test
    void networkNeedsDeclarationAndPermission() {
        var runner = new ContainerFunctionRunner(new ContainerFunctionRunner.Settings("podman", true));

        assertEquals("host", runner.command(ContainerRuntime.of("img").withNetwork(true)).get(5));
        assertEquals("none", runner.command(ContainerRuntime.of("img")).get(5));
        assertEquals("podman", runner.command(ContainerRuntime.of("img")).get(0));
    }

    @Test
    void passesMountsAndEnvironment() {
        var runtime = new ContainerRuntime(
            "img",
            false,
            List.of(
                new ContainerRuntime.Mount(ContainerRuntime.Mount.Type.VOLUME, "cache", "/cache", true),
                new ContainerRuntime.Mount(ContainerRuntime.Mount.Type.TMPFS, "", "/tmp", false)
            ),
            List.of("MODE=strict")
        );

        var command = new ContainerFunctionRunner(ContainerFunctionRunner.Settings.defaults()).command(runtime);

        assertEquals(List.of(
            "docker", "run", "--rm", "-i",
            "--network", "none",
            "--security-opt=no-new-privileges",
            "--mount", "type=volume,source=cache,target=/cache",
            "--mount", "type=tmpfs,target=/tmp",
            "-e", "MODE=strict",
            "img"
        ), command);
    }

    @Test
    void bindMountsAreAbsoluteAndReadOnly() {
        var mount = new ContainerRuntime.Mount(ContainerRuntime.Mount.Type.BIND, "data", "/data", false);
        var source = Path.of("data").toAbsolutePath().normalize();

        assertEquals("type=bind,source=" + source + ",target=/data,readonly", ContainerFunctionRunner.mountSpec(mount));
    }

    @Test
    void blankEngineFallsBackToDocker() {
        assertEquals("docker", new ContainerFunctionRunner.Settings(" ", false).engine());
    }
}
