package work.lcod.pipeline.model;

import java.util.List;
import java.util.Objects;

/**
 * Function packaged as a container image.
 */
public record ContainerRuntime(String image, boolean network, List<Mount> mounts, List<String> env) implements RuntimeDescriptor {
    public ContainerRuntime {
        Objects.requireNonNull(image, "image");
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
        env = env == null ? List.of() : List.copyOf(env);
    }

    public static ContainerRuntime of(String image) {
        return new ContainerRuntime(image, false, List.of(), List.of());
    }

    public ContainerRuntime withNetwork(boolean enabled) {
        return new ContainerRuntime(image, enabled, mounts, env);
    }

    @Override
    public RuntimeKind kind() {
        return RuntimeKind.CONTAINER;
    }

    @Override
    public String reference() {
        return image;
    }

    public record Mount(Type type, String source, String destination, boolean readWrite) {
        public Mount {
            Objects.requireNonNull(type, "type");
            source = source == null ? "" : source;
            Objects.requireNonNull(destination, "destination");
        }

        public enum Type {
            BIND,
            VOLUME,
            TMPFS
        }
    }
}
