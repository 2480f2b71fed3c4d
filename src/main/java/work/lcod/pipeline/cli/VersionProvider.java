package work.lcod.pipeline.cli;

import picocli.CommandLine;
import work.lcod.pipeline.codec.ResourceListCodec;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "lcod-pipeline (java) " + version,
            "wire format: " + ResourceListCodec.API_VERSION + " " + ResourceListCodec.KIND,
            "jvm: " + System.getProperty("java.version")
        };
    }
}
