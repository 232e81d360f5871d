package work.lcod.orbital.cli;

import picocli.CommandLine;
import work.lcod.orbital.registry.BehaviorRegistry;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "orbital-run " + version,
            "standard behaviors: " + BehaviorRegistry.standard().size(),
            "java: " + Runtime.version()
        };
    }
}
