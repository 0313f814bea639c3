package work.lcod.foundation.cli;

import picocli.CommandLine;

/**
 * Reports the jar manifest version, or {@code development} when running from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = ConfigCommand.class.getPackage();
        String version = pkg.getImplementationVersion();
        return new String[] {
            "lcod-config " + (version != null ? version : "development"),
            "JVM: " + Runtime.version()
        };
    }
}
