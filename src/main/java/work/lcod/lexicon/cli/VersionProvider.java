package work.lcod.lexicon.cli;

import picocli.CommandLine;

/**
 * Reads the version from the jar manifest; unpackaged builds report {@code development}.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        String title = pkg.getImplementationTitle() != null ? pkg.getImplementationTitle() : "lcod-lexicon";
        return new String[] { "lexicon (java) " + version, title + ", Java " + Runtime.version().feature() };
    }
}
