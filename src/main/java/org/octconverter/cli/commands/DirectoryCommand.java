package org.octconverter.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.octconverter.cli.CommandLineInterface;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.formats.FormatReaders;
import org.octconverter.formats.IFormatReader;
import org.octconverter.formats.ReadOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists the records a file's directory resolves to, without decoding them.
 */
@Command(
    name = "directory",
    description = "Print the records of a file's directory (type, tag, offset, length, key)"
)
public class DirectoryCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "File to list"
    )
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (IFormatReader reader = FormatReaders.open(file, ReadOptions.fromConfig(parent.getConfig()))) {
            List<DirectoryEntry<?>> entries = reader.listDirectory();
            out.println("=== " + file.getFileName() + " (" + reader.formatName() + "), " + entries.size()
                    + " records ===");
            out.println(String.format("%-20s %-24s %12s %12s  %s", "TYPE", "TAG", "OFFSET", "LENGTH", "KEY"));
            for (DirectoryEntry<?> entry : entries) {
                out.println(String.format("%-20s %-24s %12d %12d  %s", entry.type(), entry.tag(), entry.offset(),
                        entry.length(), entry.chunkKey().map(Object::toString).orElse("-")));
            }
            out.flush();
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading directory of " + file + ": " + e.getMessage());
            return 1;
        }
    }
}
