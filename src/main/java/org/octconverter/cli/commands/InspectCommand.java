package org.octconverter.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.octconverter.cli.CommandLineInterface;
import org.octconverter.cli.report.DecodeReport;
import org.octconverter.formats.FormatReaders;
import org.octconverter.formats.IFormatReader;
import org.octconverter.formats.ReadOptions;
import org.octconverter.model.Decoded;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "inspect",
    description = "Decode a file and print its volumes, fundus images, metadata and warnings"
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(InspectCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "File to decode (.fds, .fda, .e2e, .sdb, .img, .oct, .dcm)"
    )
    private Path file;

    @Option(
        names = {"--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

    @Option(
        names = {"--deinterlace"},
        description = "Split interlaced frames into two slices (default from octconverter.read.deinterlace)"
    )
    private Boolean deinterlace;

    @Option(
        names = {"--rows"},
        description = "Zeiss frame rows (default from octconverter.read.zeiss.rows)"
    )
    private Integer rows;

    @Option(
        names = {"--cols"},
        description = "Zeiss frame columns (default from octconverter.read.zeiss.cols)"
    )
    private Integer cols;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (!"summary".equals(format) && !"json".equals(format)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Unknown format: " + format + ". Supported formats: summary, json");
        }
        ReadOptions options = options();
        PrintWriter out = spec.commandLine().getOut();
        try (IFormatReader reader = FormatReaders.open(file, options)) {
            List<Decoded<OctVolume>> volumes = reader.readOctVolumes();
            List<Decoded<FundusImage>> fundus = reader.readFundusImages();
            DecodeReport report = new DecodeReport(String.valueOf(file.getFileName()), reader.formatName(),
                    volumes, fundus);
            if ("json".equals(format)) {
                out.println(report.toJson());
                out.flush();
            } else {
                report.printSummary(out);
            }
            return 0;
        } catch (IOException e) {
            LOG.debug("Decoding {} failed", file, e);
            spec.commandLine().getErr().println("Error decoding " + file + ": " + e.getMessage());
            return 1;
        }
    }

    private ReadOptions options() {
        try {
            ReadOptions options = ReadOptions.fromConfig(parent.getConfig());
            if (deinterlace != null) {
                options = options.withDeinterlace(deinterlace);
            }
            if (rows != null || cols != null) {
                options = options.withZeissFrame(rows != null ? rows : options.zeissRows(),
                        cols != null ? cols : options.zeissCols());
            }
            return options;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
